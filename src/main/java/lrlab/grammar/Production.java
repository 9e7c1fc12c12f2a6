package lrlab.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Comparable<Production> {

	/**
	 * Number of the production, 0 is the augmented start production
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = left;
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (Symbol symbol : right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			}
		}
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return Terminal.EPSILON.name;
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return id + " " + left + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public int compareTo(Production o) {
		return Integer.compare(id, o.id);
	}
}
