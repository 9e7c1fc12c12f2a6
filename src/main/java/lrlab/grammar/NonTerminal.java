package lrlab.grammar;

import java.util.*;

/**
 * A non terminal symbol with associated productions.
 */
public class NonTerminal extends Symbol {

	/**
	 * List of productions that have this non terminal on their left side, in declaration order.
	 */
	private final List<Production> productions = new ArrayList<>();

	public NonTerminal(String name) {
		super(name);
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	public List<Production> getProductions(){
		return Collections.unmodifiableList(productions);
	}

	void addProduction(Production production) {
		productions.add(production);
	}
}
