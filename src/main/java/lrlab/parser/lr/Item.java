package lrlab.parser.lr;

import java.util.Objects;

import lrlab.grammar.*;

/**
 * A dotted production, optionally with a single lookahead terminal (canonical LR(1) and LALR(1) items).
 *
 * Items are ordered by production, dot position and lookahead, which gives every item set a canonical
 * sorted form.
 */
public class Item implements Comparable<Item> {

	public final Production production;

	/**
	 * Number of right hand side symbols in front of the dot
	 */
	public final int position;

	/**
	 * Lookahead terminal, null for LR(0) items
	 */
	public final Terminal lookahead;

	public Item(Production production, int position, Terminal lookahead) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException("Invalid dot position " + position + " for " + production);
		}
		this.production = production;
		this.position = position;
		this.lookahead = lookahead;
	}

	public Item(Production production, Terminal lookahead){
		this(production, 0, lookahead);
	}

	public NonTerminal left(){
		return production.left;
	}

	public boolean isComplete(){
		return position == production.rightSize();
	}

	public boolean hasLookahead(){
		return lookahead != null;
	}

	/**
	 * Symbol right after the dot, null if the item is complete
	 */
	public Symbol nextSymbol(){
		if (isComplete()){
			return null;
		}
		return production.right.get(position);
	}

	public boolean inFrontOfNonTerminal(){
		return !isComplete() && !nextSymbol().isTerminal();
	}

	public Item advance(){
		if (isComplete()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Item(production, position + 1, lookahead);
	}

	/**
	 * The item without its lookahead
	 */
	public Item core(){
		return lookahead == null ? this : new Item(production, position, null);
	}

	public Item withLookahead(Terminal lookahead){
		return new Item(production, position, lookahead);
	}

	public String formatWithoutLookahead(){
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" →");
		for (int i = 0; i < production.rightSize(); i++) {
			if (i == position){
				builder.append(" •");
			}
			builder.append(" ").append(production.right.get(i));
		}
		if (isComplete()){
			builder.append(" •");
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		if (lookahead == null){
			return formatWithoutLookahead();
		}
		return "[" + formatWithoutLookahead() + ", " + lookahead + "]";
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Item)){
			return false;
		}
		Item other = (Item)obj;
		return other.production.equals(production) && other.position == position
				&& Objects.equals(other.lookahead, lookahead);
	}

	@Override
	public int hashCode() {
		return Objects.hash(production.id, position, lookahead);
	}

	@Override
	public int compareTo(Item o) {
		int cmp = Integer.compare(production.id, o.production.id);
		if (cmp != 0){
			return cmp;
		}
		cmp = Integer.compare(position, o.position);
		if (cmp != 0){
			return cmp;
		}
		if (lookahead == null || o.lookahead == null){
			return Boolean.compare(lookahead != null, o.lookahead != null);
		}
		return lookahead.compareTo(o.lookahead);
	}
}
