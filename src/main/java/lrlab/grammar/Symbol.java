package lrlab.grammar;

import java.util.Objects;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are identified by their name and ordered by it, a terminal comes before a non terminal
 * with the same name.
 */
public abstract class Symbol implements Comparable<Symbol> {

	/**
	 * Name of the symbol as written in the grammar text
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public abstract boolean isTerminal();

	@Override
	public int hashCode() {
		return isTerminal() ? name.hashCode() : ~name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		int cmp = name.compareTo(o.name);
		if (cmp != 0){
			return cmp;
		}
		return Boolean.compare(!isTerminal(), !o.isTerminal());
	}

	@Override
	public String toString() {
		return name;
	}
}
