package lrlab.parser.lr;

import lrlab.LrlabException;

/**
 * Grammar classes an LR table can be built for, they differ in the automaton and the reduce lookaheads.
 */
public enum TableKind {
	/** LR(0) items, reduce under every terminal */
	LR0("LR(0)", false),
	/** LR(0) items, reduce under the FOLLOW set of the left hand side */
	SLR1("SLR(1)", false),
	/** Canonical LR(1) items, reduce under the item's lookahead */
	CLR1("CLR(1)", true),
	/** Canonical LR(1) items merged by core, reduce under the merged lookaheads */
	LALR1("LALR(1)", true);

	public final String displayName;

	/**
	 * Does the automaton use items with lookaheads?
	 */
	public final boolean usesLookahead;

	TableKind(String displayName, boolean usesLookahead) {
		this.displayName = displayName;
		this.usesLookahead = usesLookahead;
	}

	public static TableKind fromName(String name){
		switch (name.toLowerCase().replaceAll("[()_-]", "")){
			case "lr0":
				return LR0;
			case "slr":
			case "slr1":
				return SLR1;
			case "clr":
			case "clr1":
			case "lr1":
				return CLR1;
			case "lalr":
			case "lalr1":
				return LALR1;
			default:
				throw new LrlabException("Unknown table kind " + name + ", expected one of lr0, slr1, clr1 and lalr1");
		}
	}

	@Override
	public String toString() {
		return displayName;
	}
}
