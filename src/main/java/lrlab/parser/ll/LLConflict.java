package lrlab.parser.ll;

import lrlab.grammar.NonTerminal;
import lrlab.grammar.Production;
import lrlab.grammar.Terminal;

/**
 * Two productions in the same cell of an LL(1) table
 */
public class LLConflict {

	public final NonTerminal nonTerminal;

	public final Terminal terminal;

	public final Production production1;

	public final Production production2;

	public LLConflict(NonTerminal nonTerminal, Terminal terminal, Production production1, Production production2) {
		this.nonTerminal = nonTerminal;
		this.terminal = terminal;
		this.production1 = production1;
		this.production2 = production2;
	}

	@Override
	public String toString() {
		return String.format("LL(1) conflict at [%s, %s]: %s vs %s", nonTerminal, terminal, production1, production2);
	}
}
