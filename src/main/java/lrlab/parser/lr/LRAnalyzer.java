package lrlab.parser.lr;

import java.util.List;
import java.util.logging.Logger;

import lrlab.grammar.Grammar;
import lrlab.grammar.GrammarReport;
import lrlab.grammar.Symbol;

/**
 * Builds the automaton and the parsing table of one grammar class and tells whether the grammar
 * belongs to it.
 */
public class LRAnalyzer {

	private static final Logger LOG = Logger.getLogger("Automaton");

	public final Grammar grammar;

	public final TableKind kind;

	private final Automaton automaton;

	/**
	 * Canonical LR(1) automaton the LALR(1) automaton was merged from, null for the other kinds
	 */
	private final Automaton canonicalAutomaton;

	private final LRParserTable table;

	public LRAnalyzer(Grammar grammar, TableKind kind) {
		this.grammar = grammar;
		this.kind = kind;
		if (kind == TableKind.LALR1){
			canonicalAutomaton = Automaton.build(grammar, true);
			automaton = new LALRMerger(canonicalAutomaton).merge();
		} else {
			canonicalAutomaton = null;
			automaton = Automaton.build(grammar, kind.usesLookahead);
		}
		table = automaton.toParserTable(kind);
		LOG.info(verdict());
	}

	public Automaton getAutomaton(){
		return automaton;
	}

	public Automaton getCanonicalAutomaton(){
		return canonicalAutomaton;
	}

	public LRParserTable getTable(){
		return table;
	}

	public List<Conflict> getConflicts(){
		return table.getConflicts();
	}

	/**
	 * Does the grammar belong to the analyzed class (no conflicts)?
	 */
	public boolean isInClass(){
		return !table.hasConflicts();
	}

	public String verdict(){
		if (isInClass()){
			return String.format("The grammar is %s.", kind);
		}
		return String.format("The grammar is not %s: %d conflict(s).", kind, table.getConflicts().size());
	}

	/**
	 * Full text report: grammar, sets, states, transitions, table, conflicts and the verdict
	 */
	public String report(){
		StringBuilder builder = new StringBuilder();
		builder.append(kind).append(" analysis\n\n");
		builder.append(new GrammarReport(grammar)).append("\n");
		if (canonicalAutomaton != null){
			builder.append(String.format("Canonical LR(1) states: %d, merged into %d LALR(1) states\n\n",
					canonicalAutomaton.size(), automaton.size()));
		}
		builder.append("States:\n").append(automaton).append("\n\n");
		builder.append("Transitions:\n").append(automaton.formatTransitions()).append("\n");
		builder.append("ACTION / GOTO table:\n").append(table.formatTable()).append("\n");
		if (table.hasConflicts()){
			builder.append("Conflicts:\n");
			for (Conflict conflict : table.getConflicts()){
				Symbol symbol = conflict.symbol;
				builder.append(String.format("  state %d, symbol %s, %s: %s vs %s\n", conflict.state, symbol,
						conflict.kind, conflict.action1(), conflict.action2()));
			}
			builder.append("\n");
		}
		builder.append(verdict()).append("\n");
		return builder.toString();
	}
}
