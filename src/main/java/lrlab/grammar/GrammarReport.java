package lrlab.grammar;

import java.util.*;

import lrlab.util.Utils;

import static lrlab.util.Utils.formatSet;

/**
 * Text report of a grammar: its symbols, numbered productions and the NULLABLE, FIRST and FOLLOW sets.
 */
public class GrammarReport {

	private final Grammar grammar;

	public GrammarReport(Grammar grammar) {
		this.grammar = grammar;
	}

	public String formatProductions(){
		StringBuilder builder = new StringBuilder();
		for (Production production : grammar.getProductions()){
			builder.append(String.format("%3d  %s → %s\n", production.id, production.left, production.formatRightSide()));
		}
		return builder.toString();
	}

	/**
	 * Table with the NULLABLE flag and the FIRST and FOLLOW set of every non terminal
	 */
	public String formatSets(){
		List<List<String>> rows = new ArrayList<>();
		rows.add(Utils.makeArrayList("Non terminal", "Nullable", "FIRST", "FOLLOW"));
		Map<Symbol, Set<Terminal>> first = grammar.calculateFirstSets();
		Map<NonTerminal, Set<Terminal>> follow = grammar.calculateFollowSets();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			rows.add(Utils.makeArrayList(nonTerminal.name,
					grammar.isNullable(nonTerminal) ? "yes" : "no",
					formatSet(first.get(nonTerminal)),
					formatSet(follow.get(nonTerminal))));
		}
		return Utils.formatTable(rows);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("Terminals: ").append(formatSet(grammar.getTerminals())).append("\n");
		builder.append("Non terminals: ").append(formatSet(grammar.getNonTerminals())).append("\n");
		builder.append("Start symbol: ").append(grammar.getStart())
				.append(" (augmented: ").append(grammar.getAugmentedStart()).append(")\n\n");
		builder.append("Productions:\n").append(formatProductions()).append("\n");
		builder.append("Sets:\n").append(formatSets());
		for (String diagnostic : grammar.getDiagnostics()){
			builder.append("Warning: ").append(diagnostic).append("\n");
		}
		return builder.toString();
	}
}
