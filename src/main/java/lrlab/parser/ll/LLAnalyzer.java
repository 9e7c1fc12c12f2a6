package lrlab.parser.ll;

import java.util.logging.Logger;

import lrlab.grammar.*;

/**
 * Checks whether a grammar is LL(1), optionally after eliminating left recursion and left factoring.
 */
public class LLAnalyzer {

	private static final Logger LOG = Logger.getLogger("LL1");

	private final Rules originalRules;

	private final Grammar grammar;

	private final LLParserTable table;

	public final boolean transformed;

	public LLAnalyzer(Rules rules, boolean transform) {
		this.originalRules = rules.copy();
		this.transformed = transform;
		Rules usedRules = rules;
		if (transform){
			usedRules = GrammarTransformations.leftFactor(GrammarTransformations.eliminateLeftRecursion(rules));
		}
		this.grammar = Grammar.fromRules(usedRules);
		this.table = LLParserTable.fromGrammar(grammar);
		LOG.info(verdict());
	}

	public LLAnalyzer(Grammar grammar) {
		this.originalRules = grammar.getRules();
		this.transformed = false;
		this.grammar = grammar;
		this.table = LLParserTable.fromGrammar(grammar);
		LOG.info(verdict());
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public LLParserTable getTable(){
		return table;
	}

	public boolean isLL1(){
		return table.isLL1();
	}

	public String verdict(){
		if (isLL1()){
			return "The grammar is LL(1).";
		}
		return String.format("The grammar is not LL(1): %d conflict(s).", table.getConflicts().size());
	}

	public String report(){
		StringBuilder builder = new StringBuilder("LL(1) analysis\n\n");
		if (transformed){
			builder.append("Original grammar:\n").append(originalRules).append("\n");
			builder.append("Transformed grammar:\n").append(grammar.getRules()).append("\n");
		}
		builder.append(new GrammarReport(grammar)).append("\n");
		builder.append("Parsing table:\n").append(table.formatTable()).append("\n");
		if (!isLL1()){
			builder.append("Conflicts:\n");
			for (LLConflict conflict : table.getConflicts()){
				builder.append("  ").append(conflict).append("\n");
			}
			builder.append("\n");
		}
		builder.append(verdict()).append("\n");
		return builder.toString();
	}
}
