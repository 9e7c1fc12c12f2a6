package lrlab.parser.ll;

import java.util.*;
import java.util.logging.Logger;

import lrlab.grammar.*;
import lrlab.util.Utils;

/**
 * LL(1) parsing table that maps a non terminal and a lookahead terminal to the productions to expand.
 *
 * A cell with more than one production is a conflict, all productions are kept.
 */
public class LLParserTable {

	private static final Logger LOG = Logger.getLogger("LL1");

	public final Grammar grammar;

	/**
	 * Maps a non terminal and a lookahead terminal to the productions that can be expanded
	 */
	private final Map<NonTerminal, SortedMap<Terminal, List<Production>>> table = new TreeMap<>();

	private final List<LLConflict> conflicts = new ArrayList<>();

	public LLParserTable(Grammar grammar){
		this.grammar = grammar;
	}

	/**
	 * A production A → α is added for every terminal in FIRST(α) and, if α is nullable, for every terminal
	 * in FOLLOW(A). The augmented start production is left out.
	 */
	public static LLParserTable fromGrammar(Grammar grammar){
		LLParserTable llTable = new LLParserTable(grammar);
		for (Production production : grammar.getProductions()){
			if (production.id == 0){
				continue;
			}
			Set<Terminal> lookaheads = new TreeSet<>();
			for (Terminal terminal : grammar.calculateFirstOfSequence(production.right)){
				if (!terminal.isEpsilon()){
					lookaheads.add(terminal);
				}
			}
			if (grammar.isNullable(production.right)){
				lookaheads.addAll(grammar.calculateFollowSet(production.left));
			}
			for (Terminal lookahead : lookaheads){
				llTable.insertAction(production.left, lookahead, production);
			}
		}
		return llTable;
	}

	public void insertAction(NonTerminal nonTerminal, Terminal lookahead, Production executedProduction){
		List<Production> cell = table.computeIfAbsent(nonTerminal, n -> new TreeMap<>())
				.computeIfAbsent(lookahead, t -> new ArrayList<>());
		if (cell.contains(executedProduction)){
			return;
		}
		if (!cell.isEmpty()){
			LLConflict conflict = new LLConflict(nonTerminal, lookahead, cell.get(0), executedProduction);
			conflicts.add(conflict);
			LOG.info(conflict.toString());
		}
		cell.add(executedProduction);
	}

	/**
	 * Productions in the cell, empty if there are none
	 */
	public List<Production> getProductions(NonTerminal nonTerminal, Terminal lookahead){
		SortedMap<Terminal, List<Production>> row = table.get(nonTerminal);
		if (row == null || !row.containsKey(lookahead)){
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(row.get(lookahead));
	}

	public List<LLConflict> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public boolean isLL1(){
		return conflicts.isEmpty();
	}

	/**
	 * Grid with a row per non terminal and a column per terminal, cells list the production numbers
	 */
	public String formatTable(){
		List<Terminal> terminals = new ArrayList<>(grammar.getTerminals());
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add("");
		for (Terminal terminal : terminals){
			header.add(terminal.name);
		}
		rows.add(header);
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (nonTerminal.equals(grammar.getAugmentedStart())){
				continue;
			}
			List<String> row = new ArrayList<>();
			row.add(nonTerminal.name);
			for (Terminal terminal : terminals){
				List<String> ids = new ArrayList<>();
				for (Production production : getProductions(nonTerminal, terminal)){
					ids.add(String.valueOf(production.id));
				}
				row.add(Utils.join(ids, " / "));
			}
			rows.add(row);
		}
		return Utils.formatTable(rows);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		int i = 0;
		for (Map.Entry<NonTerminal, SortedMap<Terminal, List<Production>>> entry : table.entrySet()){
			if (i++ != 0){
				builder.append("\n");
			}
			builder.append(entry.getKey()).append(" = {");
			for (Map.Entry<Terminal, List<Production>> cell : entry.getValue().entrySet()){
				builder.append(" ").append(cell.getKey()).append(" = {");
				for (Production production : cell.getValue()){
					builder.append(" ").append(production.formatRightSide());
				}
				builder.append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}
