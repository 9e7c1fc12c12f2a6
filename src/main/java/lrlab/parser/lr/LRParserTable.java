package lrlab.parser.lr;

import java.util.*;
import java.util.logging.Logger;

import lrlab.grammar.*;
import lrlab.util.Utils;

/**
 * ACTION and GOTO table of an LR automaton.
 *
 * Actions are collected per cell first, {@link #finish()} then turns every cell with more than one
 * distinct action into a {@link ConflictAction} and records a {@link Conflict}. Conflicts are never
 * resolved.
 */
public class LRParserTable {

	private static final Logger LOG = Logger.getLogger("Automaton");

	public final Grammar grammar;

	public final TableKind kind;

	/**
	 * Actions per terminal for each state.
	 */
	private final List<SortedMap<Terminal, SortedSet<Action>>> candidates = new ArrayList<>();

	private final List<SortedMap<Terminal, Action>> actionTable = new ArrayList<>();

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final List<SortedMap<NonTerminal, Integer>> gotoTable = new ArrayList<>();

	private final List<Conflict> conflicts = new ArrayList<>();

	private boolean finished = false;

	public LRParserTable(Grammar grammar, TableKind kind, int numberOfStates) {
		this.grammar = grammar;
		this.kind = kind;
		for (int i = 0; i < numberOfStates; i++){
			candidates.add(new TreeMap<>());
			actionTable.add(new TreeMap<>());
			gotoTable.add(new TreeMap<>());
		}
	}

	public static abstract class Action implements Comparable<Action> {

		public abstract String name();

		/**
		 * Shift actions come first, then reduce actions, then accept
		 */
		abstract int rank();

		abstract int number();

		@Override
		public int compareTo(Action o) {
			int cmp = Integer.compare(rank(), o.rank());
			return cmp != 0 ? cmp : Integer.compare(number(), o.number());
		}

		@Override
		public boolean equals(Object obj) {
			return obj != null && obj.getClass() == getClass() && compareTo((Action)obj) == 0;
		}

		@Override
		public int hashCode() {
			return rank() * 31 + number();
		}
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "s" + stateToBeShifted;
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		int rank() {
			return 0;
		}

		@Override
		int number() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		@Override
		public String toString() {
			return "r" + production.id;
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		int rank() {
			return 1;
		}

		@Override
		int number() {
			return production.id;
		}
	}

	public static class Accept extends Action {

		@Override
		public String toString() {
			return "acc";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		int rank() {
			return 2;
		}

		@Override
		int number() {
			return 0;
		}
	}

	/**
	 * Multi valued table entry of a cell with a conflict
	 */
	public static class ConflictAction extends Action {

		public final List<Action> actions;

		public ConflictAction(Collection<Action> actions) {
			List<Action> sorted = new ArrayList<>(actions);
			Collections.sort(sorted);
			this.actions = Collections.unmodifiableList(sorted);
		}

		@Override
		public String toString() {
			return Utils.join(actions, " / ");
		}

		@Override
		public String name() {
			return "conflict";
		}

		@Override
		int rank() {
			return 3;
		}

		@Override
		int number() {
			return actions.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ConflictAction && ((ConflictAction)obj).actions.equals(actions);
		}

		@Override
		public int hashCode() {
			return actions.hashCode();
		}
	}

	private void insert(int state, Terminal terminal, Action action){
		if (finished){
			throw new IllegalStateException("Table is already finished");
		}
		candidates.get(state).computeIfAbsent(terminal, t -> new TreeSet<>()).add(action);
	}

	public void addShift(int state, Terminal terminal, int newState){
		insert(state, terminal, new ShiftAction(newState));
	}

	public void addReduce(int state, Terminal terminal, Production production){
		insert(state, terminal, new ReduceAction(production));
	}

	public void addAccept(int state){
		insert(state, Terminal.EOF, new Accept());
	}

	public void addGoto(int state, NonTerminal nonTerminal, int newState){
		gotoTable.get(state).put(nonTerminal, newState);
	}

	/**
	 * Fills the action table and records the conflicts
	 */
	public LRParserTable finish(){
		if (finished){
			return this;
		}
		for (int state = 0; state < candidates.size(); state++){
			for (Map.Entry<Terminal, SortedSet<Action>> entry : candidates.get(state).entrySet()){
				SortedSet<Action> actions = entry.getValue();
				if (actions.size() == 1){
					actionTable.get(state).put(entry.getKey(), actions.first());
				} else {
					ConflictAction conflictAction = new ConflictAction(actions);
					actionTable.get(state).put(entry.getKey(), conflictAction);
					Conflict conflict = new Conflict(state, entry.getKey(), conflictAction.actions);
					conflicts.add(conflict);
					LOG.info(kind + ": " + conflict);
				}
			}
		}
		finished = true;
		return this;
	}

	public int getNumberOfStates(){
		return actionTable.size();
	}

	/**
	 * Action for the state and terminal, null if the cell is empty
	 */
	public Action getAction(int state, Terminal terminal){
		return actionTable.get(state).get(terminal);
	}

	public SortedMap<Terminal, Action> getActions(int state){
		return Collections.unmodifiableSortedMap(actionTable.get(state));
	}

	/**
	 * Goto target for the state and non terminal, null if there is none
	 */
	public Integer getGoto(int state, NonTerminal nonTerminal){
		return gotoTable.get(state).get(nonTerminal);
	}

	public SortedMap<NonTerminal, Integer> getGotos(int state){
		return Collections.unmodifiableSortedMap(gotoTable.get(state));
	}

	public List<Conflict> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public boolean hasConflicts(){
		return !conflicts.isEmpty();
	}

	/**
	 * Formats the table as a grid with one column per terminal and non terminal
	 */
	public String formatTable(){
		List<Terminal> terminals = new ArrayList<>(grammar.getTerminals());
		List<NonTerminal> nonTerminals = new ArrayList<>(grammar.getNonTerminals());
		nonTerminals.remove(grammar.getAugmentedStart());
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add("State");
		for (Terminal terminal : terminals){
			header.add(terminal.name);
		}
		for (NonTerminal nonTerminal : nonTerminals){
			header.add(nonTerminal.name);
		}
		rows.add(header);
		for (int i = 0; i < actionTable.size(); i++){
			List<String> row = new ArrayList<>();
			row.add(String.valueOf(i));
			for (Terminal terminal : terminals){
				Action action = getAction(i, terminal);
				row.add(action == null ? "" : action.toString());
			}
			for (NonTerminal nonTerminal : nonTerminals){
				Integer target = getGoto(i, nonTerminal);
				row.add(target == null ? "" : target.toString());
			}
			rows.add(row);
		}
		return Utils.formatTable(rows);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < actionTable.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = ");
			builder.append(actionTable.get(i));
			builder.append(" GOTO = ");
			builder.append(gotoTable.get(i));
		}
		return builder.toString();
	}
}
