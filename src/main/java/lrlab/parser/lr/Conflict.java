package lrlab.parser.lr;

import java.util.Collections;
import java.util.List;

import lrlab.grammar.Terminal;
import lrlab.parser.lr.LRParserTable.Action;
import lrlab.parser.lr.LRParserTable.ShiftAction;

/**
 * Several actions for the same state and terminal.
 */
public class Conflict {

	public enum Kind {
		SHIFT_REDUCE("shift-reduce"),
		REDUCE_REDUCE("reduce-reduce");

		public final String displayName;

		Kind(String displayName) {
			this.displayName = displayName;
		}

		@Override
		public String toString() {
			return displayName;
		}
	}

	public final int state;

	public final Terminal symbol;

	public final Kind kind;

	/**
	 * All competing actions, sorted (shifts first)
	 */
	public final List<Action> actions;

	public Conflict(int state, Terminal symbol, List<Action> actions) {
		if (actions.size() < 2){
			throw new IllegalArgumentException("A conflict needs at least two actions");
		}
		this.state = state;
		this.symbol = symbol;
		this.actions = Collections.unmodifiableList(actions);
		Kind kind = Kind.REDUCE_REDUCE;
		for (Action action : actions){
			if (action instanceof ShiftAction){
				kind = Kind.SHIFT_REDUCE;
			}
		}
		this.kind = kind;
	}

	public Action action1(){
		return actions.get(0);
	}

	public Action action2(){
		return actions.get(1);
	}

	@Override
	public String toString() {
		return String.format("%s conflict in state %d at %s: %s", kind, state, symbol,
				new LRParserTable.ConflictAction(actions));
	}
}
