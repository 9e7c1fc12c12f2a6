package lrlab.parser.lr;

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSortedSet;

import guru.nidi.graphviz.attribute.Font;
import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Rank;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.Graph;
import guru.nidi.graphviz.model.Node;

import lrlab.Config;
import lrlab.LrlabException;
import lrlab.grammar.*;

import static guru.nidi.graphviz.model.Factory.*;

/**
 * Deterministic automaton over LR item sets.
 *
 * States are discovered breadth first starting with the closure of the augmented start item, the symbols
 * of each state are expanded in sorted order, so state ids only depend on the grammar.
 */
public class Automaton {

	private static final Logger LOG = Logger.getLogger("Automaton");

	public final Grammar grammar;

	/**
	 * Do the items carry lookaheads?
	 */
	public final boolean withLookahead;

	private final List<State> states;

	/**
	 * Transitions of each state, indexed by the state id
	 */
	private final List<SortedMap<Symbol, Integer>> transitions;

	Automaton(Grammar grammar, boolean withLookahead, List<State> states, List<SortedMap<Symbol, Integer>> transitions) {
		this.grammar = grammar;
		this.withLookahead = withLookahead;
		this.states = Collections.unmodifiableList(states);
		this.transitions = transitions;
	}

	/**
	 * Builds the LR(0) automaton or, with lookaheads, the canonical LR(1) automaton.
	 */
	public static Automaton build(Grammar grammar, boolean withLookahead){
		List<State> states = new ArrayList<>();
		List<SortedMap<Symbol, Integer>> transitions = new ArrayList<>();
		Map<ImmutableSortedSet<Item>, Integer> stateIds = new HashMap<>();
		Item startItem = new Item(grammar.getAugmentedProduction(), withLookahead ? Terminal.EOF : null);
		State startState = new State(0, State.closure(grammar, Collections.singletonList(startItem)));
		states.add(startState);
		stateIds.put(startState.getItems(), 0);
		Deque<State> worklist = new ArrayDeque<>();
		worklist.add(startState);
		while (!worklist.isEmpty()){
			State currentState = worklist.poll();
			SortedMap<Symbol, Integer> row = new TreeMap<>();
			for (Symbol symbol : currentState.nextSymbols()){
				ImmutableSortedSet<Item> target = State.goTo(grammar, currentState.getItems(), symbol);
				if (target.isEmpty()){
					continue;
				}
				Integer targetId = stateIds.get(target);
				if (targetId == null){
					targetId = states.size();
					State newState = new State(targetId, target);
					states.add(newState);
					stateIds.put(target, targetId);
					worklist.add(newState);
				}
				row.put(symbol, targetId);
			}
			// states are expanded in id order
			transitions.add(row);
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Built %s automaton with %d states", withLookahead ? "LR(1)" : "LR(0)", states.size()));
		}
		return new Automaton(grammar, withLookahead, states, transitions);
	}

	public List<State> getStates(){
		return states;
	}

	public State getState(int id){
		return states.get(id);
	}

	public int size(){
		return states.size();
	}

	public SortedMap<Symbol, Integer> getTransitions(int state){
		return Collections.unmodifiableSortedMap(transitions.get(state));
	}

	/**
	 * Target of the transition, null if there is none
	 */
	public Integer getTransition(int state, Symbol symbol){
		return transitions.get(state).get(symbol);
	}

	/**
	 * Id of the state with exactly the passed items, -1 if there is none
	 */
	public int findState(Collection<Item> items){
		ImmutableSortedSet<Item> key = ImmutableSortedSet.copyOf(items);
		for (State state : states){
			if (state.getItems().equals(key)){
				return state.id;
			}
		}
		return -1;
	}

	/**
	 * Derives the ACTION and GOTO table, the table kind decides under which terminals complete items
	 * are reduced.
	 */
	public LRParserTable toParserTable(TableKind kind){
		if (kind.usesLookahead != withLookahead){
			throw new LrlabException(String.format("A %s table needs an automaton %s lookaheads", kind,
					kind.usesLookahead ? "with" : "without"));
		}
		LRParserTable table = new LRParserTable(grammar, kind, states.size());
		for (State state : states){
			for (Map.Entry<Symbol, Integer> transition : transitions.get(state.id).entrySet()){
				Symbol symbol = transition.getKey();
				if (symbol.isTerminal()){
					table.addShift(state.id, (Terminal)symbol, transition.getValue());
				} else {
					table.addGoto(state.id, (NonTerminal)symbol, transition.getValue());
				}
			}
			for (Item item : state.getCompleteItems()){
				if (item.left().equals(grammar.getAugmentedStart())){
					table.addAccept(state.id);
					continue;
				}
				for (Terminal terminal : reduceLookaheads(kind, item)){
					table.addReduce(state.id, terminal, item.production);
				}
			}
		}
		return table.finish();
	}

	private Collection<Terminal> reduceLookaheads(TableKind kind, Item item){
		switch (kind){
			case LR0:
				return grammar.getTerminals();
			case SLR1:
				return grammar.calculateFollowSet(item.left());
			default:
				return Collections.singletonList(item.lookahead);
		}
	}

	public String formatTransitions(){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < transitions.size(); i++){
			for (Map.Entry<Symbol, Integer> transition : transitions.get(i).entrySet()){
				builder.append(String.format("%d --%s--> %d\n", i, transition.getKey(), transition.getValue()));
			}
		}
		return builder.toString();
	}

	/**
	 * Graphviz graph with a box per state listing its items and an edge per transition
	 */
	public Graph toGraphviz(String name){
		List<Node> nodes = new ArrayList<>();
		for (State state : states){
			StringBuilder label = new StringBuilder("I").append(state.id);
			for (Item item : state.getItems()){
				label.append("\n").append(item);
			}
			Node node = node(nodeName(state.id)).with(Label.of(label.toString()));
			for (Map.Entry<Symbol, Integer> transition : transitions.get(state.id).entrySet()){
				node = node.link(to(node(nodeName(transition.getValue()))).with(Label.of(transition.getKey().name)));
			}
			nodes.add(node);
		}
		return graph(name).directed()
				.graphAttr().with(Rank.dir(rankDir()))
				.nodeAttr().with(Shape.BOX, Font.name(Config.getGraphvizFont()))
				.with(nodes.toArray(new Node[0]));
	}

	private static String nodeName(int state){
		return "I" + state;
	}

	private static Rank.RankDir rankDir(){
		switch (Config.getGraphvizRankDir()){
			case "TB":
				return Rank.RankDir.TOP_TO_BOTTOM;
			case "BT":
				return Rank.RankDir.BOTTOM_TO_TOP;
			case "RL":
				return Rank.RankDir.RIGHT_TO_LEFT;
			default:
				return Rank.RankDir.LEFT_TO_RIGHT;
		}
	}

	public String toDot(String name){
		return toGraphviz(name).toString();
	}

	/**
	 * Renders the automaton as SVG, needs a working Graphviz engine
	 */
	public void toSvg(String name, File file) throws IOException {
		Graphviz.fromGraph(toGraphviz(name)).render(Format.SVG).toFile(file);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n\n");
			}
			builder.append(state);
		}
		return builder.toString();
	}
}
