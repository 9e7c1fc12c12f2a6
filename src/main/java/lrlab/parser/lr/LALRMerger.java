package lrlab.parser.lr;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ListMultimap;

import lrlab.LrlabException;
import lrlab.grammar.Symbol;

/**
 * Merges the states of a canonical LR(1) automaton that have the same core into LALR(1) states.
 *
 * Merged states are numbered by the smallest canonical state id of their group, so the start state
 * keeps the id 0.
 */
public class LALRMerger {

	private static final Logger LOG = Logger.getLogger("Automaton");

	private final Automaton canonical;

	/**
	 * Merged state id for each canonical state id
	 */
	private final int[] stateMapping;

	/**
	 * Canonical state ids for each merged state id
	 */
	private final ListMultimap<Integer, Integer> groups = ArrayListMultimap.create();

	public LALRMerger(Automaton canonical) {
		if (!canonical.withLookahead){
			throw new LrlabException("Only automata with lookaheads can be merged");
		}
		this.canonical = canonical;
		this.stateMapping = new int[canonical.size()];
		Map<ImmutableSortedSet<Item>, Integer> mergedIds = new HashMap<>();
		for (State state : canonical.getStates()){
			ImmutableSortedSet<Item> core = state.core();
			Integer mergedId = mergedIds.get(core);
			if (mergedId == null){
				mergedId = mergedIds.size();
				mergedIds.put(core, mergedId);
			}
			stateMapping[state.id] = mergedId;
			groups.put(mergedId, state.id);
		}
	}

	public Automaton merge(){
		int numberOfStates = groups.keySet().size();
		List<State> states = new ArrayList<>();
		List<SortedMap<Symbol, Integer>> transitions = new ArrayList<>();
		for (int mergedId = 0; mergedId < numberOfStates; mergedId++){
			Set<Item> items = new HashSet<>();
			for (int canonicalId : groups.get(mergedId)){
				items.addAll(canonical.getState(canonicalId).getItems());
			}
			states.add(new State(mergedId, items));
			transitions.add(new TreeMap<>());
		}
		for (State state : canonical.getStates()){
			int from = stateMapping[state.id];
			for (Map.Entry<Symbol, Integer> transition : canonical.getTransitions(state.id).entrySet()){
				int to = stateMapping[transition.getValue()];
				Integer existing = transitions.get(from).put(transition.getKey(), to);
				if (existing != null && existing != to){
					throw new LrlabException(String.format("Inconsistent transition of merged state %d at %s: %d and %d",
							from, transition.getKey(), existing, to));
				}
			}
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Merged %d canonical LR(1) states into %d LALR(1) states", canonical.size(), numberOfStates));
		}
		return new Automaton(canonical.grammar, true, states, transitions);
	}

	/**
	 * Merged state id for each canonical state id
	 */
	public int[] getStateMapping(){
		return stateMapping.clone();
	}

	/**
	 * Canonical states merged into the passed state
	 */
	public List<Integer> getMergedStates(int mergedId){
		return Collections.unmodifiableList(groups.get(mergedId));
	}
}
