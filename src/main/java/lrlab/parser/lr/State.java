package lrlab.parser.lr;

import java.util.*;

import com.google.common.collect.ImmutableSortedSet;

import lrlab.grammar.*;

/**
 * A state of an LR automaton: an immutable set of items.
 *
 * The sorted item set is the canonical key of the state, two states with the same items are the same
 * state. Closure and goto live here as static functions over item sets.
 */
public class State implements Comparable<State> {

	public final int id;

	private final ImmutableSortedSet<Item> items;

	public State(int id, Collection<Item> items) {
		this.id = id;
		this.items = ImmutableSortedSet.copyOf(items);
	}

	public ImmutableSortedSet<Item> getItems(){
		return items;
	}

	/**
	 * Items that aren't added by the closure: items with the dot not at the start and the augmented start item
	 */
	public List<Item> getKernel(){
		List<Item> kernel = new ArrayList<>();
		for (Item item : items){
			if (item.position > 0 || item.production.id == 0){
				kernel.add(item);
			}
		}
		return kernel;
	}

	/**
	 * The items without their lookaheads
	 */
	public ImmutableSortedSet<Item> core(){
		ImmutableSortedSet.Builder<Item> builder = ImmutableSortedSet.naturalOrder();
		for (Item item : items){
			builder.add(item.core());
		}
		return builder.build();
	}

	/**
	 * Symbols that appear right after a dot, sorted
	 */
	public SortedSet<Symbol> nextSymbols(){
		SortedSet<Symbol> symbols = new TreeSet<>();
		for (Item item : items){
			if (!item.isComplete()){
				symbols.add(item.nextSymbol());
			}
		}
		return symbols;
	}

	public List<Item> getCompleteItems(){
		List<Item> complete = new ArrayList<>();
		for (Item item : items){
			if (item.isComplete()){
				complete.add(item);
			}
		}
		return complete;
	}

	/**
	 * Adds the items implied by non terminals right after a dot until nothing changes.
	 *
	 * Items with a lookahead get new items for every terminal in FIRST(β a) for an item [A → α • B β, a],
	 * items without lookahead get items without lookahead.
	 */
	public static ImmutableSortedSet<Item> closure(Grammar grammar, Collection<Item> kernel){
		Set<Item> result = new HashSet<>(kernel);
		Deque<Item> worklist = new ArrayDeque<>(kernel);
		while (!worklist.isEmpty()){
			Item item = worklist.poll();
			if (!item.inFrontOfNonTerminal()){
				continue;
			}
			NonTerminal next = (NonTerminal)item.nextSymbol();
			Collection<Terminal> lookaheads;
			if (item.hasLookahead()){
				List<Symbol> rest = item.production.right.subList(item.position + 1, item.production.rightSize());
				lookaheads = grammar.calculateFirstOfSequence(rest, item.lookahead);
			} else {
				lookaheads = Collections.singletonList(null);
			}
			for (Production production : next.getProductions()){
				for (Terminal lookahead : lookaheads){
					Item newItem = new Item(production, lookahead);
					if (result.add(newItem)){
						worklist.add(newItem);
					}
				}
			}
		}
		return ImmutableSortedSet.copyOf(result);
	}

	/**
	 * Advances the dot over the passed symbol in every item where it's possible and returns the closure
	 * of the result, an empty set if no item could be advanced.
	 */
	public static ImmutableSortedSet<Item> goTo(Grammar grammar, Collection<Item> items, Symbol symbol){
		List<Item> kernel = new ArrayList<>();
		for (Item item : items){
			if (!item.isComplete() && item.nextSymbol().equals(symbol)){
				kernel.add(item.advance());
			}
		}
		if (kernel.isEmpty()){
			return ImmutableSortedSet.of();
		}
		return closure(grammar, kernel);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("State ").append(id);
		for (Item item : items){
			builder.append("\n- ").append(item);
		}
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof State && ((State)obj).id == id && ((State)obj).items.equals(items);
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
