package lrlab.grammar;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import lrlab.Config;

import static lrlab.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and numbered productions.
 *
 * The grammar is always augmented: production 0 is <code>S' → S</code> with <code>S</code> being the
 * first declared left hand side. All other productions are numbered by the name of their left hand side
 * and then by declaration order. NULLABLE, FIRST and FOLLOW sets are calculated lazily and cached,
 * the grammar itself can't be modified.
 *
 * Use {@link GrammarParser} or {@link #fromRules(Rules)} to create instances.
 */
public class Grammar {

	private static final Logger LOG = Logger.getLogger("Grammar");

	private final NonTerminal start;

	private final NonTerminal augmentedStart;

	private final List<Production> productions;

	private final SortedSet<NonTerminal> nonTerminals;

	/**
	 * Terminals including the EOF terminal
	 */
	private final SortedSet<Terminal> terminals;

	private final Rules rules;

	private final int followIterationLimit;

	private Set<NonTerminal> nullable;
	private Map<Symbol, Set<Terminal>> firstSets;
	private Map<NonTerminal, Set<Terminal>> followSets;
	private int followIterations;
	private boolean followConverged;

	private Grammar(Rules rules, int followIterationLimit) {
		this.rules = rules.copy();
		this.followIterationLimit = followIterationLimit;
		Map<String, NonTerminal> nonTerminalsByName = new HashMap<>();
		for (String left : rules.getLeftSides()){
			if (left.equals(Terminal.EOF.name) || left.equals(Terminal.EPSILON.name)){
				throw new GrammarError(0, "Reserved symbol " + left + " can't be a left hand side");
			}
			nonTerminalsByName.put(left, new NonTerminal(left));
		}
		this.start = nonTerminalsByName.get(rules.getStart());
		this.augmentedStart = new NonTerminal(rules.freshName(start.name));
		this.nonTerminals = new TreeSet<>(nonTerminalsByName.values());
		this.nonTerminals.add(augmentedStart);
		this.terminals = new TreeSet<>();
		this.terminals.add(Terminal.EOF);
		List<Production> prods = new ArrayList<>();
		prods.add(new Production(0, augmentedStart, Collections.singletonList(start)));
		List<String> sortedLeftSides = new ArrayList<>(rules.getLeftSides());
		Collections.sort(sortedLeftSides);
		for (String left : sortedLeftSides){
			for (List<String> alternative : rules.getAlternatives(left)){
				List<Symbol> right = new ArrayList<>();
				for (String name : alternative){
					if (nonTerminalsByName.containsKey(name)){
						right.add(nonTerminalsByName.get(name));
					} else {
						Terminal terminal = name.equals(Terminal.EOF.name) ? Terminal.EOF : new Terminal(name);
						terminals.add(terminal);
						right.add(terminal);
					}
				}
				prods.add(new Production(prods.size(), nonTerminalsByName.get(left), right));
			}
		}
		for (Production production : prods){
			production.left.addProduction(production);
		}
		this.productions = Collections.unmodifiableList(prods);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Created grammar with %d productions, %d terminals and %d non terminals",
					productions.size(), terminals.size(), nonTerminals.size()));
		}
	}

	public static Grammar fromRules(Rules rules){
		return fromRules(rules, Config.followIterationLimit());
	}

	/**
	 * @param followIterationLimit maximum number of passes of the FOLLOW set fixpoint iteration
	 */
	public static Grammar fromRules(Rules rules, int followIterationLimit){
		return new Grammar(rules, followIterationLimit);
	}

	public NonTerminal getStart(){
		return start;
	}

	public NonTerminal getAugmentedStart(){
		return augmentedStart;
	}

	public Production getAugmentedProduction(){
		return productions.get(0);
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProduction(int id){
		return productions.get(id);
	}

	public SortedSet<Terminal> getTerminals(){
		return Collections.unmodifiableSortedSet(terminals);
	}

	public SortedSet<NonTerminal> getNonTerminals(){
		return Collections.unmodifiableSortedSet(nonTerminals);
	}

	/**
	 * The rules this grammar was created from (without the augmented production)
	 */
	public Rules getRules(){
		return rules.copy();
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	public Set<NonTerminal> calculateNullable(){
		if (nullable != null){
			return nullable;
		}
		Set<NonTerminal> epsSet = new TreeSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : productions) {
				if (epsSet.contains(prod.left)){
					continue;
				}
				boolean allNullable = true;
				for (Symbol sym : prod.right){
					if (sym.isTerminal() || !epsSet.contains(sym)){
						allNullable = false;
						break;
					}
				}
				if (allNullable){
					somethingChanged = epsSet.add(prod.left) || somethingChanged;
				}
			}
		} while (somethingChanged);
		nullable = Collections.unmodifiableSet(epsSet);
		return nullable;
	}

	public boolean isNullable(Symbol symbol){
		return !symbol.isTerminal() && calculateNullable().contains(symbol);
	}

	public boolean isNullable(List<Symbol> term){
		for (Symbol symbol : term){
			if (!isNullable(symbol)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Calculates the FIRST set of every symbol. Terminals map to themselves, the FIRST set of a nullable
	 * non terminal contains {@link Terminal#EPSILON}.
	 */
	public Map<Symbol, Set<Terminal>> calculateFirstSets(){
		if (firstSets != null){
			return firstSets;
		}
		Set<NonTerminal> epsilonable = calculateNullable();
		Map<Symbol, Set<Terminal>> first = new TreeMap<>();
		for (Terminal terminal : terminals){
			first.put(terminal, new TreeSet<>(Collections.singleton(terminal)));
		}
		for (NonTerminal nonTerminal : nonTerminals){
			first.put(nonTerminal, new TreeSet<>());
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Production production : productions){
				Set<Terminal> set = first.get(production.left);
				for (Symbol sym : production.right){
					for (Terminal terminal : first.get(sym)){
						if (!terminal.isEpsilon()){
							firstChanged = set.add(terminal) || firstChanged;
						}
					}
					if (!epsilonable.contains(sym)){
						break;
					}
				}
			}
		} while (firstChanged);
		for (NonTerminal nonTerminal : epsilonable){
			first.get(nonTerminal).add(Terminal.EPSILON);
		}
		Map<Symbol, Set<Terminal>> result = new TreeMap<>();
		for (Map.Entry<Symbol, Set<Terminal>> entry : first.entrySet()){
			result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		firstSets = Collections.unmodifiableMap(result);
		return firstSets;
	}

	/**
	 * FIRST set of a sequence of symbols, contains {@link Terminal#EPSILON} if the whole sequence is nullable
	 */
	public Set<Terminal> calculateFirstOfSequence(List<Symbol> term){
		Map<Symbol, Set<Terminal>> first = calculateFirstSets();
		Set<Terminal> set = new TreeSet<>();
		for (Symbol symbol : term){
			for (Terminal terminal : first.get(symbol)){
				if (!terminal.isEpsilon()){
					set.add(terminal);
				}
			}
			if (!isNullable(symbol)){
				return set;
			}
		}
		set.add(Terminal.EPSILON);
		return set;
	}

	/**
	 * FIRST set of the sequence followed by the passed lookahead terminal, never contains epsilon
	 */
	public Set<Terminal> calculateFirstOfSequence(List<Symbol> term, Terminal lookahead){
		Set<Terminal> set = calculateFirstOfSequence(term);
		if (set.remove(Terminal.EPSILON)){
			set.add(lookahead);
		}
		return set;
	}

	/**
	 * Calculate the follow set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol)
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except for ε is placed in FOLLOW(B).
	 * If there is a production A → aB, then everything in FOLLOW(A) is in FOLLOW(B)
	 * If there is a production A → aBb, where FIRST(b) contains ε, then everything in FOLLOW(A) is in FOLLOW(B)
	 *
	 * The iteration stops after the configured number of passes even if it didn't reach the fixpoint,
	 * {@link #isFollowConverged()} tells whether it did.
	 */
	public Map<NonTerminal, Set<Terminal>> calculateFollowSets(){
		if (followSets != null){
			return followSets;
		}
		Map<NonTerminal, Set<Terminal>> follow = new TreeMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			follow.put(nonTerminal, new TreeSet<>());
		}
		follow.get(augmentedStart).add(Terminal.EOF);
		follow.get(start).add(Terminal.EOF);
		boolean followChanged = true;
		int iterations = 0;
		while (followChanged && iterations < followIterationLimit){
			followChanged = false;
			iterations++;
			for (Production production : productions){
				for (int i = 0; i < production.right.size(); i++){
					Symbol symbol = production.right.get(i);
					if (symbol.isTerminal()){
						continue;
					}
					Set<Terminal> set = follow.get(symbol);
					List<Symbol> rest = production.right.subList(i + 1, production.right.size());
					for (Terminal terminal : calculateFirstOfSequence(rest)){
						if (!terminal.isEpsilon()){
							followChanged = set.add(terminal) || followChanged;
						}
					}
					if (isNullable(rest)){
						followChanged = set.addAll(follow.get(production.left)) || followChanged;
					}
				}
			}
		}
		followIterations = iterations;
		followConverged = !followChanged;
		if (!followConverged){
			LOG.warning(String.format("FOLLOW sets didn't converge within %d iterations", followIterationLimit));
		} else if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("FOLLOW sets converged after %d iterations", iterations));
		}
		Map<NonTerminal, Set<Terminal>> result = new TreeMap<>();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : follow.entrySet()){
			result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		followSets = Collections.unmodifiableMap(result);
		return followSets;
	}

	public Set<Terminal> calculateFollowSet(NonTerminal nonTerminal){
		return calculateFollowSets().get(nonTerminal);
	}

	/**
	 * Did the last FOLLOW set calculation reach its fixpoint?
	 */
	public boolean isFollowConverged(){
		calculateFollowSets();
		return followConverged;
	}

	public int getFollowIterations(){
		calculateFollowSets();
		return followIterations;
	}

	/**
	 * Non fatal problems found while calculating the sets of this grammar
	 */
	public List<String> getDiagnostics(){
		List<String> diagnostics = new ArrayList<>();
		if (!isFollowConverged()){
			diagnostics.add(String.format("FOLLOW sets didn't converge within %d iterations", followIterationLimit));
		}
		return diagnostics;
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
