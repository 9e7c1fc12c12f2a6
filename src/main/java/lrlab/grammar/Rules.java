package lrlab.grammar;

import java.util.*;

import static lrlab.util.Utils.join;

/**
 * Raw, textual form of a grammar: alternatives per left hand side in declaration order.
 *
 * The first declared left hand side is the start symbol. Symbols that are never a left hand side are
 * terminals. This is the form the grammar transformations work on, {@link Grammar#fromRules(Rules)}
 * turns it into a numbered, augmented grammar.
 */
public class Rules {

	private final Map<String, List<List<String>>> alternatives = new LinkedHashMap<>();

	public Rules add(String left, List<String> right){
		alternatives.computeIfAbsent(left, k -> new ArrayList<>()).add(new ArrayList<>(right));
		return this;
	}

	public Rules add(String left, String... right){
		return add(left, Arrays.asList(right));
	}

	/**
	 * Replace all alternatives of the passed left hand side, keeps its declaration position
	 */
	public void set(String left, List<List<String>> rightSides){
		List<List<String>> copy = new ArrayList<>();
		for (List<String> right : rightSides){
			copy.add(new ArrayList<>(right));
		}
		alternatives.put(left, copy);
	}

	public boolean isEmpty(){
		return alternatives.isEmpty();
	}

	public String getStart(){
		if (alternatives.isEmpty()){
			throw new GrammarError(0, "Grammar has no productions");
		}
		return alternatives.keySet().iterator().next();
	}

	public List<String> getLeftSides(){
		return new ArrayList<>(alternatives.keySet());
	}

	public boolean isNonTerminal(String symbol){
		return alternatives.containsKey(symbol);
	}

	public List<List<String>> getAlternatives(String left){
		List<List<String>> alts = alternatives.get(left);
		return alts == null ? Collections.emptyList() : Collections.unmodifiableList(alts);
	}

	/**
	 * Returns a name based on the passed one that isn't used as a symbol yet, by appending primes.
	 */
	public String freshName(String base){
		Set<String> used = new HashSet<>(alternatives.keySet());
		for (List<List<String>> alts : alternatives.values()){
			for (List<String> alt : alts){
				used.addAll(alt);
			}
		}
		String name = base + "'";
		while (used.contains(name)){
			name += "'";
		}
		return name;
	}

	public Rules copy(){
		Rules rules = new Rules();
		for (Map.Entry<String, List<List<String>>> entry : alternatives.entrySet()){
			rules.set(entry.getKey(), entry.getValue());
		}
		return rules;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Rules && ((Rules)obj).alternatives.equals(alternatives);
	}

	@Override
	public int hashCode() {
		return alternatives.hashCode();
	}

	/**
	 * Formats the rules in the grammar text format that {@link GrammarParser} reads.
	 */
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<String, List<List<String>>> entry : alternatives.entrySet()){
			builder.append(entry.getKey()).append(" → ");
			List<String> alts = new ArrayList<>();
			for (List<String> alt : entry.getValue()){
				alts.add(alt.isEmpty() ? Terminal.EPSILON.name : join(alt, " "));
			}
			builder.append(join(alts, " | ")).append("\n");
		}
		return builder.toString();
	}
}
