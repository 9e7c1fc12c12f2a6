package lrlab.grammar;

import java.util.*;
import java.util.logging.Logger;

import static lrlab.util.Utils.join;

/**
 * Transformations that make a grammar more likely to be LL(1).
 *
 * Both work on {@link Rules} and leave the passed rules untouched.
 */
public class GrammarTransformations {

	private static final Logger LOG = Logger.getLogger("Grammar");

	/**
	 * Eliminates direct and indirect left recursion.
	 *
	 * The non terminals are processed in declaration order A1, …, An. Productions Ai → Aj γ with j &lt; i
	 * are expanded with the alternatives of Aj, then direct left recursion Ai → Ai α | β is replaced by
	 * Ai → β Ai' and Ai' → α Ai' | ε. Alternatives of the form A → A are dropped. The result is only
	 * guaranteed to be free of left recursion if the grammar has no ε-productions and no cycles.
	 */
	public static Rules eliminateLeftRecursion(Rules rules){
		Rules result = rules.copy();
		List<String> order = result.getLeftSides();
		for (int i = 0; i < order.size(); i++){
			String a = order.get(i);
			for (int j = 0; j < i; j++){
				String b = order.get(j);
				List<List<String>> newAlternatives = new ArrayList<>();
				for (List<String> alternative : result.getAlternatives(a)){
					if (!alternative.isEmpty() && alternative.get(0).equals(b)){
						for (List<String> bAlternative : result.getAlternatives(b)){
							List<String> expanded = new ArrayList<>(bAlternative);
							expanded.addAll(alternative.subList(1, alternative.size()));
							newAlternatives.add(expanded);
						}
					} else {
						newAlternatives.add(alternative);
					}
				}
				result.set(a, newAlternatives);
			}
			List<List<String>> alphas = new ArrayList<>();
			List<List<String>> betas = new ArrayList<>();
			for (List<String> alternative : result.getAlternatives(a)){
				if (!alternative.isEmpty() && alternative.get(0).equals(a)){
					if (alternative.size() > 1){
						alphas.add(alternative.subList(1, alternative.size()));
					}
				} else {
					betas.add(alternative);
				}
			}
			if (alphas.isEmpty()){
				continue;
			}
			String aPrime = result.freshName(a);
			List<List<String>> aAlternatives = new ArrayList<>();
			for (List<String> beta : betas){
				List<String> alt = new ArrayList<>(beta);
				alt.add(aPrime);
				aAlternatives.add(alt);
			}
			List<List<String>> primeAlternatives = new ArrayList<>();
			for (List<String> alpha : alphas){
				List<String> alt = new ArrayList<>(alpha);
				alt.add(aPrime);
				primeAlternatives.add(alt);
			}
			primeAlternatives.add(new ArrayList<>());
			result.set(a, aAlternatives);
			result.set(aPrime, primeAlternatives);
			LOG.info(String.format("Eliminated left recursion in %s, introduced %s", a, aPrime));
		}
		return result;
	}

	/**
	 * Left factors the alternatives of every non terminal until no two alternatives share a first symbol.
	 *
	 * A → α β1 | α β2 | γ becomes A → α A' | γ and A' → β1 | β2 with α being the longest common prefix.
	 */
	public static Rules leftFactor(Rules rules){
		Rules result = rules.copy();
		boolean changed = true;
		while (changed){
			changed = false;
			for (String a : result.getLeftSides()){
				if (leftFactorOnce(result, a)){
					changed = true;
					break;
				}
			}
		}
		return result;
	}

	private static boolean leftFactorOnce(Rules rules, String a){
		Map<String, List<List<String>>> groups = new LinkedHashMap<>();
		for (List<String> alternative : rules.getAlternatives(a)){
			if (!alternative.isEmpty()){
				groups.computeIfAbsent(alternative.get(0), k -> new ArrayList<>()).add(alternative);
			}
		}
		for (List<List<String>> group : groups.values()){
			if (group.size() < 2){
				continue;
			}
			List<String> prefix = commonPrefix(group);
			String aPrime = rules.freshName(a);
			List<List<String>> aAlternatives = new ArrayList<>();
			boolean inserted = false;
			for (List<String> alternative : rules.getAlternatives(a)){
				if (group.contains(alternative)){
					if (!inserted){
						List<String> factored = new ArrayList<>(prefix);
						factored.add(aPrime);
						aAlternatives.add(factored);
						inserted = true;
					}
				} else {
					aAlternatives.add(alternative);
				}
			}
			List<List<String>> primeAlternatives = new ArrayList<>();
			for (List<String> alternative : group){
				List<String> suffix = new ArrayList<>(alternative.subList(prefix.size(), alternative.size()));
				if (!primeAlternatives.contains(suffix)){
					primeAlternatives.add(suffix);
				}
			}
			rules.set(a, aAlternatives);
			rules.set(aPrime, primeAlternatives);
			LOG.info(String.format("Left factored %s with common prefix %s, introduced %s", a, join(prefix, " "), aPrime));
			return true;
		}
		return false;
	}

	private static List<String> commonPrefix(List<List<String>> alternatives){
		List<String> first = alternatives.get(0);
		int length = first.size();
		for (List<String> alternative : alternatives){
			length = Math.min(length, alternative.size());
			for (int i = 0; i < length; i++){
				if (!alternative.get(i).equals(first.get(i))){
					length = i;
					break;
				}
			}
		}
		return new ArrayList<>(first.subList(0, length));
	}
}
