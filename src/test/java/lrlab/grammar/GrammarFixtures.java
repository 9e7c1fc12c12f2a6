package lrlab.grammar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

import com.google.common.io.Resources;

/**
 * Access to the grammars in <code>src/test/resources/grammars</code> and shorthands for symbols
 */
public class GrammarFixtures {

	public static String text(String name){
		try {
			return Resources.toString(Resources.getResource("grammars/" + name + ".grammar"), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static Grammar grammar(String name){
		return GrammarParser.parse(text(name));
	}

	public static Rules rules(String name){
		return GrammarParser.parseRules(text(name));
	}

	public static NonTerminal nonTerminal(Grammar grammar, String name){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (nonTerminal.name.equals(name)){
				return nonTerminal;
			}
		}
		throw new AssertionError("No non terminal " + name + " in\n" + grammar);
	}

	public static Terminal terminal(String name){
		return name.equals(Terminal.EPSILON.name) ? Terminal.EPSILON
				: name.equals(Terminal.EOF.name) ? Terminal.EOF : new Terminal(name);
	}

	public static Set<Terminal> terminals(String... names){
		Set<Terminal> set = new TreeSet<>();
		for (String name : names){
			set.add(terminal(name));
		}
		return set;
	}

	/**
	 * Production with the passed left hand side and right hand side (symbols separated by spaces, ε for none)
	 */
	public static Production production(Grammar grammar, String left, String right){
		for (Production production : grammar.getProductions()){
			if (production.left.name.equals(left) && production.formatRightSide().equals(right)){
				return production;
			}
		}
		throw new AssertionError("No production " + left + " → " + right + " in\n" + grammar);
	}
}
