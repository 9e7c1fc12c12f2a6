package lrlab.grammar;

import org.junit.jupiter.api.Test;

import static lrlab.grammar.GrammarFixtures.rules;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTransformationsTest {

	@Test
	public void testDirectLeftRecursion(){
		Rules expected = new Rules()
				.add("E", "T", "E'")
				.add("T", "F", "T'")
				.add("F", "(", "E", ")").add("F", "id")
				.add("E'", "+", "T", "E'").add("E'")
				.add("T'", "*", "F", "T'").add("T'");
		assertEquals(expected, GrammarTransformations.eliminateLeftRecursion(rules("expression")));
	}

	@Test
	public void testIndirectLeftRecursion(){
		Rules rules = GrammarParser.parseRules("S → A a | b\nA → S c | d");
		Rules expected = new Rules()
				.add("S", "A", "a").add("S", "b")
				.add("A", "b", "c", "A'").add("A", "d", "A'")
				.add("A'", "a", "c", "A'").add("A'");
		assertEquals(expected, GrammarTransformations.eliminateLeftRecursion(rules));
	}

	@Test
	public void testRulesWithoutLeftRecursionStayTheSame(){
		Rules rules = GrammarParser.parseRules("S → a S b | c");
		assertEquals(rules, GrammarTransformations.eliminateLeftRecursion(rules));
	}

	@Test
	public void testPassedRulesAreNotModified(){
		Rules rules = rules("expression");
		GrammarTransformations.eliminateLeftRecursion(rules);
		GrammarTransformations.leftFactor(rules);
		assertEquals(rules("expression"), rules);
	}

	@Test
	public void testLeftFactoring(){
		Rules rules = GrammarParser.parseRules("S → i E t S | i E t S e S | a\nE → b");
		Rules expected = new Rules()
				.add("S", "i", "E", "t", "S", "S'").add("S", "a")
				.add("E", "b")
				.add("S'").add("S'", "e", "S");
		assertEquals(expected, GrammarTransformations.leftFactor(rules));
	}

	@Test
	public void testRepeatedLeftFactoring(){
		Rules rules = GrammarParser.parseRules("A → a b c | a b d | a e");
		Rules expected = new Rules()
				.add("A", "a", "A'")
				.add("A'", "b", "A''").add("A'", "e")
				.add("A''", "c").add("A''", "d");
		assertEquals(expected, GrammarTransformations.leftFactor(rules));
	}

	@Test
	public void testFreshNamesAvoidUsedSymbols(){
		Rules rules = new Rules().add("A", "A'", "x").add("A", "A'", "y").add("A'", "z");
		Rules factored = GrammarTransformations.leftFactor(rules);
		assertTrue(factored.isNonTerminal("A''"));
		assertEquals(1, factored.getAlternatives("A").size());
	}
}
