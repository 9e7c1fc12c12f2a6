package lrlab.grammar;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static lrlab.grammar.GrammarFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarParserTest {

	@Test
	public void testAlternativesAndContinuationLines(){
		Rules rules = GrammarParser.parseRules("A → a B | c\n     | ε\nB → b");
		assertEquals(Arrays.asList(Arrays.asList("a", "B"), Collections.singletonList("c"), Collections.emptyList()),
				rules.getAlternatives("A"));
		assertEquals(Collections.singletonList(Collections.singletonList("b")), rules.getAlternatives("B"));
		assertEquals("A", rules.getStart());
	}

	@Test
	public void testAsciiArrowAndComments(){
		Rules rules = GrammarParser.parseRules("# comment\n\nS -> x S | \n");
		assertEquals(Arrays.asList(Arrays.asList("x", "S"), Collections.emptyList()), rules.getAlternatives("S"));
	}

	@Test
	public void testQuotedSymbolsAreAtomic(){
		Rules rules = GrammarParser.parseRules("A → '|' '->' a'ε'");
		assertEquals(Collections.singletonList(Arrays.asList("'|'", "'->'", "a", "'ε'")), rules.getAlternatives("A"));
	}

	@Test
	public void testSymbolsWithoutLeftHandSideAreTerminals(){
		Grammar grammar = grammar("assignment");
		assertEquals(terminals("$", "*", "=", "id"), grammar.getTerminals());
		assertEquals(4, grammar.getNonTerminals().size());
		assertEquals("S", grammar.getStart().name);
		assertEquals("S'", grammar.getAugmentedStart().name);
	}

	@Test
	public void testProductionNumbering(){
		Grammar grammar = grammar("assignment");
		assertEquals("0 S' → S", grammar.getProduction(0).toString());
		assertEquals("1 L → * R", grammar.getProduction(1).toString());
		assertEquals("2 L → id", grammar.getProduction(2).toString());
		assertEquals("3 R → L", grammar.getProduction(3).toString());
		assertEquals("4 S → L = R", grammar.getProduction(4).toString());
		assertEquals("5 S → R", grammar.getProduction(5).toString());
		assertEquals(grammar.toString(), grammar("assignment").toString(), "numbering is stable");
	}

	@Test
	public void testAugmentedStartGetsAFreshName(){
		Grammar grammar = Grammar.fromRules(new Rules().add("S", "S'").add("S", "a").add("S'", "b"));
		assertEquals("S''", grammar.getAugmentedStart().name);
		assertEquals(grammar.getStart(), grammar.getAugmentedProduction().right.get(0));
	}

	@Test
	public void testEpsilonProduction(){
		Grammar grammar = GrammarParser.parse("A → a A | ε");
		Production epsilon = production(grammar, "A", "ε");
		assertTrue(epsilon.isEpsilonProduction());
		assertFalse(grammar.getTerminals().contains(Terminal.EPSILON));
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"",
			"# only a comment",
			"A a b",
			"| a",
			"A → 'a",
			"A → ''",
			"A B → c",
			"→ c",
			"$ → a"
	})
	public void testInvalidGrammars(String text){
		assertThrows(GrammarError.class, () -> GrammarParser.parse(text));
	}

	@Test
	public void testErrorLineNumber(){
		GrammarError error = assertThrows(GrammarError.class, () -> GrammarParser.parseRules("A → a\n\nB b"));
		assertEquals(3, error.line);
	}

	@Test
	public void testRulesRoundTripThroughText(){
		Rules rules = rules("expression");
		assertEquals(rules, GrammarParser.parseRules(rules.toString()));
	}
}
