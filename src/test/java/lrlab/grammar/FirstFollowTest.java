package lrlab.grammar;

import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static lrlab.grammar.GrammarFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class FirstFollowTest {

	/**
	 * Expression grammar without left recursion, primed names can't be written in the grammar text
	 */
	private static Grammar expressions(){
		return Grammar.fromRules(new Rules()
				.add("E", "T", "E'")
				.add("E'", "+", "T", "E'").add("E'")
				.add("T", "F", "T'")
				.add("T'", "*", "F", "T'").add("T'")
				.add("F", "(", "E", ")").add("F", "id"));
	}

	@Test
	public void testNullable(){
		Grammar grammar = expressions();
		assertEquals(new HashSet<>(Arrays.asList(nonTerminal(grammar, "E'"), nonTerminal(grammar, "T'"))),
				new HashSet<>(grammar.calculateNullable()));
		assertFalse(grammar.isNullable(nonTerminal(grammar, "E")));
		assertFalse(grammar.isNullable(terminal("id")));
	}

	@ParameterizedTest
	@CsvSource(quoteCharacter = '"', value = {
			"E, ( id",
			"E', + ε",
			"T, ( id",
			"T', * ε",
			"F, ( id"
	})
	public void testFirst(String nonTerminal, String first){
		Grammar grammar = expressions();
		assertEquals(terminals(first.split(" ")), grammar.calculateFirstSets().get(nonTerminal(grammar, nonTerminal)));
	}

	@ParameterizedTest
	@CsvSource(quoteCharacter = '"', value = {
			"E, ) $",
			"E', ) $",
			"T, + ) $",
			"T', + ) $",
			"F, * + ) $"
	})
	public void testFollow(String nonTerminal, String follow){
		Grammar grammar = expressions();
		assertEquals(terminals(follow.split(" ")), grammar.calculateFollowSet(nonTerminal(grammar, nonTerminal)));
	}

	@Test
	public void testFirstOfTerminalIsTheTerminal(){
		Grammar grammar = expressions();
		assertEquals(terminals("+"), grammar.calculateFirstSets().get(terminal("+")));
	}

	@Test
	public void testFirstLooksPastNullableSymbols(){
		Grammar grammar = GrammarParser.parse("S → A B c\nA → a | ε\nB → b | ε");
		assertEquals(terminals("a", "b", "c"), grammar.calculateFirstSets().get(nonTerminal(grammar, "S")));
		assertEquals(terminals("b", "c"), grammar.calculateFollowSet(nonTerminal(grammar, "A")));
		assertEquals(terminals("c"), grammar.calculateFollowSet(nonTerminal(grammar, "B")));
	}

	@Test
	public void testFirstOfSequence(){
		Grammar grammar = GrammarParser.parse("S → A B c\nA → a | ε\nB → b | ε");
		List<Symbol> ab = Arrays.asList(nonTerminal(grammar, "A"), nonTerminal(grammar, "B"));
		assertEquals(terminals("a", "b", "ε"), grammar.calculateFirstOfSequence(ab));
		assertEquals(terminals("a", "b", "$"), grammar.calculateFirstOfSequence(ab, Terminal.EOF));
		assertEquals(terminals("ε"), grammar.calculateFirstOfSequence(Collections.emptyList()));
	}

	@Test
	public void testFollowOfStartContainsEof(){
		Grammar grammar = grammar("assignment");
		assertTrue(grammar.calculateFollowSet(grammar.getStart()).contains(Terminal.EOF));
		assertTrue(grammar.calculateFollowSet(grammar.getAugmentedStart()).contains(Terminal.EOF));
		assertEquals(terminals("=", "$"), grammar.calculateFollowSet(nonTerminal(grammar, "R")));
	}

	@Test
	public void testFollowIterationLimit(){
		Grammar limited = Grammar.fromRules(rules("expression"), 1);
		assertFalse(limited.isFollowConverged());
		assertEquals(1, limited.getFollowIterations());
		assertEquals(1, limited.getDiagnostics().size());
		Grammar unlimited = Grammar.fromRules(rules("expression"));
		assertTrue(unlimited.isFollowConverged());
		assertTrue(unlimited.getDiagnostics().isEmpty());
	}

	@Test
	public void testReportContainsSets(){
		String report = new GrammarReport(expressions()).toString();
		assertTrue(report.contains("Productions:"), report);
		assertTrue(report.contains("E'"), report);
		assertTrue(report.contains("{$, ), +}"), report);
		assertFalse(report.contains("Warning"), report);
	}
}
