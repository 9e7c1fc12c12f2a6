package lrlab.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses grammars written as
 *
 * <pre>
 * Stmt → Expr ';'
 *      | Cond ;
 * Expr → Factor | ε
 * </pre>
 *
 * Alternatives are separated by <code>|</code>, a line starting with <code>|</code> continues the last
 * left hand side. Symbols are separated by whitespace, quoted symbols like <code>'|'</code> are atomic
 * terminals (the quotes are part of their name). <code>ε</code> or an empty alternative is the empty word.
 * <code>-&gt;</code> can be used instead of <code>→</code>, lines starting with <code>#</code> are comments.
 */
public class GrammarParser {

	public static final String ARROW = "→";
	public static final String ASCII_ARROW = "->";

	public static Grammar parse(String text){
		return Grammar.fromRules(parseRules(text));
	}

	public static Rules parseRules(String text){
		Rules rules = new Rules();
		String currentLeft = null;
		String[] lines = text.split("\r?\n", -1);
		for (int i = 0; i < lines.length; i++){
			int lineNumber = i + 1;
			String line = lines[i].trim();
			if (line.isEmpty() || line.startsWith("#")){
				continue;
			}
			String right;
			if (line.startsWith("|")){
				if (currentLeft == null){
					throw new GrammarError(lineNumber, "Alternative without a preceding left hand side");
				}
				right = line.substring(1);
			} else {
				int arrow = findArrow(line);
				if (arrow == -1){
					throw new GrammarError(lineNumber, "Expected " + ARROW + " in \"" + line + "\"");
				}
				currentLeft = line.substring(0, arrow).trim();
				if (currentLeft.isEmpty() || currentLeft.contains(" ") || currentLeft.contains("'")){
					throw new GrammarError(lineNumber, "Invalid left hand side \"" + currentLeft + "\"");
				}
				int arrowLength = line.startsWith(ARROW, arrow) ? ARROW.length() : ASCII_ARROW.length();
				right = line.substring(arrow + arrowLength);
			}
			for (List<String> alternative : splitAlternatives(right, lineNumber)){
				rules.add(currentLeft, alternative);
			}
		}
		if (rules.isEmpty()){
			throw new GrammarError(0, "Grammar has no productions");
		}
		return rules;
	}

	private static int findArrow(String line){
		int arrow = line.indexOf(ARROW);
		int asciiArrow = line.indexOf(ASCII_ARROW);
		if (arrow == -1){
			return asciiArrow;
		}
		if (asciiArrow == -1){
			return arrow;
		}
		return Math.min(arrow, asciiArrow);
	}

	/**
	 * Splits a right hand side into its alternatives and these into symbols.
	 */
	static List<List<String>> splitAlternatives(String right, int lineNumber){
		List<List<String>> alternatives = new ArrayList<>();
		List<String> current = new ArrayList<>();
		StringBuilder symbol = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < right.length(); i++){
			char c = right.charAt(i);
			if (quoted){
				symbol.append(c);
				if (c == '\''){
					quoted = false;
					finishSymbol(symbol, current, lineNumber);
				}
			} else if (c == '\''){
				finishSymbol(symbol, current, lineNumber);
				symbol.append(c);
				quoted = true;
			} else if (c == '|'){
				finishSymbol(symbol, current, lineNumber);
				alternatives.add(current);
				current = new ArrayList<>();
			} else if (Character.isWhitespace(c)){
				finishSymbol(symbol, current, lineNumber);
			} else {
				symbol.append(c);
			}
		}
		if (quoted){
			throw new GrammarError(lineNumber, "Unterminated quoted symbol " + symbol);
		}
		finishSymbol(symbol, current, lineNumber);
		alternatives.add(current);
		return alternatives;
	}

	private static void finishSymbol(StringBuilder symbol, List<String> alternative, int lineNumber){
		if (symbol.length() == 0){
			return;
		}
		String str = symbol.toString();
		symbol.setLength(0);
		if (str.equals("''")){
			throw new GrammarError(lineNumber, "Empty quoted symbol");
		}
		if (!str.equals(Terminal.EPSILON.name)){
			alternative.add(str);
		}
	}
}
