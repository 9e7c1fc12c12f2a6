package lrlab.grammar;

import lrlab.LrlabException;

/**
 * Malformed grammar text
 */
public class GrammarError extends LrlabException {

	/**
	 * Line of the grammar text (starting at 1), 0 if unknown
	 */
	public final int line;

	public GrammarError(int line, String message) {
		super(line > 0 ? String.format("Grammar error in line %d: %s", line, message) : message);
		this.line = line;
	}
}
