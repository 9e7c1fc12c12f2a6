package lrlab.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol {

	/**
	 * End of input marker
	 */
	public static final Terminal EOF = new Terminal("$");

	/**
	 * Marks the empty word in FIRST sets, never part of a production
	 */
	public static final Terminal EPSILON = new Terminal("ε");

	public Terminal(String name) {
		super(name);
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	public boolean isEpsilon(){
		return this.equals(EPSILON);
	}
}
