package lrlab;

/**
 * Base class of the unchecked exceptions thrown by this project.
 */
public class LrlabException extends RuntimeException {

	public LrlabException(String message) {
		super(message);
	}

	public LrlabException(String message, Throwable cause) {
		super(message, cause);
	}
}
