package nl.tue.treealignment.algorithms;

/**
 * Thrown when the (I)LP solver does not produce a usable solution for the
 * program of a trace.
 */
public class OptimizationException extends Exception {

	private static final long serialVersionUID = 6530318520736287157L;

	public OptimizationException(String message) {
		super(message);
	}

	public OptimizationException(String message, Throwable cause) {
		super(message + ": " + cause.getMessage(), cause);
	}

}
