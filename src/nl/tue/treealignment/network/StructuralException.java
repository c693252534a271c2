package nl.tue.treealignment.network;

import nl.tue.treealignment.tree.ProcessTree;

/**
 * Thrown when a process tree cannot be compiled into a network, for example a
 * LOOP node that does not have exactly two children.
 */
public class StructuralException extends Exception {

	private static final long serialVersionUID = -3216419012447726025L;

	private final transient ProcessTree subtree;

	public StructuralException(String message, ProcessTree subtree) {
		super(message + ": " + subtree);
		this.subtree = subtree;
	}

	/**
	 * Returns the offending subtree
	 */
	public ProcessTree getSubtree() {
		return subtree;
	}
}
