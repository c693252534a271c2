package nl.tue.treealignment.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A process tree node. Leaves carry an activity label, or no label at all in
 * which case they are silent (tau) leaves. Internal nodes carry one of the
 * operators and an ordered list of children.
 *
 * For LOOP nodes, the first child is the "do" part and the second child the
 * "redo" part.
 *
 * Trees are immutable once constructed.
 */
public class ProcessTree {

	public static enum Operator {
		SEQUENCE("->"), XOR("X"), PARALLEL("+"), LOOP("*");

		private final String symbol;

		private Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	public static final String TAU = "tau";

	private final Operator operator;
	private final String label;
	private final List<ProcessTree> children;

	protected ProcessTree(Operator operator, String label, List<ProcessTree> children) {
		this.operator = operator;
		this.label = label;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public static ProcessTree activity(String label) {
		if (label == null) {
			throw new IllegalArgumentException("Activity label cannot be null, use tau() for silent leaves");
		}
		return new ProcessTree(null, label, Collections.<ProcessTree>emptyList());
	}

	public static ProcessTree tau() {
		return new ProcessTree(null, null, Collections.<ProcessTree>emptyList());
	}

	public static ProcessTree sequence(ProcessTree... children) {
		return new ProcessTree(Operator.SEQUENCE, null, Arrays.asList(children));
	}

	public static ProcessTree xor(ProcessTree... children) {
		return new ProcessTree(Operator.XOR, null, Arrays.asList(children));
	}

	public static ProcessTree parallel(ProcessTree... children) {
		return new ProcessTree(Operator.PARALLEL, null, Arrays.asList(children));
	}

	public static ProcessTree loop(ProcessTree doPart, ProcessTree redoPart) {
		return new ProcessTree(Operator.LOOP, null, Arrays.asList(doPart, redoPart));
	}

	/**
	 * Creates an internal node without checking the number of children. Used
	 * for trees coming from elsewhere; the network factory rejects malformed
	 * ones.
	 */
	public static ProcessTree of(Operator operator, List<ProcessTree> children) {
		if (operator == null) {
			throw new IllegalArgumentException("Internal nodes need an operator");
		}
		return new ProcessTree(operator, null, children);
	}

	/**
	 * Returns the operator of this node, or null for leaves
	 */
	public Operator getOperator() {
		return operator;
	}

	/**
	 * Returns the label of this leaf, or null for silent leaves and internal
	 * nodes
	 */
	public String getLabel() {
		return label;
	}

	public List<ProcessTree> getChildren() {
		return children;
	}

	public boolean isLeaf() {
		return operator == null;
	}

	public boolean isTau() {
		return operator == null && label == null;
	}

	public String toString() {
		if (isLeaf()) {
			return isTau() ? TAU : "'" + label + "'";
		}
		StringBuilder b = new StringBuilder();
		b.append(operator.getSymbol());
		b.append("( ");
		for (int i = 0; i < children.size(); i++) {
			if (i > 0) {
				b.append(", ");
			}
			b.append(children.get(i));
		}
		b.append(" )");
		return b.toString();
	}
}
