package nl.tue.treealignment.algorithms.ilp;

import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Values returned by a solver for a linear program.
 */
public class Solution {

	private final double objective;
	private final double[] values;
	private final boolean optimal;

	public Solution(double objective, double[] values, boolean optimal) {
		this.objective = objective;
		this.values = values;
		this.optimal = optimal;
	}

	public double getObjective() {
		return objective;
	}

	public double getValue(int column) {
		return values[column];
	}

	public int size() {
		return values.length;
	}

	/**
	 * Returns false if the solver stopped with a feasible but not proven
	 * optimal solution, for example after a timeout.
	 */
	public boolean isOptimal() {
		return optimal;
	}

	/**
	 * Solves a program without columns, which backends do not accept. Such a
	 * program is feasible only if it has no rows, since rows without
	 * coefficients are kept only when their right hand side is not zero.
	 */
	static Solution ofEmptyProgram(LinearProgram program) throws OptimizationException {
		if (program.getNRows() > 0) {
			throw new OptimizationException("Program without columns has " + program.getNRows()
					+ " unsatisfiable rows, first: " + program.getRowName(0));
		}
		return new Solution(0, new double[0], true);
	}
}
