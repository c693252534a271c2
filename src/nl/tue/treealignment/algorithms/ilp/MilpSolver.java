package nl.tue.treealignment.algorithms.ilp;

import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Solves a mixed integer linear program, minimizing the objective.
 * Implementations must be safe to call from multiple threads at once.
 */
public interface MilpSolver {

	/**
	 * Solves the program. A timeout of zero or less means no time limit.
	 * 
	 * @param program
	 * @param timeoutMilliseconds
	 * @return the solution with variable values indexed like the columns of the
	 *         program
	 * @throws OptimizationException
	 *             if the solver fails or the program is infeasible
	 */
	public Solution solve(LinearProgram program, int timeoutMilliseconds) throws OptimizationException;

	public String getName();
}
