package nl.tue.treealignment.algorithms.ilp;

import lpsolve.LpSolve;
import lpsolve.LpSolveException;
import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Solves programs with lp_solve 5.5. Requires the native lpsolve55 and
 * lpsolve55j libraries on the library path.
 */
public class LpSolveSolver implements MilpSolver {

	public Solution solve(LinearProgram program, int timeoutMilliseconds) throws OptimizationException {
		if (program.getNColumns() == 0) {
			return Solution.ofEmptyProgram(program);
		}
		int columns = program.getNColumns();
		LpSolve solver;
		try {
			synchronized (LpSolve.class) {
				solver = LpSolve.makeLp(0, columns);
			}
		} catch (LpSolveException e) {
			throw new OptimizationException("Could not create lp_solve model", e);
		}

		try {
			solver.setVerbose(0);

			// lp_solve counts columns from 1
			int[] colno = new int[columns];
			double[] row = new double[columns];
			for (int c = 0; c < columns; c++) {
				colno[c] = c + 1;
				row[c] = program.getCost(c);
			}
			solver.setObjFnex(columns, row, colno);

			solver.setAddRowmode(true);
			for (int r = 0; r < program.getNRows(); r++) {
				int[] cols = program.getRowColumns(r);
				for (int i = 0; i < cols.length; i++) {
					colno[i] = cols[i] + 1;
				}
				solver.addConstraintex(cols.length, program.getRowCoefficients(r), colno,
						program.getRowType(r) == LinearProgram.EQ ? LpSolve.EQ : LpSolve.LE, program.getRhs(r));
			}
			solver.setAddRowmode(false);

			for (int c = 0; c < columns; c++) {
				solver.setLowbo(c + 1, program.getLower(c));
				solver.setUpbo(c + 1, program.getUpper(c));
				solver.setInt(c + 1, program.isInteger(c));
			}
			solver.setMinim();
			if (timeoutMilliseconds > 0) {
				solver.setTimeout(Math.max(1, timeoutMilliseconds / 1000));
			}

			int solverResult = solver.solve();
			if (solverResult == LpSolve.OPTIMAL || solverResult == LpSolve.SUBOPTIMAL) {
				double[] values = new double[columns];
				solver.getVariables(values);
				return new Solution(solver.getObjective(), values, solverResult == LpSolve.OPTIMAL);
			}
			throw new OptimizationException("lp_solve returned " + solverResult + " for a program with " + columns
					+ " columns and " + program.getNRows() + " rows");
		} catch (LpSolveException e) {
			throw new OptimizationException("lp_solve failed", e);
		} finally {
			solver.deleteLp();
		}
	}

	public String getName() {
		return "lp_solve";
	}

}
