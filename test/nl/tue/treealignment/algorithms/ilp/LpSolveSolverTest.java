package nl.tue.treealignment.algorithms.ilp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import lpsolve.LpSolve;
import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Skipped when the native lp_solve libraries cannot be loaded.
 */
public class LpSolveSolverTest {

	private final MilpSolver solver = new LpSolveSolver();

	@BeforeAll
	public static void checkNativeLibrary() {
		boolean available;
		try {
			LpSolve.lpSolveVersion();
			available = true;
		} catch (LinkageError e) {
			available = false;
		}
		assumeTrue(available, "lp_solve native library not on the library path");
	}

	@Test
	public void testMixedIntegerProgram() throws OptimizationException {
		Solution solution = solver.solve(OjAlgoSolverTest.knapsack(), 0);
		assertEquals(-1.5, solution.getObjective(), 1E-6);
		assertEquals(1.0, solution.getValue(0), 1E-6);
		assertEquals(0.5, solution.getValue(1), 1E-6);
	}

	@Test
	public void testInfeasibleProgram() {
		assertThrows(OptimizationException.class, () -> solver.solve(OjAlgoSolverTest.infeasible(), 0));
	}
}
