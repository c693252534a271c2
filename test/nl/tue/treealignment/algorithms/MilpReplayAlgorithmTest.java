package nl.tue.treealignment.algorithms;

import static nl.tue.treealignment.tree.ProcessTree.activity;
import static nl.tue.treealignment.tree.ProcessTree.loop;
import static nl.tue.treealignment.tree.ProcessTree.parallel;
import static nl.tue.treealignment.tree.ProcessTree.sequence;
import static nl.tue.treealignment.tree.ProcessTree.tau;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import nl.tue.treealignment.Alignment;
import nl.tue.treealignment.Move;
import nl.tue.treealignment.Utils;
import nl.tue.treealignment.Utils.Statistic;
import nl.tue.treealignment.algorithms.ilp.LinearProgram;
import nl.tue.treealignment.algorithms.ilp.MilpSolver;
import nl.tue.treealignment.algorithms.ilp.Solution;
import nl.tue.treealignment.network.Network;
import nl.tue.treealignment.network.NetworkFactory;
import nl.tue.treealignment.network.StructuralException;
import nl.tue.treealignment.tree.ProcessTree;

public class MilpReplayAlgorithmTest {

	private static Network compile(ProcessTree tree) throws StructuralException {
		return new NetworkFactory().compile(tree);
	}

	/**
	 * Returns a fixed solution, whatever the program.
	 */
	private static class FixedSolver implements MilpSolver {
		private final Solution solution;

		FixedSolver(Solution solution) {
			this.solution = solution;
		}

		public Solution solve(LinearProgram program, int timeoutMilliseconds) {
			return solution;
		}

		public String getName() {
			return "fixed";
		}
	}

	@Test
	public void testSingleActivityDimensions() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		LinearProgram program = algorithm.setupProgram();
		// x for two steps, y for two nodes, one z
		assertEquals(5, program.getNColumns());
		assertEquals(4, program.getNEqualities());
		assertEquals(0, program.getNInequalities());
		assertEquals(0, program.getNIntegers());
		assertEquals(1.0, program.getCost(0), 0);
		assertEquals(1.0, program.getCost(2), 0);
		assertEquals(0.0, program.getCost(4), 0);
	}

	@Test
	public void testEmptyTraceDimensions() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")),
				Collections.<String>emptyList());
		LinearProgram program = algorithm.setupProgram();
		assertEquals(1, program.getNColumns());
		assertEquals(2, program.getNRows());
		assertEquals(-1.0, program.getRhs(0), 0);
		assertEquals(1.0, program.getRhs(1), 0);
	}

	@Test
	public void testParallelDimensions() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(parallel(activity("A"), activity("B"))),
				Arrays.asList("A"));
		LinearProgram program = algorithm.setupProgram();
		// 12 x, 6 y, 1 z and 4 s
		assertEquals(23, program.getNColumns());
		assertEquals(4, program.getNIntegers());
		// 12 conservation and 4 shuffle rows
		assertEquals(16, program.getNEqualities());
		// the synchronous move over an edge with cost 2 is rewarded
		assertEquals(-1.0, program.getCost(18), 0);
	}

	@Test
	public void testDuplicateLabelsAreBounded() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(sequence(activity("A"), activity("A"))),
				Arrays.asList("A", "A"));
		LinearProgram program = algorithm.setupProgram();
		assertEquals(2, program.getNInequalities());
		int row = program.getNRows() - 1;
		assertEquals(LinearProgram.LE, program.getRowType(row));
		assertEquals(1.0, program.getRhs(row), 0);
		assertEquals(2, program.getRowColumns(row).length);
	}

	@Test
	public void testTauLoopAcceptsEmptyTrace() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(loop(tau(), activity("A"))),
				Collections.<String>emptyList());
		LinearProgram program = algorithm.setupProgram();
		assertEquals(1, program.getNColumns());
		// the self loop cancels and source and sink coincide
		assertEquals(0, program.getNRows());
	}

	@Test
	public void testDecodeSynchronousMove() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		algorithm.setupProgram();
		List<Move> moves = algorithm.decode(new Solution(0, new double[] { 0, 0, 0, 0, 1 }, true));
		assertEquals(Arrays.asList(Move.synchronous("A")), moves);
		assertEquals(0, algorithm.degenerateSteps);
		assertEquals(0, algorithm.modelOnlySteps);
	}

	@Test
	public void testDecodeLogAndModelMoves() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("B"));
		LinearProgram program = algorithm.setupProgram();
		// x0, x1, y1 for two nodes, no z
		assertEquals(4, program.getNColumns());
		List<Move> moves = algorithm.decode(new Solution(2, new double[] { 0, 1, 1, 0 }, true));
		assertEquals(Arrays.asList(Move.onLog("B"), Move.onModel("A")), moves);
	}

	@Test
	public void testDecodeModelOnlyStep() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		algorithm.setupProgram();
		List<Move> moves = algorithm.decode(new Solution(1, new double[] { 0, 1, 0, 0, 0 }, true));
		assertEquals(Arrays.asList(Move.onModel("A")), moves);
		assertEquals(1, algorithm.modelOnlySteps);
		assertEquals(0, algorithm.degenerateSteps);
	}

	@Test
	public void testDecodeAllZeroFallsBackToLogMoves() throws StructuralException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		algorithm.setupProgram();
		List<Move> moves = algorithm.decode(new Solution(0, new double[5], true));
		assertEquals(Arrays.asList(Move.onLog("A")), moves);
		assertEquals(1, algorithm.degenerateSteps);
	}

	@Test
	public void testRunRecordsExitCode() throws StructuralException, OptimizationException {
		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		Alignment alignment = algorithm.run(new FixedSolver(new Solution(0.1 + 0.2, new double[5], false)), 0);

		int exitCode = alignment.getStatistics().get(Statistic.EXITCODE);
		assertEquals(Utils.SUBOPTIMALALIGNMENT | Utils.DEGENERATESOLUTION, exitCode);
		assertFalse(alignment.isOptimal());
		assertEquals(0.3, alignment.getCost(), 0);
		assertEquals(1, alignment.getStatistics().get(Statistic.DEGENERATESTEPS));
		assertEquals(5, alignment.getStatistics().get(Statistic.VARIABLES));
		assertEquals(1, alignment.getStatistics().get(Statistic.LOGMOVES));
	}

	@Test
	public void testRunPropagatesSolverFailure() throws StructuralException {
		final MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(compile(activity("A")), Arrays.asList("A"));
		final OptimizationException failure = new OptimizationException("infeasible");
		OptimizationException e = assertThrows(OptimizationException.class, () -> algorithm.run(new MilpSolver() {
			public Solution solve(LinearProgram program, int timeoutMilliseconds) throws OptimizationException {
				throw failure;
			}

			public String getName() {
				return "failing";
			}
		}, 0));
		assertSame(failure, e);
	}
}
