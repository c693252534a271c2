package nl.tue.treealignment;

import nl.tue.treealignment.algorithms.ReplayAlgorithm.Debug;
import nl.tue.treealignment.algorithms.ilp.LpSolveSolver;
import nl.tue.treealignment.algorithms.ilp.MilpSolver;
import nl.tue.treealignment.algorithms.ilp.OjAlgoSolver;

public abstract class ReplayerParameters {

	public static enum Solver {
		OJALGO, LPSOLVE;
	}

	public final Solver solver; // which MILP backend
	public final int nThreads; // variants aligned in parallel
	public final int variantCacheSize; // 0 disables the cache
	public final int timeoutMilliseconds; // per variant, 0 for no limit
	public final Debug debug; // debug level

	private ReplayerParameters(Solver solver, int nThreads, int variantCacheSize, int timeoutMilliseconds,
			Debug debug) {
		if (nThreads < 1) {
			throw new IllegalArgumentException("At least one thread is needed, got " + nThreads);
		}
		if (variantCacheSize < 0) {
			throw new IllegalArgumentException("Negative variant cache size: " + variantCacheSize);
		}
		this.solver = solver;
		this.nThreads = nThreads;
		this.variantCacheSize = variantCacheSize;
		this.timeoutMilliseconds = timeoutMilliseconds;
		this.debug = debug;
	}

	public MilpSolver createSolver() {
		switch (solver) {
			case LPSOLVE :
				return new LpSolveSolver();
			case OJALGO :
			default :
				return new OjAlgoSolver();
		}
	}

	private static int defaultThreads() {
		return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
	}

	public final static class Default extends ReplayerParameters {
		public Default() {
			super(Solver.OJALGO, defaultThreads(), 128, 0, Debug.NONE);
		}

		public Default(Debug debug) {
			super(Solver.OJALGO, defaultThreads(), 128, 0, debug);
		}

		public Default(int nThreads, Debug debug) {
			super(Solver.OJALGO, nThreads, 128, 0, debug);
		}
	}

	public final static class OjAlgo extends ReplayerParameters {
		public OjAlgo() {
			super(Solver.OJALGO, defaultThreads(), 128, 0, Debug.NONE);
		}

		public OjAlgo(int nThreads, int variantCacheSize, int timeoutMilliseconds, Debug debug) {
			super(Solver.OJALGO, nThreads, variantCacheSize, timeoutMilliseconds, debug);
		}
	}

	public final static class LpSolve extends ReplayerParameters {
		public LpSolve() {
			super(Solver.LPSOLVE, defaultThreads(), 128, 0, Debug.NONE);
		}

		public LpSolve(int nThreads, int variantCacheSize, int timeoutMilliseconds, Debug debug) {
			super(Solver.LPSOLVE, nThreads, variantCacheSize, timeoutMilliseconds, debug);
		}
	}
}
