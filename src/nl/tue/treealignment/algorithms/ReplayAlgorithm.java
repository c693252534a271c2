package nl.tue.treealignment.algorithms;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.treealignment.Alignment;
import nl.tue.treealignment.Move;
import nl.tue.treealignment.Utils;
import nl.tue.treealignment.Utils.Statistic;
import nl.tue.treealignment.algorithms.ilp.LinearProgram;
import nl.tue.treealignment.algorithms.ilp.MilpSolver;
import nl.tue.treealignment.algorithms.ilp.Solution;
import nl.tue.treealignment.network.Network;

/**
 * The replay algorithm aligns one trace with a compiled network. It sets up a
 * linear program, hands it to a solver and reconstructs the moves from the
 * solution. Setting up and decoding are left to implementing subclasses.
 *
 * An instance is used for a single trace and is not thread safe; the network
 * it reads is.
 */
public abstract class ReplayAlgorithm {

	public static enum Debug {
		NORMAL, //
		NONE, //
		STATS, //
		LP;

		private static PrintStream output = System.out;

		public synchronized void println(Debug db, String s) {
			if (this == db) {
				synchronized (output) {
					output.println(s);
				}
			}
		}

		public synchronized void println(Debug db) {
			if (this == db) {
				synchronized (output) {
					output.println();
				}
			}
		}

		public synchronized void print(Debug db, String s) {
			if (this == db) {
				synchronized (output) {
					output.print(s);
				}
			}
		}

		public synchronized static void setOutputStream(PrintStream out) {
			output = out;
		}

		public synchronized static PrintStream getOutputStream() {
			return output;
		}
	}

	/**
	 * Tolerance above which a variable in the solution counts as active
	 */
	public static final double ACTIVE = 1E-5;

	protected final Network net;
	protected final List<String> trace;
	protected final Debug debug;

	protected int setupTime;
	protected int solveTime;
	protected int alignmentResult;
	protected int modelOnlySteps;
	protected int degenerateSteps;

	private LinearProgram program;

	public ReplayAlgorithm(Network net, List<String> trace, Debug debug) {
		this.net = net;
		this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
		this.debug = debug;
	}

	public Alignment run(MilpSolver solver, int timeoutMilliseconds) throws OptimizationException {
		long start = System.nanoTime();
		alignmentResult = 0;
		modelOnlySteps = 0;
		degenerateSteps = 0;

		program = setupProgram();
		setupTime = (int) ((System.nanoTime() - start) / 1000);
		debug.println(Debug.LP, "Program for " + Utils.toString(trace, ',') + ":");
		debug.println(Debug.LP, program.toString());

		long solveStart = System.nanoTime();
		Solution solution;
		try {
			solution = solver.solve(program, timeoutMilliseconds);
		} finally {
			solveTime = (int) ((System.nanoTime() - solveStart) / 1000);
		}
		alignmentResult |= solution.isOptimal() ? Utils.OPTIMALALIGNMENT : Utils.SUBOPTIMALALIGNMENT;

		List<Move> moves = decode(solution);
		if (degenerateSteps > 0) {
			alignmentResult |= Utils.DEGENERATESOLUTION;
		}
		double cost = Utils.roundCost(solution.getObjective());

		debug.println(Debug.NORMAL, "Aligned " + Utils.toString(trace, ',') + " with " + solver.getName() + " cost "
				+ cost + " in " + (setupTime + solveTime) + " us: " + Utils.toString(moves));
		return new Alignment(trace, cost, moves, getStatistics(moves));
	}

	/**
	 * Builds the linear program for the trace.
	 */
	protected abstract LinearProgram setupProgram();

	/**
	 * Reconstructs the alignment moves from a solution to the program built by
	 * {@link #setupProgram()}.
	 */
	protected abstract List<Move> decode(Solution solution);

	/**
	 * Returns the program built in the last run, or null.
	 */
	public LinearProgram getProgram() {
		return program;
	}

	public TObjectIntMap<Statistic> getStatistics(List<Move> moves) {
		TObjectIntMap<Statistic> map = new TObjectIntHashMap<>(20);
		map.put(Statistic.EXITCODE, alignmentResult);
		map.put(Statistic.TRACELENGTH, trace.size());
		map.put(Statistic.NODES, net.numNodes());
		map.put(Statistic.EDGES, net.numEdges());
		if (program != null) {
			map.put(Statistic.VARIABLES, program.getNColumns());
			map.put(Statistic.BINARYVARIABLES, program.getNIntegers());
			map.put(Statistic.EQUALITIES, program.getNEqualities());
			map.put(Statistic.INEQUALITIES, program.getNInequalities());
		}
		int sync = 0, log = 0, model = 0;
		for (Move move : moves) {
			switch (move.getType()) {
				case SYNC :
					sync++;
					break;
				case LOG :
					log++;
					break;
				case MODEL :
					model++;
					break;
			}
		}
		map.put(Statistic.ALIGNMENTLENGTH, moves.size());
		map.put(Statistic.SYNCMOVES, sync);
		map.put(Statistic.LOGMOVES, log);
		map.put(Statistic.MODELMOVES, model);
		map.put(Statistic.MODELONLYSTEPS, modelOnlySteps);
		map.put(Statistic.DEGENERATESTEPS, degenerateSteps);
		map.put(Statistic.SETUPTIME, setupTime);
		map.put(Statistic.SOLVETIME, solveTime);
		map.put(Statistic.TOTALTIME, setupTime + solveTime);
		return map;
	}

}
