package nl.tue.treealignment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public class Utils {

	public static int OPTIMALALIGNMENT = 1;
	public static int FAILEDALIGNMENT = 2;
	public static int SUBOPTIMALALIGNMENT = 4;
	public static int DEGENERATESOLUTION = 8;

	/**
	 * Precision used to round alignment costs.
	 */
	public static int COSTDECIMALS = 13;

	public enum Statistic {
		EXITCODE("Exit code for alignment"), //
		TRACELENGTH("Length of the trace"), //
		NODES("Nodes in the network"), //
		EDGES("Edges in the network"), //
		VARIABLES("Variables in the program"), //
		BINARYVARIABLES("Binary shuffle variables"), //
		EQUALITIES("Equality constraints"), //
		INEQUALITIES("Inequality constraints"), //
		ALIGNMENTLENGTH("Length of the alignment found"), //
		SYNCMOVES("Synchronous moves"), //
		LOGMOVES("Moves on log"), //
		MODELMOVES("Moves on model"), //
		MODELONLYSTEPS("Events explained only by model moves"), //
		DEGENERATESTEPS("Events without active variables"), //
		SETUPTIME("Time to setup program (us)"), //
		SOLVETIME("Time to solve program (us)"), //
		TOTALTIME("Total Time including setup (us)");
		private final String label;

		private Statistic(String label) {
			this.label = label;
		}

		public String toString() {
			return label;
		}
	}

	/**
	 * Removes floating point noise from a solver objective by adding a tiny
	 * epsilon and rounding to COSTDECIMALS decimals.
	 *
	 * @param cost
	 * @return
	 */
	public static double roundCost(double cost) {
		if (Double.isNaN(cost) || Double.isInfinite(cost)) {
			return cost;
		}
		return new BigDecimal(cost + 1E-14).setScale(COSTDECIMALS, RoundingMode.HALF_UP).doubleValue();
	}

	/**
	 * Computes the fitness of a trace given its alignment cost and the cost of
	 * aligning the empty trace to the same model. The result is 0 if the
	 * normalizing denominator is not positive.
	 *
	 * @param cost
	 * @param emptyTraceCost
	 * @param traceLength
	 * @return
	 */
	public static double fitness(double cost, double emptyTraceCost, int traceLength) {
		double max = emptyTraceCost + traceLength;
		return max > 0 ? 1.0 - cost / max : 0.0;
	}

	public static String toString(List<Move> moves) {
		StringBuilder b = new StringBuilder();
		b.append('[');
		for (int i = 0; i < moves.size(); i++) {
			if (i > 0) {
				b.append(", ");
			}
			b.append(moves.get(i));
		}
		b.append(']');
		return b.toString();
	}

	public static String toString(List<String> trace, char separator) {
		StringBuilder b = new StringBuilder();
		b.append('<');
		for (int i = 0; i < trace.size(); i++) {
			if (i > 0) {
				b.append(separator);
			}
			b.append(trace.get(i));
		}
		b.append('>');
		return b.toString();
	}
}
