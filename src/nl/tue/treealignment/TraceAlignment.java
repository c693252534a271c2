package nl.tue.treealignment;

import java.util.Collections;
import java.util.List;

/**
 * Result of replaying one trace of a log: the alignment of its variant and the
 * fitness of the trace. A trace whose variant could not be aligned is
 * unreliable; it has no alignment, a NaN cost and fitness 0.
 */
public class TraceAlignment {

	private final int traceIndex;
	private final List<String> trace;
	private final Alignment alignment;
	private final double fitness;
	private final String message;

	private TraceAlignment(int traceIndex, List<String> trace, Alignment alignment, double fitness, String message) {
		this.traceIndex = traceIndex;
		this.trace = trace;
		this.alignment = alignment;
		this.fitness = fitness;
		this.message = message;
	}

	static TraceAlignment reliable(int traceIndex, List<String> trace, Alignment alignment, double fitness) {
		return new TraceAlignment(traceIndex, trace, alignment, fitness, null);
	}

	static TraceAlignment unreliable(int traceIndex, List<String> trace, String message) {
		return new TraceAlignment(traceIndex, trace, null, 0.0, message);
	}

	public int getTraceIndex() {
		return traceIndex;
	}

	public List<String> getTrace() {
		return trace;
	}

	/**
	 * Returns the alignment, or null if the trace is not reliable.
	 */
	public Alignment getAlignment() {
		return alignment;
	}

	public List<Move> getMoves() {
		return alignment == null ? Collections.<Move>emptyList() : alignment.getMoves();
	}

	public double getCost() {
		return alignment == null ? Double.NaN : alignment.getCost();
	}

	public double getFitness() {
		return fitness;
	}

	public boolean isReliable() {
		return alignment != null;
	}

	/**
	 * Returns the reason the trace could not be aligned, or null.
	 */
	public String getMessage() {
		return message;
	}

	public String toString() {
		return traceIndex + ": " + Utils.toString(trace, ',') + (isReliable()
				? " cost=" + getCost() + " fitness=" + fitness + " " + Utils.toString(getMoves())
				: " failed: " + message);
	}
}
