package nl.tue.treealignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gnu.trove.TCollections;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.treealignment.Utils.Statistic;

/**
 * Optimal alignment of one trace (variant): the rounded cost and the moves
 * realizing it, together with the statistics of the computation.
 */
public class Alignment {

	private final List<String> trace;
	private final double cost;
	private final List<Move> moves;
	private final TObjectIntMap<Statistic> statistics;

	public Alignment(List<String> trace, double cost, List<Move> moves, TObjectIntMap<Statistic> statistics) {
		this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
		this.cost = cost;
		this.moves = Collections.unmodifiableList(new ArrayList<>(moves));
		this.statistics = TCollections.unmodifiableMap(new TObjectIntHashMap<>(statistics));
	}

	public List<String> getTrace() {
		return trace;
	}

	public double getCost() {
		return cost;
	}

	public List<Move> getMoves() {
		return moves;
	}

	public TObjectIntMap<Statistic> getStatistics() {
		return statistics;
	}

	public boolean isOptimal() {
		return (statistics.get(Statistic.EXITCODE) & Utils.OPTIMALALIGNMENT) == Utils.OPTIMALALIGNMENT;
	}

	public String toString() {
		return Utils.toString(trace, ',') + " cost=" + cost + " " + Utils.toString(moves);
	}
}
