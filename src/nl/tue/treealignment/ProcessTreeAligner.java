package nl.tue.treealignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import gnu.trove.map.TObjectIntMap;
import nl.tue.treealignment.Utils.Statistic;
import nl.tue.treealignment.algorithms.MilpReplayAlgorithm;
import nl.tue.treealignment.algorithms.OptimizationException;
import nl.tue.treealignment.algorithms.ReplayAlgorithm.Debug;
import nl.tue.treealignment.algorithms.ilp.MilpSolver;
import nl.tue.treealignment.network.Network;
import nl.tue.treealignment.network.NetworkFactory;
import nl.tue.treealignment.network.StructuralException;
import nl.tue.treealignment.tree.ProcessTree;

/**
 * Aligns traces with a single process tree. The tree is compiled once; every
 * call to {@link #align(List)} builds and solves a fresh program for the
 * trace unless its variant is cached.
 *
 * Instances are thread safe.
 */
public class ProcessTreeAligner {

	private final ReplayerParameters parameters;
	private final Network network;
	private final MilpSolver solver;
	private final VariantCache cache;
	private final AtomicInteger solves = new AtomicInteger();

	public ProcessTreeAligner(ProcessTree tree) throws StructuralException {
		this(new ReplayerParameters.Default(), tree);
	}

	public ProcessTreeAligner(ReplayerParameters parameters, ProcessTree tree) throws StructuralException {
		this(parameters, tree, parameters.createSolver());
	}

	public ProcessTreeAligner(ReplayerParameters parameters, ProcessTree tree, MilpSolver solver)
			throws StructuralException {
		this.parameters = parameters;
		this.network = new NetworkFactory(parameters.debug).compile(tree);
		this.solver = solver;
		this.cache = new VariantCache(parameters.variantCacheSize);
	}

	/**
	 * Computes an optimal alignment of the trace. Equal traces yield the same
	 * alignment as long as the variant is in the cache.
	 *
	 * @throws OptimizationException
	 *             if the solver fails; nothing is cached in that case
	 */
	public Alignment align(List<String> trace) throws OptimizationException {
		List<String> variant = Collections.unmodifiableList(new ArrayList<>(trace));
		Alignment alignment = cache.get(variant);
		if (alignment != null) {
			return alignment;
		}

		MilpReplayAlgorithm algorithm = new MilpReplayAlgorithm(network, variant, parameters.debug);
		solves.incrementAndGet();
		alignment = algorithm.run(solver, parameters.timeoutMilliseconds);
		printStatistics(alignment.getStatistics());
		return cache.putIfAbsent(variant, alignment);
	}

	private void printStatistics(TObjectIntMap<Statistic> statistics) {
		if (parameters.debug != Debug.STATS) {
			return;
		}
		StringBuilder b = new StringBuilder();
		b.append(network.getLabel());
		for (Statistic s : Statistic.values()) {
			b.append(',');
			b.append(statistics.get(s));
		}
		parameters.debug.println(Debug.STATS, b.toString());
	}

	public Network getNetwork() {
		return network;
	}

	public VariantCache getCache() {
		return cache;
	}

	/**
	 * Returns how many programs have been solved, excluding cache hits.
	 */
	public int getNumberOfSolves() {
		return solves.get();
	}
}
