package nl.tue.treealignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.treealignment.TraceReplayTask.TraceReplayResult;
import nl.tue.treealignment.Utils.Statistic;
import nl.tue.treealignment.algorithms.ReplayAlgorithm.Debug;
import nl.tue.treealignment.network.StructuralException;
import nl.tue.treealignment.tree.ProcessTree;

/**
 * Replays a log, given as a list of traces, on a process tree. Identical traces
 * are aligned once. The empty trace is aligned first; its cost normalizes the
 * fitness of every trace.
 */
public class Replayer {

	private final ReplayerParameters parameters;
	private final ProcessTreeAligner aligner;
	private Progress progress;
	private double emptyTraceCost = Double.NaN;

	public Replayer(ProcessTree tree) throws StructuralException {
		this(new ReplayerParameters.Default(), tree);
	}

	public Replayer(ReplayerParameters parameters, ProcessTree tree) throws StructuralException {
		this(parameters, new ProcessTreeAligner(parameters, tree));
	}

	public Replayer(ReplayerParameters parameters, ProcessTreeAligner aligner) {
		this.parameters = parameters;
		this.aligner = aligner;
	}

	/**
	 * Aligns every trace of the log.
	 * 
	 * @return one result per trace, in the order of the log
	 */
	public List<TraceAlignment> computeAlignments(Progress progress, List<? extends List<String>> log)
			throws InterruptedException, ExecutionException {
		this.progress = progress;

		if (parameters.debug == Debug.STATS) {
			parameters.debug.print(Debug.STATS, "Network label");
			for (Statistic s : Statistic.values()) {
				parameters.debug.print(Debug.STATS, ",");
				parameters.debug.print(Debug.STATS, s.toString());
			}
			parameters.debug.println(Debug.STATS);
		}

		// group the traces by variant
		TObjectIntMap<List<String>> variant2index = new TObjectIntHashMap<>(10, 0.7f, -1);
		List<List<String>> variants = new ArrayList<>();
		List<TIntList> variant2traces = new ArrayList<>();
		for (int t = 0; t < log.size(); t++) {
			List<String> trace = Collections.unmodifiableList(new ArrayList<>(log.get(t)));
			int v = variant2index.get(trace);
			if (v < 0) {
				v = variants.size();
				variant2index.put(trace, v);
				variants.add(trace);
				variant2traces.add(new TIntArrayList(2));
			}
			variant2traces.get(v).add(t);
		}

		ExecutorService service = Executors.newFixedThreadPool(parameters.nThreads);
		getProgress().setMaximum(variants.size() + 1);

		List<Future<TraceReplayTask>> resultList = new ArrayList<>(variants.size() + 1);
		resultList.add(service.submit(
				new TraceReplayTask(aligner, getProgress(), Collections.<String>emptyList(), -1)));
		for (int v = 0; v < variants.size(); v++) {
			resultList.add(service.submit(new TraceReplayTask(aligner, getProgress(), variants.get(v), v)));
		}
		service.shutdown();

		try {
			return mergeResults(log.size(), variants, variant2traces, resultList);
		} finally {
			if (isCancelled()) {
				service.shutdownNow();
			}
		}
	}

	private List<TraceAlignment> mergeResults(int logSize, List<List<String>> variants,
			List<TIntList> variant2traces, List<Future<TraceReplayTask>> resultList)
			throws InterruptedException, ExecutionException {
		TraceAlignment[] result = new TraceAlignment[logSize];

		Iterator<Future<TraceReplayTask>> itResult = resultList.iterator();

		// get the alignment of the empty trace
		TraceReplayTask tr = itResult.next().get();
		if (tr.getResult() == TraceReplayResult.SUCCESS) {
			emptyTraceCost = tr.getSuccesfulResult().getCost();
			getProgress().log("Cost of the empty trace: " + emptyTraceCost);
		} else {
			emptyTraceCost = 0;
			getProgress().log("Failure: <> " + tr.getMessage());
		}

		while (itResult.hasNext() && !isCancelled()) {
			tr = itResult.next().get();
			TIntList traces = variant2traces.get(tr.getVariantIndex());
			if (tr.getResult() == TraceReplayResult.SUCCESS) {
				Alignment alignment = tr.getSuccesfulResult();
				double fitness = Utils.fitness(alignment.getCost(), emptyTraceCost, tr.getVariant().size());
				for (int i = 0; i < traces.size(); i++) {
					result[traces.get(i)] = TraceAlignment.reliable(traces.get(i), tr.getVariant(), alignment,
							fitness);
				}
			} else {
				// FAILURE TO COMPUTE ALIGNMENT
				getProgress().log("Failure: " + Utils.toString(tr.getVariant(), ',') + " " + tr.getMessage());
				for (int i = 0; i < traces.size(); i++) {
					result[traces.get(i)] = TraceAlignment.unreliable(traces.get(i), tr.getVariant(),
							tr.getMessage());
				}
			}
		}

		if (isCancelled()) {
			for (int v = 0; v < variant2traces.size(); v++) {
				TIntList traces = variant2traces.get(v);
				for (int i = 0; i < traces.size(); i++) {
					int t = traces.get(i);
					if (result[t] == null) {
						result[t] = TraceAlignment.unreliable(t, variants.get(v), "Cancelled");
					}
				}
			}
		}
		List<TraceAlignment> list = new ArrayList<>(logSize);
		Collections.addAll(list, result);
		return list;
	}

	/**
	 * Returns the average fitness of the reliable traces, or 0 if there are
	 * none.
	 */
	public static double averageFitness(List<TraceAlignment> alignments) {
		double sum = 0;
		int n = 0;
		for (TraceAlignment alignment : alignments) {
			if (alignment.isReliable()) {
				sum += alignment.getFitness();
				n++;
			}
		}
		return n == 0 ? 0.0 : sum / n;
	}

	/**
	 * Returns the cost of aligning the empty trace, computed by the last call
	 * to {@link #computeAlignments(Progress, List)}, or NaN before that.
	 */
	public double getEmptyTraceCost() {
		return emptyTraceCost;
	}

	public ProcessTreeAligner getAligner() {
		return aligner;
	}

	private boolean isCancelled() {
		return getProgress().isCancelled();
	}

	public Progress getProgress() {
		return progress == null ? Progress.INVISIBLE : progress;
	}
}
