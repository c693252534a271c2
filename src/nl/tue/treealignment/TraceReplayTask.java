package nl.tue.treealignment;

import java.util.List;
import java.util.concurrent.Callable;

import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Aligns a single variant. The empty trace is aligned by a task with variant
 * index -1.
 */
class TraceReplayTask implements Callable<TraceReplayTask> {

	enum TraceReplayResult {
		FAILED, SUCCESS
	};

	private final ProcessTreeAligner aligner;
	private final Progress progress;
	private final List<String> variant;
	private final int variantIndex;
	private TraceReplayResult result;
	private Alignment alignment;
	private String message;

	public TraceReplayTask(ProcessTreeAligner aligner, Progress progress, List<String> variant, int variantIndex) {
		this.aligner = aligner;
		this.progress = progress;
		this.variant = variant;
		this.variantIndex = variantIndex;
	}

	public TraceReplayTask call() {
		try {
			if (progress.isCancelled()) {
				result = TraceReplayResult.FAILED;
				message = "Cancelled";
				return this;
			}
			alignment = aligner.align(variant);
			result = TraceReplayResult.SUCCESS;
		} catch (OptimizationException e) {
			result = TraceReplayResult.FAILED;
			message = e.getMessage();
		} finally {
			progress.inc();
		}
		return this;
	}

	public TraceReplayResult getResult() {
		return result;
	}

	public Alignment getSuccesfulResult() {
		return alignment;
	}

	public String getMessage() {
		return message;
	}

	public List<String> getVariant() {
		return variant;
	}

	public int getVariantIndex() {
		return variantIndex;
	}
}
