package nl.tue.treealignment.network;

import java.util.Arrays;

/**
 * A group of shuffle edges at a parallel split or join node. Within one time
 * step, either all edges of the group carry their full capacity or none of
 * them carries flow.
 */
public class ShuffleGroup {

	private final int node;
	private final int index;
	private final int inverseAllocationCount;
	private final int[] edges;

	ShuffleGroup(int node, int index, int inverseAllocationCount, int[] edges) {
		this.node = node;
		this.index = index;
		this.inverseAllocationCount = inverseAllocationCount;
		this.edges = edges;
	}

	/**
	 * The split or join node carrying this group
	 */
	public int getNode() {
		return node;
	}

	/**
	 * The position of this group among the groups of its node
	 */
	public int getIndex() {
		return index;
	}

	public int getInverseAllocationCount() {
		return inverseAllocationCount;
	}

	public int[] getEdges() {
		return edges.clone();
	}

	public int size() {
		return edges.length;
	}

	public int getEdge(int i) {
		return edges[i];
	}

	public String toString() {
		return "n" + node + "." + index + "(iac=" + inverseAllocationCount + ")" + Arrays.toString(edges);
	}
}
