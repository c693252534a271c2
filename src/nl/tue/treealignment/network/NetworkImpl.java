package nl.tue.treealignment.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gnu.trove.list.TByteList;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TByteArrayList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TLongIntHashMap;

/**
 * Array based storage of a network. Nodes and edges are added by the
 * {@link NetworkFactory}, after which the network is frozen: adjacency lists,
 * shuffle groups and the label index are computed once and the network no
 * longer changes.
 */
public class NetworkImpl implements Network {

	private static final int[] EMPTY = new int[0];

	private static final byte SPLIT = 1;
	private static final byte JOIN = 2;

	private final String label;

	// node attributes
	private final TIntList nodeIac = new TIntArrayList();
	private final TByteList nodeFlags = new TByteArrayList();
	private final TIntObjectMap<List<TIntList>> nodeShuffles = new TIntObjectHashMap<>();

	// edge attributes
	private final TIntList edgeFrom = new TIntArrayList();
	private final TIntList edgeTo = new TIntArrayList();
	private final TIntList edgeKey = new TIntArrayList();
	private final TIntList edgeIac = new TIntArrayList();
	private final List<String> edgeLabel = new ArrayList<>();
	private final TByteList edgeShuffle = new TByteArrayList();
	private final TLongIntMap edgesBetween = new TLongIntHashMap(10, 0.5f, -1, 0);

	private int source = -1;
	private int sink = -1;

	private boolean frozen = false;
	private int[][] incoming;
	private int[][] outgoing;
	private List<ShuffleGroup> shuffleGroups;
	private Map<String, int[]> activityToEdges;

	public NetworkImpl(String label) {
		this.label = label;
	}

	private void checkNotFrozen() {
		if (frozen) {
			throw new IllegalStateException("Network " + label + " can no longer be changed.");
		}
	}

	int addNode() {
		checkNotFrozen();
		nodeIac.add(NOIAC);
		nodeFlags.add((byte) 0);
		return nodeIac.size() - 1;
	}

	void setSource(int node) {
		checkNotFrozen();
		source = node;
	}

	void setSink(int node) {
		checkNotFrozen();
		sink = node;
	}

	/**
	 * Adds an edge with capacity 1/iac. Labelled edges cost iac, all other
	 * edges are free.
	 *
	 * @return the number of the new edge
	 */
	int addEdge(int from, int to, String activity, int iac, boolean shuffle) {
		checkNotFrozen();
		long pair = (((long) from) << 32) | (to & 0xFFFFFFFFL);
		int key = edgesBetween.adjustOrPutValue(pair, 1, 0);
		edgeFrom.add(from);
		edgeTo.add(to);
		edgeKey.add(key);
		edgeIac.add(iac);
		edgeLabel.add(activity);
		edgeShuffle.add(shuffle ? (byte) 1 : (byte) 0);
		return edgeFrom.size() - 1;
	}

	/**
	 * Marks the node as a split or join of a parallel operator. The first time
	 * a node is marked, the inverse allocation count is recorded.
	 */
	void markParallel(int node, int iac, boolean split) {
		checkNotFrozen();
		if (!nodeShuffles.containsKey(node)) {
			nodeShuffles.put(node, new ArrayList<TIntList>(2));
			nodeIac.set(node, iac);
		}
		nodeFlags.set(node, (byte) (nodeFlags.get(node) | (split ? SPLIT : JOIN)));
	}

	void addShuffleGroup(int node, TIntList edges) {
		checkNotFrozen();
		nodeShuffles.get(node).add(edges);
	}

	void freeze() {
		if (frozen) {
			return;
		}
		if (source < 0 || sink < 0) {
			throw new IllegalStateException("Network " + label + " has no source or sink.");
		}
		int nodes = numNodes();
		TIntList[] in = new TIntList[nodes];
		TIntList[] out = new TIntList[nodes];
		for (int e = 0; e < numEdges(); e++) {
			int u = edgeFrom.get(e);
			int v = edgeTo.get(e);
			if (out[u] == null) {
				out[u] = new TIntArrayList(2);
			}
			out[u].add(e);
			if (in[v] == null) {
				in[v] = new TIntArrayList(2);
			}
			in[v].add(e);
		}
		incoming = new int[nodes][];
		outgoing = new int[nodes][];
		for (int v = 0; v < nodes; v++) {
			incoming[v] = in[v] == null ? EMPTY : in[v].toArray();
			outgoing[v] = out[v] == null ? EMPTY : out[v].toArray();
		}

		List<ShuffleGroup> groups = new ArrayList<>();
		for (int v = 0; v < nodes; v++) {
			List<TIntList> list = nodeShuffles.get(v);
			if (list == null) {
				continue;
			}
			for (int i = 0; i < list.size(); i++) {
				groups.add(new ShuffleGroup(v, i, nodeIac.get(v), list.get(i).toArray()));
			}
		}
		shuffleGroups = Collections.unmodifiableList(groups);

		Map<String, TIntList> index = new HashMap<>();
		for (int e = 0; e < numEdges(); e++) {
			String activity = edgeLabel.get(e);
			if (activity != null) {
				TIntList list = index.get(activity);
				if (list == null) {
					list = new TIntArrayList(2);
					index.put(activity, list);
				}
				list.add(e);
			}
		}
		activityToEdges = new HashMap<>(index.size() * 2);
		for (Map.Entry<String, TIntList> entry : index.entrySet()) {
			activityToEdges.put(entry.getKey(), entry.getValue().toArray());
		}

		frozen = true;
	}

	public String getLabel() {
		return label;
	}

	public int numNodes() {
		return nodeIac.size();
	}

	public int numEdges() {
		return edgeFrom.size();
	}

	public int getSource() {
		return source;
	}

	public int getSink() {
		return sink;
	}

	public int getEdgeSource(int edge) {
		return edgeFrom.get(edge);
	}

	public int getEdgeTarget(int edge) {
		return edgeTo.get(edge);
	}

	public int getEdgeKey(int edge) {
		return edgeKey.get(edge);
	}

	public String getEdgeLabel(int edge) {
		return edgeLabel.get(edge);
	}

	public double getCapacity(int edge) {
		return 1.0 / edgeIac.get(edge);
	}

	public int getCost(int edge) {
		return edgeLabel.get(edge) == null ? 0 : edgeIac.get(edge);
	}

	public boolean isShuffle(int edge) {
		return edgeShuffle.get(edge) != 0;
	}

	public int[] getIncoming(int node) {
		return incoming[node];
	}

	public int[] getOutgoing(int node) {
		return outgoing[node];
	}

	public boolean isSplit(int node) {
		return (nodeFlags.get(node) & SPLIT) != 0;
	}

	public boolean isJoin(int node) {
		return (nodeFlags.get(node) & JOIN) != 0;
	}

	public int getInverseAllocationCount(int node) {
		return nodeIac.get(node);
	}

	public List<ShuffleGroup> getShuffleGroups() {
		return shuffleGroups;
	}

	public int[] getEdgesLabelled(String activity) {
		int[] edges = activityToEdges.get(activity);
		return edges == null ? EMPTY : edges;
	}

	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append(label);
		b.append(" [source=n");
		b.append(source);
		b.append(", sink=n");
		b.append(sink);
		b.append("]\n");
		for (int e = 0; e < numEdges(); e++) {
			b.append("  n");
			b.append(getEdgeSource(e));
			b.append(" -> n");
			b.append(getEdgeTarget(e));
			b.append(" #");
			b.append(getEdgeKey(e));
			b.append(' ');
			b.append(getEdgeLabel(e) == null ? "-" : getEdgeLabel(e));
			b.append(" cap=1/");
			b.append(edgeIac.get(e));
			b.append(" cost=");
			b.append(getCost(e));
			if (isShuffle(e)) {
				b.append(" shuffle");
			}
			b.append('\n');
		}
		for (ShuffleGroup group : shuffleGroups) {
			b.append("  ");
			b.append(group);
			b.append('\n');
		}
		return b.toString();
	}
}
