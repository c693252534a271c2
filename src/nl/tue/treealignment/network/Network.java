package nl.tue.treealignment.network;

import java.util.List;

/**
 * Flow network compiled from a process tree. Nodes and edges are numbered
 * 0..numNodes()-1 and 0..numEdges()-1 respectively. Multiple edges may
 * connect the same pair of nodes; they are told apart by their key.
 * 
 * Every path from the source to the sink corresponds to an execution of the
 * process tree. The network may contain cycles (for loops).
 * 
 * Implementations are immutable and can be shared between threads.
 */
public interface Network {

	public static final int NOIAC = 0;

	/**
	 * Returns a description of the network, typically the tree it was compiled
	 * from.
	 * 
	 * @return
	 */
	public String getLabel();

	public int numNodes();

	public int numEdges();

	/**
	 * The unique start node
	 * 
	 * @return
	 */
	public int getSource();

	/**
	 * The unique end node. Equals the source if the tree accepts the empty
	 * trace by means of a silent root or a loop with a silent do-part.
	 * 
	 * @return
	 */
	public int getSink();

	public int getEdgeSource(int edge);

	public int getEdgeTarget(int edge);

	/**
	 * Returns the index of this edge among all edges connecting the same pair of
	 * nodes, in order of creation.
	 * 
	 * @param edge
	 * @return
	 */
	public int getEdgeKey(int edge);

	/**
	 * Returns the activity label of the edge or null for silent and structural
	 * edges.
	 * 
	 * @param edge
	 * @return
	 */
	public String getEdgeLabel(int edge);

	/**
	 * The upper bound on the flow over this edge, i.e. 1 divided by the inverse
	 * allocation count at the time the edge was created.
	 * 
	 * @param edge
	 * @return
	 */
	public double getCapacity(int edge);

	/**
	 * The cost of using the full capacity of the edge. Equals the inverse
	 * allocation count for labelled edges and 0 otherwise.
	 * 
	 * @param edge
	 * @return
	 */
	public int getCost(int edge);

	/**
	 * Returns true for the edges spreading into and joining from the branches
	 * of a parallel operator.
	 * 
	 * @param edge
	 * @return
	 */
	public boolean isShuffle(int edge);

	/**
	 * Returns the edges entering the node, ordered by edge number
	 * 
	 * @param node
	 * @return
	 */
	public int[] getIncoming(int node);

	/**
	 * Returns the edges leaving the node, ordered by edge number
	 * 
	 * @param node
	 * @return
	 */
	public int[] getOutgoing(int node);

	public boolean isSplit(int node);

	public boolean isJoin(int node);

	/**
	 * Returns the inverse allocation count recorded at a split or join node, or
	 * NOIAC for all other nodes.
	 * 
	 * @param node
	 * @return
	 */
	public int getInverseAllocationCount(int node);

	/**
	 * Returns all shuffle groups, ordered by node and by index within the node.
	 * 
	 * @return
	 */
	public List<ShuffleGroup> getShuffleGroups();

	/**
	 * Returns the edges carrying the given activity label, in order of edge
	 * number. Returns an empty array for unknown labels.
	 * 
	 * @param label
	 * @return
	 */
	public int[] getEdgesLabelled(String label);

}
