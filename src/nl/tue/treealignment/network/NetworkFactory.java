package nl.tue.treealignment.network;

import java.util.List;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import nl.tue.treealignment.algorithms.ReplayAlgorithm.Debug;
import nl.tue.treealignment.tree.ProcessTree;
import nl.tue.treealignment.tree.ProcessTree.Operator;

/**
 * Compiles a process tree into a {@link Network}. Each subtree is laid out
 * between an entry and an exit node. The inverse allocation count (iac)
 * starts at 1 and is multiplied by the number of children at every parallel
 * operator, which divides the capacity of the edges in the branches.
 *
 * Nodes are numbered in order of creation; the source is always node 0.
 */
public class NetworkFactory {

	private final Debug debug;

	public NetworkFactory() {
		this(Debug.NONE);
	}

	public NetworkFactory(Debug debug) {
		this.debug = debug;
	}

	public Network compile(ProcessTree tree) throws StructuralException {
		long start = System.nanoTime();
		NetworkImpl network = new NetworkImpl(tree.toString());

		int startNode = network.addNode();
		network.setSource(startNode);

		if (tree.isTau()) {
			// only the empty trace fits
			network.setSink(startNode);
		} else if (tree.getOperator() == Operator.LOOP) {
			checkLoop(tree);
			if (tree.getChildren().get(0).isTau()) {
				// the redo part is a self loop on the start node
				network.setSink(startNode);
				build(network, tree.getChildren().get(1), startNode, startNode, 1);
			} else {
				int endNode = network.addNode();
				network.setSink(endNode);
				build(network, tree.getChildren().get(0), startNode, endNode, 1);
				build(network, tree.getChildren().get(1), endNode, startNode, 1);
			}
		} else {
			int endNode = network.addNode();
			network.setSink(endNode);
			build(network, tree, startNode, endNode, 1);
		}
		network.freeze();

		debug.println(Debug.NORMAL, "Compiled " + network.getLabel() + " into " + network.numNodes() + " nodes, "
				+ network.numEdges() + " edges and " + network.getShuffleGroups().size() + " shuffle groups in "
				+ (System.nanoTime() - start) / 1000 + " us.");
		return network;
	}

	private void build(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		if (tree.isLeaf()) {
			buildLeaf(network, tree, entry, exit, iac);
			return;
		}
		if (tree.getChildren().isEmpty()) {
			throw new StructuralException("Operator " + tree.getOperator() + " without children", tree);
		}
		switch (tree.getOperator()) {
			case SEQUENCE :
				buildSequence(network, tree, entry, exit, iac);
				break;
			case XOR :
				buildXor(network, tree, entry, exit, iac);
				break;
			case PARALLEL :
				buildParallel(network, tree, entry, exit, iac);
				break;
			case LOOP :
				buildLoop(network, tree, entry, exit, iac);
				break;
			default :
				throw new StructuralException("Operator " + tree.getOperator() + " is not supported", tree);
		}
	}

	private void buildLeaf(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		if (!tree.getChildren().isEmpty()) {
			throw new StructuralException("Leaf with children", tree);
		}
		network.addEdge(entry, exit, tree.getLabel(), iac, false);
	}

	private void buildSequence(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		List<ProcessTree> children = tree.getChildren();
		if (children.size() == 1) {
			build(network, children.get(0), entry, exit, iac);
			return;
		}
		int[] nodes = new int[children.size() + 1];
		nodes[0] = entry;
		for (int i = 1; i < children.size(); i++) {
			nodes[i] = network.addNode();
		}
		nodes[children.size()] = exit;
		for (int i = 0; i < children.size(); i++) {
			build(network, children.get(i), nodes[i], nodes[i + 1], iac);
		}
	}

	private void buildXor(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		for (ProcessTree child : tree.getChildren()) {
			build(network, child, entry, exit, iac);
		}
	}

	private void buildParallel(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		network.markParallel(entry, iac, true);
		network.markParallel(exit, iac, false);

		List<ProcessTree> children = tree.getChildren();
		int localIac = iac * children.size();
		TIntList split = new TIntArrayList(children.size());
		TIntList join = new TIntArrayList(children.size());

		for (ProcessTree child : children) {
			int branchStart = network.addNode();
			int branchEnd = network.addNode();
			split.add(network.addEdge(entry, branchStart, null, localIac, true));
			join.add(network.addEdge(branchEnd, exit, null, localIac, true));
			build(network, child, branchStart, branchEnd, localIac);
		}

		network.addShuffleGroup(entry, split);
		network.addShuffleGroup(exit, join);
	}

	private void buildLoop(NetworkImpl network, ProcessTree tree, int entry, int exit, int iac)
			throws StructuralException {
		checkLoop(tree);
		int loopStart = network.addNode();
		network.addEdge(entry, loopStart, null, iac, false);
		int loopEnd = network.addNode();
		network.addEdge(loopEnd, exit, null, iac, false);

		build(network, tree.getChildren().get(0), loopStart, loopEnd, iac);
		build(network, tree.getChildren().get(1), loopEnd, loopStart, iac);
	}

	private static void checkLoop(ProcessTree tree) throws StructuralException {
		if (tree.getChildren().size() != 2) {
			throw new StructuralException("Loop does not have exactly two children", tree);
		}
	}

}
