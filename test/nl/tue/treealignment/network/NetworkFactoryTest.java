package nl.tue.treealignment.network;

import static nl.tue.treealignment.tree.ProcessTree.activity;
import static nl.tue.treealignment.tree.ProcessTree.loop;
import static nl.tue.treealignment.tree.ProcessTree.parallel;
import static nl.tue.treealignment.tree.ProcessTree.sequence;
import static nl.tue.treealignment.tree.ProcessTree.tau;
import static nl.tue.treealignment.tree.ProcessTree.xor;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import nl.tue.treealignment.tree.ProcessTree;
import nl.tue.treealignment.tree.ProcessTree.Operator;

public class NetworkFactoryTest {

	private final NetworkFactory factory = new NetworkFactory();

	private static void assertEdge(Network net, int edge, int from, int to, String label, double capacity,
			int cost) {
		assertEquals(from, net.getEdgeSource(edge), "source of edge " + edge);
		assertEquals(to, net.getEdgeTarget(edge), "target of edge " + edge);
		assertEquals(label, net.getEdgeLabel(edge), "label of edge " + edge);
		assertEquals(capacity, net.getCapacity(edge), 1E-12, "capacity of edge " + edge);
		assertEquals(cost, net.getCost(edge), "cost of edge " + edge);
	}

	@Test
	public void testSingleActivity() throws StructuralException {
		Network net = factory.compile(activity("A"));
		assertEquals(2, net.numNodes());
		assertEquals(1, net.numEdges());
		assertEquals(0, net.getSource());
		assertEquals(1, net.getSink());
		assertEdge(net, 0, 0, 1, "A", 1.0, 1);
		assertFalse(net.isShuffle(0));
		assertArrayEquals(new int[] { 0 }, net.getOutgoing(0));
		assertArrayEquals(new int[] { 0 }, net.getIncoming(1));
		assertArrayEquals(new int[0], net.getIncoming(0));
		assertTrue(net.getShuffleGroups().isEmpty());
	}

	@Test
	public void testTauRoot() throws StructuralException {
		Network net = factory.compile(tau());
		assertEquals(1, net.numNodes());
		assertEquals(0, net.numEdges());
		assertEquals(net.getSource(), net.getSink());
	}

	@Test
	public void testSequence() throws StructuralException {
		Network net = factory.compile(sequence(activity("A"), activity("B"), activity("C")));
		assertEquals(4, net.numNodes());
		assertEquals(3, net.numEdges());
		assertEdge(net, 0, 0, 2, "A", 1.0, 1);
		assertEdge(net, 1, 2, 3, "B", 1.0, 1);
		assertEdge(net, 2, 3, 1, "C", 1.0, 1);
	}

	@Test
	public void testXorWithTauUsesParallelEdges() throws StructuralException {
		Network net = factory.compile(xor(activity("A"), tau()));
		assertEquals(2, net.numNodes());
		assertEquals(2, net.numEdges());
		assertEdge(net, 0, 0, 1, "A", 1.0, 1);
		assertEdge(net, 1, 0, 1, null, 1.0, 0);
		assertEquals(0, net.getEdgeKey(0));
		assertEquals(1, net.getEdgeKey(1));
	}

	@Test
	public void testParallel() throws StructuralException {
		Network net = factory.compile(parallel(activity("A"), activity("B")));
		assertEquals(6, net.numNodes());
		assertEquals(6, net.numEdges());

		assertEdge(net, 0, 0, 2, null, 0.5, 0);
		assertEdge(net, 1, 3, 1, null, 0.5, 0);
		assertEdge(net, 2, 2, 3, "A", 0.5, 2);
		assertEdge(net, 3, 0, 4, null, 0.5, 0);
		assertEdge(net, 4, 5, 1, null, 0.5, 0);
		assertEdge(net, 5, 4, 5, "B", 0.5, 2);
		assertTrue(net.isShuffle(0));
		assertTrue(net.isShuffle(4));
		assertFalse(net.isShuffle(2));

		assertTrue(net.isSplit(0));
		assertFalse(net.isJoin(0));
		assertTrue(net.isJoin(1));
		assertEquals(1, net.getInverseAllocationCount(0));
		assertEquals(Network.NOIAC, net.getInverseAllocationCount(2));

		List<ShuffleGroup> groups = net.getShuffleGroups();
		assertEquals(2, groups.size());
		assertEquals(0, groups.get(0).getNode());
		assertArrayEquals(new int[] { 0, 3 }, groups.get(0).getEdges());
		assertEquals(1, groups.get(1).getNode());
		assertArrayEquals(new int[] { 1, 4 }, groups.get(1).getEdges());
		assertEquals(1, groups.get(1).getInverseAllocationCount());
	}

	@Test
	public void testNestedParallelDividesCapacity() throws StructuralException {
		Network net = factory.compile(parallel(activity("A"), parallel(activity("B"), activity("C"), activity("D"))));
		int a = net.getEdgesLabelled("A")[0];
		int b = net.getEdgesLabelled("B")[0];
		assertEquals(0.5, net.getCapacity(a), 1E-12);
		assertEquals(2, net.getCost(a));
		assertEquals(1.0 / 6, net.getCapacity(b), 1E-12);
		assertEquals(6, net.getCost(b));

		ShuffleGroup inner = null;
		for (ShuffleGroup group : net.getShuffleGroups()) {
			if (group.size() == 3) {
				inner = group;
			}
		}
		assertEquals(2, inner.getInverseAllocationCount());
		assertEquals(4, net.getShuffleGroups().size());
	}

	@Test
	public void testLoopRoot() throws StructuralException {
		Network net = factory.compile(loop(activity("A"), activity("B")));
		assertEquals(2, net.numNodes());
		assertEquals(2, net.numEdges());
		assertEdge(net, 0, 0, 1, "A", 1.0, 1);
		assertEdge(net, 1, 1, 0, "B", 1.0, 1);
	}

	@Test
	public void testTauLoopRootIsSelfLoop() throws StructuralException {
		Network net = factory.compile(loop(tau(), activity("A")));
		assertEquals(1, net.numNodes());
		assertEquals(0, net.getSource());
		assertEquals(0, net.getSink());
		assertEquals(1, net.numEdges());
		assertEdge(net, 0, 0, 0, "A", 1.0, 1);
	}

	@Test
	public void testNestedLoopHasGates() throws StructuralException {
		Network net = factory.compile(sequence(loop(activity("A"), activity("B")), activity("C")));
		assertEquals(5, net.numNodes());
		assertEquals(5, net.numEdges());
		assertEdge(net, 0, 0, 3, null, 1.0, 0);
		assertEdge(net, 1, 4, 2, null, 1.0, 0);
		assertEdge(net, 2, 3, 4, "A", 1.0, 1);
		assertEdge(net, 3, 4, 3, "B", 1.0, 1);
		assertEdge(net, 4, 2, 1, "C", 1.0, 1);
	}

	@Test
	public void testActivityIndex() throws StructuralException {
		Network net = factory.compile(sequence(activity("A"), xor(activity("A"), activity("B"))));
		assertArrayEquals(new int[] { 0, 1 }, net.getEdgesLabelled("A"));
		assertArrayEquals(new int[] { 2 }, net.getEdgesLabelled("B"));
		assertEquals(0, net.getEdgesLabelled("Z").length);
	}

	@Test
	public void testMalformedLoops() {
		final ProcessTree shortLoop = ProcessTree.of(Operator.LOOP, Arrays.asList(activity("A")));
		StructuralException e = assertThrows(StructuralException.class, () -> factory.compile(shortLoop));
		assertSame(shortLoop, e.getSubtree());

		assertThrows(StructuralException.class, () -> factory.compile(sequence(activity("B"), shortLoop)));
		assertThrows(StructuralException.class, () -> factory.compile(ProcessTree.of(Operator.LOOP,
				Arrays.asList(activity("A"), activity("B"), activity("C")))));
	}

	@Test
	public void testOperatorWithoutChildren() {
		assertThrows(StructuralException.class, () -> factory
				.compile(sequence(activity("A"), ProcessTree.of(Operator.XOR, Collections.<ProcessTree>emptyList()))));
	}

	@Test
	public void testLeafWithChildren() {
		final ProcessTree leaf = new ProcessTree(null, "A", Arrays.asList(activity("B"))) {
		};
		assertThrows(StructuralException.class, () -> factory.compile(leaf));
	}

	@Test
	public void testFrozenNetwork() throws StructuralException {
		final NetworkImpl net = (NetworkImpl) factory.compile(activity("A"));
		assertThrows(IllegalStateException.class, () -> net.addNode());
		assertThrows(IllegalStateException.class, () -> net.addEdge(0, 1, "B", 1, false));
	}
}
