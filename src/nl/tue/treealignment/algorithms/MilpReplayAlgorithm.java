package nl.tue.treealignment.algorithms;

import java.util.ArrayList;
import java.util.List;

import gnu.trove.map.TIntDoubleMap;
import gnu.trove.map.hash.TIntDoubleHashMap;
import nl.tue.treealignment.Move;
import nl.tue.treealignment.algorithms.ilp.LinearProgram;
import nl.tue.treealignment.algorithms.ilp.Solution;
import nl.tue.treealignment.network.Network;
import nl.tue.treealignment.network.ShuffleGroup;

/**
 * Aligns a trace of length n with a network by means of a time-expanded mixed
 * integer linear program. Step 0 is before the first event and step i is
 * after the i-th event. The program has four kinds of variables:
 * <ul>
 * <li>x[i,e] for steps 0..n and every edge: flow over the edge within step i
 * (model moves), bounded by the edge capacity and costing the edge cost;</li>
 * <li>y[i,v] for steps 1..n and every node: flow waiting in v while event i
 * is consumed (log moves), bounded by 1 and costing 1;</li>
 * <li>z[i,e] for steps 1..n and the edges labelled with event i: flow
 * crossing from step i-1 to step i over the edge (synchronous moves), costing
 * 1-cost for edges of cost above 1 and nothing otherwise;</li>
 * <li>s[i,g] for steps 0..n and every shuffle group: binary selector forcing
 * the group's edges to carry either all or none of 1/iac within a step.</li>
 * </ul>
 *
 * One unit of flow leaves the source in step 0 and arrives at the sink in
 * step n.
 */
public class MilpReplayAlgorithm extends ReplayAlgorithm {

	private final int steps;
	private final List<ShuffleGroup> groups;

	// column indices of the variables
	private int[][] x;
	private int[][] y;
	private int[][] zEdges;
	private int[][] z;
	private int[][] s;

	public MilpReplayAlgorithm(Network net, List<String> trace) {
		this(net, trace, Debug.NONE);
	}

	public MilpReplayAlgorithm(Network net, List<String> trace, Debug debug) {
		super(net, trace, debug);
		this.steps = trace.size() + 1;
		this.groups = net.getShuffleGroups();
	}

	protected LinearProgram setupProgram() {
		LinearProgram program = new LinearProgram();
		int n = trace.size();

		x = new int[steps][net.numEdges()];
		for (int i = 0; i < steps; i++) {
			for (int e = 0; e < net.numEdges(); e++) {
				x[i][e] = program.addColumn("x" + i + "_" + edgeName(e), net.getCost(e), 0, net.getCapacity(e),
						false);
			}
		}

		y = new int[steps][];
		for (int i = 1; i < steps; i++) {
			y[i] = new int[net.numNodes()];
			for (int v = 0; v < net.numNodes(); v++) {
				y[i][v] = program.addColumn("y" + i + "_n" + v, 1, 0, 1, false);
			}
		}

		zEdges = new int[steps][];
		z = new int[steps][];
		zEdges[0] = new int[0];
		z[0] = new int[0];
		for (int i = 1; i < steps; i++) {
			zEdges[i] = net.getEdgesLabelled(trace.get(i - 1));
			z[i] = new int[zEdges[i].length];
			for (int k = 0; k < zEdges[i].length; k++) {
				int e = zEdges[i][k];
				int cost = net.getCost(e);
				z[i][k] = program.addColumn("z" + i + "_" + edgeName(e), cost > 1 ? 1 - cost : 0, 0,
						net.getCapacity(e), false);
			}
		}

		s = new int[steps][groups.size()];
		for (int i = 0; i < steps; i++) {
			for (int g = 0; g < groups.size(); g++) {
				ShuffleGroup group = groups.get(g);
				s[i][g] = program.addColumn("s" + i + "_n" + group.getNode() + "." + group.getIndex(), 0, 0, 1, true);
			}
		}

		TIntDoubleMap row = new TIntDoubleHashMap();

		// flow conservation per step and node
		for (int i = 0; i < steps; i++) {
			for (int v = 0; v < net.numNodes(); v++) {
				row.clear();
				for (int e : net.getIncoming(v)) {
					row.adjustOrPutValue(x[i][e], 1, 1);
				}
				for (int e : net.getOutgoing(v)) {
					row.adjustOrPutValue(x[i][e], -1, -1);
				}
				if (i > 0) {
					row.adjustOrPutValue(y[i][v], 1, 1);
					for (int k = 0; k < zEdges[i].length; k++) {
						if (net.getEdgeTarget(zEdges[i][k]) == v) {
							row.adjustOrPutValue(z[i][k], 1, 1);
						}
					}
				}
				if (i < n) {
					row.adjustOrPutValue(y[i + 1][v], -1, -1);
					for (int k = 0; k < zEdges[i + 1].length; k++) {
						if (net.getEdgeSource(zEdges[i + 1][k]) == v) {
							row.adjustOrPutValue(z[i + 1][k], -1, -1);
						}
					}
				}
				double rhs = 0;
				if (i == 0 && v == net.getSource()) {
					rhs -= 1;
				}
				if (i == n && v == net.getSink()) {
					rhs += 1;
				}
				program.addRow("f" + i + "_n" + v, row, LinearProgram.EQ, rhs);
			}
		}

		// shuffle consistency per group and step
		for (int g = 0; g < groups.size(); g++) {
			ShuffleGroup group = groups.get(g);
			double share = 1.0 / group.getInverseAllocationCount();
			for (int i = 0; i < steps; i++) {
				row.clear();
				for (int j = 0; j < group.size(); j++) {
					row.adjustOrPutValue(x[i][group.getEdge(j)], 1, 1);
				}
				row.adjustOrPutValue(s[i][g], -share, -share);
				program.addRow("sh" + i + "_n" + group.getNode() + "." + group.getIndex(), row, LinearProgram.EQ, 0);
			}
		}

		// at most one synchronous move among equally labelled edges
		for (int i = 1; i < steps; i++) {
			if (zEdges[i].length > 1) {
				row.clear();
				for (int k = 0; k < zEdges[i].length; k++) {
					row.adjustOrPutValue(z[i][k], net.getCost(zEdges[i][k]), net.getCost(zEdges[i][k]));
				}
				program.addRow("d" + i, row, LinearProgram.LE, 1);
			}
		}

		return program;
	}

	/**
	 * Scans the events in order. Event i is a synchronous move if any z[i,.]
	 * is active, otherwise a log move if any y[i,.] is active. Otherwise the
	 * labels with active flow in step i are reported as model moves in place
	 * of the event and if there are none, the event is reported as a log move.
	 *
	 * After a synchronous or log move, and before the first event, the labels
	 * with active flow in that step follow as model moves.
	 */
	protected List<Move> decode(Solution solution) {
		List<Move> moves = new ArrayList<>(2 * steps);
		addModelMoves(moves, solution, 0);
		for (int i = 1; i < steps; i++) {
			String activity = trace.get(i - 1);
			if (isActive(solution, z[i])) {
				moves.add(Move.synchronous(activity));
				addModelMoves(moves, solution, i);
			} else if (isActive(solution, y[i])) {
				moves.add(Move.onLog(activity));
				addModelMoves(moves, solution, i);
			} else if (addModelMoves(moves, solution, i) > 0) {
				modelOnlySteps++;
			} else {
				moves.add(Move.onLog(activity));
				degenerateSteps++;
			}
		}
		return moves;
	}

	private boolean isActive(Solution solution, int[] columns) {
		for (int c : columns) {
			if (solution.getValue(c) > ACTIVE) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Adds a model move for every distinct label with active flow in the step,
	 * in order of edge number.
	 *
	 * @return the number of moves added
	 */
	private int addModelMoves(List<Move> moves, Solution solution, int step) {
		List<String> labels = new ArrayList<>(2);
		for (int e = 0; e < net.numEdges(); e++) {
			String label = net.getEdgeLabel(e);
			if (label != null && solution.getValue(x[step][e]) > ACTIVE && !labels.contains(label)) {
				labels.add(label);
			}
		}
		for (String label : labels) {
			moves.add(Move.onModel(label));
		}
		return labels.size();
	}

	private String edgeName(int e) {
		return "n" + net.getEdgeSource(e) + "_n" + net.getEdgeTarget(e) + "_" + net.getEdgeKey(e);
	}
}
