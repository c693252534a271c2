package nl.tue.treealignment.algorithms.ilp;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import nl.tue.treealignment.algorithms.OptimizationException;

/**
 * Solves programs with the pure Java ojAlgo solver. A fresh model is built for
 * every call, so a single instance can be shared between threads.
 */
public class OjAlgoSolver implements MilpSolver {

	public Solution solve(LinearProgram program, int timeoutMilliseconds) throws OptimizationException {
		if (program.getNColumns() == 0) {
			return Solution.ofEmptyProgram(program);
		}
		ExpressionsBasedModel model = new ExpressionsBasedModel();
		if (timeoutMilliseconds > 0) {
			model.options.time_abort = timeoutMilliseconds;
		}

		Variable[] variables = new Variable[program.getNColumns()];
		for (int c = 0; c < variables.length; c++) {
			Variable variable = model.newVariable(program.getColumnName(c)).lower(program.getLower(c))
					.upper(program.getUpper(c)).weight(program.getCost(c));
			if (program.isInteger(c)) {
				variable.integer();
			}
			variables[c] = variable;
		}

		for (int r = 0; r < program.getNRows(); r++) {
			Expression expression = model.newExpression(program.getRowName(r));
			int[] cols = program.getRowColumns(r);
			double[] coefs = program.getRowCoefficients(r);
			for (int i = 0; i < cols.length; i++) {
				expression.set(variables[cols[i]], coefs[i]);
			}
			if (program.getRowType(r) == LinearProgram.EQ) {
				expression.level(program.getRhs(r));
			} else {
				expression.upper(program.getRhs(r));
			}
		}

		Optimisation.Result result;
		try {
			result = model.minimise();
		} catch (RuntimeException e) {
			throw new OptimizationException("ojAlgo failed", e);
		}

		Optimisation.State state = result.getState();
		if (!state.isFeasible()) {
			throw new OptimizationException("ojAlgo returned " + state + " for a program with "
					+ program.getNColumns() + " columns and " + program.getNRows() + " rows");
		}

		double[] values = new double[variables.length];
		for (int c = 0; c < values.length; c++) {
			values[c] = result.get(c).doubleValue();
		}
		return new Solution(result.getValue(), values, state.isOptimal());
	}

	public String getName() {
		return "ojAlgo";
	}

}
