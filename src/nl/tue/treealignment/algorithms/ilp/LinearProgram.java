package nl.tue.treealignment.algorithms.ilp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gnu.trove.list.TByteList;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.array.TByteArrayList;
import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.map.TIntDoubleMap;

/**
 * Solver independent representation of a mixed integer linear program with
 * a minimization objective. Columns carry a cost, bounds and an integrality
 * flag. Rows are stored sparsely and are either equalities or upper bounded
 * inequalities.
 */
public class LinearProgram {

	public static final byte EQ = 0;
	public static final byte LE = 1;

	private static final double ZERO = 1E-12;

	private final TDoubleList cost = new TDoubleArrayList();
	private final TDoubleList lower = new TDoubleArrayList();
	private final TDoubleList upper = new TDoubleArrayList();
	private final TByteList integer = new TByteArrayList();
	private final List<String> columnNames = new ArrayList<>();

	private final List<int[]> rowColumns = new ArrayList<>();
	private final List<double[]> rowCoefficients = new ArrayList<>();
	private final TByteList rowType = new TByteArrayList();
	private final TDoubleList rhs = new TDoubleArrayList();
	private final List<String> rowNames = new ArrayList<>();

	private int equalities = 0;
	private int integers = 0;

	/**
	 * Adds a column and returns its index.
	 */
	public int addColumn(String name, double cost, double lower, double upper, boolean integer) {
		this.cost.add(cost);
		this.lower.add(lower);
		this.upper.add(upper);
		this.integer.add(integer ? (byte) 1 : (byte) 0);
		this.columnNames.add(name);
		if (integer) {
			integers++;
		}
		return this.cost.size() - 1;
	}

	/**
	 * Adds a row. Coefficients that are (numerically) zero are dropped. A row
	 * without coefficients and a zero right hand side is trivially satisfied
	 * and not added.
	 *
	 * @return the index of the row, or -1 if it was not added.
	 */
	public int addRow(String name, TIntDoubleMap coefficients, byte type, double rhs) {
		int[] cols = coefficients.keys();
		Arrays.sort(cols);
		int n = 0;
		double[] coefs = new double[cols.length];
		for (int i = 0; i < cols.length; i++) {
			double v = coefficients.get(cols[i]);
			if (Math.abs(v) > ZERO) {
				cols[n] = cols[i];
				coefs[n] = v;
				n++;
			}
		}
		if (n == 0 && Math.abs(rhs) <= ZERO) {
			return -1;
		}
		rowColumns.add(Arrays.copyOf(cols, n));
		rowCoefficients.add(Arrays.copyOf(coefs, n));
		rowType.add(type);
		this.rhs.add(rhs);
		rowNames.add(name);
		if (type == EQ) {
			equalities++;
		}
		return rowType.size() - 1;
	}

	public int getNColumns() {
		return cost.size();
	}

	public int getNRows() {
		return rowType.size();
	}

	public int getNEqualities() {
		return equalities;
	}

	public int getNInequalities() {
		return getNRows() - equalities;
	}

	public int getNIntegers() {
		return integers;
	}

	public double getCost(int column) {
		return cost.get(column);
	}

	public double getLower(int column) {
		return lower.get(column);
	}

	public double getUpper(int column) {
		return upper.get(column);
	}

	public boolean isInteger(int column) {
		return integer.get(column) != 0;
	}

	public String getColumnName(int column) {
		return columnNames.get(column);
	}

	/**
	 * Returns the column indices of the non-zero coefficients of the row, in
	 * ascending order. The array should not be modified.
	 */
	public int[] getRowColumns(int row) {
		return rowColumns.get(row);
	}

	/**
	 * Returns the non-zero coefficients of the row, aligned with
	 * {@link #getRowColumns(int)}. The array should not be modified.
	 */
	public double[] getRowCoefficients(int row) {
		return rowCoefficients.get(row);
	}

	public byte getRowType(int row) {
		return rowType.get(row);
	}

	public double getRhs(int row) {
		return rhs.get(row);
	}

	public String getRowName(int row) {
		return rowNames.get(row);
	}

	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append("min:");
		for (int c = 0; c < getNColumns(); c++) {
			if (cost.get(c) != 0) {
				append(b, cost.get(c), c);
			}
		}
		b.append(";\n");
		for (int r = 0; r < getNRows(); r++) {
			b.append(rowNames.get(r));
			b.append(':');
			int[] cols = rowColumns.get(r);
			double[] coefs = rowCoefficients.get(r);
			for (int i = 0; i < cols.length; i++) {
				append(b, coefs[i], cols[i]);
			}
			b.append(rowType.get(r) == EQ ? " = " : " <= ");
			b.append(rhs.get(r));
			b.append(";\n");
		}
		for (int c = 0; c < getNColumns(); c++) {
			b.append(lower.get(c));
			b.append(" <= ");
			b.append(columnNames.get(c));
			b.append(" <= ");
			b.append(upper.get(c));
			if (isInteger(c)) {
				b.append(" int");
			}
			b.append(";\n");
		}
		return b.toString();
	}

	private void append(StringBuilder b, double coef, int column) {
		b.append(coef < 0 ? " -" : " +");
		if (Math.abs(coef) != 1) {
			b.append(Math.abs(coef));
			b.append(' ');
		}
		b.append(columnNames.get(column));
	}
}
