package com.github.micycle1.deblend.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Small dense/sparse helpers over EJML matrices used by the factorization. All
 * methods allocate their outputs; inputs are never modified.
 */
public final class Matrices {

	private Matrices() {
	}

	/** a * b */
	public static DMatrixRMaj mult(DMatrixRMaj a, DMatrixRMaj b) {
		DMatrixRMaj c = new DMatrixRMaj(a.numRows, b.numCols);
		CommonOps_DDRM.mult(a, b, c);
		return c;
	}

	/** a^T * b */
	public static DMatrixRMaj multTransA(DMatrixRMaj a, DMatrixRMaj b) {
		DMatrixRMaj c = new DMatrixRMaj(a.numCols, b.numCols);
		CommonOps_DDRM.multTransA(a, b, c);
		return c;
	}

	/** a * b^T */
	public static DMatrixRMaj multTransB(DMatrixRMaj a, DMatrixRMaj b) {
		DMatrixRMaj c = new DMatrixRMaj(a.numRows, b.numRows);
		CommonOps_DDRM.multTransB(a, b, c);
		return c;
	}

	/** Moore-Penrose pseudoinverse. */
	public static DMatrixRMaj pinv(DMatrixRMaj a) {
		DMatrixRMaj inv = new DMatrixRMaj(a.numCols, a.numRows);
		CommonOps_DDRM.pinv(a, inv);
		return inv;
	}

	/** a - b */
	public static DMatrixRMaj subtract(DMatrixRMaj a, DMatrixRMaj b) {
		checkSameShape(a, b);
		DMatrixRMaj c = new DMatrixRMaj(a.numRows, a.numCols);
		final double[] ad = a.data, bd = b.data, cd = c.data;
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			cd[i] = ad[i] - bd[i];
		}
		return c;
	}

	/** Square matrix a with eps added to its diagonal. */
	public static DMatrixRMaj addToDiagonal(DMatrixRMaj a, double eps) {
		if (a.numRows != a.numCols) {
			throw new IllegalArgumentException("Matrix must be square, got " + a.numRows + "x" + a.numCols);
		}
		DMatrixRMaj c = a.copy();
		for (int i = 0; i < c.numRows; i++) {
			c.add(i, i, eps);
		}
		return c;
	}

	/** Column sums. With {@code absolute} the magnitudes are summed. */
	public static double[] columnSums(DMatrixRMaj a, boolean absolute) {
		double[] sums = new double[a.numCols];
		for (int r = 0; r < a.numRows; r++) {
			int base = r * a.numCols;
			for (int c = 0; c < a.numCols; c++) {
				double v = a.data[base + c];
				sums[c] += absolute ? Math.abs(v) : v;
			}
		}
		return sums;
	}

	/**
	 * Normalization factors for {@code w}'s columns: the column sums, with zero
	 * sums replaced by 1 so that all-zero columns are left unchanged.
	 */
	public static double[] normFactors(DMatrixRMaj w, boolean absolute) {
		double[] f = columnSums(w, absolute);
		for (int c = 0; c < f.length; c++) {
			if (f[c] == 0) {
				f[c] = 1;
			}
		}
		return f;
	}

	/** Copy of a with column c divided by factors[c]. */
	public static DMatrixRMaj divideColumns(DMatrixRMaj a, double[] factors) {
		checkLength(factors, a.numCols, "column factors");
		DMatrixRMaj c = a.copy();
		for (int r = 0; r < c.numRows; r++) {
			int base = r * c.numCols;
			for (int k = 0; k < c.numCols; k++) {
				c.data[base + k] /= factors[k];
			}
		}
		return c;
	}

	/** Copy of a with row r multiplied by factors[r]. */
	public static DMatrixRMaj scaleRows(DMatrixRMaj a, double[] factors) {
		checkLength(factors, a.numRows, "row factors");
		DMatrixRMaj c = a.copy();
		for (int r = 0; r < c.numRows; r++) {
			int base = r * c.numCols;
			for (int k = 0; k < c.numCols; k++) {
				c.data[base + k] *= factors[r];
			}
		}
		return c;
	}

	/** Row r of a as a new array. */
	public static double[] row(DMatrixRMaj a, int r) {
		double[] out = new double[a.numCols];
		System.arraycopy(a.data, r * a.numCols, out, 0, a.numCols);
		return out;
	}

	/** Frobenius norm. */
	public static double frobenius(DMatrixRMaj a) {
		double s = 0.0;
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			s += a.data[i] * a.data[i];
		}
		return Math.sqrt(s);
	}

	/** ||a - b||_F without materializing the difference. */
	public static double distance(DMatrixRMaj a, DMatrixRMaj b) {
		checkSameShape(a, b);
		double s = 0.0;
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			double d = a.data[i] - b.data[i];
			s += d * d;
		}
		return Math.sqrt(s);
	}

	public static double min(DMatrixRMaj a) {
		double m = Double.POSITIVE_INFINITY;
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			m = Math.min(m, a.data[i]);
		}
		return m;
	}

	public static double max(DMatrixRMaj a) {
		double m = Double.NEGATIVE_INFINITY;
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			m = Math.max(m, a.data[i]);
		}
		return m;
	}

	public static boolean isNonNegative(DMatrixRMaj a) {
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			if (!(a.data[i] >= 0)) {
				return false;
			}
		}
		return true;
	}

	public static boolean isFinite(DMatrixRMaj a) {
		for (int i = 0, n = a.getNumElements(); i < n; i++) {
			if (!Double.isFinite(a.data[i])) {
				return false;
			}
		}
		return true;
	}

	/** y = A x for a CSC sparse A, walking the compressed columns directly. */
	public static double[] multVector(DMatrixSparseCSC a, double[] x) {
		checkLength(x, a.numCols, "vector");
		double[] y = new double[a.numRows];
		final int[] colIdx = a.col_idx, rows = a.nz_rows;
		final double[] vals = a.nz_values;
		for (int j = 0; j < a.numCols; j++) {
			double xj = x[j];
			if (xj == 0.0) {
				continue;
			}
			for (int p = colIdx[j], pe = colIdx[j + 1]; p < pe; p++) {
				y[rows[p]] += vals[p] * xj;
			}
		}
		return y;
	}

	public static double dot(double[] a, double[] b) {
		checkLength(b, a.length, "vector");
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	static void checkSameShape(DMatrixRMaj a, DMatrixRMaj b) {
		if (a.numRows != b.numRows || a.numCols != b.numCols) {
			throw new IllegalArgumentException("Shape mismatch: " + a.numRows + "x" + a.numCols + " vs " + b.numRows + "x" + b.numCols);
		}
	}

	private static void checkLength(double[] v, int expected, String what) {
		if (v.length != expected) {
			throw new IllegalArgumentException("Expected " + what + " of length " + expected + ", got " + v.length);
		}
	}
}
