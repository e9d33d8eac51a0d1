package com.github.micycle1.deblend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

import com.github.micycle1.deblend.footprint.BBox;
import com.github.micycle1.deblend.footprint.Footprint;
import com.github.micycle1.deblend.linalg.Matrices;

/**
 * Builds the per-peak symmetry operators S_k and the quadratic penalty operators
 * D_k = I + S_k^T S_k - 2 S_k, and applies them to an intensity matrix.
 * <p>
 * Operators depend on peak geometry only, so they are built once per footprint
 * and reused for every iteration. Construction is independent per peak.
 */
public final class SymmetryOperators {

	private SymmetryOperators() {
	}

	/** Symmetry operator for a peak at (px, py) on a {@code height x width} grid. */
	public static DMatrixSparseCSC peakOperator(int height, int width, int px, int py) {
		return PeakSymmetry.of(height, width, px, py).toOperator();
	}

	/** One symmetry operator per peak of {@code footprint}, in peak order. */
	public static List<DMatrixSparseCSC> symmetryOperators(Footprint footprint) {
		Objects.requireNonNull(footprint, "footprint must not be null");
		BBox bbox = footprint.getBBox();
		int count = footprint.getPeaks().size();
		List<DMatrixSparseCSC> ops = new ArrayList<>(count);
		for (int k = 0; k < count; k++) {
			ops.add(peakOperator(bbox.getHeight(), bbox.getWidth(), footprint.relativeX(k), footprint.relativeY(k)));
		}
		return Collections.unmodifiableList(ops);
	}

	/** D = I + S^T S - 2 S */
	public static DMatrixSparseCSC diffOperator(DMatrixSparseCSC s) {
		if (s.numRows != s.numCols) {
			throw new IllegalArgumentException("Symmetry operator must be square, got " + s.numRows + "x" + s.numCols);
		}
		final int n = s.numRows;
		DMatrixSparseCSC st = CommonOps_DSCC.transpose(s, new DMatrixSparseCSC(n, n, 0), null);
		DMatrixSparseCSC sts = new DMatrixSparseCSC(n, n, 0);
		CommonOps_DSCC.mult(st, s, sts);

		DMatrixSparseCSC withIdentity = new DMatrixSparseCSC(n, n, 0);
		CommonOps_DSCC.add(1.0, CommonOps_DSCC.identity(n), 1.0, sts, withIdentity, null, null);
		DMatrixSparseCSC d = new DMatrixSparseCSC(n, n, 0);
		CommonOps_DSCC.add(1.0, withIdentity, -2.0, s, d, null, null);
		return d;
	}

	/** Penalty operator for every peak of {@code footprint}, in peak order. */
	public static List<DMatrixSparseCSC> diffOperators(Footprint footprint) {
		List<DMatrixSparseCSC> ops = new ArrayList<>();
		for (DMatrixSparseCSC s : symmetryOperators(footprint)) {
			ops.add(diffOperator(s));
		}
		return Collections.unmodifiableList(ops);
	}

	/**
	 * Hdiff[k] = D_k H[k] for every source k with an operator; rows without one
	 * (the background row in particular) are zero.
	 */
	public static DMatrixRMaj intensityDiff(DMatrixRMaj h, Map<Integer, DMatrixSparseCSC> diffOps) {
		DMatrixRMaj out = new DMatrixRMaj(h.numRows, h.numCols);
		for (Map.Entry<Integer, DMatrixSparseCSC> e : diffOps.entrySet()) {
			int k = e.getKey();
			double[] d = Matrices.multVector(e.getValue(), Matrices.row(h, k));
			System.arraycopy(d, 0, out.data, k * h.numCols, h.numCols);
		}
		return out;
	}

	/** Symmetry cost: sum over constrained sources of H[k]^T D_k H[k]. */
	public static double penalty(DMatrixRMaj h, Map<Integer, DMatrixSparseCSC> diffOps) {
		double cost = 0.0;
		for (Map.Entry<Integer, DMatrixSparseCSC> e : diffOps.entrySet()) {
			double[] row = Matrices.row(h, e.getKey());
			cost += Matrices.dot(row, Matrices.multVector(e.getValue(), row));
		}
		return cost;
	}
}
