package com.github.micycle1.deblend;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.deblend.linalg.Matrices;
import com.github.micycle1.deblend.linalg.RegularizedSolver;

/**
 * The interchangeable update rules of {@link FactorizationSolver}.
 */
public enum UpdateRule implements FactorizationUpdate {

	/**
	 * Lee and Seung multiplicative update:
	 *
	 * <pre>
	 * W' = W .* (A H^T) ./ (W H H^T + eps), columns of W' divided by their sums
	 * H' = H .* (W'^T A) ./ (W'^T W' H + beta Hdiff + eps)
	 * </pre>
	 *
	 * Non-negative A, W, H stay non-negative for {@code beta = 0}. The symmetry
	 * term Hdiff = D_k H[k] is negative wherever a pixel is fainter than its
	 * reflection, so with {@code beta > 0} the denominator can shrink to zero or
	 * below and H can turn negative; {@link #MULTIPLICATIVE_SPLIT} avoids that.
	 */
	MULTIPLICATIVE {
		@Override
		public SolverState update(DMatrixRMaj a, SolverState state, UpdateContext context) {
			return multiplicative(a, state, context, false);
		}
	},

	/**
	 * {@link #MULTIPLICATIVE} with beta Hdiff split by sign: the positive part is
	 * added to the denominator and the magnitude of the negative part to the
	 * numerator. Every factor is then a ratio of non-negative terms, so W and H
	 * stay non-negative for any {@code beta}.
	 */
	MULTIPLICATIVE_SPLIT {
		@Override
		public SolverState update(DMatrixRMaj a, SolverState state, UpdateContext context) {
			return multiplicative(a, state, context, true);
		}
	},

	/**
	 * Unconstrained alternating least squares:
	 *
	 * <pre>
	 * W = A H^T (H H^T + eps I)^-1, columns of W normalized
	 * H = (W^T W + eps I)^-1 W^T A
	 * </pre>
	 *
	 * A baseline only: neither non-negativity nor symmetry is enforced and entries
	 * can go negative.
	 */
	EXACT_INVERSE {
		@Override
		public SolverState update(DMatrixRMaj a, SolverState state, UpdateContext context) {
			final double eps = FactorizationSolver.EPSILON;
			DMatrixRMaj h = state.getFactorization().h();

			// (H H^T + eps I) W^T = H A^T
			DMatrixRMaj wt = RegularizedSolver.solve(Matrices.multTransB(h, h), Matrices.multTransB(h, a), eps);
			DMatrixRMaj w = CommonOps_DDRM.transpose(wt, null);
			w = Matrices.divideColumns(w, Matrices.normFactors(w, true));

			DMatrixRMaj h1 = RegularizedSolver.solve(Matrices.multTransA(w, w), Matrices.multTransA(w, a), eps);
			return state.with(Factorization.adopt(w, h1));
		}
	},

	/**
	 * One explicit gradient step on ||A - W H||^2 (plus beta Hdiff in H's gradient
	 * when penalized), H first and then W against the new H. Both step sizes are
	 * halved in the returned state.
	 */
	GRADIENT_DESCENT {
		@Override
		public SolverState update(DMatrixRMaj a, SolverState state, UpdateContext context) {
			DMatrixRMaj w = state.getFactorization().w();
			DMatrixRMaj h = state.getFactorization().h();
			final double stepW = state.getStepW(), stepH = state.getStepH();

			DMatrixRMaj residual = Matrices.subtract(Matrices.mult(w, h), a);

			DMatrixRMaj derivH = Matrices.multTransA(w, residual);
			if (context.isPenalized()) {
				DMatrixRMaj hdiff = SymmetryOperators.intensityDiff(h, context.getDiffOperators());
				CommonOps_DDRM.addEquals(derivH, context.getBeta(), hdiff);
			}
			DMatrixRMaj h1 = h.copy();
			CommonOps_DDRM.addEquals(h1, -stepH, derivH);

			DMatrixRMaj derivW = Matrices.multTransB(residual, h1);
			DMatrixRMaj w1 = w.copy();
			CommonOps_DDRM.addEquals(w1, -stepW, derivW);

			return new SolverState(Factorization.adopt(w1, h1), stepW / 2.0, stepH / 2.0);
		}
	};

	private static SolverState multiplicative(DMatrixRMaj a, SolverState state, UpdateContext context, boolean splitPenalty) {
		final double eps = FactorizationSolver.EPSILON;
		DMatrixRMaj w = state.getFactorization().w();
		DMatrixRMaj h = state.getFactorization().h();

		DMatrixRMaj numW = Matrices.multTransB(a, h);
		DMatrixRMaj denW = Matrices.mult(w, Matrices.multTransB(h, h));
		DMatrixRMaj w1 = new DMatrixRMaj(w.numRows, w.numCols);
		for (int i = 0, n = w1.getNumElements(); i < n; i++) {
			w1.data[i] = w.data[i] * numW.data[i] / (denW.data[i] + eps);
		}
		// W only; H is updated unscaled
		w1 = Matrices.divideColumns(w1, Matrices.normFactors(w1, true));

		DMatrixRMaj numH = Matrices.multTransA(w1, a);
		DMatrixRMaj denH = Matrices.mult(Matrices.multTransA(w1, w1), h);
		if (context.isPenalized()) {
			DMatrixRMaj hdiff = SymmetryOperators.intensityDiff(h, context.getDiffOperators());
			final double beta = context.getBeta();
			for (int i = 0, n = hdiff.getNumElements(); i < n; i++) {
				double d = beta * hdiff.data[i];
				if (!splitPenalty || d > 0) {
					denH.data[i] += d;
				} else {
					numH.data[i] -= d;
				}
			}
		}
		DMatrixRMaj h1 = new DMatrixRMaj(h.numRows, h.numCols);
		for (int i = 0, n = h1.getNumElements(); i < n; i++) {
			h1.data[i] = h.data[i] * numH.data[i] / (denH.data[i] + eps);
		}
		return state.with(Factorization.adopt(w1, h1));
	}

	/** Parses a rule name case-insensitively, accepting '-' for '_'. */
	public static UpdateRule parse(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Update rule name must not be null");
		}
		String key = name.trim().toUpperCase().replace('-', '_');
		for (UpdateRule r : values()) {
			if (r.name().equals(key)) {
				return r;
			}
		}
		throw new IllegalArgumentException("Unknown update rule '" + name + "'");
	}
}
