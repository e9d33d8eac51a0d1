package com.github.micycle1.deblend.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ojalgo.matrix.decomposition.LU;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.R064Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves {@code (G + eps*I) X = B} for a small square Gram matrix G. Dense LU
 * first (fast); when LU reports the system unsolvable the pseudoinverse of the
 * regularized matrix is used instead (robust). Never throws for singular G.
 */
public final class RegularizedSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(RegularizedSolver.class);

	private RegularizedSolver() {
	}

	public static DMatrixRMaj solve(DMatrixRMaj gram, DMatrixRMaj rhs, double eps) {
		if (gram.numRows != rhs.numRows) {
			throw new IllegalArgumentException("Gram matrix has " + gram.numRows + " rows, right-hand side has " + rhs.numRows);
		}
		DMatrixRMaj g = Matrices.addToDiagonal(gram, eps);
		final int n = g.numRows, m = rhs.numCols;

		final R064Store a = R064Store.FACTORY.make(n, n);
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				a.set(i, j, g.get(i, j));
			}
		}
		final R064Store b = R064Store.FACTORY.make(n, m);
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < m; j++) {
				b.set(i, j, rhs.get(i, j));
			}
		}

		final LU<Double> lu = LU.R064.make();
		if (lu.decompose(a) && lu.isSolvable()) {
			final MatrixStore<Double> x = lu.getSolution(b);
			DMatrixRMaj out = new DMatrixRMaj(n, m);
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < m; j++) {
					out.set(i, j, x.doubleValue(i, j));
				}
			}
			return out;
		}

		LOGGER.debug("LU could not solve the regularized {}x{} system; using the pseudoinverse", n, n);
		return Matrices.mult(Matrices.pinv(g), rhs);
	}
}
