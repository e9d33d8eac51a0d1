package com.github.micycle1.deblend;

import java.util.Map;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Iterative engine approximating the data matrix A (bands x pixels) by W H, with
 * W the color matrix (bands x sources) and H the intensity matrix (sources x
 * pixels), optionally penalizing each source's departure from point symmetry
 * about its peak.
 * </p>
 *
 * <p>
 * The caller fixes the number of iterations: there is no convergence test and no
 * early exit, so a solve is fully deterministic. Each iteration consumes a
 * {@link SolverState} and produces a new one; nothing is rewritten in place.
 * Degenerate numerics (zero-sum columns, singular Gram matrices) are absorbed by
 * the update rules, never raised.
 * </p>
 *
 * <p>
 * Instances hold only immutable inputs and may be shared between threads; the
 * iterations of one solve are sequential.
 * </p>
 */
public class FactorizationSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(FactorizationSolver.class);

	/** Regularizer guarding every division and inversion. */
	public static final double EPSILON = 1e-9;

	private final DMatrixRMaj data;
	private final FactorizationUpdate update;
	private final UpdateRule rule; // null for custom updates
	private final UpdateContext context;

	/**
	 * @param data    bands x pixels data matrix; copied
	 * @param update  an {@link UpdateRule}, or a custom update for experiments
	 * @param context symmetry weight and operators
	 */
	public FactorizationSolver(DMatrixRMaj data, FactorizationUpdate update, UpdateContext context) {
		this.data = Objects.requireNonNull(data, "data must not be null").copy();
		this.update = Objects.requireNonNull(update, "update must not be null");
		this.rule = update instanceof UpdateRule ? (UpdateRule) update : null;
		this.context = Objects.requireNonNull(context, "context must not be null");
	}

	public SolveResult solve(Factorization initial, int iterations) {
		return solve(SolverState.of(initial), iterations);
	}

	/**
	 * Runs exactly {@code iterations} updates starting from {@code initial}.
	 *
	 * @throws IllegalArgumentException if the shapes of W and H do not match A, a
	 *                                  penalty operator does not match the pixel
	 *                                  count, or one targets the background row
	 */
	public SolveResult solve(SolverState initial, int iterations) {
		Objects.requireNonNull(initial, "initial state must not be null");
		if (iterations < 0) {
			throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
		}
		checkShapes(initial.getFactorization());

		double[] history = new double[iterations + 1];
		SolverState state = initial;
		history[0] = state.getFactorization().residualNorm(data);
		for (int i = 1; i <= iterations; i++) {
			state = update.update(data, state, context);
			history[i] = state.getFactorization().residualNorm(data);
			LOGGER.debug("iteration {}: residual {}", i, history[i]);
		}

		SolveResult result = new SolveResult(state, rule, history);
		LOGGER.info("{} update: {} iterations, residual {} -> {}", rule != null ? rule : update.getClass().getSimpleName(), iterations, history[0],
				result.getFinalResidual());
		if (!result.isFinite()) {
			LOGGER.warn("Factorization contains non-finite values after {} iterations", iterations);
		}
		return result;
	}

	private void checkShapes(Factorization f) {
		if (f.getBandCount() != data.numRows) {
			throw new IllegalArgumentException("W has " + f.getBandCount() + " bands, data has " + data.numRows);
		}
		if (f.getPixelCount() != data.numCols) {
			throw new IllegalArgumentException("H has " + f.getPixelCount() + " pixels, data has " + data.numCols);
		}
		final int sources = f.getSourceCount();
		for (Map.Entry<Integer, DMatrixSparseCSC> e : context.getDiffOperators().entrySet()) {
			int k = e.getKey();
			if (k >= sources) {
				throw new IllegalArgumentException("Penalty operator for source " + k + " but only " + sources + " sources");
			}
			if (context.isIncludeBackground() && k == sources - 1) {
				throw new IllegalArgumentException("The background row cannot carry a symmetry operator");
			}
			DMatrixSparseCSC d = e.getValue();
			if (d.numRows != data.numCols || d.numCols != data.numCols) {
				throw new IllegalArgumentException("Penalty operator for source " + k + " is " + d.numRows + "x" + d.numCols + ", expected "
						+ data.numCols + "x" + data.numCols);
			}
		}
	}
}
