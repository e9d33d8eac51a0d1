package com.github.micycle1.deblend;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Everything an update rule needs besides A, W and H: the symmetry weight beta,
 * the penalty operators keyed by source index, and whether the last source is
 * the synthetic background.
 * <p>
 * Background policy: the background row takes part in every W/H update and in
 * W's column normalization like any source, but never carries a symmetry
 * operator. {@link FactorizationSolver} rejects a context that assigns one to
 * it.
 */
public final class UpdateContext {

	private static final UpdateContext UNPENALIZED = new UpdateContext(0, Collections.emptyMap(), false);

	private final double beta;
	private final Map<Integer, DMatrixSparseCSC> diffOperators;
	private final boolean includeBackground;

	private UpdateContext(double beta, Map<Integer, DMatrixSparseCSC> diffOperators, boolean includeBackground) {
		this.beta = beta;
		this.diffOperators = diffOperators;
		this.includeBackground = includeBackground;
	}

	/** No symmetry penalty and no background row. */
	public static UpdateContext unpenalized() {
		return UNPENALIZED;
	}

	/**
	 * @param beta              symmetry weight, {@code >= 0}
	 * @param diffOperators     penalty operators D_k keyed by source index k;
	 *                          sources without an entry are unpenalized
	 * @param includeBackground whether the last source is the background row
	 */
	public static UpdateContext of(double beta, Map<Integer, DMatrixSparseCSC> diffOperators, boolean includeBackground) {
		Objects.requireNonNull(diffOperators, "diffOperators must not be null");
		if (!(beta >= 0)) {
			throw new IllegalArgumentException("beta must be non-negative, got " + beta);
		}
		for (Integer k : diffOperators.keySet()) {
			if (k == null || k < 0) {
				throw new IllegalArgumentException("Invalid source index " + k);
			}
		}
		return new UpdateContext(beta, Collections.unmodifiableMap(new TreeMap<>(diffOperators)), includeBackground);
	}

	public double getBeta() {
		return beta;
	}

	public Map<Integer, DMatrixSparseCSC> getDiffOperators() {
		return diffOperators;
	}

	public Optional<DMatrixSparseCSC> diffOperator(int source) {
		return Optional.ofNullable(diffOperators.get(source));
	}

	public boolean isIncludeBackground() {
		return includeBackground;
	}

	/** True if the symmetry term changes the updates at all. */
	public boolean isPenalized() {
		return beta > 0 && !diffOperators.isEmpty();
	}
}
