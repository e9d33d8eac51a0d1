package com.github.micycle1.deblend;

import java.util.List;
import java.util.Optional;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.deblend.footprint.Footprint;

/**
 * Everything one {@link NmfDeblender#deblend} run produced for a footprint.
 */
public final class DeblendResult {

	private final Footprint footprint;
	private final DeblendParameters parameters;
	private final List<Constraint> constraints;
	private final Factorization initial;
	private final SolveResult solve;
	private final Reconstruction reconstruction;
	private final DMatrixRMaj maskedVariance; // nullable

	DeblendResult(Footprint footprint, DeblendParameters parameters, List<Constraint> constraints, Factorization initial, SolveResult solve,
			Reconstruction reconstruction, DMatrixRMaj maskedVariance) {
		this.footprint = footprint;
		this.parameters = parameters;
		this.constraints = constraints;
		this.initial = initial;
		this.solve = solve;
		this.reconstruction = reconstruction;
		this.maskedVariance = maskedVariance;
	}

	public Footprint getFootprint() {
		return footprint;
	}

	public DeblendParameters getParameters() {
		return parameters;
	}

	/** Constraint applied to each peak, in peak order. */
	public List<Constraint> getConstraints() {
		return constraints;
	}

	/** The (W, H) the solver started from. */
	public Factorization getInitial() {
		return initial;
	}

	public Factorization getFactorization() {
		return solve.getFactorization();
	}

	public SolveResult getSolve() {
		return solve;
	}

	public Reconstruction getReconstruction() {
		return reconstruction;
	}

	public double getOffset() {
		return reconstruction.getOffset();
	}

	/** Template image of peak/background {@code source} in {@code band}. */
	public double[][] templateImage(int band, int source) {
		return reconstruction.templateImage(band, source);
	}

	/** Variance with bad pixels zeroed, if the data carried a variance plane. */
	public Optional<DMatrixRMaj> getMaskedVariance() {
		return maskedVariance == null ? Optional.empty() : Optional.of(maskedVariance.copy());
	}
}
