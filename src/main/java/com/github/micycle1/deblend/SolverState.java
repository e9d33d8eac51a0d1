package com.github.micycle1.deblend;

import java.util.Objects;

/**
 * What one iteration hands to the next: the current factorization plus the
 * gradient-descent step sizes (which halve after every gradient step and are
 * passed through unchanged by the other rules).
 */
public final class SolverState {

	public static final double DEFAULT_STEP = 0.001;

	private final Factorization factorization;
	private final double stepW;
	private final double stepH;

	public SolverState(Factorization factorization, double stepW, double stepH) {
		this.factorization = Objects.requireNonNull(factorization, "factorization must not be null");
		this.stepW = stepW;
		this.stepH = stepH;
	}

	public static SolverState of(Factorization factorization) {
		return new SolverState(factorization, DEFAULT_STEP, DEFAULT_STEP);
	}

	public Factorization getFactorization() {
		return factorization;
	}

	public double getStepW() {
		return stepW;
	}

	public double getStepH() {
		return stepH;
	}

	SolverState with(Factorization next) {
		return new SolverState(next, stepW, stepH);
	}
}
