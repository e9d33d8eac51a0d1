package com.github.micycle1.deblend;

import java.util.Objects;

/**
 * Outcome of {@link FactorizationSolver#solve}: the final state, the rule that
 * produced it and the residual norm ||A - W H||_F recorded after every iteration.
 */
public final class SolveResult {

	private final SolverState state;
	private final UpdateRule rule;
	private final double[] residualHistory;

	SolveResult(SolverState state, UpdateRule rule, double[] residualHistory) {
		this.state = Objects.requireNonNull(state);
		this.rule = rule;
		this.residualHistory = residualHistory;
	}

	public Factorization getFactorization() {
		return state.getFactorization();
	}

	/** Final state, for resuming a solve (step sizes included). */
	public SolverState getState() {
		return state;
	}

	public UpdateRule getRule() {
		return rule;
	}

	public int getIterations() {
		return residualHistory.length - 1;
	}

	/** Entry 0 is the initial residual; entry i is the residual after iteration i. */
	public double[] residualHistory() {
		return residualHistory.clone();
	}

	public double getFinalResidual() {
		return residualHistory[residualHistory.length - 1];
	}

	public boolean isFinite() {
		return state.getFactorization().isFinite();
	}
}
