package com.github.micycle1.deblend;

import org.ejml.data.DMatrixRMaj;

/**
 * One iteration of the factorization: (A, W, H, context) to (W', H'). The input
 * state is never modified.
 */
public interface FactorizationUpdate {

	SolverState update(DMatrixRMaj data, SolverState state, UpdateContext context);
}
