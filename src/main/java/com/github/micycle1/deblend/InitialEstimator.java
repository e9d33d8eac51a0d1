package com.github.micycle1.deblend;

import java.util.List;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.deblend.linalg.Matrices;

/**
 * Builds the starting (W, H) pair from per-source template profiles.
 * <p>
 * Each source's H row is the unweighted mean of its per-band profiles. An
 * optional background row is set to the constant data offset. W is then the
 * least-squares solution of A = W*H through the pseudoinverse of H (H may be
 * rank deficient when peaks are close or bands are few), and finally the
 * columns of W are normalized to unit sum with H rescaled to compensate.
 */
public final class InitialEstimator {

	private InitialEstimator() {
	}

	/**
	 * @param data              bands x pixels data matrix (already offset if
	 *                          {@code offset != 0})
	 * @param profiles          for each source, its per-band spatial profiles, each
	 *                          flattened to {@code pixels} values
	 * @param includeBackground append a background row holding {@code offset}
	 * @param offset            constant added to the data to make it non-negative
	 */
	public static Factorization estimate(DMatrixRMaj data, List<double[][]> profiles, boolean includeBackground, double offset) {
		Objects.requireNonNull(data, "data must not be null");
		Objects.requireNonNull(profiles, "profiles must not be null");
		final int pixels = data.numCols;
		final int peakCount = profiles.size();
		final int sources = includeBackground ? peakCount + 1 : peakCount;
		if (sources == 0) {
			throw new IllegalArgumentException("No sources to estimate");
		}

		DMatrixRMaj h = new DMatrixRMaj(sources, pixels);
		for (int k = 0; k < peakCount; k++) {
			double[] mean = meanProfile(profiles.get(k), pixels, k);
			for (int p = 0; p < pixels; p++) {
				h.set(k, p, mean[p]);
			}
		}
		if (includeBackground) {
			for (int p = 0; p < pixels; p++) {
				h.set(sources - 1, p, offset);
			}
		}

		DMatrixRMaj w = Matrices.mult(data, Matrices.pinv(h));
		return Factorization.adopt(w, h).normalized(false);
	}

	static double[] meanProfile(double[][] bandProfiles, int pixels, int source) {
		if (bandProfiles == null || bandProfiles.length == 0) {
			throw new IllegalArgumentException("Source " + source + " has no band profiles");
		}
		double[] mean = new double[pixels];
		for (int b = 0; b < bandProfiles.length; b++) {
			if (bandProfiles[b].length != pixels) {
				throw new IllegalArgumentException(
						"Source " + source + " band " + b + " profile has " + bandProfiles[b].length + " pixels, expected " + pixels);
			}
			for (int p = 0; p < pixels; p++) {
				mean[p] += bandProfiles[b][p];
			}
		}
		for (int p = 0; p < pixels; p++) {
			mean[p] /= bandProfiles.length;
		}
		return mean;
	}
}
