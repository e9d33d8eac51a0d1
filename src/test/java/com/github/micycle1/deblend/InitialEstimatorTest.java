package com.github.micycle1.deblend;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Random;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.deblend.linalg.Matrices;

public class InitialEstimatorTest {

	@Test
	void centeredPeakWithBackground() {
		// 2 bands, 5x5 footprint, one peak at (2,2), offset 3
		final int pixels = 25;
		final double offset = 3.0;
		double[] g = Fixtures.gaussian(5, 5, 2, 2, 1.2, 10.0);
		double[][] bandProfiles = new double[2][pixels];
		for (int p = 0; p < pixels; p++) {
			bandProfiles[0][p] = 0.8 * g[p];
			bandProfiles[1][p] = 1.2 * g[p];
		}
		double[] mean = InitialEstimator.meanProfile(bandProfiles, pixels, 0);
		for (int p = 0; p < pixels; p++) {
			assertEquals(g[p], mean[p], 1e-12);
		}

		// columns of the true W sum to one, so normalization leaves H as seeded
		DMatrixRMaj wTrue = new DMatrixRMaj(new double[][] { { 0.3, 0.5 }, { 0.7, 0.5 } });
		DMatrixRMaj hTrue = new DMatrixRMaj(2, pixels);
		for (int p = 0; p < pixels; p++) {
			hTrue.set(0, p, g[p]);
			hTrue.set(1, p, offset);
		}
		DMatrixRMaj a = Matrices.mult(wTrue, hTrue);

		Factorization f = InitialEstimator.estimate(a, List.<double[][]>of(bandProfiles), true, offset);
		assertEquals(2, f.getSourceCount());
		for (int p = 0; p < pixels; p++) {
			assertEquals(g[p], f.intensity(0, p), 1e-9, "peak row pixel " + p);
			assertEquals(offset, f.intensity(1, p), 1e-9, "background row pixel " + p);
		}
		for (int b = 0; b < 2; b++) {
			for (int k = 0; k < 2; k++) {
				assertEquals(wTrue.get(b, k), f.color(b, k), 1e-9);
			}
		}
		assertTrue(Matrices.distance(a, f.product()) < 1e-9 * Matrices.frobenius(a));
	}

	@ParameterizedTest
	@ValueSource(longs = { 3L, 17L, 2024L })
	void columnsSumToOneAndProductIsPreserved(long seed) {
		Random rnd = new Random(seed);
		final int bands = 4, pixels = 30;
		DMatrixRMaj a = Fixtures.random(bands, pixels, 0.0, rnd);
		List<double[][]> profiles = List.of(randomProfiles(bands, pixels, rnd), randomProfiles(bands, pixels, rnd));

		Factorization f = InitialEstimator.estimate(a, profiles, false, 0.0);
		for (double s : Fixtures.columnSums(f.getColors())) {
			assertEquals(1.0, s, 1e-9);
		}

		// same fit before normalization: W0 H0 with H0 the mean profiles
		DMatrixRMaj h0 = new DMatrixRMaj(2, pixels);
		for (int k = 0; k < 2; k++) {
			double[] mean = InitialEstimator.meanProfile(profiles.get(k), pixels, k);
			for (int p = 0; p < pixels; p++) {
				h0.set(k, p, mean[p]);
			}
		}
		DMatrixRMaj w0 = Matrices.mult(a, Matrices.pinv(h0));
		assertTrue(Matrices.distance(Matrices.mult(w0, h0), f.product()) < 1e-9);
	}

	@Test
	void zeroSumColumnIsLeftUntouched() {
		DMatrixRMaj w = new DMatrixRMaj(new double[][] { { 2, 0, 1 }, { 3, 0, -1 } });
		DMatrixRMaj h = new DMatrixRMaj(new double[][] { { 1, 2 }, { 4, 5 }, { 7, 8 } });
		Factorization f = Factorization.of(w, h).normalized(false);

		assertEquals(0.4, f.color(0, 0), 1e-12);
		assertEquals(0.6, f.color(1, 0), 1e-12);
		assertEquals(5.0, f.intensity(0, 0), 1e-12);
		// all-zero column and signed zero-sum column are divided by 1
		assertEquals(0.0, f.color(0, 1), 0.0);
		assertEquals(1.0, f.color(0, 2), 0.0);
		assertEquals(-1.0, f.color(1, 2), 0.0);
		assertEquals(4.0, f.intensity(1, 0), 0.0);
		assertEquals(8.0, f.intensity(2, 1), 0.0);
		assertTrue(Matrices.distance(Matrices.mult(w, h), f.product()) < 1e-12);

		// summing magnitudes, the third column is no longer degenerate
		Factorization g = Factorization.of(w, h).normalized(true);
		assertEquals(0.5, g.color(0, 2), 1e-12);
		assertEquals(-0.5, g.color(1, 2), 1e-12);
	}

	@Test
	void zeroBackgroundRowStaysZero() {
		// without an offset the background row is all zero
		double[] g = Fixtures.gaussian(4, 4, 1, 1, 1.0, 5.0);
		DMatrixRMaj a = new DMatrixRMaj(2, 16);
		for (int p = 0; p < 16; p++) {
			a.set(0, p, 2 * g[p]);
			a.set(1, p, 3 * g[p]);
		}
		Factorization f = InitialEstimator.estimate(a, List.<double[][]>of(new double[][] { g, g }), true, 0.0);
		assertEquals(1.0, Fixtures.columnSums(f.getColors())[0], 1e-9);
		assertEquals(0.4, f.color(0, 0), 1e-9);
		for (int p = 0; p < 16; p++) {
			assertEquals(0.0, f.intensity(1, p), 0.0);
			assertEquals(5 * g[p], f.intensity(0, p), 1e-9);
		}
		assertTrue(Matrices.distance(a, f.product()) < 1e-9);
	}

	@Test
	void rankDeficientIntensitiesDoNotThrow() {
		// two identical peaks: H has rank 1
		double[] g = Fixtures.gaussian(5, 5, 2, 2, 1.0, 1.0);
		DMatrixRMaj a = new DMatrixRMaj(3, 25);
		for (int b = 0; b < 3; b++) {
			for (int p = 0; p < 25; p++) {
				a.set(b, p, (b + 1) * g[p]);
			}
		}
		double[][] same = { g, g, g };
		Factorization f = InitialEstimator.estimate(a, List.of(same, same), false, 0.0);
		assertTrue(f.isFinite());
		assertTrue(Matrices.distance(a, f.product()) < 1e-9);
	}

	@Test
	void rejectsMismatchedProfiles() {
		DMatrixRMaj a = new DMatrixRMaj(2, 9);
		double[][] wrong = { new double[9], new double[8] };
		assertThrows(IllegalArgumentException.class, () -> InitialEstimator.estimate(a, List.<double[][]>of(wrong), false, 0));
		assertThrows(IllegalArgumentException.class, () -> InitialEstimator.estimate(a, List.<double[][]>of(new double[0][]), false, 0));
		assertThrows(IllegalArgumentException.class, () -> InitialEstimator.estimate(a, List.of(), false, 0));
	}

	private static double[][] randomProfiles(int bands, int pixels, Random rnd) {
		double[][] p = new double[bands][pixels];
		for (int b = 0; b < bands; b++) {
			for (int i = 0; i < pixels; i++) {
				p[b][i] = rnd.nextDouble();
			}
		}
		return p;
	}
}
