package com.github.micycle1.deblend;

import java.util.Random;

import org.ejml.data.DMatrixRMaj;

/**
 * Random and synthetic fixtures shared by the tests.
 */
final class Fixtures {

	private Fixtures() {
	}

	/** Entries uniform in [lo, lo + 1). */
	static DMatrixRMaj random(int rows, int cols, double lo, Random rnd) {
		DMatrixRMaj m = new DMatrixRMaj(rows, cols);
		for (int i = 0; i < m.getNumElements(); i++) {
			m.data[i] = lo + rnd.nextDouble();
		}
		return m;
	}

	/** Circular gaussian on a height x width grid, flattened row-major. */
	static double[] gaussian(int height, int width, int cx, int cy, double sigma, double amplitude) {
		double[] g = new double[height * width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				double r2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
				g[y * width + x] = amplitude * Math.exp(-r2 / (2 * sigma * sigma));
			}
		}
		return g;
	}

	static double[] columnSums(DMatrixRMaj m) {
		double[] s = new double[m.numCols];
		for (int r = 0; r < m.numRows; r++) {
			for (int c = 0; c < m.numCols; c++) {
				s[c] += m.get(r, c);
			}
		}
		return s;
	}
}
