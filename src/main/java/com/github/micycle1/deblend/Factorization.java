package com.github.micycle1.deblend;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.deblend.linalg.Matrices;

/**
 * An immutable (W, H) pair: the color matrix W (bands x sources) and the
 * intensity matrix H (sources x pixels). Matrices are copied on the way in and
 * on the way out, so no two iterations ever alias the same storage.
 */
public final class Factorization {

	private final DMatrixRMaj w;
	private final DMatrixRMaj h;

	private Factorization(DMatrixRMaj w, DMatrixRMaj h) {
		if (w.numCols != h.numRows) {
			throw new IllegalArgumentException("W has " + w.numCols + " sources but H has " + h.numRows);
		}
		this.w = w;
		this.h = h;
	}

	/** Factorization holding copies of {@code w} and {@code h}. */
	public static Factorization of(DMatrixRMaj w, DMatrixRMaj h) {
		Objects.requireNonNull(w, "W must not be null");
		Objects.requireNonNull(h, "H must not be null");
		return new Factorization(w.copy(), h.copy());
	}

	/** Wraps freshly computed matrices without copying. Callers must not keep references. */
	static Factorization adopt(DMatrixRMaj w, DMatrixRMaj h) {
		return new Factorization(w, h);
	}

	/** Copy of the color matrix W. */
	public DMatrixRMaj getColors() {
		return w.copy();
	}

	/** Copy of the intensity matrix H. */
	public DMatrixRMaj getIntensities() {
		return h.copy();
	}

	// read-only views for the solver, never handed out
	DMatrixRMaj w() {
		return w;
	}

	DMatrixRMaj h() {
		return h;
	}

	public int getBandCount() {
		return w.numRows;
	}

	public int getSourceCount() {
		return w.numCols;
	}

	public int getPixelCount() {
		return h.numCols;
	}

	public double color(int band, int source) {
		return w.get(band, source);
	}

	public double intensity(int source, int pixel) {
		return h.get(source, pixel);
	}

	/** The model W*H. */
	public DMatrixRMaj product() {
		return Matrices.mult(w, h);
	}

	/** ||A - W*H||_F */
	public double residualNorm(DMatrixRMaj data) {
		return Matrices.distance(data, product());
	}

	public boolean isNonNegative() {
		return Matrices.isNonNegative(w) && Matrices.isNonNegative(h);
	}

	public boolean isFinite() {
		return Matrices.isFinite(w) && Matrices.isFinite(h);
	}

	/**
	 * Divides each column of W by its sum and multiplies the matching row of H by
	 * the same factor, so W*H is unchanged. Columns summing to exactly zero are
	 * divided by 1 (left as they are).
	 *
	 * @param absolute sum magnitudes rather than signed values
	 */
	public Factorization normalized(boolean absolute) {
		double[] f = Matrices.normFactors(w, absolute);
		return adopt(Matrices.divideColumns(w, f), Matrices.scaleRows(h, f));
	}

	@Override
	public String toString() {
		return "Factorization{bands=" + getBandCount() + ", sources=" + getSourceCount() + ", pixels=" + getPixelCount() + "}";
	}
}
