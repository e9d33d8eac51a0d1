package com.github.micycle1.deblend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.deblend.footprint.BBox;
import com.github.micycle1.deblend.linalg.Matrices;

/**
 * Projections of a solved factorization back to images: per-source per-band
 * templates, the full model W H, residuals and per-band diagnostics.
 * <p>
 * The template of source k in band b is {@code W[b,k] * H[k,:]}. The background
 * source, when present, is the last one and has the data offset subtracted
 * again. All methods are side-effect free.
 */
public final class Reconstruction {

	private final Factorization factorization;
	private final DMatrixRMaj data;
	private final double offset;
	private final boolean includeBackground;
	private final BBox shape; // nullable
	private final DMatrixRMaj model;

	/**
	 * @param factorization     the solved (W, H)
	 * @param data              the (offset) data matrix the factorization was fit
	 *                          to
	 * @param offset            constant added to the data before fitting
	 * @param includeBackground whether the last source is the background
	 * @param shape             footprint box used to reshape templates; may be
	 *                          null when only flat templates are needed
	 */
	public Reconstruction(Factorization factorization, DMatrixRMaj data, double offset, boolean includeBackground, BBox shape) {
		this.factorization = Objects.requireNonNull(factorization, "factorization must not be null");
		Objects.requireNonNull(data, "data must not be null");
		if (data.numRows != factorization.getBandCount() || data.numCols != factorization.getPixelCount()) {
			throw new IllegalArgumentException("Data is " + data.numRows + "x" + data.numCols + " but the factorization is "
					+ factorization.getBandCount() + "x" + factorization.getPixelCount());
		}
		if (shape != null && shape.getArea() != data.numCols) {
			throw new IllegalArgumentException(shape + " does not cover " + data.numCols + " pixels");
		}
		this.data = data.copy();
		this.offset = offset;
		this.includeBackground = includeBackground;
		this.shape = shape;
		this.model = factorization.product();
	}

	public boolean isBackground(int source) {
		return includeBackground && source == factorization.getSourceCount() - 1;
	}

	/** Flat template of {@code source} in {@code band}. */
	public double[] template(int band, int source) {
		checkIndices(band, source);
		final int pixels = factorization.getPixelCount();
		double c = factorization.color(band, source);
		double shift = isBackground(source) ? offset : 0.0;
		double[] t = new double[pixels];
		for (int p = 0; p < pixels; p++) {
			t[p] = c * factorization.intensity(source, p) - shift;
		}
		return t;
	}

	/**
	 * Template reshaped to the footprint grid, {@code [row][col]}.
	 *
	 * @throws IllegalArgumentException if no footprint shape was supplied
	 */
	public double[][] templateImage(int band, int source) {
		if (shape == null) {
			throw new IllegalArgumentException("A footprint shape is required to reshape the template");
		}
		return reshape(template(band, source), shape.getHeight(), shape.getWidth());
	}

	/** Total flux of a source's template in one band. */
	public double flux(int band, int source) {
		double s = 0.0;
		for (double v : template(band, source)) {
			s += v;
		}
		return s;
	}

	/**
	 * Column {@code source} of W. For the background source 1/bands is subtracted,
	 * its share of a normalized column that only carries the offset.
	 */
	public double[] sed(int source) {
		checkIndices(0, source);
		final int bands = factorization.getBandCount();
		double shift = isBackground(source) ? 1.0 / bands : 0.0;
		double[] sed = new double[bands];
		for (int b = 0; b < bands; b++) {
			sed[b] = factorization.color(b, source) - shift;
		}
		return sed;
	}

	/** Copy of the model W H. */
	public DMatrixRMaj model() {
		return model.copy();
	}

	/** W H - A */
	public DMatrixRMaj residual() {
		return Matrices.subtract(model, data);
	}

	/**
	 * sum |W H - A| / sum |A| over one band. A band of zero data gives 0 if the
	 * residual is zero too, infinity otherwise.
	 */
	public double residualFraction(int band) {
		checkIndices(band, 0);
		double num = 0.0, den = 0.0;
		for (int p = 0; p < data.numCols; p++) {
			num += Math.abs(model.get(band, p) - data.get(band, p));
			den += Math.abs(data.get(band, p));
		}
		if (den == 0) {
			return num == 0 ? 0.0 : Double.POSITIVE_INFINITY;
		}
		return num / den;
	}

	public BandDiagnostics diagnostics(int band) {
		checkIndices(band, 0);
		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		double maxDiff = Double.NEGATIVE_INFINITY;
		double diffSum = 0.0, dataSum = 0.0;
		for (int p = 0; p < data.numCols; p++) {
			double a = data.get(band, p);
			double d = model.get(band, p) - a;
			min = Math.min(min, a);
			max = Math.max(max, a);
			maxDiff = Math.max(maxDiff, d);
			diffSum += d;
			dataSum += a;
		}
		double percent = dataSum == 0 ? (diffSum == 0 ? 0.0 : Double.POSITIVE_INFINITY) : 100.0 * Math.abs(diffSum / dataSum);
		return new BandDiagnostics(band, min, max, maxDiff, residualFraction(band), percent);
	}

	public List<BandDiagnostics> diagnostics() {
		List<BandDiagnostics> out = new ArrayList<>();
		for (int b = 0; b < factorization.getBandCount(); b++) {
			out.add(diagnostics(b));
		}
		return Collections.unmodifiableList(out);
	}

	public Factorization getFactorization() {
		return factorization;
	}

	public double getOffset() {
		return offset;
	}

	public Optional<BBox> getShape() {
		return Optional.ofNullable(shape);
	}

	static double[][] reshape(double[] flat, int height, int width) {
		if (flat.length != height * width) {
			throw new IllegalArgumentException("Cannot reshape " + flat.length + " pixels to " + width + "x" + height);
		}
		double[][] img = new double[height][width];
		for (int y = 0; y < height; y++) {
			System.arraycopy(flat, y * width, img[y], 0, width);
		}
		return img;
	}

	private void checkIndices(int band, int source) {
		if (band < 0 || band >= factorization.getBandCount()) {
			throw new IllegalArgumentException("Band " + band + " out of range [0, " + factorization.getBandCount() + ")");
		}
		if (source < 0 || source >= factorization.getSourceCount()) {
			throw new IllegalArgumentException("Source " + source + " out of range [0, " + factorization.getSourceCount() + ")");
		}
	}
}
