package com.github.micycle1.deblend;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;

/**
 * Geometry of the point reflection about one peak: the largest axis-aligned
 * sub-rectangle of the footprint grid that maps onto itself under 180 degree
 * rotation about the peak.
 * <p>
 * Per axis, with the peak at p on an axis of length n:
 * <ul>
 * <li>p left of the midpoint: [0, 2p+1)</li>
 * <li>p right of the midpoint: [2p-n+1, n)</li>
 * <li>p on the midpoint: [0, n)</li>
 * </ul>
 * Pixels are indexed row-major ({@code y * width + x}).
 */
public final class PeakSymmetry {

	private final int height, width;
	private final int px, py;
	private final int xmin, xmax; // [xmin, xmax)
	private final int ymin, ymax; // [ymin, ymax)

	private PeakSymmetry(int height, int width, int px, int py) {
		this.height = height;
		this.width = width;
		this.px = px;
		this.py = py;
		int[] xr = axisRange(px, width);
		int[] yr = axisRange(py, height);
		this.xmin = xr[0];
		this.xmax = xr[1];
		this.ymin = yr[0];
		this.ymax = yr[1];
	}

	/**
	 * @param height grid height
	 * @param width  grid width
	 * @param px     peak column, relative to the grid origin
	 * @param py     peak row, relative to the grid origin
	 */
	public static PeakSymmetry of(int height, int width, int px, int py) {
		if (height <= 0 || width <= 0) {
			throw new IllegalArgumentException("Grid must be non-empty, got " + width + "x" + height);
		}
		if (px < 0 || px >= width || py < 0 || py >= height) {
			throw new IllegalArgumentException("Peak (" + px + "," + py + ") lies outside the " + width + "x" + height + " grid");
		}
		return new PeakSymmetry(height, width, px, py);
	}

	private static int[] axisRange(int p, int size) {
		double mid = (size - 1) / 2.0;
		if (p < mid) {
			return new int[] { 0, 2 * p + 1 };
		} else if (p > mid) {
			return new int[] { 2 * p - size + 1, size };
		}
		return new int[] { 0, size };
	}

	/** True if the peak sits exactly on the geometric center of the grid. */
	public boolean isCentered() {
		return px == (width - 1) / 2.0 && py == (height - 1) / 2.0;
	}

	public int getXMin() {
		return xmin;
	}

	public int getXMax() {
		return xmax;
	}

	public int getYMin() {
		return ymin;
	}

	public int getYMax() {
		return ymax;
	}

	public int getSubWidth() {
		return xmax - xmin;
	}

	public int getSubHeight() {
		return ymax - ymin;
	}

	/** Grid columns between the sub-rectangle's right edge and the next row's left edge. */
	public int getExtraWidth() {
		return width - getSubWidth();
	}

	/** First flattened pixel of the sub-rectangle. */
	public int getStart() {
		return ymin * width + xmin;
	}

	/** One past the last flattened pixel of the sub-rectangle. */
	public int getEnd() {
		return (ymax - 1) * width + xmax;
	}

	/** True if flattened pixel {@code pixel} lies inside the sub-rectangle. */
	public boolean contains(int pixel) {
		int y = pixel / width, x = pixel % width;
		return x >= xmin && x < xmax && y >= ymin && y < ymax;
	}

	/** The pixel that {@code pixel} maps to under the reflection, or -1 outside the sub-rectangle. */
	public int mirror(int pixel) {
		if (!contains(pixel)) {
			return -1;
		}
		int y = pixel / width, x = pixel % width;
		return (ymin + ymax - 1 - y) * width + (xmin + xmax - 1 - x);
	}

	/**
	 * The sparse symmetry operator S (pixels x pixels). Row i holds a single 1 at
	 * the mirror of pixel i inside the sub-rectangle; rows outside it are empty.
	 */
	public DMatrixSparseCSC toOperator() {
		final int n = height * width;

		if (isCentered()) {
			// whole footprint: anti-diagonal identity
			DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, n);
			for (int i = 0; i < n; i++) {
				tr.addItem(i, n - 1 - i, 1.0);
			}
			return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
		}

		// The block spans the flattened range [start, end). Reversing that range maps
		// offset k = row*width + col to the reflected pixel, but the trailing
		// extraWidth columns of each row but the last are not part of the
		// sub-rectangle and would wrap into the wrong row; their entries stay zero.
		final int tWidth = getSubWidth();
		final int start = getStart();
		final int span = getEnd() - start;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, tWidth * getSubHeight());
		for (int k = 0; k < span; k++) {
			if (k % width >= tWidth) {
				continue;
			}
			tr.addItem(start + k, start + span - 1 - k, 1.0);
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Override
	public String toString() {
		return "PeakSymmetry{peak=(" + px + "," + py + "), x=[" + xmin + "," + xmax + "), y=[" + ymin + "," + ymax + ")}";
	}
}
