package com.github.micycle1.deblend.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.deblend.footprint.BBox;
import com.github.micycle1.deblend.linalg.Matrices;

/**
 * Per-band pixel data of one footprint, already cropped to the footprint's
 * bounding box: the data matrix A (bands x pixels, rows flattened row-major),
 * plus optional mask and variance planes of the same shape.
 * <p>
 * Immutable. {@link #withPositivityOffset()} returns a new instance rather than
 * shifting this one.
 */
public final class MultibandData {

	private final List<String> bands;
	private final int height;
	private final int width;
	private final DMatrixRMaj data;
	private final int[][] mask; // nullable
	private final double[][] variance; // nullable
	private final double offset;

	private MultibandData(List<String> bands, int height, int width, DMatrixRMaj data, int[][] mask, double[][] variance, double offset) {
		this.bands = bands;
		this.height = height;
		this.width = width;
		this.data = data;
		this.mask = mask;
		this.variance = variance;
		this.offset = offset;
	}

	/**
	 * @param bands  band names, one per image
	 * @param images per-band images, each {@code [height][width]}
	 */
	public static MultibandData of(List<String> bands, double[][][] images) {
		Objects.requireNonNull(bands, "bands must not be null");
		Objects.requireNonNull(images, "images must not be null");
		if (images.length == 0 || images.length != bands.size()) {
			throw new IllegalArgumentException("Expected " + bands.size() + " band images, got " + images.length);
		}
		final int h = images[0].length;
		if (h == 0) {
			throw new IllegalArgumentException("Band images must not be empty");
		}
		final int w = images[0][0].length;
		DMatrixRMaj a = new DMatrixRMaj(images.length, h * w);
		for (int b = 0; b < images.length; b++) {
			if (images[b].length != h) {
				throw new IllegalArgumentException("Band " + b + " has " + images[b].length + " rows, expected " + h);
			}
			for (int y = 0; y < h; y++) {
				if (images[b][y].length != w) {
					throw new IllegalArgumentException("Band " + b + " row " + y + " has " + images[b][y].length + " columns, expected " + w);
				}
				for (int x = 0; x < w; x++) {
					a.set(b, y * w + x, images[b][y][x]);
				}
			}
		}
		return new MultibandData(Collections.unmodifiableList(new ArrayList<>(bands)), h, w, a, null, null, 0);
	}

	/** Data given directly as a bands x pixels matrix for a box of the given shape. */
	public static MultibandData of(List<String> bands, BBox bbox, DMatrixRMaj matrix) {
		Objects.requireNonNull(matrix, "matrix must not be null");
		if (matrix.numRows != bands.size() || matrix.numCols != bbox.getArea()) {
			throw new IllegalArgumentException(
					"Data matrix is " + matrix.numRows + "x" + matrix.numCols + ", expected " + bands.size() + "x" + bbox.getArea());
		}
		return new MultibandData(Collections.unmodifiableList(new ArrayList<>(bands)), bbox.getHeight(), bbox.getWidth(), matrix.copy(), null, null, 0);
	}

	/**
	 * Attaches mask and variance planes, each {@code [bands][pixels]}. Either may
	 * be null.
	 */
	public MultibandData withPlanes(int[][] maskPlanes, double[][] variancePlanes) {
		if (maskPlanes != null) {
			checkPlanes(maskPlanes.length, "mask");
			for (int[] row : maskPlanes) {
				checkPlaneRow(row.length, "mask");
			}
		}
		if (variancePlanes != null) {
			checkPlanes(variancePlanes.length, "variance");
			for (double[] row : variancePlanes) {
				checkPlaneRow(row.length, "variance");
			}
		}
		return new MultibandData(bands, height, width, data, deepCopy(maskPlanes), deepCopy(variancePlanes), offset);
	}

	/**
	 * Shifts every pixel by {@code -min(A)} if any pixel is negative, so the
	 * multiplicative update sees non-negative data. Data without negative pixels
	 * is returned unchanged with a zero offset.
	 */
	public MultibandData withPositivityOffset() {
		double min = Matrices.min(data);
		if (min >= 0) {
			return this;
		}
		double shift = -min;
		DMatrixRMaj shifted = data.copy();
		for (int i = 0, n = shifted.getNumElements(); i < n; i++) {
			shifted.data[i] += shift;
		}
		return new MultibandData(bands, height, width, shifted, mask, variance, offset + shift);
	}

	/**
	 * Variance planes with every pixel whose mask intersects {@code badBits} set to
	 * zero. Empty if no variance was attached; unmasked if no mask was attached.
	 */
	public Optional<DMatrixRMaj> maskedVariance(int badBits) {
		if (variance == null) {
			return Optional.empty();
		}
		DMatrixRMaj v = new DMatrixRMaj(variance);
		if (mask != null) {
			for (int b = 0; b < mask.length; b++) {
				for (int p = 0; p < mask[b].length; p++) {
					if ((mask[b][p] & badBits) != 0) {
						v.set(b, p, 0);
					}
				}
			}
		}
		return Optional.of(v);
	}

	/** Copy of the bands x pixels data matrix. */
	public DMatrixRMaj getData() {
		return data.copy();
	}

	/** Constant added to every pixel to make the data non-negative (0 if none). */
	public double getOffset() {
		return offset;
	}

	public List<String> getBands() {
		return bands;
	}

	public int getBandCount() {
		return bands.size();
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	public int getPixelCount() {
		return height * width;
	}

	public boolean hasMask() {
		return mask != null;
	}

	private void checkPlanes(int count, String what) {
		if (count != bands.size()) {
			throw new IllegalArgumentException("Expected " + bands.size() + " " + what + " planes, got " + count);
		}
	}

	private void checkPlaneRow(int length, String what) {
		if (length != getPixelCount()) {
			throw new IllegalArgumentException("A " + what + " plane has " + length + " pixels, expected " + getPixelCount());
		}
	}

	private static int[][] deepCopy(int[][] a) {
		if (a == null) {
			return null;
		}
		int[][] c = new int[a.length][];
		for (int i = 0; i < a.length; i++) {
			c[i] = a[i].clone();
		}
		return c;
	}

	private static double[][] deepCopy(double[][] a) {
		if (a == null) {
			return null;
		}
		double[][] c = new double[a.length][];
		for (int i = 0; i < a.length; i++) {
			c[i] = a[i].clone();
		}
		return c;
	}
}
