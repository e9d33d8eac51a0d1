package com.github.micycle1.deblend.footprint;

import java.util.Objects;

/**
 * A single-band template image together with the box it was measured in. The
 * template box usually differs from (and may overhang) the parent footprint's
 * box, so templates are embedded before they are used to seed a factorization.
 */
public final class TemplateImage {

	private final BBox bbox;
	private final double[][] pixels; // [row][col], bbox.height x bbox.width

	public TemplateImage(BBox bbox, double[][] pixels) {
		this.bbox = Objects.requireNonNull(bbox, "bbox must not be null");
		Objects.requireNonNull(pixels, "pixels must not be null");
		if (pixels.length != bbox.getHeight()) {
			throw new IllegalArgumentException("Template has " + pixels.length + " rows, box height is " + bbox.getHeight());
		}
		this.pixels = new double[pixels.length][];
		for (int r = 0; r < pixels.length; r++) {
			if (pixels[r].length != bbox.getWidth()) {
				throw new IllegalArgumentException("Template row " + r + " has " + pixels[r].length + " columns, box width is " + bbox.getWidth());
			}
			this.pixels[r] = pixels[r].clone();
		}
	}

	public BBox getBBox() {
		return bbox;
	}

	public double get(int row, int col) {
		return pixels[row][col];
	}

	/**
	 * Places this template into {@code target}, zero elsewhere, and flattens the
	 * result row-major. Template pixels falling outside {@code target} are
	 * clipped.
	 */
	public double[] embedInto(BBox target) {
		final int tw = target.getWidth();
		double[] out = new double[target.getArea()];

		// offsets of the template origin inside the target box
		int dx = bbox.getMinX() - target.getMinX();
		int dy = bbox.getMinY() - target.getMinY();

		int r0 = Math.max(0, -dy), r1 = Math.min(bbox.getHeight(), target.getHeight() - dy);
		int c0 = Math.max(0, -dx), c1 = Math.min(bbox.getWidth(), tw - dx);
		for (int r = r0; r < r1; r++) {
			int base = (r + dy) * tw + dx;
			for (int c = c0; c < c1; c++) {
				out[base + c] = pixels[r][c];
			}
		}
		return out;
	}
}
