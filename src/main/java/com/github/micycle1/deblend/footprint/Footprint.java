package com.github.micycle1.deblend.footprint;

import java.util.List;

/**
 * Footprint: the minimal view of a detection region required by the deblender.
 * <p>
 * Conventions:
 * <ul>
 * <li>Pixels of the bounding box are flattened row-major: pixel (x, y), relative
 * to the box origin, has index {@code y * width + x}. Every matrix built for a
 * footprint uses this order.</li>
 * <li>{@link #getPeaks()} is ordered; peak k is source k (row k of the intensity
 * matrix).</li>
 * <li>Peak coordinates are absolute image coordinates and must lie inside the
 * bounding box.</li>
 * </ul>
 * Implementations are expected to be immutable.
 */
public interface Footprint {

	/** Bounding box of the footprint, in absolute image coordinates. */
	BBox getBBox();

	/** Ordered peaks, one per source. */
	List<Peak> getPeaks();

	/** Number of pixels in the bounding box. */
	default int getPixelCount() {
		return getBBox().getArea();
	}

	/** Peak k's x coordinate relative to the bounding box origin. */
	default int relativeX(int k) {
		return getPeaks().get(k).getIx() - getBBox().getMinX();
	}

	/** Peak k's y coordinate relative to the bounding box origin. */
	default int relativeY(int k) {
		return getPeaks().get(k).getIy() - getBBox().getMinY();
	}
}
