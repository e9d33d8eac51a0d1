package com.github.micycle1.deblend.footprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular {@link Footprint}: every pixel of the bounding box belongs to the
 * footprint. Adapter for callers whose detection stage only hands over a box and
 * a peak list.
 */
public final class BoxFootprint implements Footprint {

	private final BBox bbox;
	private final List<Peak> peaks;

	public BoxFootprint(BBox bbox, List<Peak> peaks) {
		this.bbox = Objects.requireNonNull(bbox, "bbox must not be null");
		Objects.requireNonNull(peaks, "peaks must not be null");
		for (Peak p : peaks) {
			if (!bbox.contains(p.getIx(), p.getIy())) {
				throw new IllegalArgumentException(p + " lies outside " + bbox);
			}
		}
		this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
	}

	/** Footprint with its origin at (0, 0). */
	public static BoxFootprint of(int width, int height, Peak... peaks) {
		return new BoxFootprint(new BBox(0, 0, width, height), List.of(peaks));
	}

	@Override
	public BBox getBBox() {
		return bbox;
	}

	@Override
	public List<Peak> getPeaks() {
		return peaks;
	}

	@Override
	public String toString() {
		return "BoxFootprint{" + bbox + ", peaks=" + peaks + "}";
	}
}
