package com.github.micycle1.deblend;

/**
 * Fit-quality figures for one band.
 */
public final class BandDiagnostics {

	private final int band;
	private final double dataMin;
	private final double dataMax;
	private final double maxDifference;
	private final double residualFraction;
	private final double residualPercent;

	BandDiagnostics(int band, double dataMin, double dataMax, double maxDifference, double residualFraction, double residualPercent) {
		this.band = band;
		this.dataMin = dataMin;
		this.dataMax = dataMax;
		this.maxDifference = maxDifference;
		this.residualFraction = residualFraction;
		this.residualPercent = residualPercent;
	}

	public int getBand() {
		return band;
	}

	public double getDataMin() {
		return dataMin;
	}

	public double getDataMax() {
		return dataMax;
	}

	/** Largest signed entry of (W H - A) in this band. */
	public double getMaxDifference() {
		return maxDifference;
	}

	/** sum |W H - A| / sum |A| over the band's pixels. */
	public double getResidualFraction() {
		return residualFraction;
	}

	/** 100 |sum (W H - A) / sum A| over the band's pixels. */
	public double getResidualPercent() {
		return residualPercent;
	}

	@Override
	public String toString() {
		return String.format("band %d: pixel range %.4g to %.4g, max difference %.4g, residual fraction %.4g, residual %.1f%%", band, dataMin, dataMax,
				maxDifference, residualFraction, residualPercent);
	}
}
