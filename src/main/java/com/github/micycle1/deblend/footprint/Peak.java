package com.github.micycle1.deblend.footprint;

/**
 * A detected peak in absolute (image) pixel coordinates.
 */
public final class Peak {

	private final int ix;
	private final int iy;

	public Peak(int ix, int iy) {
		this.ix = ix;
		this.iy = iy;
	}

	public int getIx() {
		return ix;
	}

	public int getIy() {
		return iy;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Peak)) {
			return false;
		}
		Peak p = (Peak) o;
		return ix == p.ix && iy == p.iy;
	}

	@Override
	public int hashCode() {
		return 31 * ix + iy;
	}

	@Override
	public String toString() {
		return "Peak(" + ix + "," + iy + ")";
	}
}
