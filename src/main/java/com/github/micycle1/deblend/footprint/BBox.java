package com.github.micycle1.deblend.footprint;

/**
 * Axis-aligned integer pixel box: origin (minX, minY) plus width and height.
 * Immutable.
 */
public final class BBox {

	private final int minX;
	private final int minY;
	private final int width;
	private final int height;

	public BBox(int minX, int minY, int width, int height) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("BBox must have positive extent, got " + width + "x" + height);
		}
		this.minX = minX;
		this.minY = minY;
		this.width = width;
		this.height = height;
	}

	public int getMinX() {
		return minX;
	}

	public int getMinY() {
		return minY;
	}

	/** Exclusive upper x bound. */
	public int getEndX() {
		return minX + width;
	}

	/** Exclusive upper y bound. */
	public int getEndY() {
		return minY + height;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getArea() {
		return width * height;
	}

	public boolean contains(int x, int y) {
		return x >= minX && x < getEndX() && y >= minY && y < getEndY();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BBox)) {
			return false;
		}
		BBox b = (BBox) o;
		return minX == b.minX && minY == b.minY && width == b.width && height == b.height;
	}

	@Override
	public int hashCode() {
		return ((minX * 31 + minY) * 31 + width) * 31 + height;
	}

	@Override
	public String toString() {
		return "BBox{min=(" + minX + "," + minY + "), " + width + "x" + height + "}";
	}
}
