package com.github.micycle1.deblend.data;

/**
 * Mask planes carried with the per-band pixel data, with their bit positions in
 * the integer mask.
 */
public enum MaskPlane {

	BAD(0), SAT(1), INTRP(2), CR(3), EDGE(4), DETECTED(5), DETECTED_NEGATIVE(6), SUSPECT(7), NO_DATA(8);

	private final int bit;

	MaskPlane(int bit) {
		this.bit = bit;
	}

	public int getBit() {
		return bit;
	}

	public int bitmask() {
		return 1 << bit;
	}

	/** OR of the given planes' bitmasks. */
	public static int bits(MaskPlane... planes) {
		int m = 0;
		for (MaskPlane p : planes) {
			m |= p.bitmask();
		}
		return m;
	}

	/** Planes that make a pixel unusable for fitting. */
	public static int badPixelBits() {
		return bits(BAD, CR, NO_DATA, SAT, SUSPECT);
	}
}
