package com.github.micycle1.deblend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shape constraint applied to a single source, selected by one letter per peak.
 */
public enum Constraint {

	/** 'S': penalize departure from point symmetry about the peak. */
	SYMMETRY('S'),
	/** ' ' or 'N': unconstrained. */
	NONE(' '),
	/** 'M': monotonic decrease away from the peak. Not implemented. */
	MONOTONICITY('M');

	private final char code;

	Constraint(char code) {
		this.code = code;
	}

	public char getCode() {
		return code;
	}

	public static Constraint of(char c) {
		switch (Character.toUpperCase(c)) {
			case 'S':
				return SYMMETRY;
			case ' ':
			case 'N':
				return NONE;
			case 'M':
				return MONOTONICITY;
			default:
				throw new IllegalArgumentException("Unknown constraint '" + c + "'");
		}
	}

	/**
	 * One constraint per peak. A single letter applies to every peak; otherwise
	 * there must be exactly one letter per peak.
	 */
	public static List<Constraint> parse(String codes, int peakCount) {
		if (codes == null || codes.isEmpty()) {
			throw new IllegalArgumentException("Constraint string must not be empty");
		}
		List<Constraint> out = new ArrayList<>(peakCount);
		if (codes.length() == 1) {
			Constraint c = of(codes.charAt(0));
			for (int k = 0; k < peakCount; k++) {
				out.add(c);
			}
		} else if (codes.length() == peakCount) {
			for (int k = 0; k < peakCount; k++) {
				out.add(of(codes.charAt(k)));
			}
		} else {
			throw new IllegalArgumentException("Got " + codes.length() + " constraints for " + peakCount + " peaks");
		}
		return Collections.unmodifiableList(out);
	}
}
