package com.github.micycle1.deblend;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ConstraintTest {

	@Test
	void singleLetterAppliesToAllPeaks() {
		assertEquals(List.of(Constraint.SYMMETRY, Constraint.SYMMETRY, Constraint.SYMMETRY), Constraint.parse("S", 3));
		assertEquals(List.of(Constraint.NONE), Constraint.parse(" ", 1));
		for (Constraint c : Constraint.values()) {
			assertEquals(c, Constraint.of(c.getCode()));
		}
	}

	@Test
	void oneLetterPerPeak() {
		assertEquals(List.of(Constraint.SYMMETRY, Constraint.NONE, Constraint.MONOTONICITY), Constraint.parse("sNm", 3));
		assertEquals(List.of(Constraint.SYMMETRY, Constraint.NONE), Constraint.parse("S ", 2));
	}

	@Test
	void rejectsBadInput() {
		assertThrows(IllegalArgumentException.class, () -> Constraint.parse("", 2));
		assertThrows(IllegalArgumentException.class, () -> Constraint.parse(null, 2));
		assertThrows(IllegalArgumentException.class, () -> Constraint.parse("SS", 3));
		assertThrows(IllegalArgumentException.class, () -> Constraint.parse("X", 1));
		assertThrows(IllegalArgumentException.class, () -> Constraint.of('?'));
	}
}
