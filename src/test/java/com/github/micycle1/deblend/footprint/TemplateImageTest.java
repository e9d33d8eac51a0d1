package com.github.micycle1.deblend.footprint;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class TemplateImageTest {

	private static final double[][] PIXELS = { { 1, 2 }, { 3, 4 } };

	@Test
	void embedsInsideTarget() {
		TemplateImage t = new TemplateImage(new BBox(11, 21, 2, 2), PIXELS);
		double[] flat = t.embedInto(new BBox(10, 20, 3, 3));
		assertArrayEquals(new double[] { 0, 0, 0, 0, 1, 2, 0, 3, 4 }, flat, 0.0);
	}

	@Test
	void clipsOverhangingPixels() {
		TemplateImage t = new TemplateImage(new BBox(9, 19, 2, 2), PIXELS);
		assertArrayEquals(new double[] { 4, 0, 0, 0 }, t.embedInto(new BBox(10, 20, 2, 2)), 0.0);

		TemplateImage far = new TemplateImage(new BBox(50, 50, 2, 2), PIXELS);
		assertArrayEquals(new double[4], far.embedInto(new BBox(10, 20, 2, 2)), 0.0);
	}

	@Test
	void copiesItsPixels() {
		double[][] px = { { 1, 2 }, { 3, 4 } };
		TemplateImage t = new TemplateImage(new BBox(0, 0, 2, 2), px);
		px[0][0] = 99;
		assertEquals(1.0, t.get(0, 0), 0.0);
		assertThrows(IllegalArgumentException.class, () -> new TemplateImage(new BBox(0, 0, 3, 2), px));
	}

	@Test
	void footprintPeaksAndRelativeCoordinates() {
		BoxFootprint fp = new BoxFootprint(new BBox(10, 20, 5, 4), List.of(new Peak(12, 21), new Peak(14, 23)));
		assertEquals(20, fp.getPixelCount());
		assertEquals(2, fp.relativeX(0));
		assertEquals(1, fp.relativeY(0));
		assertEquals(4, fp.relativeX(1));
		assertEquals(3, fp.relativeY(1));
		assertThrows(IllegalArgumentException.class, () -> new BoxFootprint(new BBox(10, 20, 5, 4), List.of(new Peak(15, 21))));
		assertThrows(IllegalArgumentException.class, () -> new BBox(0, 0, 0, 3));
		assertTrue(new BBox(1, 1, 2, 2).contains(2, 2));
		assertFalse(new BBox(1, 1, 2, 2).contains(3, 2));
		assertEquals(new BBox(1, 1, 2, 2), new BBox(1, 1, 2, 2));
	}
}
