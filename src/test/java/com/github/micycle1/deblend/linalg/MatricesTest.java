package com.github.micycle1.deblend.linalg;

import static org.junit.jupiter.api.Assertions.*;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.junit.jupiter.api.Test;

public class MatricesTest {

	private static final DMatrixRMaj A = new DMatrixRMaj(new double[][] { { 1, -2, 0 }, { 3, 4, 0 } });

	@Test
	void columnSumsAndNormFactors() {
		assertArrayEquals(new double[] { 4, 2, 0 }, Matrices.columnSums(A, false), 0.0);
		assertArrayEquals(new double[] { 4, 6, 0 }, Matrices.columnSums(A, true), 0.0);
		assertArrayEquals(new double[] { 4, 6, 1 }, Matrices.normFactors(A, true), 0.0);
	}

	@Test
	void divideColumnsThenScaleRowsPreservesProduct() {
		DMatrixRMaj h = new DMatrixRMaj(new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } });
		double[] f = Matrices.normFactors(A, true);
		DMatrixRMaj w1 = Matrices.divideColumns(A, f);
		DMatrixRMaj h1 = Matrices.scaleRows(h, f);
		assertEquals(0.0, Matrices.distance(Matrices.mult(A, h), Matrices.mult(w1, h1)), 1e-12);
		assertArrayEquals(new double[] { 1, 1, 0 }, Matrices.columnSums(w1, true), 1e-15);
		// inputs untouched
		assertEquals(-2.0, A.get(0, 1), 0.0);
	}

	@Test
	void transposedProducts() {
		DMatrixRMaj ata = Matrices.multTransA(A, A);
		DMatrixRMaj aat = Matrices.multTransB(A, A);
		assertEquals(3, ata.numRows);
		assertEquals(2, aat.numRows);
		assertEquals(10.0, ata.get(0, 0), 0.0);
		assertEquals(5.0, aat.get(0, 0), 0.0);
		assertEquals(-5.0, aat.get(0, 1), 0.0);
	}

	@Test
	void pinvOfRankDeficientMatrix() {
		DMatrixRMaj r1 = new DMatrixRMaj(new double[][] { { 1, 2 }, { 2, 4 } });
		DMatrixRMaj p = Matrices.pinv(r1);
		// A A+ A = A
		assertEquals(0.0, Matrices.distance(r1, Matrices.mult(Matrices.mult(r1, p), r1)), 1e-10);
	}

	@Test
	void sparseVectorProduct() {
		DMatrixSparseTriplet t = new DMatrixSparseTriplet(3, 3, 3);
		t.addItem(0, 2, 1.0);
		t.addItem(1, 1, 2.0);
		t.addItem(2, 0, -1.0);
		DMatrixSparseCSC s = DConvertMatrixStruct.convert(t, (DMatrixSparseCSC) null);
		assertArrayEquals(new double[] { 3, 4, -1 }, Matrices.multVector(s, new double[] { 1, 2, 3 }), 0.0);
		assertThrows(IllegalArgumentException.class, () -> Matrices.multVector(s, new double[2]));
	}

	@Test
	void predicatesAndNorms() {
		assertFalse(Matrices.isNonNegative(A));
		assertTrue(Matrices.isNonNegative(Matrices.divideColumns(new DMatrixRMaj(2, 2), new double[] { 1, 1 })));
		DMatrixRMaj nan = new DMatrixRMaj(1, 1);
		nan.set(0, 0, Double.NaN);
		assertFalse(Matrices.isNonNegative(nan));
		assertFalse(Matrices.isFinite(nan));
		assertTrue(Matrices.isFinite(A));
		assertEquals(Math.sqrt(30), Matrices.frobenius(A), 1e-12);
		assertEquals(-2.0, Matrices.min(A), 0.0);
		assertEquals(4.0, Matrices.max(A), 0.0);
		assertArrayEquals(new double[] { 3, 4, 0 }, Matrices.row(A, 1), 0.0);
		assertEquals(11.0, Matrices.dot(new double[] { 1, 2 }, new double[] { 3, 4 }), 0.0);
		assertThrows(IllegalArgumentException.class, () -> Matrices.subtract(A, new DMatrixRMaj(3, 2)));
		assertThrows(IllegalArgumentException.class, () -> Matrices.addToDiagonal(A, 1.0));
	}
}
