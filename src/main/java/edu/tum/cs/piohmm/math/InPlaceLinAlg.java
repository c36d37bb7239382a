package edu.tum.cs.piohmm.math;

import java.util.Arrays;

import com.google.common.primitives.Doubles;

public class InPlaceLinAlg {

	public static double dotProduct(double[] a, double[] b) {
		double d = 0.0;
		for (int i = 0; i < a.length; i++)
			d += a[i] * b[i];
		return d;
	}

	/** a_(off..off+b.length) . b */
	public static double dotProduct(double[] a, int off, double[] b) {
		double d = 0.0;
		for (int i = 0; i < b.length; i++)
			d += a[off + i] * b[i];
		return d;
	}

	/** dest := a + c * b (dest may be a) */
	public static double[] addScaled(double[] a, double[] b, double c, double[] dest) {
		for (int i = 0; i < dest.length; i++)
			dest[i] = a[i] + (c * b[i]);
		return dest;
	}

	/** dest_(off..off+v.length) += c * v */
	public static void addScaled(double[] dest, int off, double[] v, double c) {
		for (int i = 0; i < v.length; i++)
			dest[off + i] += c * v[i];
	}

	/** m_(rowOff+i, colOff+j) += c * a_i * b_j */
	public static void addOuterProduct(double[][] m, int rowOff, int colOff, double[] a, double[] b, double c) {
		for (int i = 0; i < a.length; i++) {
			double ca = c * a[i];
			if (ca == 0.0)
				continue;
			double[] row = m[rowOff + i];
			for (int j = 0; j < b.length; j++)
				row[colOff + j] += ca * b[j];
		}
	}

	public static double normLInf(double[] a) {
		double norm = 0.0;
		for (double v : a) {
			double abs = Math.abs(v);
			if (abs > norm)
				norm = abs;
		}
		return norm;
	}

	public static double maxAbsDiag(double[][] m) {
		double max = 0.0;
		for (int i = 0; i < m.length; i++)
			max = Math.max(max, Math.abs(m[i][i]));
		return max;
	}

	public static void clear(double[][] m) {
		for (double[] row : m)
			Arrays.fill(row, 0.0);
	}

	public static double[][] copy(double[][] m) {
		double[][] c = new double[m.length][];
		for (int i = 0; i < m.length; i++)
			c[i] = m[i].clone();
		return c;
	}

	public static double[][][] copy(double[][][] m) {
		double[][][] c = new double[m.length][][];
		for (int i = 0; i < m.length; i++)
			c[i] = copy(m[i]);
		return c;
	}

	public static boolean isFinite(double[] a) {
		for (double v : a) {
			if (!Doubles.isFinite(v))
				return false;
		}
		return true;
	}

}
