package edu.tum.cs.piohmm.math;

import java.util.Arrays;

public class LogSpace {

	/** log(sum(exp(a))) over all entries; -Infinity if every entry is -Infinity. */
	public static double logSumExp(double[] a) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : a) {
			if (v > max)
				max = v;
		}
		if (max == Double.NEGATIVE_INFINITY)
			return max;
		if (Double.isNaN(max) || (max == Double.POSITIVE_INFINITY))
			return max;
		double sum = 0.0;
		for (double v : a)
			sum += Math.exp(v - max);
		return max + Math.log(sum);
	}

	/**
	 * Normalizes a vector so that its entries sum up to 1.
	 * If the sum of all entries is equal to 0.0, the vector is set to the uniform distribution.
	 */
	public static double[] normalize(double[] vector) {
		double sum = 0.0;
		for (int i = 0; i < vector.length; i++)
			sum += vector[i];
		if (sum != 0.0) {
			for (int i = 0; i < vector.length; i++)
				vector[i] /= sum;
		} else
			Arrays.fill(vector, 1.0 / vector.length);
		return vector;
	}

	/** Index of the largest entry; ties go to the lowest index. */
	public static int argMax(double[] v) {
		int maxIdx = 0;
		for (int i = 1; i < v.length; i++) {
			if (v[i] > v[maxIdx])
				maxIdx = i;
		}
		return maxIdx;
	}

	public static double sum(double[] v) {
		double s = 0.0;
		for (double d : v)
			s += d;
		return s;
	}

	/** Weighted log value that treats 0 * log(0) as 0. */
	public static double weightedLog(double weight, double logValue) {
		if (weight == 0.0)
			return 0.0;
		return weight * logValue;
	}

}
