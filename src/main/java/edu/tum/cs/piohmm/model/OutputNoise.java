package edu.tum.cs.piohmm.model;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import edu.tum.cs.piohmm.ConfigurationException;

/**
 * Output noise of one state of a Gaussian emission model in precision form, either diagonal or with a full
 * covariance matrix.
 */
public class OutputNoise {

	private static final double symmetryThreshold = 1E-10;
	private static final double positivityThreshold = 1E-14;

	private final double[][] precision;
	private final double logDeterminant;

	private OutputNoise(double[][] precision, double logDeterminant) {
		this.precision = precision;
		this.logDeterminant = logDeterminant;
	}

	public static OutputNoise diagonal(double[] variance) {
		int dim = variance.length;
		double[][] p = new double[dim][dim];
		double logDet = 0.0;
		for (int d = 0; d < dim; d++) {
			p[d][d] = 1.0 / variance[d];
			logDet += Math.log(variance[d]);
		}
		return new OutputNoise(p, logDet);
	}

	/** @throws ConfigurationException if the covariance is not symmetric positive definite */
	public static OutputNoise full(double[][] covariance) {
		CholeskyDecomposition chol;
		try {
			chol = new CholeskyDecomposition(new Array2DRowRealMatrix(covariance, true), symmetryThreshold,
					positivityThreshold);
		} catch (NonSymmetricMatrixException ex) {
			throw new ConfigurationException("output covariance is not symmetric");
		} catch (NonPositiveDefiniteMatrixException ex) {
			throw new ConfigurationException("output covariance is not positive definite");
		}
		RealMatrix l = chol.getL();
		double logDet = 0.0;
		for (int d = 0; d < covariance.length; d++)
			logDet += 2.0 * Math.log(l.getEntry(d, d));
		return new OutputNoise(chol.getSolver().getInverse().getData(), logDet);
	}

	public int getDimension() {
		return precision.length;
	}

	/** log |Sigma| */
	public double getLogDeterminant() {
		return logDeterminant;
	}

	public double getPrecision(int d, int e) {
		return precision[d][e];
	}

	/** out = Sigma^-1 r */
	public void whiten(double[] r, double[] out) {
		for (int d = 0; d < precision.length; d++) {
			double s = 0.0;
			for (int e = 0; e < r.length; e++)
				s += precision[d][e] * r[e];
			out[d] = s;
		}
	}

	/** r' Sigma^-1 r */
	public double quadraticForm(double[] r) {
		double q = 0.0;
		for (int d = 0; d < precision.length; d++) {
			double s = 0.0;
			for (int e = 0; e < r.length; e++)
				s += precision[d][e] * r[e];
			q += r[d] * s;
		}
		return q;
	}

}
