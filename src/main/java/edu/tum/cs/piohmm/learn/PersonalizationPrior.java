package edu.tum.cs.piohmm.learn;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;

/** Zero-mean Gaussian prior N(0, Sigma) on the personalization vectors. */
public class PersonalizationPrior {

	private static final double LOG_2PI = Math.log(2.0 * Math.PI);

	private final int dimension;
	private final double[][] precision;
	private final double logDet;

	public PersonalizationPrior(RealMatrix covariance) {
		dimension = covariance.getRowDimension();
		CholeskyDecomposition chol;
		try {
			chol = new CholeskyDecomposition(covariance);
		} catch (NonPositiveDefiniteMatrixException ex) {
			throw new NumericalInstabilityException("personalization covariance is not positive definite");
		} catch (NonSymmetricMatrixException ex) {
			throw new NumericalInstabilityException("personalization covariance is not symmetric");
		}
		precision = chol.getSolver().getInverse().getData();
		RealMatrix l = chol.getL();
		double ld = 0.0;
		for (int i = 0; i < dimension; i++)
			ld += 2.0 * Math.log(l.getEntry(i, i));
		logDet = ld;
	}

	/** Prior of an empty personalization vector. */
	public static PersonalizationPrior empty() {
		return new PersonalizationPrior(0, new double[0][0], 0.0);
	}

	private PersonalizationPrior(int dimension, double[][] precision, double logDet) {
		this.dimension = dimension;
		this.precision = precision;
		this.logDet = logDet;
	}

	public int getDimension() {
		return dimension;
	}

	public double getLogDeterminant() {
		return logDet;
	}

	public double getPrecisionTrace() {
		double tr = 0.0;
		for (int i = 0; i < dimension; i++)
			tr += precision[i][i];
		return tr;
	}

	/** b' Sigma^-1 b */
	public double mahalanobis(double[] b) {
		double d = 0.0;
		for (int i = 0; i < dimension; i++)
			d += b[i] * InPlaceLinAlg.dotProduct(precision[i], b);
		return d;
	}

	public double logDensity(double[] b) {
		if (dimension == 0)
			return 0.0;
		return -0.5 * ((dimension * LOG_2PI) + logDet + mahalanobis(b));
	}

	/** Adds the gradient and Hessian of logDensity at b. */
	public void addDerivatives(double[] b, double[] grad, double[][] hess) {
		for (int i = 0; i < dimension; i++) {
			grad[i] -= InPlaceLinAlg.dotProduct(precision[i], b);
			for (int j = 0; j < dimension; j++)
				hess[i][j] -= precision[i][j];
		}
	}

}
