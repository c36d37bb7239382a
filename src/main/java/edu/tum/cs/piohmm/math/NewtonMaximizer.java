package edu.tum.cs.piohmm.math;

import java.util.Arrays;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;

import com.google.common.primitives.Doubles;

import edu.tum.cs.piohmm.NumericalInstabilityException;

/**
 * Damped Newton ascent with backtracking line search. Every accepted step satisfies the Armijo condition, so the
 * objective never decreases relative to the starting point.
 */
public class NewtonMaximizer {

	private static final double armijo = 1E-4;
	private static final int maxLineSearchIter = 50;
	private static final int maxDampingAttempts = 12;
	private static final double relDamping = 1E-9;
	private static final double relSlopeEps = 1E-12;

	public static class Result {
		public final double[] x;
		public final double value;
		public final int numIterations;
		public final boolean converged;

		public Result(double[] x, double value, int numIterations, boolean converged) {
			this.x = x;
			this.value = value;
			this.numIterations = numIterations;
			this.converged = converged;
		}
	}

	private final int maxIter;
	private final double tolerance;

	public NewtonMaximizer(int maxIter, double tolerance) {
		this.maxIter = maxIter;
		this.tolerance = tolerance;
	}

	public int getMaxIterations() {
		return maxIter;
	}

	public Result maximize(ConcaveObjective f, double[] start) {
		int n = f.getDimension();
		double[] x = start.clone();
		double value = f.value(x);
		if (!Doubles.isFinite(value))
			throw new NumericalInstabilityException("objective is not finite at the starting point");
		if (n == 0)
			return new Result(x, value, 0, true);

		double[] grad = new double[n];
		double[][] hess = new double[n][n];
		double[] xNew = new double[n];
		for (int iter = 0; iter < maxIter; iter++) {
			Arrays.fill(grad, 0.0);
			InPlaceLinAlg.clear(hess);
			value = f.evaluate(x, grad, hess);
			if (!InPlaceLinAlg.isFinite(grad))
				throw new NumericalInstabilityException("non-finite gradient in iteration " + iter);

			double[] step = solveNewtonSystem(grad, hess);
			double slope = InPlaceLinAlg.dotProduct(grad, step);
			double slopeEps = relSlopeEps * (1.0 + Math.abs(value));
			if ((InPlaceLinAlg.normLInf(step) < tolerance) || (slope <= slopeEps))
				return new Result(x, value, iter, true);

			double rate = 1.0;
			boolean accepted = false;
			for (int i = 0; i < maxLineSearchIter; i++) {
				InPlaceLinAlg.addScaled(x, step, rate, xNew);
				double v = f.value(xNew);
				if (v >= value + (armijo * rate * slope)) {
					double[] tmp = x;
					x = xNew;
					xNew = tmp;
					value = v;
					accepted = true;
					break;
				}
				rate *= 0.5;
			}
			if (!accepted) {
				// no representable improvement along an ascent direction: numerical optimum
				return new Result(x, value, iter + 1, slope <= Math.sqrt(slopeEps));
			}
		}
		return new Result(x, value, maxIter, false);
	}

	/** Solves (-H + mu * I) d = g, increasing mu until the system is positive definite. */
	private static double[] solveNewtonSystem(double[] grad, double[][] hess) {
		int n = grad.length;
		double mu = relDamping * (1.0 + InPlaceLinAlg.maxAbsDiag(hess));
		for (int attempt = 0; attempt < maxDampingAttempts; attempt++) {
			double[][] a = new double[n][n];
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < n; j++)
					a[i][j] = -0.5 * (hess[i][j] + hess[j][i]);
				a[i][i] += mu;
			}
			try {
				CholeskyDecomposition chol = new CholeskyDecomposition(new Array2DRowRealMatrix(a, false),
						CholeskyDecomposition.DEFAULT_RELATIVE_SYMMETRY_THRESHOLD, 0.0);
				return chol.getSolver().solve(new ArrayRealVector(grad, false)).toArray();
			} catch (NonPositiveDefiniteMatrixException ex) {
				mu *= 100.0;
			}
		}
		throw new NumericalInstabilityException("Newton system is not positive definite after damping");
	}

}
