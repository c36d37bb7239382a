package edu.tum.cs.piohmm.model;

import org.apache.commons.math3.special.Gamma;

import com.google.common.primitives.Doubles;

import edu.tum.cs.piohmm.math.MultinomialLogit;

/**
 * Supported emission distributions. Each family is a generalized linear model with its canonical link, evaluated on
 * the vector of linear predictors eta (one entry per response row) of a single state.
 */
public enum EmissionFamily {

	/** Normal outputs with a per-state diagonal or full covariance; identity link. */
	GAUSSIAN {
		@Override
		public int numResponses(int outputDimension, int numCategories) {
			return outputDimension;
		}

		@Override
		public boolean isValidOutput(double[] y, int numCategories) {
			for (double v : y) {
				if (!Doubles.isFinite(v))
					return false;
			}
			return true;
		}

		@Override
		public double logLikelihood(double[] eta, double[] y, OutputNoise noise) {
			double[] r = residual(eta, y);
			return -0.5 * ((r.length * LOG_2PI) + noise.getLogDeterminant() + noise.quadraticForm(r));
		}

		@Override
		public void addGradient(double[] eta, double[] y, OutputNoise noise, double w, double[] grad) {
			double[] r = residual(eta, y);
			double[] g = new double[r.length];
			noise.whiten(r, g);
			for (int d = 0; d < y.length; d++)
				grad[d] += w * g[d];
		}

		@Override
		public void addHessian(double[] eta, double[] y, OutputNoise noise, double w, double[][] hess) {
			for (int d = 0; d < y.length; d++) {
				for (int e = 0; e < y.length; e++)
					hess[d][e] -= w * noise.getPrecision(d, e);
			}
		}
	},

	/** Single output column holding a category index in [0, numCategories); category 0 is the reference. */
	CATEGORICAL {
		@Override
		public int numResponses(int outputDimension, int numCategories) {
			return numCategories - 1;
		}

		@Override
		public boolean isValidOutput(double[] y, int numCategories) {
			return (y.length == 1) && isNonNegativeInteger(y[0]) && (y[0] < numCategories);
		}

		@Override
		public double logLikelihood(double[] eta, double[] y, OutputNoise noise) {
			int c = (int) y[0];
			double ll = -MultinomialLogit.logPartition(eta);
			if (c > 0)
				ll += eta[c - 1];
			return ll;
		}

		@Override
		public void addGradient(double[] eta, double[] y, OutputNoise noise, double w, double[] grad) {
			double[] p = new double[eta.length];
			MultinomialLogit.probabilities(eta, p);
			int c = (int) y[0];
			for (int r = 0; r < eta.length; r++)
				grad[r] += w * (((r == c - 1) ? 1.0 : 0.0) - p[r]);
		}

		@Override
		public void addHessian(double[] eta, double[] y, OutputNoise noise, double w, double[][] hess) {
			double[] p = new double[eta.length];
			MultinomialLogit.probabilities(eta, p);
			MultinomialLogit.addHessian(p, 1.0, w, hess);
		}
	},

	/** Independent count outputs; log link. */
	POISSON {
		@Override
		public int numResponses(int outputDimension, int numCategories) {
			return outputDimension;
		}

		@Override
		public boolean isValidOutput(double[] y, int numCategories) {
			for (double v : y) {
				if (!isNonNegativeInteger(v))
					return false;
			}
			return true;
		}

		@Override
		public double logLikelihood(double[] eta, double[] y, OutputNoise noise) {
			double ll = 0.0;
			for (int d = 0; d < y.length; d++)
				ll += (y[d] * eta[d]) - Math.exp(eta[d]) - Gamma.logGamma(y[d] + 1.0);
			return ll;
		}

		@Override
		public void addGradient(double[] eta, double[] y, OutputNoise noise, double w, double[] grad) {
			for (int d = 0; d < y.length; d++)
				grad[d] += w * (y[d] - Math.exp(eta[d]));
		}

		@Override
		public void addHessian(double[] eta, double[] y, OutputNoise noise, double w, double[][] hess) {
			for (int d = 0; d < y.length; d++)
				hess[d][d] -= w * Math.exp(eta[d]);
		}
	};

	static final double LOG_2PI = Math.log(2.0 * Math.PI);

	private static double[] residual(double[] eta, double[] y) {
		double[] r = new double[y.length];
		for (int d = 0; d < y.length; d++)
			r[d] = y[d] - eta[d];
		return r;
	}

	private static boolean isNonNegativeInteger(double v) {
		return Doubles.isFinite(v) && (v >= 0.0) && (v == Math.rint(v));
	}

	/** Number of coefficient rows per state. */
	public abstract int numResponses(int outputDimension, int numCategories);

	public abstract boolean isValidOutput(double[] y, int numCategories);

	/**
	 * @param noise output noise of the state (GAUSSIAN only, ignored otherwise)
	 */
	public abstract double logLikelihood(double[] eta, double[] y, OutputNoise noise);

	/** grad_r += w * d logLikelihood / d eta_r */
	public abstract void addGradient(double[] eta, double[] y, OutputNoise noise, double w, double[] grad);

	/** hess_rs += w * d^2 logLikelihood / (d eta_r d eta_s) */
	public abstract void addHessian(double[] eta, double[] y, OutputNoise noise, double w, double[][] hess);

}
