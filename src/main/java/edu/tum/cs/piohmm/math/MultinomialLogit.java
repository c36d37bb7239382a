package edu.tum.cs.piohmm.math;

/**
 * Multinomial logit with an implicit reference category whose linear predictor is fixed at zero. The arrays
 * passed to these methods hold the predictors of the non-reference categories only.
 */
public class MultinomialLogit {

	/** log(1 + sum_r exp(eta_r)) */
	public static double logPartition(double[] eta) {
		double max = 0.0;
		for (double v : eta) {
			if (v > max)
				max = v;
		}
		double sum = Math.exp(-max);
		for (double v : eta)
			sum += Math.exp(v - max);
		return max + Math.log(sum);
	}

	/**
	 * Fills p with the probabilities of the non-reference categories.
	 * @return probability of the reference category
	 */
	public static double probabilities(double[] eta, double[] p) {
		double logZ = logPartition(eta);
		double sum = 0.0;
		for (int r = 0; r < eta.length; r++) {
			p[r] = Math.exp(eta[r] - logZ);
			sum += p[r];
		}
		return Math.max(0.0, 1.0 - sum);
	}

	/**
	 * Log-likelihood of soft counts: sum_r counts_r * eta_r - total * logPartition(eta), where total includes the
	 * count of the reference category.
	 */
	public static double logLikelihood(double[] eta, double[] counts, double total) {
		if (total == 0.0)
			return 0.0;
		double ll = -total * logPartition(eta);
		for (int r = 0; r < eta.length; r++)
			ll += counts[r] * eta[r];
		return ll;
	}

	/** grad_r += w * (counts_r - total * p_r) */
	public static void addGradient(double[] p, double[] counts, double total, double w, double[] grad) {
		for (int r = 0; r < p.length; r++)
			grad[r] += w * (counts[r] - total * p[r]);
	}

	/** hess_rs -= w * total * (delta_rs * p_r - p_r * p_s) */
	public static void addHessian(double[] p, double total, double w, double[][] hess) {
		double f = w * total;
		for (int r = 0; r < p.length; r++) {
			hess[r][r] -= f * p[r];
			for (int s = 0; s < p.length; s++)
				hess[r][s] += f * p[r] * p[s];
		}
	}

}
