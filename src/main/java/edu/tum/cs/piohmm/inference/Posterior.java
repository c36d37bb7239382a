package edu.tum.cs.piohmm.inference;

/**
 * Result of a forward-backward pass over one subject. Transition marginals are indexed by the destination step,
 * i.e. entry t-1 holds P(z_(t-1) = j, z_t = k | y) for t = 1..T-1.
 */
public class Posterior {

	private final String subjectId;
	private final double[][] stateMarginals;
	private final double[][][] transitionMarginals;
	private final double[][] filtered;
	private final double[] logScale;
	private final double logLikelihood;
	private final double backwardLogLikelihood;

	Posterior(String subjectId, double[][] stateMarginals, double[][][] transitionMarginals, double[][] filtered,
			double[] logScale, double backwardLogLikelihood) {
		this.subjectId = subjectId;
		this.stateMarginals = stateMarginals;
		this.transitionMarginals = transitionMarginals;
		this.filtered = filtered;
		this.logScale = logScale;
		double ll = 0.0;
		for (double c : logScale)
			ll += c;
		this.logLikelihood = ll;
		this.backwardLogLikelihood = backwardLogLikelihood;
	}

	public String getSubjectId() {
		return subjectId;
	}

	public int length() {
		return stateMarginals.length;
	}

	public int getNumStates() {
		return stateMarginals[0].length;
	}

	/** P(z_t = k | y) */
	public double getStateMarginal(int t, int k) {
		return stateMarginals[t][k];
	}

	public double[] getStateMarginals(int t) {
		return stateMarginals[t].clone();
	}

	/** P(z_(t-1) = j, z_t = k | y) for 1 <= t < T */
	public double getTransitionMarginal(int t, int j, int k) {
		return transitionMarginals[t - 1][j][k];
	}

	public int getNumTransitions() {
		return transitionMarginals.length;
	}

	/** Forward belief state P(z_t = k | y_0..y_t). */
	public double[] getFiltered(int t) {
		return filtered[t].clone();
	}

	/** Logarithm of the scale factor of step t; these sum up to the log-likelihood. */
	public double getLogScale(int t) {
		return logScale[t];
	}

	/** Log-likelihood accumulated from the forward scale factors. */
	public double getLogLikelihood() {
		return logLikelihood;
	}

	/** Log-likelihood recomputed from the backward variables at the first step. */
	public double getBackwardLogLikelihood() {
		return backwardLogLikelihood;
	}

	// raw access for the learning package, no copies
	public double[][] stateMarginals() {
		return stateMarginals;
	}

	public double[][][] transitionMarginals() {
		return transitionMarginals;
	}

}
