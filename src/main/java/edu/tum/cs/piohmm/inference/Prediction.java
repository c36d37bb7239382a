package edu.tum.cs.piohmm.inference;

/**
 * Result of a forward pass that keeps the one-step-ahead predictive state distribution P(z_t | y_0..y_(t-1)) next
 * to the belief state P(z_t | y_0..y_t) and the log evidence log p(y_t | y_0..y_(t-1)) of every step.
 */
public class Prediction {

	private final String subjectId;
	private final double[][] predictive;
	private final double[][] filtered;
	private final double[] logEvidence;

	Prediction(String subjectId, double[][] predictive, double[][] filtered, double[] logEvidence) {
		this.subjectId = subjectId;
		this.predictive = predictive;
		this.filtered = filtered;
		this.logEvidence = logEvidence;
	}

	public String getSubjectId() {
		return subjectId;
	}

	public int length() {
		return predictive.length;
	}

	/** P(z_t | y_0..y_(t-1)); the initial distribution for t = 0. */
	public double[] getPredictive(int t) {
		return predictive[t].clone();
	}

	public double[] getFiltered(int t) {
		return filtered[t].clone();
	}

	/** log p(y_t | y_0..y_(t-1)); 0 for unobserved steps. */
	public double getLogEvidence(int t) {
		return logEvidence[t];
	}

	public double getLogLikelihood() {
		double ll = 0.0;
		for (double v : logEvidence)
			ll += v;
		return ll;
	}

}
