package edu.tum.cs.piohmm.inference;

import com.google.common.primitives.Ints;

/** Most likely latent state sequence of one subject. */
public class Path {

	private final String subjectId;
	private final int[] states;
	private final double logProbability;

	public Path(String subjectId, int[] states, double logProbability) {
		this.subjectId = subjectId;
		this.states = states.clone();
		this.logProbability = logProbability;
	}

	public String getSubjectId() {
		return subjectId;
	}

	public int length() {
		return states.length;
	}

	public int getState(int t) {
		return states[t];
	}

	public int[] getStates() {
		return states.clone();
	}

	/** Joint log-probability of the path and the observed outputs. */
	public double getLogProbability() {
		return logProbability;
	}

	@Override
	public String toString() {
		return "Path [subject=" + subjectId + ", states=" + Ints.join(",", states) + ", logProbability=" +
				logProbability + "]";
	}

}
