package edu.tum.cs.piohmm.inference;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Max-product decoding in log space. Predecessors and final states are scanned in ascending order and only replaced
 * on a strict improvement, so ties resolve to the lowest state index.
 */
public class ViterbiDecoder {

	public Path decode(PersonalizedModel model, Subject subject) {
		String id = subject.getId();
		int numSteps = subject.length();
		int numStates = model.getSpecification().getNumStates();
		PersonalizedModel.checkInputs(subject);

		double[] logEmission = new double[numStates];
		double[][] logTrans = new double[numStates][numStates];
		double[] delta = new double[numStates];
		double[] next = new double[numStates];
		int[][] backPointer = new int[numSteps][numStates];

		model.logEmissions(subject, 0, logEmission);
		checkEmissions(logEmission, 0, id);
		for (int k = 0; k < numStates; k++)
			delta[k] = model.logInitial(k) + logEmission[k];

		for (int t = 1; t < numSteps; t++) {
			model.logEmissions(subject, t, logEmission);
			checkEmissions(logEmission, t, id);
			model.logTransitionMatrix(model.transitionDesign(subject, t), logTrans);
			for (int k = 0; k < numStates; k++) {
				double best = Double.NEGATIVE_INFINITY;
				int bestIdx = 0;
				for (int j = 0; j < numStates; j++) {
					double v = delta[j] + logTrans[j][k];
					if (Double.isNaN(v))
						throw new NumericalInstabilityException("undefined path score at step " + t, id);
					if (v > best) {
						best = v;
						bestIdx = j;
					}
				}
				next[k] = best + logEmission[k];
				backPointer[t][k] = bestIdx;
			}
			double[] tmp = delta;
			delta = next;
			next = tmp;
		}

		int last = 0;
		for (int k = 1; k < numStates; k++) {
			if (delta[k] > delta[last])
				last = k;
		}
		double logProb = delta[last];
		if (Double.isNaN(logProb) || (logProb == Double.NEGATIVE_INFINITY))
			throw new NumericalInstabilityException("no path with positive probability", id);

		int[] states = new int[numSteps];
		states[numSteps - 1] = last;
		for (int t = numSteps - 1; t > 0; t--)
			states[t - 1] = backPointer[t][states[t]];
		return new Path(id, states, logProb);
	}

	private static void checkEmissions(double[] logEmission, int t, String id) {
		for (double v : logEmission) {
			if (Double.isNaN(v) || (v == Double.POSITIVE_INFINITY))
				throw new NumericalInstabilityException("undefined emission log-likelihood at step " + t, id);
		}
	}

}
