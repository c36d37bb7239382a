package edu.tum.cs.piohmm.inference;

import edu.tum.cs.piohmm.ConfigurationException;
import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.math.LogSpace;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Forward-only recursion for online use: one-step-ahead predictive state distributions, and forecasts of the state
 * distribution a number of steps after the last output taken into account. Future steps use the subject's own
 * inputs, so a subject may carry inputs for steps whose outputs are not (yet) observed.
 */
public class StatePredictor {

	public Prediction predict(PersonalizedModel model, Subject subject) {
		return run(model, subject, subject.length());
	}

	/** Forward pass over the first numSteps steps. */
	private Prediction run(PersonalizedModel model, Subject subject, int numSteps) {
		PersonalizedModel.checkInputs(subject);
		String id = subject.getId();
		int numStates = model.getSpecification().getNumStates();

		double[][] predictive = new double[numSteps][numStates];
		double[][] filtered = new double[numSteps][numStates];
		double[] logEvidence = new double[numSteps];
		double[] logEmission = new double[numStates];
		for (int k = 0; k < numStates; k++)
			predictive[0][k] = Math.exp(model.logInitial(k));

		for (int t = 0; t < numSteps; t++) {
			model.logEmissions(subject, t, logEmission);
			double max = Double.NEGATIVE_INFINITY;
			for (double v : logEmission) {
				if (Double.isNaN(v) || (v == Double.POSITIVE_INFINITY))
					throw new NumericalInstabilityException("undefined emission log-likelihood at step " + t, id);
				max = Math.max(max, v);
			}
			if (max == Double.NEGATIVE_INFINITY)
				throw new NumericalInstabilityException("output has zero likelihood under every state at step " + t,
						id);

			for (int k = 0; k < numStates; k++)
				filtered[t][k] = predictive[t][k] * Math.exp(logEmission[k] - max);
			double s = LogSpace.sum(filtered[t]);
			if (!(s > 0.0) || Double.isInfinite(s))
				throw new NumericalInstabilityException("evidence " + s + " at step " + t, id);
			for (int k = 0; k < numStates; k++)
				filtered[t][k] /= s;
			logEvidence[t] = max + Math.log(s);

			if (t + 1 < numSteps)
				propagate(model, subject, t + 1, filtered[t], predictive[t + 1]);
		}
		return new Prediction(id, predictive, filtered, logEvidence);
	}

	/**
	 * Distribution of the state at step origin + horizon given the outputs up to step origin.
	 * @throws ConfigurationException if origin + horizon lies outside the subject's steps
	 */
	public double[] forecast(PersonalizedModel model, Subject subject, int origin, int horizon) {
		if ((origin < 0) || (horizon < 0) || (origin + horizon >= subject.length()))
			throw new ConfigurationException("cannot forecast " + horizon + " steps from step " + origin + " of " +
					subject.length(), subject.getId());
		double[] p = run(model, subject, origin + 1).getFiltered(origin);
		double[] next = new double[p.length];
		for (int t = origin + 1; t <= origin + horizon; t++) {
			propagate(model, subject, t, p, next);
			double[] tmp = p;
			p = next;
			next = tmp;
		}
		return p;
	}

	/** out = p * A_t, with A_t the transition matrix into step t */
	private static void propagate(PersonalizedModel model, Subject subject, int t, double[] p, double[] out) {
		double[][] a = model.transitionMatrix(model.transitionDesign(subject, t));
		for (int k = 0; k < out.length; k++) {
			double sum = 0.0;
			for (int j = 0; j < p.length; j++)
				sum += p[j] * a[j][k];
			out[k] = sum;
		}
	}

}
