package edu.tum.cs.piohmm.inference;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.math.LogSpace;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Scaled forward-backward recursion. Emission log-likelihoods of every step are shifted by their maximum m_t
 * before exponentiation; together with the forward normalizer s_t this yields the explicit log scale factor
 * m_t + log(s_t), and the log-likelihood is the sum of all scale factors.
 */
public class ForwardBackwardEngine {

	public Posterior run(PersonalizedModel model, Subject subject) {
		String id = subject.getId();
		int numSteps = subject.length();
		int numStates = model.getSpecification().getNumStates();
		PersonalizedModel.checkInputs(subject);

		double[][] emission = new double[numSteps][numStates];
		double[] shift = new double[numSteps];
		double[][][] trans = new double[numSteps][][];
		for (int t = 0; t < numSteps; t++) {
			model.logEmissions(subject, t, emission[t]);
			shift[t] = maxFinite(emission[t], t, id);
			for (int k = 0; k < numStates; k++)
				emission[t][k] = Math.exp(emission[t][k] - shift[t]);
			if (t > 0) {
				trans[t] = new double[numStates][numStates];
				model.logTransitionMatrix(model.transitionDesign(subject, t), trans[t]);
				for (int j = 0; j < numStates; j++) {
					for (int k = 0; k < numStates; k++) {
						double v = Math.exp(trans[t][j][k]);
						if (Double.isNaN(v))
							throw new NumericalInstabilityException("undefined transition probability at step " + t,
									id);
						trans[t][j][k] = v;
					}
				}
			}
		}

		// forward pass
		double[][] alpha = new double[numSteps][numStates];
		double[] scale = new double[numSteps];
		double[] logScale = new double[numSteps];
		for (int k = 0; k < numStates; k++)
			alpha[0][k] = Math.exp(model.logInitial(k)) * emission[0][k];
		normalizeForward(alpha, scale, logScale, shift, 0, id);
		for (int t = 1; t < numSteps; t++) {
			for (int k = 0; k < numStates; k++) {
				double sum = 0.0;
				for (int j = 0; j < numStates; j++)
					sum += alpha[t - 1][j] * trans[t][j][k];
				alpha[t][k] = sum * emission[t][k];
			}
			normalizeForward(alpha, scale, logScale, shift, t, id);
		}

		// backward pass, reusing the forward scale factors
		double[][] beta = new double[numSteps][numStates];
		for (int k = 0; k < numStates; k++)
			beta[numSteps - 1][k] = 1.0;
		for (int t = numSteps - 2; t >= 0; t--) {
			for (int j = 0; j < numStates; j++) {
				double sum = 0.0;
				for (int k = 0; k < numStates; k++)
					sum += trans[t + 1][j][k] * emission[t + 1][k] * beta[t + 1][k];
				beta[t][j] = sum / scale[t + 1];
			}
		}

		double[][] gamma = new double[numSteps][numStates];
		for (int t = 0; t < numSteps; t++) {
			for (int k = 0; k < numStates; k++)
				gamma[t][k] = alpha[t][k] * beta[t][k];
			checkedNormalize(gamma[t], t, id);
		}

		double[][][] xi = new double[numSteps - 1][numStates][numStates];
		for (int t = 1; t < numSteps; t++) {
			double[][] x = xi[t - 1];
			double sum = 0.0;
			for (int j = 0; j < numStates; j++) {
				for (int k = 0; k < numStates; k++) {
					x[j][k] = alpha[t - 1][j] * trans[t][j][k] * emission[t][k] * beta[t][k] / scale[t];
					sum += x[j][k];
				}
			}
			if (!(sum > 0.0) || Double.isInfinite(sum))
				throw new NumericalInstabilityException("degenerate transition marginals at step " + t, id);
			for (int j = 0; j < numStates; j++) {
				for (int k = 0; k < numStates; k++)
					x[j][k] /= sum;
			}
		}

		double first = 0.0;
		for (int k = 0; k < numStates; k++)
			first += Math.exp(model.logInitial(k)) * emission[0][k] * beta[0][k];
		double backwardLL = Math.log(first) + shift[0];
		for (int t = 1; t < numSteps; t++)
			backwardLL += logScale[t];

		return new Posterior(id, gamma, xi, alpha, logScale, backwardLL);
	}

	private static double maxFinite(double[] logEmission, int t, String id) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : logEmission) {
			if (Double.isNaN(v) || (v == Double.POSITIVE_INFINITY))
				throw new NumericalInstabilityException("undefined emission log-likelihood at step " + t, id);
			if (v > max)
				max = v;
		}
		if (max == Double.NEGATIVE_INFINITY)
			throw new NumericalInstabilityException("output has zero likelihood under every state at step " + t, id);
		return max;
	}

	private static void normalizeForward(double[][] alpha, double[] scale, double[] logScale, double[] shift, int t,
			String id) {
		double s = LogSpace.sum(alpha[t]);
		if (!(s > 0.0) || Double.isInfinite(s))
			throw new NumericalInstabilityException("scale factor " + s + " at step " + t, id);
		for (int k = 0; k < alpha[t].length; k++)
			alpha[t][k] /= s;
		scale[t] = s;
		logScale[t] = shift[t] + Math.log(s);
	}

	private static void checkedNormalize(double[] v, int t, String id) {
		double s = LogSpace.sum(v);
		if (!(s > 0.0) || Double.isInfinite(s))
			throw new NumericalInstabilityException("degenerate state marginals at step " + t, id);
		for (int k = 0; k < v.length; k++)
			v[k] /= s;
	}

}
