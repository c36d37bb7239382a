package edu.tum.cs.piohmm.model;

import com.google.common.primitives.Doubles;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;
import edu.tum.cs.piohmm.math.LogSpace;

/**
 * Model of a single subject: global parameters combined with the subject's personalization vector. Computes
 * design vectors, transition matrices and emission log-likelihoods for individual time steps.
 */
public class PersonalizedModel {

	private final ModelSpecification spec;
	private final GlobalParameters global;
	private final PersonalizationLayout layout;
	private final double[] personalization;
	private final int[] transitionCovariates;
	private final int[] emissionCovariates;
	private final int numStates;
	private final int numResponses;
	private final OutputNoise[] noise;

	public PersonalizedModel(ModelSpecification spec, GlobalParameters global, double[] personalization) {
		this.spec = spec;
		this.global = global;
		this.layout = new PersonalizationLayout(spec);
		this.personalization = personalization.clone();
		this.transitionCovariates = spec.getTransitionCovariates();
		this.emissionCovariates = spec.getEmissionCovariates();
		this.numStates = spec.getNumStates();
		this.numResponses = spec.getNumResponses();
		this.noise = global.outputNoise();
	}

	public ModelSpecification getSpecification() {
		return spec;
	}

	public GlobalParameters getGlobal() {
		return global;
	}

	public double[] getPersonalization() {
		return personalization.clone();
	}

	public double logInitial(int k) {
		return Math.log(global.initial[k]);
	}

	/** Transition design of the step from t-1 to t (t >= 1). */
	public double[] transitionDesign(Subject subject, int t) {
		double[] u = new double[spec.getTransitionDesignSize()];
		u[0] = 1.0;
		int idx = 1;
		for (int c : transitionCovariates)
			u[idx++] = subject.getInput(t, c);
		if (spec.hasTimeGapCovariate())
			u[idx] = subject.getTime(t) - subject.getTime(t - 1);
		if (!InPlaceLinAlg.isFinite(u))
			throw new NumericalInstabilityException("non-finite transition covariate at step " + t, subject.getId());
		return u;
	}

	public double[] emissionDesign(Subject subject, int t) {
		double[] e = new double[spec.getEmissionDesignSize()];
		e[0] = 1.0;
		int idx = 1;
		for (int c : emissionCovariates)
			e[idx++] = subject.getInput(t, c);
		if (!InPlaceLinAlg.isFinite(e))
			throw new NumericalInstabilityException("non-finite emission covariate at step " + t, subject.getId());
		return e;
	}

	/** Logit of the transition from source to destination; 0 for self-transitions. */
	public double transitionLogit(int source, int destination, double[] u) {
		if (source == destination)
			return 0.0;
		if (!spec.isTransitionAllowed(source, destination))
			return Double.NEGATIVE_INFINITY;
		double logit = InPlaceLinAlg.dotProduct(global.transition[source][destination], u);
		if (layout.hasTransitionOffsets())
			logit += InPlaceLinAlg.dotProduct(personalization, layout.transitionOffset(destination), u);
		return logit;
	}

	/** Fills out[j][k] with log P(z_t = k | z_(t-1) = j) for the given transition design. */
	public void logTransitionMatrix(double[] u, double[][] out) {
		for (int j = 0; j < numStates; j++) {
			double[] row = out[j];
			for (int k = 0; k < numStates; k++)
				row[k] = transitionLogit(j, k, u);
			double logZ = LogSpace.logSumExp(row);
			for (int k = 0; k < numStates; k++)
				row[k] -= logZ;
		}
	}

	public double[][] transitionMatrix(double[] u) {
		double[][] a = new double[numStates][numStates];
		logTransitionMatrix(u, a);
		for (double[] row : a) {
			for (int k = 0; k < row.length; k++)
				row[k] = Math.exp(row[k]);
		}
		return a;
	}

	/** Fills eta with the linear predictors of the given state. */
	public void emissionPredictor(int state, double[] e, double[] eta) {
		for (int r = 0; r < numResponses; r++) {
			eta[r] = InPlaceLinAlg.dotProduct(global.emission[state][r], e);
			if (layout.hasEmissionOffsets())
				eta[r] += InPlaceLinAlg.dotProduct(personalization, layout.emissionOffset(r), e);
		}
	}

	public double logEmission(int state, double[] y, double[] e) {
		double[] eta = new double[numResponses];
		emissionPredictor(state, e, eta);
		return spec.getEmissionFamily().logLikelihood(eta, y, (noise != null) ? noise[state] : null);
	}

	/**
	 * Checks every input value of the subject, including columns that no covariate list refers to.
	 * @throws NumericalInstabilityException naming the subject at the first non-finite value
	 */
	public static void checkInputs(Subject subject) {
		for (int t = 0; t < subject.length(); t++) {
			for (int c = 0; c < subject.getInputDimension(); c++) {
				if (!Doubles.isFinite(subject.getInput(t, c)))
					throw new NumericalInstabilityException("non-finite input in column " + c + " at step " + t,
							subject.getId());
			}
		}
	}

	/** Fills out with the emission log-likelihood of every state at step t; zeros if the step is unobserved. */
	public void logEmissions(Subject subject, int t, double[] out) {
		if (!subject.isObserved(t)) {
			for (int k = 0; k < numStates; k++)
				out[k] = 0.0;
			return;
		}
		double[] e = emissionDesign(subject, t);
		double[] y = subject.getOutput(t);
		for (int k = 0; k < numStates; k++)
			out[k] = logEmission(k, y, e);
	}

}
