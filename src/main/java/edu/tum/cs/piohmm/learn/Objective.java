package edu.tum.cs.piohmm.learn;

import java.util.Collection;

import edu.tum.cs.piohmm.FitConfiguration;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.PersonalizationLayout;

/**
 * Penalized log-likelihood monitored by EM:
 * <pre>
 * F = sum_i log p(y_i | b_i) + sum_i log N(b_i; 0, Sigma) - (nu/2) log|Sigma| - (psi/2) tr(Sigma^-1)
 *     - (lambda/2) ||Newton-fitted coefficients||^2
 * </pre>
 * Without personalization and regularization F is the plain log-likelihood.
 */
public class Objective {

	private final double regularization;
	private final double covarianceShrinkage;
	private final double covariancePriorWeight;

	public Objective(FitConfiguration cfg) {
		this(cfg.getRegularization(), cfg.getCovarianceShrinkage(), cfg.getCovariancePriorWeight());
	}

	public Objective(double regularization, double covarianceShrinkage, double covariancePriorWeight) {
		this.regularization = regularization;
		this.covarianceShrinkage = covarianceShrinkage;
		this.covariancePriorWeight = covariancePriorWeight;
	}

	public double compute(ModelSpecification spec, GlobalParameters global, PersonalizationPrior prior,
			double logLikelihood, Collection<double[]> personalization) {
		double f = logLikelihood;
		if (prior.getDimension() > 0) {
			for (double[] b : personalization)
				f += prior.logDensity(b);
			f -= 0.5 * ((covariancePriorWeight * prior.getLogDeterminant()) +
					(covarianceShrinkage * prior.getPrecisionTrace()));
		}
		return f - ridgePenalty(spec, global);
	}

	/** Ridge penalty on transition coefficients and on non-Gaussian emission coefficients. */
	public double ridgePenalty(ModelSpecification spec, GlobalParameters global) {
		if (regularization == 0.0)
			return 0.0;
		double sq = 0.0;
		int numStates = spec.getNumStates();
		for (int j = 0; j < numStates; j++) {
			for (int k = 0; k < numStates; k++) {
				if ((k != j) && spec.isTransitionAllowed(j, k)) {
					double[] w = global.getTransitionCoefficients(j, k);
					sq += InPlaceLinAlg.dotProduct(w, w);
				}
			}
		}
		if (spec.getEmissionFamily() != EmissionFamily.GAUSSIAN) {
			for (int k = 0; k < numStates; k++) {
				for (int r = 0; r < spec.getNumResponses(); r++) {
					double[] w = global.getEmissionCoefficients(k, r);
					sq += InPlaceLinAlg.dotProduct(w, w);
				}
			}
		}
		return 0.5 * regularization * sq;
	}

	/** Number of free parameters, as used by the BIC. */
	public static int countFreeParameters(ModelSpecification spec) {
		int numStates = spec.getNumStates();
		int n = numStates - 1;
		for (int j = 0; j < numStates; j++) {
			for (int k = 0; k < numStates; k++) {
				if ((k != j) && spec.isTransitionAllowed(j, k))
					n += spec.getTransitionDesignSize();
			}
		}
		n += numStates * spec.getNumResponses() * spec.getEmissionDesignSize();
		int dim = spec.getOutputDimension();
		if (spec.hasFullCovariance())
			n += numStates * ((dim * (dim + 1)) / 2);
		else if (spec.getEmissionFamily() == EmissionFamily.GAUSSIAN)
			n += numStates * dim;
		int q = new PersonalizationLayout(spec).getDimension();
		return n + ((q * (q + 1)) / 2);
	}

}
