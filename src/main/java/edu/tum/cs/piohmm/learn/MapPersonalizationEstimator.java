package edu.tum.cs.piohmm.learn;

import java.util.Arrays;

import edu.tum.cs.piohmm.NonConvergenceException;
import edu.tum.cs.piohmm.math.ConcaveObjective;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;
import edu.tum.cs.piohmm.math.LogSpace;
import edu.tum.cs.piohmm.math.NewtonMaximizer;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.OutputNoise;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Point estimate of the personalization vector b that maximizes the subject's expected complete-data
 * log-likelihood plus log N(b; 0, Sigma). The objective is concave in b, so damped Newton iterations reach the
 * unique maximum unless the iteration bound is too tight.
 */
public class MapPersonalizationEstimator implements PersonalizationEstimator {

	private final NewtonMaximizer newton;

	public MapPersonalizationEstimator(int maxIter, double tolerance) {
		this.newton = new NewtonMaximizer(maxIter, tolerance);
	}

	@Override
	public double[] estimate(ModelSpecification spec, GlobalParameters global, PersonalizationPrior prior,
			SubjectStatistics stats, double[] start) {
		SubjectObjective f = new SubjectObjective(spec, global, prior, stats);
		NewtonMaximizer.Result result = newton.maximize(f, start);
		if (!result.converged)
			throw new NonConvergenceException("personalization did not converge within " +
					newton.getMaxIterations() + " iterations", stats.getSubject().getId());
		return result.x;
	}

	/** Expected complete-data log-likelihood of one subject as a function of its personalization vector. */
	static class SubjectObjective implements ConcaveObjective {
		private final ModelSpecification spec;
		private final GlobalParameters global;
		private final PersonalizationPrior prior;
		private final SubjectStatistics stats;
		private final PersonalizationLayout layout;
		private final EmissionFamily family;
		private final OutputNoise[] noise;
		private final int numStates;
		private final int numResponses;

		SubjectObjective(ModelSpecification spec, GlobalParameters global, PersonalizationPrior prior,
				SubjectStatistics stats) {
			this.spec = spec;
			this.global = global;
			this.prior = prior;
			this.stats = stats;
			this.layout = new PersonalizationLayout(spec);
			this.family = spec.getEmissionFamily();
			this.noise = global.outputNoise();
			this.numStates = spec.getNumStates();
			this.numResponses = spec.getNumResponses();
		}

		@Override
		public int getDimension() {
			return layout.getDimension();
		}

		@Override
		public double value(double[] b) {
			return evaluate(b, null, null);
		}

		@Override
		public double evaluate(double[] b, double[] grad, double[][] hess) {
			PersonalizedModel model = new PersonalizedModel(spec, global, b);
			double value = prior.logDensity(b);
			if (grad != null)
				prior.addDerivatives(b, grad, hess);
			if (layout.hasTransitionOffsets())
				value += transitionTerm(model, grad, hess);
			if (layout.hasEmissionOffsets())
				value += emissionTerm(model, grad, hess);
			return value;
		}

		private double transitionTerm(PersonalizedModel model, double[] grad, double[][] hess) {
			Subject subject = stats.getSubject();
			double[][][] xi = stats.getPosterior().transitionMarginals();
			double[] eta = new double[numStates];
			double[] p = new double[numStates];
			double value = 0.0;
			for (int t = 1; t < subject.length(); t++) {
				double[] u = stats.getTransitionDesign(t);
				double[][] x = xi[t - 1];
				for (int j = 0; j < numStates; j++) {
					double total = LogSpace.sum(x[j]);
					if (total == 0.0)
						continue;
					for (int k = 0; k < numStates; k++)
						eta[k] = model.transitionLogit(j, k, u);
					double logZ = LogSpace.logSumExp(eta);
					for (int k = 0; k < numStates; k++)
						value += LogSpace.weightedLog(x[j][k], eta[k]);
					value -= total * logZ;
					if (grad == null)
						continue;

					for (int k = 0; k < numStates; k++)
						p[k] = Math.exp(eta[k] - logZ);
					for (int k = 0; k < numStates; k++) {
						if ((k == j) || !spec.isTransitionAllowed(j, k))
							continue;
						int offK = layout.transitionOffset(k);
						InPlaceLinAlg.addScaled(grad, offK, u, x[j][k] - (total * p[k]));
						for (int l = 0; l < numStates; l++) {
							if ((l == j) || !spec.isTransitionAllowed(j, l))
								continue;
							double c = total * p[k] * p[l];
							if (k == l)
								c -= total * p[k];
							InPlaceLinAlg.addOuterProduct(hess, offK, layout.transitionOffset(l), u, u, c);
						}
					}
				}
			}
			return value;
		}

		private double emissionTerm(PersonalizedModel model, double[] grad, double[][] hess) {
			Subject subject = stats.getSubject();
			double[][] gamma = stats.getPosterior().stateMarginals();
			double[] eta = new double[numResponses];
			double[] g = new double[numResponses];
			double[][] h = new double[numResponses][numResponses];
			double value = 0.0;
			for (int t = 0; t < subject.length(); t++) {
				double[] e = stats.getEmissionDesign(t);
				if (e == null)
					continue;
				double[] y = subject.getOutput(t);
				for (int k = 0; k < numStates; k++) {
					double w = gamma[t][k];
					if (w == 0.0)
						continue;
					OutputNoise n = (noise != null) ? noise[k] : null;
					model.emissionPredictor(k, e, eta);
					value += w * family.logLikelihood(eta, y, n);
					if (grad == null)
						continue;

					Arrays.fill(g, 0.0);
					InPlaceLinAlg.clear(h);
					family.addGradient(eta, y, n, w, g);
					family.addHessian(eta, y, n, w, h);
					for (int r = 0; r < numResponses; r++) {
						int offR = layout.emissionOffset(r);
						InPlaceLinAlg.addScaled(grad, offR, e, g[r]);
						for (int s = 0; s < numResponses; s++)
							InPlaceLinAlg.addOuterProduct(hess, offR, layout.emissionOffset(s), e, e, h[r][s]);
					}
				}
			}
			return value;
		}
	}

}
