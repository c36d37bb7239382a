package edu.tum.cs.piohmm.learn;

import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import edu.tum.cs.piohmm.FitConfiguration;
import edu.tum.cs.piohmm.math.ConcaveObjective;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;
import edu.tum.cs.piohmm.math.LogSpace;
import edu.tum.cs.piohmm.math.MultinomialLogit;
import edu.tum.cs.piohmm.math.NewtonMaximizer;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.Subject;

/**
 * M-step: re-estimates the global parameters from the expected sufficient statistics of all subjects and their
 * updated personalization vectors. Each parameter block is either solved in closed form or by Newton's method
 * started from its previous value, so none of the updates decreases the penalized expected complete-data
 * log-likelihood.
 */
public class Maximizer {

	private static final Logger logger = Logger.getLogger(Maximizer.class.getName());

	/** States and source rows with less expected mass keep their previous parameters. */
	public static final double MIN_WEIGHT = 1E-10;

	protected final ModelSpecification spec;
	protected final PersonalizationLayout layout;
	private final NewtonMaximizer newton;
	private final double regularization;
	private final double minVariance;
	private final double covarianceShrinkage;
	private final double covariancePriorWeight;

	public Maximizer(ModelSpecification spec, FitConfiguration cfg) {
		this(spec, cfg.getNewtonIterations(), cfg.getRegularization(), cfg.getMinVariance(),
				cfg.getCovarianceShrinkage(), cfg.getCovariancePriorWeight());
	}

	public Maximizer(ModelSpecification spec, int newtonIterations, double regularization, double minVariance,
			double covarianceShrinkage, double covariancePriorWeight) {
		this.spec = spec;
		this.layout = new PersonalizationLayout(spec);
		this.newton = new NewtonMaximizer(newtonIterations, 1E-8);
		this.regularization = regularization;
		this.minVariance = minVariance;
		this.covarianceShrinkage = covarianceShrinkage;
		this.covariancePriorWeight = covariancePriorWeight;
	}

	/**
	 * @param personalization updated personalization vector of every subject, aligned with stats
	 */
	public GlobalParameters maximize(GlobalParameters previous, List<SubjectStatistics> stats,
			double[][] personalization) {
		double[] initial = updateInitial(stats);
		double[][][] transition = previous.getTransitionCoefficients();
		for (int j = 0; j < spec.getNumStates(); j++)
			updateTransitions(j, transition[j], stats, personalization);

		double[][][] emission = previous.getEmissionCoefficients();
		double[][] variance = previous.getVariances();
		double[][][] outputCovariance = previous.getOutputCovariances();
		for (int k = 0; k < spec.getNumStates(); k++) {
			if (spec.getEmissionFamily() == EmissionFamily.GAUSSIAN)
				updateGaussianEmissions(k, emission[k], (variance != null) ? variance[k] : null,
						(outputCovariance != null) ? outputCovariance[k] : null, stats, personalization);
			else
				updateGlmEmissions(k, emission[k], stats, personalization);
		}

		double[][] covariance = (layout.getDimension() > 0) ? updateCovariance(personalization) : null;
		return new GlobalParameters(initial, transition, emission, variance, outputCovariance, covariance);
	}

	protected double[] updateInitial(List<SubjectStatistics> stats) {
		double[] initial = new double[spec.getNumStates()];
		for (SubjectStatistics s : stats) {
			double[][] gamma = s.getPosterior().stateMarginals();
			for (int k = 0; k < initial.length; k++)
				initial[k] += gamma[0][k];
		}
		return LogSpace.normalize(initial);
	}

	/** Destinations of source state j that carry free coefficients. */
	private int[] freeDestinations(int j) {
		int numStates = spec.getNumStates();
		int n = 0;
		for (int k = 0; k < numStates; k++) {
			if ((k != j) && spec.isTransitionAllowed(j, k))
				n++;
		}
		int[] dest = new int[n];
		n = 0;
		for (int k = 0; k < numStates; k++) {
			if ((k != j) && spec.isTransitionAllowed(j, k))
				dest[n++] = k;
		}
		return dest;
	}

	protected void updateTransitions(int source, double[][] coefficients, List<SubjectStatistics> stats,
			double[][] personalization) {
		int[] dest = freeDestinations(source);
		if (dest.length == 0)
			return;

		double totalWeight = 0.0;
		for (SubjectStatistics s : stats) {
			for (double[][] x : s.getPosterior().transitionMarginals())
				totalWeight += LogSpace.sum(x[source]);
		}
		if (totalWeight < MIN_WEIGHT) {
			logger.fine("no expected transitions out of state " + source + ", keeping coefficients");
			return;
		}

		int designSize = spec.getTransitionDesignSize();
		double[] start = new double[dest.length * designSize];
		for (int r = 0; r < dest.length; r++)
			System.arraycopy(coefficients[dest[r]], 0, start, r * designSize, designSize);
		NewtonMaximizer.Result result = newton.maximize(
				new TransitionObjective(source, dest, stats, personalization), start);
		if (!result.converged)
			logger.fine("transition update of state " + source + " stopped after " + result.numIterations +
					" iterations");
		for (int r = 0; r < dest.length; r++)
			System.arraycopy(result.x, r * designSize, coefficients[dest[r]], 0, designSize);
	}

	/**
	 * Weighted least squares per output dimension, then the weighted residual (co)variance. All output dimensions
	 * share design and weights, so the per-dimension solutions also maximize the likelihood under a full output
	 * covariance. Exactly one of variance and outputCovariance is non-null and is updated in place.
	 */
	protected void updateGaussianEmissions(int state, double[][] coefficients, double[] variance,
			double[][] outputCovariance, List<SubjectStatistics> stats, double[][] personalization) {
		int designSize = spec.getEmissionDesignSize();
		int dim = spec.getOutputDimension();
		double[][] xtx = new double[designSize][designSize];
		double[][] xty = new double[dim][designSize];
		double totalWeight = 0.0;
		for (int i = 0; i < stats.size(); i++) {
			SubjectStatistics s = stats.get(i);
			double[][] gamma = s.getPosterior().stateMarginals();
			for (int t = 0; t < s.getSubject().length(); t++) {
				double[] e = s.getEmissionDesign(t);
				double w = gamma[t][state];
				if ((e == null) || (w == 0.0))
					continue;
				InPlaceLinAlg.addOuterProduct(xtx, 0, 0, e, e, w);
				double[] y = s.getSubject().getOutput(t);
				for (int d = 0; d < dim; d++)
					InPlaceLinAlg.addScaled(xty[d], 0, e, w * (y[d] - emissionOffset(personalization[i], d, e)));
				totalWeight += w;
			}
		}
		if (totalWeight < MIN_WEIGHT) {
			logger.fine("state " + state + " has no expected observations, keeping emission parameters");
			return;
		}

		DecompositionSolver solver = new SingularValueDecomposition(new Array2DRowRealMatrix(xtx, false))
				.getSolver();
		for (int d = 0; d < dim; d++)
			coefficients[d] = solver.solve(new ArrayRealVector(xty[d], false)).toArray();

		double[][] scatter = new double[dim][dim];
		double[] r = new double[dim];
		for (int i = 0; i < stats.size(); i++) {
			SubjectStatistics s = stats.get(i);
			double[][] gamma = s.getPosterior().stateMarginals();
			for (int t = 0; t < s.getSubject().length(); t++) {
				double[] e = s.getEmissionDesign(t);
				double w = gamma[t][state];
				if ((e == null) || (w == 0.0))
					continue;
				double[] y = s.getSubject().getOutput(t);
				for (int d = 0; d < dim; d++)
					r[d] = y[d] - emissionOffset(personalization[i], d, e) -
							InPlaceLinAlg.dotProduct(coefficients[d], e);
				InPlaceLinAlg.addOuterProduct(scatter, 0, 0, r, r, w);
			}
		}

		if (outputCovariance == null) {
			for (int d = 0; d < dim; d++)
				variance[d] = Math.max(scatter[d][d] / totalWeight, minVariance);
		} else {
			for (int d = 0; d < dim; d++) {
				for (int c = 0; c < dim; c++)
					scatter[d][c] /= totalWeight;
			}
			floorEigenvalues(scatter, outputCovariance);
		}
	}

	/** Covariance with the eigenvectors of the sample covariance and its eigenvalues clipped at minVariance. */
	private void floorEigenvalues(double[][] sample, double[][] out) {
		EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(sample, false));
		double[] lambda = eig.getRealEigenvalues();
		RealMatrix v = eig.getV();
		int dim = sample.length;
		for (int d = 0; d < dim; d++) {
			for (int c = d; c < dim; c++) {
				double sum = 0.0;
				for (int m = 0; m < dim; m++)
					sum += v.getEntry(d, m) * Math.max(lambda[m], minVariance) * v.getEntry(c, m);
				out[d][c] = sum;
				out[c][d] = sum;
			}
		}
	}

	private double emissionOffset(double[] b, int response, double[] e) {
		if (!layout.hasEmissionOffsets())
			return 0.0;
		return InPlaceLinAlg.dotProduct(b, layout.emissionOffset(response), e);
	}

	protected void updateGlmEmissions(int state, double[][] coefficients, List<SubjectStatistics> stats,
			double[][] personalization) {
		double totalWeight = 0.0;
		for (SubjectStatistics s : stats) {
			double[][] gamma = s.getPosterior().stateMarginals();
			for (int t = 0; t < s.getSubject().length(); t++) {
				if (s.getEmissionDesign(t) != null)
					totalWeight += gamma[t][state];
			}
		}
		if (totalWeight < MIN_WEIGHT) {
			logger.fine("state " + state + " has no expected observations, keeping emission parameters");
			return;
		}

		int designSize = spec.getEmissionDesignSize();
		double[] start = new double[coefficients.length * designSize];
		for (int r = 0; r < coefficients.length; r++)
			System.arraycopy(coefficients[r], 0, start, r * designSize, designSize);
		NewtonMaximizer.Result result = newton.maximize(new EmissionObjective(state, stats, personalization), start);
		if (!result.converged)
			logger.fine("emission update of state " + state + " stopped after " + result.numIterations +
					" iterations");
		for (int r = 0; r < coefficients.length; r++)
			System.arraycopy(result.x, r * designSize, coefficients[r], 0, designSize);
	}

	/** MAP estimate (psi I + sum_i b_i b_i') / (n + nu). */
	protected double[][] updateCovariance(double[][] personalization) {
		int q = layout.getDimension();
		double[][] cov = new double[q][q];
		for (int i = 0; i < q; i++)
			cov[i][i] = covarianceShrinkage;
		for (double[] b : personalization)
			InPlaceLinAlg.addOuterProduct(cov, 0, 0, b, b, 1.0);
		double n = personalization.length + covariancePriorWeight;
		for (int i = 0; i < q; i++) {
			for (int j = 0; j < q; j++)
				cov[i][j] /= n;
		}
		return cov;
	}

	private double ridge(double[] x, double[] grad, double[][] hess) {
		if (grad != null) {
			for (int i = 0; i < x.length; i++) {
				grad[i] -= regularization * x[i];
				hess[i][i] -= regularization;
			}
		}
		return 0.5 * regularization * InPlaceLinAlg.dotProduct(x, x);
	}

	/** Multinomial logistic regression of the destinations of one source state. */
	private class TransitionObjective implements ConcaveObjective {
		private final int source;
		private final int[] dest;
		private final List<SubjectStatistics> stats;
		private final double[][] personalization;
		private final int designSize;

		public TransitionObjective(int source, int[] dest, List<SubjectStatistics> stats,
				double[][] personalization) {
			this.source = source;
			this.dest = dest;
			this.stats = stats;
			this.personalization = personalization;
			this.designSize = spec.getTransitionDesignSize();
		}

		@Override
		public int getDimension() {
			return dest.length * designSize;
		}

		@Override
		public double value(double[] x) {
			return evaluate(x, null, null);
		}

		@Override
		public double evaluate(double[] x, double[] grad, double[][] hess) {
			double[] eta = new double[dest.length];
			double[] counts = new double[dest.length];
			double[] p = new double[dest.length];
			double value = -ridge(x, grad, hess);
			for (int i = 0; i < stats.size(); i++) {
				SubjectStatistics s = stats.get(i);
				double[] b = personalization[i];
				double[][][] xi = s.getPosterior().transitionMarginals();
				for (int t = 1; t < s.getSubject().length(); t++) {
					double[] row = xi[t - 1][source];
					double total = LogSpace.sum(row);
					if (total == 0.0)
						continue;
					double[] u = s.getTransitionDesign(t);
					for (int r = 0; r < dest.length; r++) {
						eta[r] = InPlaceLinAlg.dotProduct(x, r * designSize, u);
						if (layout.hasTransitionOffsets())
							eta[r] += InPlaceLinAlg.dotProduct(b, layout.transitionOffset(dest[r]), u);
						counts[r] = row[dest[r]];
					}
					value += MultinomialLogit.logLikelihood(eta, counts, total);
					if (grad == null)
						continue;

					MultinomialLogit.probabilities(eta, p);
					for (int r = 0; r < dest.length; r++) {
						InPlaceLinAlg.addScaled(grad, r * designSize, u, counts[r] - (total * p[r]));
						for (int v = 0; v < dest.length; v++) {
							double c = total * p[r] * p[v];
							if (r == v)
								c -= total * p[r];
							InPlaceLinAlg.addOuterProduct(hess, r * designSize, v * designSize, u, u, c);
						}
					}
				}
			}
			return value;
		}
	}

	/** Weighted GLM fit of the emission coefficients of one state. */
	private class EmissionObjective implements ConcaveObjective {
		private final int state;
		private final List<SubjectStatistics> stats;
		private final double[][] personalization;
		private final int numResponses;
		private final int designSize;

		public EmissionObjective(int state, List<SubjectStatistics> stats, double[][] personalization) {
			this.state = state;
			this.stats = stats;
			this.personalization = personalization;
			this.numResponses = spec.getNumResponses();
			this.designSize = spec.getEmissionDesignSize();
		}

		@Override
		public int getDimension() {
			return numResponses * designSize;
		}

		@Override
		public double value(double[] x) {
			return evaluate(x, null, null);
		}

		@Override
		public double evaluate(double[] x, double[] grad, double[][] hess) {
			EmissionFamily family = spec.getEmissionFamily();
			double[] eta = new double[numResponses];
			double[] g = new double[numResponses];
			double[][] h = new double[numResponses][numResponses];
			double value = -ridge(x, grad, hess);
			for (int i = 0; i < stats.size(); i++) {
				SubjectStatistics s = stats.get(i);
				Subject subject = s.getSubject();
				double[][] gamma = s.getPosterior().stateMarginals();
				for (int t = 0; t < subject.length(); t++) {
					double[] e = s.getEmissionDesign(t);
					double w = gamma[t][state];
					if ((e == null) || (w == 0.0))
						continue;
					for (int r = 0; r < numResponses; r++)
						eta[r] = InPlaceLinAlg.dotProduct(x, r * designSize, e) +
								emissionOffset(personalization[i], r, e);
					double[] y = subject.getOutput(t);
					value += w * family.logLikelihood(eta, y, null);
					if (grad == null)
						continue;

					for (int r = 0; r < numResponses; r++)
						g[r] = 0.0;
					InPlaceLinAlg.clear(h);
					family.addGradient(eta, y, null, w, g);
					family.addHessian(eta, y, null, w, h);
					for (int r = 0; r < numResponses; r++) {
						InPlaceLinAlg.addScaled(grad, r * designSize, e, g[r]);
						for (int v = 0; v < numResponses; v++)
							InPlaceLinAlg.addOuterProduct(hess, r * designSize, v * designSize, e, e, h[r][v]);
					}
				}
			}
			return value;
		}
	}

}
