package edu.tum.cs.piohmm.learn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.DirichletSampler;
import org.apache.commons.rng.simple.RandomSource;

import edu.tum.cs.piohmm.FitConfiguration;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.ParameterSet;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.Subject;
import edu.tum.cs.piohmm.util.RngAdaptor;

/**
 * Random starting point of an EM run: uniform initial distribution, uniform transitions, zero covariate effects
 * and zero personalization. Full output covariances start out diagonal. Gaussian and Poisson emission intercepts come from k-means++ clustering of the observed
 * outputs (states ordered by the first output coordinate), categorical emission probabilities are drawn from a
 * flat Dirichlet distribution.
 */
public class ParameterInitializer {

	private static final Logger logger = Logger.getLogger(ParameterInitializer.class.getName());

	private static final int maxClusteringIter = 100;
	private static final double minCategoryProb = 1E-3;
	private static final double minPoissonRate = 0.5;

	private final double initialVariance;
	private final double minVariance;

	public ParameterInitializer(FitConfiguration cfg) {
		this(cfg.getInitialVariance(), cfg.getMinVariance());
	}

	public ParameterInitializer(double initialVariance, double minVariance) {
		this.initialVariance = initialVariance;
		this.minVariance = minVariance;
	}

	public ParameterSet initialize(ModelSpecification spec, List<Subject> subjects, long seed) {
		UniformRandomProvider rand = RandomSource.create(RandomSource.MT, seed);
		int numStates = spec.getNumStates();
		int numResponses = spec.getNumResponses();

		double[] initial = new double[numStates];
		Arrays.fill(initial, 1.0 / numStates);
		double[][][] transition = new double[numStates][numStates][spec.getTransitionDesignSize()];
		double[][][] emission = new double[numStates][numResponses][spec.getEmissionDesignSize()];
		double[][] variance = null;
		double[][][] outputCovariance = null;

		if (spec.getEmissionFamily() == EmissionFamily.CATEGORICAL) {
			DirichletSampler dirichlet = DirichletSampler.symmetric(rand, spec.getNumCategories(), 1.0);
			for (int k = 0; k < numStates; k++) {
				double[] p = dirichlet.sample();
				for (int c = 0; c < p.length; c++)
					p[c] = Math.max(p[c], minCategoryProb);
				for (int r = 0; r < numResponses; r++)
					emission[k][r][0] = Math.log(p[r + 1]) - Math.log(p[0]);
			}
		} else {
			List<DoublePoint> points = collectOutputs(subjects);
			double[][] centers = new double[numStates][];
			double[][] spread = new double[numStates][];
			clusterOutputs(points, spec, rand, centers, spread);
			if (spec.getEmissionFamily() == EmissionFamily.GAUSSIAN) {
				for (int k = 0; k < numStates; k++) {
					for (int d = 0; d < numResponses; d++)
						emission[k][d][0] = centers[k][d];
				}
				if (spec.hasFullCovariance()) {
					outputCovariance = new double[numStates][numResponses][numResponses];
					for (int k = 0; k < numStates; k++) {
						for (int d = 0; d < numResponses; d++)
							outputCovariance[k][d][d] = spread[k][d];
					}
				} else
					variance = spread;
			} else {
				for (int k = 0; k < numStates; k++) {
					for (int d = 0; d < numResponses; d++)
						emission[k][d][0] = Math.log(Math.max(centers[k][d], minPoissonRate));
				}
			}
		}

		int q = new PersonalizationLayout(spec).getDimension();
		double[][] covariance = null;
		if (q > 0) {
			covariance = new double[q][q];
			for (int i = 0; i < q; i++)
				covariance[i][i] = initialVariance;
		}
		return new ParameterSet(spec, new GlobalParameters(initial, transition, emission, variance, outputCovariance,
				covariance));
	}

	private static List<DoublePoint> collectOutputs(List<Subject> subjects) {
		List<DoublePoint> points = new ArrayList<DoublePoint>();
		for (Subject s : subjects) {
			for (int t = 0; t < s.length(); t++) {
				if (s.isObserved(t))
					points.add(new DoublePoint(s.getOutput(t).clone()));
			}
		}
		return points;
	}

	private void clusterOutputs(List<DoublePoint> points, ModelSpecification spec, UniformRandomProvider rand,
			double[][] centers, double[][] spread) {
		int numStates = spec.getNumStates();
		int dim = spec.getOutputDimension();
		double[] overallVariance = columnVariance(points, dim);

		List<CentroidCluster<DoublePoint>> clusters = null;
		if (points.size() >= numStates) {
			KMeansPlusPlusClusterer<DoublePoint> clusterer = new KMeansPlusPlusClusterer<DoublePoint>(numStates,
					maxClusteringIter, new EuclideanDistance(), new RngAdaptor(rand));
			try {
				clusters = clusterer.cluster(points);
			} catch (ConvergenceException ex) {
				logger.warning("k-means++ initialization failed (" + ex.getMessage() + "), using quantiles");
			} catch (MathIllegalArgumentException ex) {
				logger.warning("k-means++ initialization failed (" + ex.getMessage() + "), using quantiles");
			}
		}

		if (clusters != null) {
			Collections.sort(clusters, new Comparator<CentroidCluster<DoublePoint>>() {
				@Override
				public int compare(CentroidCluster<DoublePoint> c1, CentroidCluster<DoublePoint> c2) {
					return Double.compare(c1.getCenter().getPoint()[0], c2.getCenter().getPoint()[0]);
				}
			});
			for (int k = 0; k < numStates; k++) {
				CentroidCluster<DoublePoint> c = clusters.get(k);
				centers[k] = c.getCenter().getPoint().clone();
				spread[k] = (c.getPoints().size() > 1) ? columnVariance(c.getPoints(), dim) : overallVariance.clone();
				for (int d = 0; d < dim; d++)
					spread[k][d] = Math.max(spread[k][d], minVariance);
			}
		} else {
			// quantiles of each output column
			for (int k = 0; k < numStates; k++) {
				centers[k] = new double[dim];
				spread[k] = new double[dim];
			}
			for (int d = 0; d < dim; d++) {
				double[] col = new double[points.size()];
				for (int i = 0; i < col.length; i++)
					col[i] = points.get(i).getPoint()[d];
				Arrays.sort(col);
				for (int k = 0; k < numStates; k++) {
					centers[k][d] = (col.length > 0) ? col[(int) (((k + 0.5) / numStates) * col.length)] : 0.0;
					spread[k][d] = Math.max(overallVariance[d], minVariance);
				}
			}
		}
	}

	private static double[] columnVariance(List<DoublePoint> points, int dim) {
		double[] v = new double[dim];
		if (points.size() < 2) {
			Arrays.fill(v, 1.0);
			return v;
		}
		double[] col = new double[points.size()];
		for (int d = 0; d < dim; d++) {
			for (int i = 0; i < col.length; i++)
				col[i] = points.get(i).getPoint()[d];
			v[d] = new Variance(false).evaluate(col);
		}
		return v;
	}

}
