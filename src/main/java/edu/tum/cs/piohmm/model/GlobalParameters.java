package edu.tum.cs.piohmm.model;

import java.io.Serializable;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import edu.tum.cs.piohmm.ConfigurationException;
import edu.tum.cs.piohmm.math.InPlaceLinAlg;

/**
 * Immutable snapshot of the population-level parameters. Per-subject tasks share a snapshot by reference; the
 * maximization step replaces it as a whole.
 */
public class GlobalParameters implements Serializable {

	private static final long serialVersionUID = -1853126413598290116L;
	private static final double eps = 1E-8;

	final double[] initial;
	final double[][][] transition;
	final double[][][] emission;
	final double[][] variance;
	final double[][][] outputCovariance;
	final double[][] covariance;

	/**
	 * @param initial initial-state distribution [K]
	 * @param transition multinomial-logit coefficients [source K][destination K][transition design size]
	 * @param emission linear-predictor coefficients [K][response rows][emission design size]
	 * @param variance per-state output variances [K][D], diagonal GAUSSIAN emissions only (null otherwise)
	 * @param covariance personalization covariance [q][q], null if nothing is personalized
	 */
	public GlobalParameters(double[] initial, double[][][] transition, double[][][] emission, double[][] variance,
			double[][] covariance) {
		this(initial, transition, emission, variance, null, covariance);
	}

	/**
	 * @param outputCovariance per-state output covariance matrices [K][D][D], full-covariance GAUSSIAN emissions
	 *        only (null otherwise)
	 */
	public GlobalParameters(double[] initial, double[][][] transition, double[][][] emission, double[][] variance,
			double[][][] outputCovariance, double[][] covariance) {
		this.initial = initial.clone();
		this.transition = InPlaceLinAlg.copy(transition);
		this.emission = InPlaceLinAlg.copy(emission);
		this.variance = (variance != null) ? InPlaceLinAlg.copy(variance) : null;
		this.outputCovariance = (outputCovariance != null) ? InPlaceLinAlg.copy(outputCovariance) : null;
		this.covariance = (covariance != null) ? InPlaceLinAlg.copy(covariance) : null;
	}

	public double[] getInitial() {
		return initial.clone();
	}

	public double[][][] getTransitionCoefficients() {
		return InPlaceLinAlg.copy(transition);
	}

	public double[] getTransitionCoefficients(int source, int destination) {
		return transition[source][destination].clone();
	}

	public double[][][] getEmissionCoefficients() {
		return InPlaceLinAlg.copy(emission);
	}

	public double[] getEmissionCoefficients(int state, int response) {
		return emission[state][response].clone();
	}

	/** @return per-state variances of a diagonal Gaussian model, null otherwise */
	public double[][] getVariances() {
		return (variance != null) ? InPlaceLinAlg.copy(variance) : null;
	}

	public double[] getVariances(int state) {
		return (variance != null) ? variance[state].clone() : null;
	}

	/** @return per-state output covariances of a full-covariance Gaussian model, null otherwise */
	public double[][][] getOutputCovariances() {
		return (outputCovariance != null) ? InPlaceLinAlg.copy(outputCovariance) : null;
	}

	/** Output covariance of one state; diagonal for a diagonal Gaussian model, null for other families. */
	public double[][] getOutputCovariance(int state) {
		if (outputCovariance != null)
			return InPlaceLinAlg.copy(outputCovariance[state]);
		if (variance == null)
			return null;
		double[][] c = new double[variance[state].length][variance[state].length];
		for (int d = 0; d < c.length; d++)
			c[d][d] = variance[state][d];
		return c;
	}

	/** @return output noise of every state, or null for non-Gaussian emissions */
	public OutputNoise[] outputNoise() {
		OutputNoise[] noise;
		if (outputCovariance != null) {
			noise = new OutputNoise[outputCovariance.length];
			for (int k = 0; k < noise.length; k++)
				noise[k] = OutputNoise.full(outputCovariance[k]);
		} else if (variance != null) {
			noise = new OutputNoise[variance.length];
			for (int k = 0; k < noise.length; k++)
				noise[k] = OutputNoise.diagonal(variance[k]);
		} else
			noise = null;
		return noise;
	}

	/** @return personalization covariance, or null if nothing is personalized */
	public RealMatrix getCovariance() {
		return (covariance != null) ? new Array2DRowRealMatrix(covariance, true) : null;
	}

	public GlobalParameters withCovariance(double[][] newCovariance) {
		return new GlobalParameters(initial, transition, emission, variance, outputCovariance, newCovariance);
	}

	/**
	 * Checks shapes and probability constraints against a specification.
	 * @throws ConfigurationException if the parameters do not fit the specification
	 */
	public void validate(ModelSpecification spec) {
		int k = spec.getNumStates();
		if (initial.length != k)
			throw new ConfigurationException("initial distribution has " + initial.length + " entries, expected " + k);
		double sum = 0.0;
		for (double p : initial) {
			if (!(p >= 0.0))
				throw new ConfigurationException("negative or undefined initial probability " + p);
			sum += p;
		}
		if (Math.abs(sum - 1.0) > eps)
			throw new ConfigurationException("initial probabilities sum to " + sum);

		checkShape("transition", transition, k, k, spec.getTransitionDesignSize());
		checkShape("emission", emission, k, spec.getNumResponses(), spec.getEmissionDesignSize());
		if (spec.hasFullCovariance()) {
			if ((outputCovariance == null) || (outputCovariance.length != k) || (variance != null))
				throw new ConfigurationException("full-covariance Gaussian emissions require one covariance matrix " +
						"per state");
			for (double[][] c : outputCovariance) {
				if ((c.length != spec.getOutputDimension()) || (c[0].length != spec.getOutputDimension()))
					throw new ConfigurationException("output covariance of size " + c.length + "x" + c[0].length);
				OutputNoise.full(c);
			}
		} else if (spec.getEmissionFamily() == EmissionFamily.GAUSSIAN) {
			if ((variance == null) || (variance.length != k) || (outputCovariance != null))
				throw new ConfigurationException("Gaussian emissions require one variance vector per state");
			for (double[] v : variance) {
				if (v.length != spec.getOutputDimension())
					throw new ConfigurationException("variance vector of length " + v.length);
				for (double d : v) {
					if (!(d > 0.0))
						throw new ConfigurationException("non-positive variance " + d);
				}
			}
		} else if ((variance != null) || (outputCovariance != null))
			throw new ConfigurationException("output variances given for " + spec.getEmissionFamily() +
					" emissions");

		int q = new PersonalizationLayout(spec).getDimension();
		if (q > 0) {
			if ((covariance == null) || (covariance.length != q))
				throw new ConfigurationException("expected a " + q + "x" + q + " personalization covariance");
		} else if (covariance != null)
			throw new ConfigurationException("personalization covariance given, but nothing is personalized");
	}

	private static void checkShape(String name, double[][][] a, int n1, int n2, int n3) {
		if (a.length != n1)
			throw new ConfigurationException(name + " coefficients: expected " + n1 + " states, got " + a.length);
		for (double[][] b : a) {
			if (b.length != n2)
				throw new ConfigurationException(name + " coefficients: expected " + n2 + " rows, got " + b.length);
			for (double[] c : b) {
				if (c.length != n3)
					throw new ConfigurationException(name + " coefficients: expected design size " + n3 + ", got " +
							c.length);
			}
		}
	}

}
