package edu.tum.cs.piohmm;

import edu.tum.cs.piohmm.learn.MapPersonalizationEstimator;
import edu.tum.cs.piohmm.learn.PersonalizationEstimator;
import edu.tum.cs.piohmm.model.ParameterSet;
import edu.tum.cs.piohmm.util.PiohmmConfiguration;

/**
 * Settings of a fit. Defaults come from {@link PiohmmConfiguration}; every setter returns this configuration so that
 * calls can be chained.
 */
public class FitConfiguration {

	private int maxIterations;
	private double tolerance;
	private int numRestarts;
	private long seed;
	private int numThreads;
	private int personalizationMaxIterations;
	private double personalizationTolerance;
	private int newtonIterations;
	private double regularization;
	private double minVariance;
	private double initialVariance;
	private double covarianceShrinkage;
	private double covariancePriorWeight;
	private double monotonicityTolerance;
	private ParameterSet initialParameters;
	private PersonalizationEstimator estimator;

	public FitConfiguration() {
		this(new PiohmmConfiguration(FitConfiguration.class));
	}

	public FitConfiguration(PiohmmConfiguration cfg) {
		maxIterations = cfg.getIntProperty(PiohmmConfiguration.PROP_MAX_ITERATIONS, 100);
		tolerance = cfg.getDoubleProperty(PiohmmConfiguration.PROP_TOLERANCE, 1E-6);
		numRestarts = cfg.getIntProperty(PiohmmConfiguration.PROP_NUM_RESTARTS, 1);
		seed = cfg.getLongProperty(PiohmmConfiguration.PROP_SEED, 4711L);
		numThreads = cfg.getIntProperty(PiohmmConfiguration.PROP_NUM_THREADS,
				Runtime.getRuntime().availableProcessors());
		personalizationMaxIterations = cfg.getIntProperty(PiohmmConfiguration.PROP_PERSONALIZATION_MAX_ITERATIONS, 50);
		personalizationTolerance = cfg.getDoubleProperty(PiohmmConfiguration.PROP_PERSONALIZATION_TOLERANCE, 1E-6);
		newtonIterations = cfg.getIntProperty(PiohmmConfiguration.PROP_NEWTON_ITERATIONS, 25);
		regularization = cfg.getDoubleProperty(PiohmmConfiguration.PROP_REGULARIZATION, 1E-4);
		minVariance = cfg.getDoubleProperty(PiohmmConfiguration.PROP_MIN_VARIANCE, 1E-6);
		initialVariance = cfg.getDoubleProperty(PiohmmConfiguration.PROP_INITIAL_VARIANCE, 0.5);
		covarianceShrinkage = cfg.getDoubleProperty(PiohmmConfiguration.PROP_COVARIANCE_SHRINKAGE, 0.1);
		covariancePriorWeight = cfg.getDoubleProperty(PiohmmConfiguration.PROP_COVARIANCE_PRIOR_WEIGHT, 1.0);
		monotonicityTolerance = cfg.getDoubleProperty(PiohmmConfiguration.PROP_MONOTONICITY_TOLERANCE, 1E-6);
		validate();
	}

	/** @throws ConfigurationException if a setting is out of range */
	public void validate() {
		if (maxIterations < 1)
			throw new ConfigurationException("maxIterations must be positive, got " + maxIterations);
		if (!(tolerance >= 0.0))
			throw new ConfigurationException("tolerance must be non-negative, got " + tolerance);
		if (numRestarts < 1)
			throw new ConfigurationException("numRestarts must be positive, got " + numRestarts);
		if (numThreads < 1)
			throw new ConfigurationException("numThreads must be positive, got " + numThreads);
		if (personalizationMaxIterations < 1)
			throw new ConfigurationException("personalizationMaxIterations must be positive, got " +
					personalizationMaxIterations);
		if (!(personalizationTolerance > 0.0))
			throw new ConfigurationException("personalizationTolerance must be positive");
		if (newtonIterations < 1)
			throw new ConfigurationException("newtonIterations must be positive, got " + newtonIterations);
		if (!(regularization >= 0.0))
			throw new ConfigurationException("regularization must be non-negative, got " + regularization);
		if (!(minVariance > 0.0))
			throw new ConfigurationException("minVariance must be positive, got " + minVariance);
		if (!(initialVariance > 0.0))
			throw new ConfigurationException("initialVariance must be positive, got " + initialVariance);
		if (!(covarianceShrinkage > 0.0))
			throw new ConfigurationException("covarianceShrinkage must be positive, got " + covarianceShrinkage);
		if (!(covariancePriorWeight >= 0.0))
			throw new ConfigurationException("covariancePriorWeight must be non-negative");
		if (!(monotonicityTolerance >= 0.0))
			throw new ConfigurationException("monotonicityTolerance must be non-negative");
	}

	public int getMaxIterations() {
		return maxIterations;
	}

	public FitConfiguration withMaxIterations(int maxIterations) {
		this.maxIterations = maxIterations;
		return this;
	}

	/** Convergence threshold on the absolute improvement of the objective between iterations. */
	public double getTolerance() {
		return tolerance;
	}

	public FitConfiguration withTolerance(double tolerance) {
		this.tolerance = tolerance;
		return this;
	}

	public int getNumRestarts() {
		return numRestarts;
	}

	public FitConfiguration withNumRestarts(int numRestarts) {
		this.numRestarts = numRestarts;
		return this;
	}

	/** Restart r is initialized with seed + r. */
	public long getSeed() {
		return seed;
	}

	public FitConfiguration withSeed(long seed) {
		this.seed = seed;
		return this;
	}

	public int getNumThreads() {
		return numThreads;
	}

	public FitConfiguration withNumThreads(int numThreads) {
		this.numThreads = numThreads;
		return this;
	}

	public int getPersonalizationMaxIterations() {
		return personalizationMaxIterations;
	}

	public FitConfiguration withPersonalizationMaxIterations(int personalizationMaxIterations) {
		this.personalizationMaxIterations = personalizationMaxIterations;
		return this;
	}

	public double getPersonalizationTolerance() {
		return personalizationTolerance;
	}

	public FitConfiguration withPersonalizationTolerance(double personalizationTolerance) {
		this.personalizationTolerance = personalizationTolerance;
		return this;
	}

	/** Iteration bound of the Newton solvers inside the maximization step. */
	public int getNewtonIterations() {
		return newtonIterations;
	}

	public FitConfiguration withNewtonIterations(int newtonIterations) {
		this.newtonIterations = newtonIterations;
		return this;
	}

	/** Ridge penalty on the coefficients fitted by Newton's method. */
	public double getRegularization() {
		return regularization;
	}

	public FitConfiguration withRegularization(double regularization) {
		this.regularization = regularization;
		return this;
	}

	public double getMinVariance() {
		return minVariance;
	}

	public FitConfiguration withMinVariance(double minVariance) {
		this.minVariance = minVariance;
		return this;
	}

	/** Diagonal of the personalization covariance before the first update. */
	public double getInitialVariance() {
		return initialVariance;
	}

	public FitConfiguration withInitialVariance(double initialVariance) {
		this.initialVariance = initialVariance;
		return this;
	}

	/** Scale psi of the identity matrix added to the scatter matrix of the personalization vectors. */
	public double getCovarianceShrinkage() {
		return covarianceShrinkage;
	}

	public FitConfiguration withCovarianceShrinkage(double covarianceShrinkage) {
		this.covarianceShrinkage = covarianceShrinkage;
		return this;
	}

	/** Pseudo-count nu of the covariance prior. */
	public double getCovariancePriorWeight() {
		return covariancePriorWeight;
	}

	public FitConfiguration withCovariancePriorWeight(double covariancePriorWeight) {
		this.covariancePriorWeight = covariancePriorWeight;
		return this;
	}

	/** Relative decrease of the objective that is tolerated before the fit is aborted. */
	public double getMonotonicityTolerance() {
		return monotonicityTolerance;
	}

	public FitConfiguration withMonotonicityTolerance(double monotonicityTolerance) {
		this.monotonicityTolerance = monotonicityTolerance;
		return this;
	}

	/** @return starting point of the first restart, or null for random initialization */
	public ParameterSet getInitialParameters() {
		return initialParameters;
	}

	public FitConfiguration withInitialParameters(ParameterSet initialParameters) {
		this.initialParameters = initialParameters;
		return this;
	}

	public PersonalizationEstimator getEstimator() {
		if (estimator != null)
			return estimator;
		return new MapPersonalizationEstimator(personalizationMaxIterations, personalizationTolerance);
	}

	public FitConfiguration withEstimator(PersonalizationEstimator estimator) {
		this.estimator = estimator;
		return this;
	}

	@Override
	public String toString() {
		return "FitConfiguration [maxIterations=" + maxIterations + ", tolerance=" + tolerance + ", numRestarts=" +
				numRestarts + ", seed=" + seed + ", numThreads=" + numThreads + "]";
	}

}
