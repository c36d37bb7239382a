package edu.tum.cs.piohmm;

import java.util.Collections;
import java.util.List;

import edu.tum.cs.piohmm.model.ParameterSet;

/** Fitted parameters of the best restart together with its convergence diagnostics. */
public class FitResult {

	private final ParameterSet parameters;
	private final FitState state;
	private final double logLikelihood;
	private final double objective;
	private final int numIterations;
	private final List<Double> objectiveHistory;
	private final double[] restartObjectives;
	private final int numFreeParameters;
	private final int numObservations;

	public FitResult(ParameterSet parameters, FitState state, double logLikelihood, double objective,
			int numIterations, List<Double> objectiveHistory, double[] restartObjectives, int numFreeParameters,
			int numObservations) {
		this.parameters = parameters;
		this.state = state;
		this.logLikelihood = logLikelihood;
		this.objective = objective;
		this.numIterations = numIterations;
		this.objectiveHistory = Collections.unmodifiableList(objectiveHistory);
		this.restartObjectives = restartObjectives;
		this.numFreeParameters = numFreeParameters;
		this.numObservations = numObservations;
	}

	public ParameterSet getParameters() {
		return parameters;
	}

	public FitState getState() {
		return state;
	}

	/** Sum of the subjects' log-likelihoods under the returned parameters. */
	public double getLogLikelihood() {
		return logLikelihood;
	}

	/** Penalized log-likelihood monitored during the fit. */
	public double getObjective() {
		return objective;
	}

	public int getNumIterations() {
		return numIterations;
	}

	public List<Double> getObjectiveHistory() {
		return objectiveHistory;
	}

	/** Final objective of every restart; NaN for restarts that failed. */
	public double[] getRestartObjectives() {
		return restartObjectives.clone();
	}

	public int getNumFreeParameters() {
		return numFreeParameters;
	}

	public double getBic() {
		return (-2.0 * logLikelihood) + (numFreeParameters * Math.log(numObservations));
	}

	@Override
	public String toString() {
		return "FitResult [state=" + state + ", logLikelihood=" + logLikelihood + ", objective=" + objective +
				", iterations=" + numIterations + "]";
	}

}
