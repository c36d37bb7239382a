package edu.tum.cs.piohmm.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.tum.cs.piohmm.ConfigurationException;

/**
 * Immutable description of a personalized input-output HMM: number of latent states, emission family, which input
 * columns enter the transition and emission models, and which parameter blocks are personalized. An intercept is
 * always part of both design vectors, so the covariate lists may be empty.
 */
public class ModelSpecification implements Serializable {

	private static final long serialVersionUID = -6302846531296845203L;

	private final int numStates;
	private final EmissionFamily emissionFamily;
	private final int inputDimension;
	private final int outputDimension;
	private final int numCategories;
	private final int[] transitionCovariates;
	private final int[] emissionCovariates;
	private final boolean timeGapCovariate;
	private final boolean leftToRight;
	private final boolean fullCovariance;
	private final Set<PersonalizationTarget> personalizationTargets;
	private final List<String> inputNames;

	private ModelSpecification(Builder b) {
		if (b.numStates < 2)
			throw new ConfigurationException("number of states must be at least 2, got " + b.numStates);
		if (b.emissionFamily == null)
			throw new ConfigurationException("emission family not specified");
		if (b.inputDimension < 0)
			throw new ConfigurationException("negative input dimension " + b.inputDimension);
		if (b.inputNames != null && b.inputNames.size() != b.inputDimension)
			throw new ConfigurationException("got " + b.inputNames.size() + " input names for " + b.inputDimension +
					" input columns");
		if (b.outputDimension < 1)
			throw new ConfigurationException("output dimension must be positive, got " + b.outputDimension);
		if (b.emissionFamily == EmissionFamily.CATEGORICAL) {
			if (b.outputDimension != 1)
				throw new ConfigurationException("categorical emissions require a single output column");
			if (b.numCategories < 2)
				throw new ConfigurationException("categorical emissions require at least 2 categories, got " +
						b.numCategories);
		}
		if (b.fullCovariance && (b.emissionFamily != EmissionFamily.GAUSSIAN))
			throw new ConfigurationException("full output covariance requires Gaussian emissions");

		numStates = b.numStates;
		emissionFamily = b.emissionFamily;
		inputDimension = b.inputDimension;
		outputDimension = b.outputDimension;
		numCategories = (b.emissionFamily == EmissionFamily.CATEGORICAL) ? b.numCategories : 0;
		inputNames = (b.inputNames != null) ? Collections.unmodifiableList(b.inputNames) : null;
		transitionCovariates = resolve("transition", b.transitionCovariates, b.transitionCovariateNames);
		emissionCovariates = resolve("emission", b.emissionCovariates, b.emissionCovariateNames);
		timeGapCovariate = b.timeGapCovariate;
		leftToRight = b.leftToRight;
		fullCovariance = b.fullCovariance;
		personalizationTargets = Collections.unmodifiableSet(EnumSet.copyOf(b.personalizationTargets));
	}

	private int[] resolve(String kind, int[] indices, String[] names) {
		int[] resolved;
		if (names != null) {
			if (inputNames == null)
				throw new ConfigurationException(kind + " covariates given by name, but no input names specified");
			resolved = new int[names.length];
			for (int i = 0; i < names.length; i++) {
				resolved[i] = inputNames.indexOf(names[i]);
				if (resolved[i] < 0)
					throw new ConfigurationException("unknown " + kind + " covariate '" + names[i] + "'");
			}
		} else
			resolved = (indices != null) ? indices.clone() : new int[0];

		Set<Integer> seen = new HashSet<Integer>();
		for (int idx : resolved) {
			if ((idx < 0) || (idx >= inputDimension))
				throw new ConfigurationException(kind + " covariate index " + idx + " out of bounds for " +
						inputDimension + " input columns");
			if (!seen.add(idx))
				throw new ConfigurationException("duplicate " + kind + " covariate index " + idx);
		}
		return resolved;
	}

	public int getNumStates() {
		return numStates;
	}

	public EmissionFamily getEmissionFamily() {
		return emissionFamily;
	}

	public int getInputDimension() {
		return inputDimension;
	}

	public int getOutputDimension() {
		return outputDimension;
	}

	/** @return number of categories of a categorical emission model, 0 otherwise */
	public int getNumCategories() {
		return numCategories;
	}

	public int[] getTransitionCovariates() {
		return transitionCovariates.clone();
	}

	public int[] getEmissionCovariates() {
		return emissionCovariates.clone();
	}

	public boolean hasTimeGapCovariate() {
		return timeGapCovariate;
	}

	public boolean isLeftToRight() {
		return leftToRight;
	}

	/** @return whether Gaussian emissions use a full covariance matrix per state instead of a diagonal one */
	public boolean hasFullCovariance() {
		return fullCovariance;
	}

	public Set<PersonalizationTarget> getPersonalizationTargets() {
		return personalizationTargets;
	}

	public boolean isPersonalized(PersonalizationTarget target) {
		return personalizationTargets.contains(target);
	}

	public List<String> getInputNames() {
		return inputNames;
	}

	/** Length of the transition design vector (intercept, covariates, optional time gap). */
	public int getTransitionDesignSize() {
		return 1 + transitionCovariates.length + (timeGapCovariate ? 1 : 0);
	}

	/** Length of the emission design vector (intercept and covariates). */
	public int getEmissionDesignSize() {
		return 1 + emissionCovariates.length;
	}

	/** Number of rows of emission coefficients per state. */
	public int getNumResponses() {
		return emissionFamily.numResponses(outputDimension, numCategories);
	}

	/** @return whether the transition from state j to state k can occur at all */
	public boolean isTransitionAllowed(int j, int k) {
		return !leftToRight || (k >= j);
	}

	/**
	 * Checks that a subject conforms to this specification.
	 * @throws ConfigurationException naming the subject if it does not
	 */
	public void validate(Subject subject) {
		String id = subject.getId();
		if (subject.getInputDimension() != inputDimension)
			throw new ConfigurationException("expected " + inputDimension + " input columns, got " +
					subject.getInputDimension(), id);
		if (subject.getOutputDimension() != outputDimension)
			throw new ConfigurationException("expected " + outputDimension + " output columns, got " +
					subject.getOutputDimension(), id);
		for (int t = 0; t < subject.length(); t++) {
			if (subject.isObserved(t) && !emissionFamily.isValidOutput(subject.getOutput(t), numCategories))
				throw new ConfigurationException("invalid " + emissionFamily + " output " +
						Arrays.toString(subject.getOutput(t)) + " at step " + t, id);
		}
	}

	@Override
	public String toString() {
		return "ModelSpecification [numStates=" + numStates + ", emissionFamily=" + emissionFamily +
				(fullCovariance ? " (full covariance)" : "") + ", transitionCovariates=" + Arrays.toString(transitionCovariates) + ", emissionCovariates=" +
				Arrays.toString(emissionCovariates) + ", timeGap=" + timeGapCovariate + ", leftToRight=" +
				leftToRight + ", personalized=" + personalizationTargets + "]";
	}

	public static Builder builder(int numStates, EmissionFamily emissionFamily) {
		return new Builder(numStates, emissionFamily);
	}

	public static class Builder {
		private final int numStates;
		private final EmissionFamily emissionFamily;
		private int inputDimension;
		private int outputDimension = 1;
		private int numCategories;
		private int[] transitionCovariates, emissionCovariates;
		private String[] transitionCovariateNames, emissionCovariateNames;
		private boolean timeGapCovariate;
		private boolean leftToRight;
		private boolean fullCovariance;
		private final EnumSet<PersonalizationTarget> personalizationTargets =
				EnumSet.noneOf(PersonalizationTarget.class);
		private List<String> inputNames;

		private Builder(int numStates, EmissionFamily emissionFamily) {
			this.numStates = numStates;
			this.emissionFamily = emissionFamily;
		}

		public Builder withInputDimension(int inputDimension) {
			this.inputDimension = inputDimension;
			return this;
		}

		public Builder withInputNames(String... names) {
			this.inputNames = Arrays.asList(names.clone());
			this.inputDimension = names.length;
			return this;
		}

		public Builder withOutputDimension(int outputDimension) {
			this.outputDimension = outputDimension;
			return this;
		}

		public Builder withNumCategories(int numCategories) {
			this.numCategories = numCategories;
			return this;
		}

		public Builder withTransitionCovariates(int... indices) {
			this.transitionCovariates = indices.clone();
			this.transitionCovariateNames = null;
			return this;
		}

		public Builder withTransitionCovariates(String... names) {
			this.transitionCovariateNames = names.clone();
			this.transitionCovariates = null;
			return this;
		}

		public Builder withEmissionCovariates(int... indices) {
			this.emissionCovariates = indices.clone();
			this.emissionCovariateNames = null;
			return this;
		}

		public Builder withEmissionCovariates(String... names) {
			this.emissionCovariateNames = names.clone();
			this.emissionCovariates = null;
			return this;
		}

		public Builder withTimeGapCovariate() {
			this.timeGapCovariate = true;
			return this;
		}

		public Builder withLeftToRightTransitions() {
			this.leftToRight = true;
			return this;
		}

		public Builder withFullCovariance() {
			this.fullCovariance = true;
			return this;
		}

		public Builder withPersonalization(PersonalizationTarget... targets) {
			personalizationTargets.addAll(Arrays.asList(targets));
			return this;
		}

		public ModelSpecification build() {
			return new ModelSpecification(this);
		}
	}

}
