package edu.tum.cs.piohmm.model;

import java.io.Serializable;

/**
 * Position of the subject-specific offsets inside a personalization vector: first the transition offsets (one
 * coefficient vector per destination state) and then the emission offsets (one coefficient vector per response
 * row), each block present only if the corresponding target is personalized.
 */
public class PersonalizationLayout implements Serializable {

	private static final long serialVersionUID = 6158372064791806383L;

	private final int numStates;
	private final int transitionDesignSize;
	private final int numResponses;
	private final int emissionDesignSize;
	private final boolean transition;
	private final boolean emission;

	public PersonalizationLayout(ModelSpecification spec) {
		numStates = spec.getNumStates();
		transitionDesignSize = spec.getTransitionDesignSize();
		numResponses = spec.getNumResponses();
		emissionDesignSize = spec.getEmissionDesignSize();
		transition = spec.isPersonalized(PersonalizationTarget.TRANSITION);
		emission = spec.isPersonalized(PersonalizationTarget.EMISSION);
	}

	public boolean hasTransitionOffsets() {
		return transition;
	}

	public boolean hasEmissionOffsets() {
		return emission;
	}

	public int getTransitionBlockSize() {
		return transition ? numStates * transitionDesignSize : 0;
	}

	public int getEmissionBlockSize() {
		return emission ? numResponses * emissionDesignSize : 0;
	}

	public int getDimension() {
		return getTransitionBlockSize() + getEmissionBlockSize();
	}

	/** Start of the coefficient offsets for transitions into the given destination state. */
	public int transitionOffset(int destination) {
		return destination * transitionDesignSize;
	}

	/** Start of the coefficient offsets for the given emission response row. */
	public int emissionOffset(int response) {
		return getTransitionBlockSize() + (response * emissionDesignSize);
	}

}
