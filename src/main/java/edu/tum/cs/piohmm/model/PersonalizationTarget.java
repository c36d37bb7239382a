package edu.tum.cs.piohmm.model;

/** Parameter blocks that may carry subject-specific offsets. */
public enum PersonalizationTarget {
	TRANSITION, EMISSION
}
