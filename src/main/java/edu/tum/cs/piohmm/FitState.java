package edu.tum.cs.piohmm;

public enum FitState {
	INITIALIZED,
	ITERATING,
	CONVERGED,
	MAX_ITERATIONS_REACHED,
	FAILED,
	/** aborted between two iterations; the last completed iteration is kept */
	CANCELLED
}
