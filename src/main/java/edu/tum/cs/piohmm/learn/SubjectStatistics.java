package edu.tum.cs.piohmm.learn;

import edu.tum.cs.piohmm.inference.ForwardBackwardEngine;
import edu.tum.cs.piohmm.inference.Posterior;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Expected sufficient statistics of one subject from a single E-step: the posterior together with the design
 * vectors and the personalization vector it was computed with.
 */
public class SubjectStatistics {

	private final Subject subject;
	private final Posterior posterior;
	private final double[] personalization;
	private final double[][] transitionDesigns;
	private final double[][] emissionDesigns;

	public SubjectStatistics(Subject subject, Posterior posterior, double[] personalization,
			double[][] transitionDesigns, double[][] emissionDesigns) {
		this.subject = subject;
		this.posterior = posterior;
		this.personalization = personalization;
		this.transitionDesigns = transitionDesigns;
		this.emissionDesigns = emissionDesigns;
	}

	public static SubjectStatistics compute(ForwardBackwardEngine engine, PersonalizedModel model, Subject subject) {
		Posterior posterior = engine.run(model, subject);
		int numSteps = subject.length();
		double[][] u = new double[numSteps][];
		double[][] e = new double[numSteps][];
		for (int t = 0; t < numSteps; t++) {
			if (t > 0)
				u[t] = model.transitionDesign(subject, t);
			if (subject.isObserved(t))
				e[t] = model.emissionDesign(subject, t);
		}
		return new SubjectStatistics(subject, posterior, model.getPersonalization(), u, e);
	}

	public Subject getSubject() {
		return subject;
	}

	public Posterior getPosterior() {
		return posterior;
	}

	public double getLogLikelihood() {
		return posterior.getLogLikelihood();
	}

	/** Personalization vector the posterior was computed with. */
	public double[] getPersonalization() {
		return personalization.clone();
	}

	/** Transition design of the step from t-1 to t, t >= 1. */
	public double[] getTransitionDesign(int t) {
		return transitionDesigns[t];
	}

	/** @return emission design of step t, or null if the output of step t was not observed */
	public double[] getEmissionDesign(int t) {
		return emissionDesigns[t];
	}

}
