package edu.tum.cs.piohmm.learn;

import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;

/**
 * Updates the personalization vector of one subject under fixed global parameters, using the posterior of the
 * subject's most recent E-step. Implementations must not modify their arguments and must be safe to call
 * concurrently for different subjects.
 */
public interface PersonalizationEstimator {

	/**
	 * @param start starting point of the search
	 * @return the updated personalization vector
	 * @throws edu.tum.cs.piohmm.NonConvergenceException if no stable estimate is reached within the iteration bound
	 */
	double[] estimate(ModelSpecification spec, GlobalParameters global, PersonalizationPrior prior,
			SubjectStatistics stats, double[] start);

}
