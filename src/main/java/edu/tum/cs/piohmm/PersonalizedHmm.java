package edu.tum.cs.piohmm;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import edu.tum.cs.piohmm.inference.ForwardBackwardEngine;
import edu.tum.cs.piohmm.inference.Path;
import edu.tum.cs.piohmm.inference.Posterior;
import edu.tum.cs.piohmm.inference.Prediction;
import edu.tum.cs.piohmm.inference.StatePredictor;
import edu.tum.cs.piohmm.inference.ViterbiDecoder;
import edu.tum.cs.piohmm.learn.EmOrchestrator;
import edu.tum.cs.piohmm.learn.SubjectExecutor;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.ParameterSet;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;
import edu.tum.cs.piohmm.util.PiohmmConfiguration;

/** Entry points for fitting, decoding and evaluating personalized input-output HMMs. */
public class PersonalizedHmm {

	private static final Logger logger = Logger.getLogger(PersonalizedHmm.class.getName());

	private PersonalizedHmm() {
	}

	/**
	 * Fits a model to the given subjects.
	 * @throws PiohmmException of the kind that aborted the fit, naming the offending subject where applicable
	 */
	public static FitResult fit(ModelSpecification spec, List<Subject> subjects, FitConfiguration cfg) {
		logger.info("fitting " + spec + " to " + subjects.size() + " subjects");
		return new EmOrchestrator(spec, cfg).fit(spec, subjects);
	}

	/** Most likely state path of every subject under its personalized parameters, in the order given. */
	public static List<Path> decode(ModelSpecification spec, ParameterSet params, List<Subject> subjects) {
		int numThreads = new PiohmmConfiguration(PersonalizedHmm.class).getIntProperty(
				PiohmmConfiguration.PROP_NUM_THREADS, Runtime.getRuntime().availableProcessors());
		return decode(spec, params, subjects, numThreads);
	}

	public static List<Path> decode(final ModelSpecification spec, final ParameterSet params, List<Subject> subjects,
			int numThreads) {
		params.getGlobal().validate(spec);
		for (Subject s : subjects)
			spec.validate(s);

		final ViterbiDecoder decoder = new ViterbiDecoder();
		List<SubjectExecutor.Outcome<Path>> outcomes = new SubjectExecutor(numThreads).map(subjects,
				new SubjectExecutor.SubjectTask<Path>() {
					@Override
					public Path call(int index, Subject subject) {
						PersonalizedModel model = new PersonalizedModel(spec, params.getGlobal(),
								params.getPersonalization(subject.getId()));
						return decoder.decode(model, subject);
					}
				});
		List<Path> paths = new ArrayList<Path>(outcomes.size());
		for (SubjectExecutor.Outcome<Path> o : outcomes)
			paths.add(o.get());
		return paths;
	}

	/**
	 * Estimates personalization vectors for (possibly new) subjects while keeping the global parameters fixed.
	 * @return a copy of params extended by the new personalization vectors
	 */
	public static ParameterSet personalize(ParameterSet params, List<Subject> subjects, FitConfiguration cfg) {
		return new EmOrchestrator(params.getSpecification(), cfg).personalize(params, subjects);
	}

	/** Log-likelihood of a (possibly held-out) subject under its personalized parameters. */
	public static double logLikelihood(ParameterSet params, Subject subject) {
		return posterior(params, subject).getLogLikelihood();
	}

	/** Forward belief states P(z_t | y_0..y_t), one row per time step. */
	public static double[][] filter(ParameterSet params, Subject subject) {
		Posterior posterior = posterior(params, subject);
		double[][] belief = new double[subject.length()][];
		for (int t = 0; t < belief.length; t++)
			belief[t] = posterior.getFiltered(t);
		return belief;
	}

	/** One-step-ahead predictive state distributions, belief states and per-step log evidence. */
	public static Prediction predict(ParameterSet params, Subject subject) {
		params.getSpecification().validate(subject);
		return new StatePredictor().predict(params.model(subject.getId()), subject);
	}

	/**
	 * State distribution horizon steps after step origin, given the outputs up to step origin. The subject has to
	 * carry inputs (and time stamps) up to step origin + horizon; later outputs are ignored.
	 */
	public static double[] forecast(ParameterSet params, Subject subject, int origin, int horizon) {
		params.getSpecification().validate(subject);
		return new StatePredictor().forecast(params.model(subject.getId()), subject, origin, horizon);
	}

	private static Posterior posterior(ParameterSet params, Subject subject) {
		params.getSpecification().validate(subject);
		return new ForwardBackwardEngine().run(params.model(subject.getId()), subject);
	}

}
