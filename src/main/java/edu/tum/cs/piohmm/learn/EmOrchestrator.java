package edu.tum.cs.piohmm.learn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import edu.tum.cs.piohmm.ConfigurationException;
import edu.tum.cs.piohmm.FitConfiguration;
import edu.tum.cs.piohmm.FitResult;
import edu.tum.cs.piohmm.FitState;
import edu.tum.cs.piohmm.MonotonicityViolationException;
import edu.tum.cs.piohmm.NonConvergenceException;
import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.PiohmmException;
import edu.tum.cs.piohmm.inference.ForwardBackwardEngine;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.ParameterSet;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

/**
 * Drives EM over all subjects: parallel E-step, objective and monotonicity check, parallel personalization update,
 * serial M-step. A new parameter set is committed only after a complete iteration, so {@link #cancel()} (checked
 * between iterations) always leaves the parameters of the last completed iteration.
 */
public class EmOrchestrator {

	private static final Logger logger = Logger.getLogger(EmOrchestrator.class.getName());

	private final FitConfiguration cfg;
	private final Maximizer maximizer;
	private final Objective objective;
	private final ParameterInitializer initializer;
	private final PersonalizationEstimator estimator;
	private final ForwardBackwardEngine engine = new ForwardBackwardEngine();
	private final SubjectExecutor executor;

	private volatile boolean cancelled;
	private volatile FitState state = FitState.INITIALIZED;

	public EmOrchestrator(ModelSpecification spec, FitConfiguration cfg) {
		this(cfg, new Maximizer(spec, cfg));
	}

	public EmOrchestrator(FitConfiguration cfg, Maximizer maximizer) {
		cfg.validate();
		this.cfg = cfg;
		this.maximizer = maximizer;
		this.objective = new Objective(cfg);
		this.initializer = new ParameterInitializer(cfg);
		this.estimator = cfg.getEstimator();
		this.executor = new SubjectExecutor(cfg.getNumThreads());
	}

	/** Requests an abort at the next iteration boundary. A cancelled orchestrator stays cancelled. */
	public void cancel() {
		cancelled = true;
	}

	public FitState getState() {
		return state;
	}

	private static class RunResult {
		ParameterSet parameters;
		FitState state;
		double logLikelihood = Double.NaN;
		double objective = Double.NaN;
		int numIterations;
		final List<Double> history = new ArrayList<Double>();
	}

	private static class EStepResult {
		List<SubjectStatistics> stats;
		double logLikelihood;
		boolean reset;
	}

	/**
	 * Fits the model with the configured number of restarts and returns the restart with the highest objective.
	 * @throws PiohmmException if every restart failed, or immediately on a monotonicity violation or invalid input
	 */
	public FitResult fit(ModelSpecification spec, List<Subject> subjects) {
		if (spec != maximizer.spec)
			throw new ConfigurationException("maximizer was created for a different model specification");
		validateSubjects(spec, subjects);
		int numRestarts = cfg.getNumRestarts();
		double[] restartObjectives = new double[numRestarts];
		Arrays.fill(restartObjectives, Double.NaN);
		RunResult best = null;
		PiohmmException lastError = null;

		for (int r = 0; r < numRestarts; r++) {
			ParameterSet start;
			if ((r == 0) && (cfg.getInitialParameters() != null))
				start = copyForSpecification(spec, cfg.getInitialParameters());
			else
				start = initializer.initialize(spec, subjects, cfg.getSeed() + r);

			RunResult run;
			try {
				run = runEm(spec, subjects, start);
			} catch (MonotonicityViolationException ex) {
				state = FitState.FAILED;
				throw ex;
			} catch (ConfigurationException ex) {
				state = FitState.FAILED;
				throw ex;
			} catch (PiohmmException ex) {
				logger.warning("restart " + r + " failed: " + ex.getMessage());
				lastError = ex;
				continue;
			}

			restartObjectives[r] = run.objective;
			logger.info("restart " + r + ": " + run.state + " after " + run.numIterations + " iterations, objective " +
					run.objective);
			if (run.state == FitState.CANCELLED) {
				best = run;
				break;
			}
			if ((best == null) || (run.objective > best.objective))
				best = run;
		}

		if (best == null) {
			state = FitState.FAILED;
			throw lastError;
		}
		state = best.state;
		return new FitResult(best.parameters, best.state, best.logLikelihood, best.objective, best.numIterations,
				best.history, restartObjectives, Objective.countFreeParameters(spec), countObservations(subjects));
	}

	private RunResult runEm(ModelSpecification spec, List<Subject> subjects, ParameterSet start) {
		RunResult run = new RunResult();
		run.parameters = start;
		state = FitState.ITERATING;
		double prevObjective = Double.NaN;

		while (true) {
			if (cancelled) {
				logger.info("fit cancelled after " + run.numIterations + " iterations");
				run.state = FitState.CANCELLED;
				state = run.state;
				return run;
			}
			run.numIterations++;
			ParameterSet params = run.parameters;
			GlobalParameters global = params.getGlobal();
			PersonalizationPrior prior = createPrior(global);

			EStepResult e = expectation(params, subjects);
			List<double[]> personalization = new ArrayList<double[]>(e.stats.size());
			for (SubjectStatistics s : e.stats)
				personalization.add(s.getPersonalization());
			double f = objective.compute(spec, global, prior, e.logLikelihood, personalization);
			if (Double.isNaN(f))
				throw new NumericalInstabilityException("undefined objective in iteration " + run.numIterations);

			if (!Double.isNaN(prevObjective)) {
				double threshold = cfg.getMonotonicityTolerance() * Math.max(1.0, Math.abs(prevObjective));
				if (f < prevObjective - threshold) {
					if (e.reset)
						logger.warning("objective decreased from " + prevObjective + " to " + f +
								" after an E-step with zero personalization");
					else
						throw new MonotonicityViolationException("objective decreased from " + prevObjective +
								" to " + f + " in iteration " + run.numIterations);
				}
			}
			run.history.add(f);
			run.logLikelihood = e.logLikelihood;
			run.objective = f;
			logger.fine("iteration " + run.numIterations + ": log-likelihood " + e.logLikelihood + ", objective " + f);

			if (!Double.isNaN(prevObjective) && ((f - prevObjective) < cfg.getTolerance())) {
				run.state = FitState.CONVERGED;
				state = run.state;
				return run;
			}
			if (run.numIterations >= cfg.getMaxIterations()) {
				run.state = FitState.MAX_ITERATIONS_REACHED;
				state = run.state;
				return run;
			}

			double[][] updated = updatePersonalization(spec, global, prior, e.stats);
			GlobalParameters next = maximizer.maximize(global, e.stats, updated);

			ParameterSet committed = new ParameterSet(spec, next);
			for (int i = 0; i < subjects.size(); i++)
				committed.setPersonalization(subjects.get(i).getId(), updated[i]);
			run.parameters = committed;
			prevObjective = f;
		}
	}

	/** Parallel E-step; a failing subject is retried once with zero personalization. */
	private EStepResult expectation(final ParameterSet params, List<Subject> subjects) {
		final AtomicBoolean reset = new AtomicBoolean();
		final int q = params.getLayout().getDimension();
		List<SubjectExecutor.Outcome<SubjectStatistics>> outcomes = executor.map(subjects,
				new SubjectExecutor.SubjectTask<SubjectStatistics>() {
					@Override
					public SubjectStatistics call(int index, Subject subject) {
						try {
							return SubjectStatistics.compute(engine, params.model(subject.getId()), subject);
						} catch (NumericalInstabilityException ex) {
							if (!params.hasPersonalization(subject.getId()) || isZero(params.getPersonalization(
									subject.getId())))
								throw ex;
							logger.warning("E-step failed for subject '" + subject.getId() +
									"', retrying with zero personalization: " + ex.getMessage());
							reset.set(true);
							return SubjectStatistics.compute(engine, new PersonalizedModel(
									params.getSpecification(), params.getGlobal(), new double[q]), subject);
						}
					}
				});

		EStepResult result = new EStepResult();
		result.stats = collect(outcomes);
		for (SubjectStatistics s : result.stats)
			result.logLikelihood += s.getLogLikelihood();
		result.reset = reset.get();
		return result;
	}

	/**
	 * Parallel personalization update; a failing subject is retried once from zero. The subject objective is strictly
	 * concave, so the retry targets the same maximum.
	 */
	private double[][] updatePersonalization(final ModelSpecification spec, final GlobalParameters global,
			final PersonalizationPrior prior, List<SubjectStatistics> stats) {
		final int q = prior.getDimension();
		double[][] updated = new double[stats.size()][];
		if (q == 0) {
			for (int i = 0; i < updated.length; i++)
				updated[i] = new double[0];
			return updated;
		}

		final List<SubjectStatistics> statList = stats;
		List<Subject> subjects = new ArrayList<Subject>(stats.size());
		for (SubjectStatistics s : stats)
			subjects.add(s.getSubject());
		List<SubjectExecutor.Outcome<double[]>> outcomes = executor.map(subjects,
				new SubjectExecutor.SubjectTask<double[]>() {
					@Override
					public double[] call(int index, Subject subject) {
						SubjectStatistics s = statList.get(index);
						try {
							return estimator.estimate(spec, global, prior, s, s.getPersonalization());
						} catch (NonConvergenceException | NumericalInstabilityException ex) {
							if (isZero(s.getPersonalization()))
								throw ex;
							logger.warning("personalization failed for subject '" + subject.getId() +
									"', retrying from zero: " + ex.getMessage());
							return estimator.estimate(spec, global, prior, s, new double[q]);
						}
					}
				});
		List<double[]> values = collect(outcomes);
		return values.toArray(new double[values.size()][]);
	}

	/**
	 * Estimates personalization vectors of the given subjects under fixed global parameters, alternating E-steps and
	 * personalization updates until the subject objective stabilizes.
	 * @return a copy of the parameters that includes the new personalization vectors
	 */
	public ParameterSet personalize(ParameterSet params, List<Subject> subjects) {
		final ModelSpecification spec = params.getSpecification();
		validateSubjects(spec, subjects);
		final ParameterSet result = params.copy();
		PersonalizationLayout layout = params.getLayout();
		if (layout.getDimension() == 0)
			return result;

		final GlobalParameters global = params.getGlobal();
		final PersonalizationPrior prior = createPrior(global);
		List<SubjectExecutor.Outcome<double[]>> outcomes = executor.map(subjects,
				new SubjectExecutor.SubjectTask<double[]>() {
					@Override
					public double[] call(int index, Subject subject) {
						double[] b = result.getPersonalization(subject.getId());
						double prev = Double.NEGATIVE_INFINITY;
						for (int iter = 0; iter < cfg.getMaxIterations(); iter++) {
							SubjectStatistics s = SubjectStatistics.compute(engine,
									new PersonalizedModel(spec, global, b), subject);
							double f = s.getLogLikelihood() + prior.logDensity(b);
							if ((f - prev) < cfg.getTolerance())
								break;
							prev = f;
							b = estimator.estimate(spec, global, prior, s, b);
						}
						return b;
					}
				});
		List<double[]> values = collect(outcomes);
		for (int i = 0; i < subjects.size(); i++)
			result.setPersonalization(subjects.get(i).getId(), values.get(i));
		return result;
	}

	private static <T> List<T> collect(List<SubjectExecutor.Outcome<T>> outcomes) {
		List<T> values = new ArrayList<T>(outcomes.size());
		for (SubjectExecutor.Outcome<T> o : outcomes) {
			if (o.isFailure())
				throw o.getError();
			values.add(o.get());
		}
		return values;
	}

	private static PersonalizationPrior createPrior(GlobalParameters global) {
		return (global.getCovariance() != null) ? new PersonalizationPrior(global.getCovariance()) :
				PersonalizationPrior.empty();
	}

	private static boolean isZero(double[] b) {
		for (double v : b) {
			if (v != 0.0)
				return false;
		}
		return true;
	}

	private static ParameterSet copyForSpecification(ModelSpecification spec, ParameterSet initial) {
		ParameterSet start = new ParameterSet(spec, initial.getGlobal());
		for (String id : initial.getSubjectIds())
			start.setPersonalization(id, initial.getPersonalization(id));
		return start;
	}

	static void validateSubjects(ModelSpecification spec, List<Subject> subjects) {
		if (subjects.isEmpty())
			throw new ConfigurationException("no subjects given");
		Set<String> ids = new HashSet<String>();
		for (Subject s : subjects) {
			if (!ids.add(s.getId()))
				throw new ConfigurationException("duplicate subject id", s.getId());
			spec.validate(s);
		}
	}

	private static int countObservations(List<Subject> subjects) {
		int n = 0;
		for (Subject s : subjects) {
			for (int t = 0; t < s.length(); t++) {
				if (s.isObserved(t))
					n++;
			}
		}
		return n;
	}

}
