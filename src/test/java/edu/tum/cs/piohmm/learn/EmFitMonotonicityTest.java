package edu.tum.cs.piohmm.learn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import edu.tum.cs.piohmm.FitConfiguration;
import edu.tum.cs.piohmm.FitResult;
import edu.tum.cs.piohmm.FitState;
import edu.tum.cs.piohmm.SyntheticData;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.ParameterSet;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.PersonalizationTarget;
import edu.tum.cs.piohmm.model.Subject;

/**
 * End-to-end fits of every emission family with transition or emission personalization, a time-gap covariate and
 * optionally left-to-right transitions. The orchestrator itself rejects a decreasing objective, so a completed fit
 * already shows that EM was monotone.
 */
@RunWith(Parameterized.class)
public class EmFitMonotonicityTest {

	private static final long seed = 880123L;
	private static final double monotonicityTolerance = 1E-6;

	@Parameters(name = "{0}, full covariance {1}, {2}, left-to-right {3}")
	public static Collection<Object[]> data() {
		List<Object[]> params = new ArrayList<Object[]>();
		Object[][] families = { { EmissionFamily.GAUSSIAN, false }, { EmissionFamily.GAUSSIAN, true },
				{ EmissionFamily.POISSON, false }, { EmissionFamily.CATEGORICAL, false } };
		for (Object[] family : families) {
			for (PersonalizationTarget target : PersonalizationTarget.values()) {
				params.add(new Object[] { family[0], family[1], target, false });
				params.add(new Object[] { family[0], family[1], target, true });
			}
		}
		return params;
	}

	private final EmissionFamily family;
	private final boolean fullCovariance;
	private final PersonalizationTarget target;
	private final boolean leftToRight;

	public EmFitMonotonicityTest(EmissionFamily family, boolean fullCovariance, PersonalizationTarget target,
			boolean leftToRight) {
		this.family = family;
		this.fullCovariance = fullCovariance;
		this.target = target;
		this.leftToRight = leftToRight;
	}

	private ModelSpecification createSpec() {
		ModelSpecification.Builder b = ModelSpecification.builder(3, family).withInputDimension(2)
				.withTransitionCovariates(0).withEmissionCovariates(1).withTimeGapCovariate()
				.withPersonalization(target);
		if (family == EmissionFamily.CATEGORICAL)
			b.withNumCategories(3);
		if (fullCovariance)
			b.withFullCovariance().withOutputDimension(2);
		if (leftToRight)
			b.withLeftToRightTransitions();
		return b.build();
	}

	@Test
	public void testMonotonicFit() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec();
		GlobalParameters truth = SyntheticData.randomParameters(spec, rand, 1.0);
		int q = new PersonalizationLayout(spec).getDimension();
		List<Subject> subjects = new ArrayList<Subject>();
		for (int i = 0; i < 10; i++) {
			double[] b = SyntheticData.randomVector(q, rand, 0.5);
			subjects.add(SyntheticData.sample("s" + i, spec, truth, b, SyntheticData.randomInputs(15, 2, rand),
					SyntheticData.randomTimes(15, rand), rand).subject);
		}

		FitConfiguration cfg = new FitConfiguration().withMaxIterations(12).withTolerance(1E-6).withNumRestarts(1)
				.withSeed(seed).withNumThreads(2).withMonotonicityTolerance(monotonicityTolerance);
		FitResult result = new EmOrchestrator(spec, cfg).fit(spec, subjects);
		assertTrue(result.getState() == FitState.CONVERGED || result.getState() == FitState.MAX_ITERATIONS_REACHED);

		List<Double> history = result.getObjectiveHistory();
		assertEquals(result.getNumIterations(), history.size());
		for (int i = 1; i < history.size(); i++) {
			double prev = history.get(i - 1);
			assertTrue(spec + ": iteration " + i,
					history.get(i) >= prev - (monotonicityTolerance * Math.max(1.0, Math.abs(prev))));
		}

		ParameterSet params = result.getParameters();
		params.getGlobal().validate(spec);
		if (leftToRight) {
			double[][] a = params.model("s0").transitionMatrix(new double[] { 1.0, 0.5, 1.0 });
			for (int j = 1; j < 3; j++) {
				for (int k = 0; k < j; k++)
					assertEquals(0.0, a[j][k], 0.0);
			}
		}
		for (Subject s : subjects)
			assertEquals(q, params.getPersonalization(s.getId()).length);
	}

}
