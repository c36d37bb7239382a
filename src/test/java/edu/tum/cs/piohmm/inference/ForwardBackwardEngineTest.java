package edu.tum.cs.piohmm.inference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.Test;

import edu.tum.cs.piohmm.NumericalInstabilityException;
import edu.tum.cs.piohmm.SyntheticData;
import edu.tum.cs.piohmm.math.LogSpace;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.PersonalizationTarget;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

public class ForwardBackwardEngineTest {

	private static final long seed = 190877L;
	private static final double eps = 1E-9;

	private final ForwardBackwardEngine engine = new ForwardBackwardEngine();

	private static ModelSpecification createSpec(EmissionFamily family) {
		ModelSpecification.Builder b = ModelSpecification.builder(3, family).withInputDimension(2)
				.withTransitionCovariates(0).withEmissionCovariates(1)
				.withPersonalization(PersonalizationTarget.TRANSITION, PersonalizationTarget.EMISSION);
		if (family == EmissionFamily.CATEGORICAL)
			b.withNumCategories(4);
		else if (family == EmissionFamily.GAUSSIAN)
			b.withOutputDimension(2);
		return b.build();
	}

	private static PersonalizedModel randomModel(ModelSpecification spec, UniformRandomProvider rand) {
		GlobalParameters global = SyntheticData.randomParameters(spec, rand, 1.5);
		double[] b = SyntheticData.randomVector(new PersonalizationLayout(spec).getDimension(), rand, 0.5);
		return new PersonalizedModel(spec, global, b);
	}

	private static void checkPosterior(Posterior post) {
		for (int t = 0; t < post.length(); t++) {
			assertEquals(1.0, LogSpace.sum(post.getStateMarginals(t)), eps);
			assertEquals(1.0, LogSpace.sum(post.getFiltered(t)), eps);
		}
		int numStates = post.getNumStates();
		for (int t = 1; t < post.length(); t++) {
			double sum = 0.0;
			for (int j = 0; j < numStates; j++) {
				double rowSum = 0.0;
				for (int k = 0; k < numStates; k++) {
					assertTrue(post.getTransitionMarginal(t, j, k) >= 0.0);
					rowSum += post.getTransitionMarginal(t, j, k);
				}
				// pairwise marginals are consistent with the state marginals of both steps
				assertEquals(post.getStateMarginal(t - 1, j), rowSum, 1E-8);
				sum += rowSum;
			}
			assertEquals(1.0, sum, eps);
			for (int k = 0; k < numStates; k++) {
				double colSum = 0.0;
				for (int j = 0; j < numStates; j++)
					colSum += post.getTransitionMarginal(t, j, k);
				assertEquals(post.getStateMarginal(t, k), colSum, 1E-8);
			}
		}
		assertEquals(post.getLogLikelihood(), post.getBackwardLogLikelihood(),
				1E-8 * Math.max(1.0, Math.abs(post.getLogLikelihood())));
	}

	@Test
	public void testMarginals() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		for (EmissionFamily family : EmissionFamily.values()) {
			ModelSpecification spec = createSpec(family);
			for (int i = 0; i < 10; i++) {
				PersonalizedModel model = randomModel(spec, rand);
				SyntheticData.Sample sample = SyntheticData.sample("s" + i, spec, model.getGlobal(),
						model.getPersonalization(), SyntheticData.randomInputs(25, 2, rand), rand);
				Posterior post = engine.run(model, sample.subject);
				assertEquals(25, post.length());
				assertEquals(24, post.getNumTransitions());
				checkPosterior(post);
			}
		}
	}

	@Test
	public void testBruteForceLikelihood() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec(EmissionFamily.POISSON);
		int numSteps = 4;
		for (int i = 0; i < 5; i++) {
			PersonalizedModel model = randomModel(spec, rand);
			Subject s = SyntheticData.sample("s", spec, model.getGlobal(), model.getPersonalization(),
					SyntheticData.randomInputs(numSteps, 2, rand), rand).subject;

			int numPaths = (int) Math.pow(spec.getNumStates(), numSteps);
			double[] joint = new double[numPaths];
			double[] first = new double[spec.getNumStates()];
			for (int p = 0; p < numPaths; p++) {
				int[] path = SyntheticData.decodePathIndex(p, spec.getNumStates(), numSteps);
				joint[p] = SyntheticData.jointLogProbability(model, s, path);
			}
			double logLikelihood = LogSpace.logSumExp(joint);
			for (int p = 0; p < numPaths; p++) {
				int[] path = SyntheticData.decodePathIndex(p, spec.getNumStates(), numSteps);
				first[path[0]] += Math.exp(joint[p] - logLikelihood);
			}

			Posterior post = engine.run(model, s);
			assertEquals(logLikelihood, post.getLogLikelihood(), 1E-9);
			for (int k = 0; k < spec.getNumStates(); k++)
				assertEquals(first[k], post.getStateMarginal(0, k), 1E-9);
		}
	}

	@Test
	public void testSingleStep() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec(EmissionFamily.GAUSSIAN);
		PersonalizedModel model = randomModel(spec, rand);
		Subject s = new Subject("single", new double[][] { { 0.3, -0.2 } }, new double[][] { { 0.5, 1.0 } });
		Posterior post = engine.run(model, s);
		assertEquals(1, post.length());
		assertEquals(0, post.getNumTransitions());
		assertEquals(1.0, LogSpace.sum(post.getStateMarginals(0)), eps);

		double[] joint = new double[spec.getNumStates()];
		model.logEmissions(s, 0, joint);
		for (int k = 0; k < joint.length; k++)
			joint[k] += model.logInitial(k);
		assertEquals(LogSpace.logSumExp(joint), post.getLogLikelihood(), eps);
		assertEquals(post.getLogLikelihood(), post.getBackwardLogLikelihood(), eps);
	}

	@Test
	public void testLongSequence() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec(EmissionFamily.GAUSSIAN);
		PersonalizedModel model = randomModel(spec, rand);
		Subject s = SyntheticData.sample("long", spec, model.getGlobal(), model.getPersonalization(),
				SyntheticData.randomInputs(5000, 2, rand), rand).subject;
		Posterior post = engine.run(model, s);
		assertTrue(Double.isFinite(post.getLogLikelihood()));
		assertTrue(post.getLogLikelihood() < -1000.0);
		double sum = 0.0;
		for (int t = 0; t < post.length(); t++)
			sum += post.getLogScale(t);
		assertEquals(post.getLogLikelihood(), sum, 0.0);
		checkPosterior(post);
	}

	@Test
	public void testUnobservedSteps() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec(EmissionFamily.POISSON);
		PersonalizedModel model = randomModel(spec, rand);
		double[][] x = SyntheticData.randomInputs(6, 2, rand);
		Subject hidden = new Subject("hidden", x, new double[6][1], null, new boolean[6]);
		Posterior post = engine.run(model, hidden);
		// no evidence at all: the outputs are certain to be "explained"
		assertEquals(0.0, post.getLogLikelihood(), 1E-12);
		checkPosterior(post);
	}

	@Test
	public void testNonFiniteInput() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = createSpec(EmissionFamily.GAUSSIAN);
		PersonalizedModel model = randomModel(spec, rand);
		Subject s = SyntheticData.sample("nan", spec, model.getGlobal(), model.getPersonalization(),
				SyntheticData.randomInputs(5, 2, rand), rand).subject;
		for (int col = 0; col < 2; col++) {
			try {
				engine.run(model, s.withInput(3, col, Double.NaN));
				fail("expected NumericalInstabilityException");
			} catch (NumericalInstabilityException ex) {
				assertEquals("nan", ex.getSubjectId());
			}
		}
	}

	@Test
	public void testNonFiniteUnusedInput() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = ModelSpecification.builder(2, EmissionFamily.GAUSSIAN).withInputDimension(2)
				.withEmissionCovariates(0).build();
		GlobalParameters global = SyntheticData.randomParameters(spec, rand, 1.0);
		PersonalizedModel model = new PersonalizedModel(spec, global, new double[0]);
		Subject s = SyntheticData.sample("unused", spec, global, new double[0], SyntheticData.randomInputs(4, 2, rand),
				rand).subject;
		engine.run(model, s);
		try {
			engine.run(model, s.withInput(2, 1, Double.NaN));
			fail("expected NumericalInstabilityException");
		} catch (NumericalInstabilityException ex) {
			assertEquals("unused", ex.getSubjectId());
		}
	}

	@Test
	public void testDegenerateParameters() {
		ModelSpecification spec = SyntheticData.twoStateGaussianSpec();
		GlobalParameters global = SyntheticData.twoStateGaussian(0.9, Double.NaN, 1.0, 1.0);
		Subject s = Subject.univariate("deg", new double[2][0], new double[] { 0.0, 1.0 });
		try {
			engine.run(new PersonalizedModel(spec, global, new double[0]), s);
			fail("expected NumericalInstabilityException");
		} catch (NumericalInstabilityException ex) {
			assertEquals("deg", ex.getSubjectId());
		}
	}

}
