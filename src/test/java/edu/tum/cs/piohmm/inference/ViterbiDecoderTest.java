package edu.tum.cs.piohmm.inference;

import static org.junit.Assert.assertArrayEquals;
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

public class ViterbiDecoderTest {

	private static final long seed = 4471L;

	private final ViterbiDecoder decoder = new ViterbiDecoder();

	private void checkAgainstBruteForce(ModelSpecification spec, int numSteps, int numTrials,
			UniformRandomProvider rand) {
		int numStates = spec.getNumStates();
		int q = new PersonalizationLayout(spec).getDimension();
		for (int i = 0; i < numTrials; i++) {
			GlobalParameters global = SyntheticData.randomParameters(spec, rand, 1.5);
			PersonalizedModel model = new PersonalizedModel(spec, global, SyntheticData.randomVector(q, rand, 0.5));
			Subject s = SyntheticData.sample("s", spec, global, model.getPersonalization(),
					SyntheticData.randomInputs(numSteps, spec.getInputDimension(), rand), rand).subject;

			Path path = decoder.decode(model, s);
			assertEquals(numSteps, path.length());
			assertEquals(SyntheticData.jointLogProbability(model, s, path.getStates()), path.getLogProbability(),
					1E-9);

			double best = Double.NEGATIVE_INFINITY;
			long numPaths = (long) Math.pow(numStates, numSteps);
			for (long p = 0; p < numPaths; p++) {
				int[] candidate = SyntheticData.decodePathIndex(p, numStates, numSteps);
				double lp = SyntheticData.jointLogProbability(model, s, candidate);
				assertTrue(path.getLogProbability() >= lp - 1E-9);
				best = Math.max(best, lp);
			}
			assertEquals(best, path.getLogProbability(), 1E-9);
		}
	}

	@Test
	public void testTwoStatesThreeSteps() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		checkAgainstBruteForce(SyntheticData.twoStateGaussianSpec(), 3, 20, rand);
	}

	@Test
	public void testPersonalizedCovariateModel() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = ModelSpecification.builder(3, EmissionFamily.CATEGORICAL).withNumCategories(3)
				.withInputDimension(2).withTransitionCovariates(0, 1).withEmissionCovariates(0)
				.withPersonalization(PersonalizationTarget.TRANSITION, PersonalizationTarget.EMISSION).build();
		checkAgainstBruteForce(spec, 5, 10, rand);
	}

	@Test
	public void testLeftToRight() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		ModelSpecification spec = ModelSpecification.builder(3, EmissionFamily.POISSON).withLeftToRightTransitions()
				.build();
		checkAgainstBruteForce(spec, 4, 10, rand);
		for (int i = 0; i < 20; i++) {
			GlobalParameters global = SyntheticData.randomParameters(spec, rand, 2.0);
			PersonalizedModel model = new PersonalizedModel(spec, global, new double[0]);
			Subject s = SyntheticData.sample("s", spec, global, new double[0], new double[12][0], rand).subject;
			int[] states = decoder.decode(model, s).getStates();
			for (int t = 1; t < states.length; t++)
				assertTrue(states[t] >= states[t - 1]);
		}
	}

	@Test
	public void testTieBreaking() {
		// both states are indistinguishable, so every path has the same probability
		ModelSpecification spec = SyntheticData.twoStateGaussianSpec();
		GlobalParameters global = SyntheticData.twoStateGaussian(0.5, 1.0, 1.0, 2.0);
		PersonalizedModel model = new PersonalizedModel(spec, global, new double[0]);
		Subject s = Subject.univariate("tie", new double[4][0], new double[] { 0.3, 1.7, -0.4, 1.0 });
		Path path = decoder.decode(model, s);
		assertArrayEquals(new int[] { 0, 0, 0, 0 }, path.getStates());
	}

	@Test
	public void testSingleStep() {
		ModelSpecification spec = SyntheticData.twoStateGaussianSpec();
		GlobalParameters global = SyntheticData.twoStateGaussian(0.8, 0.0, 5.0, 1.0);
		PersonalizedModel model = new PersonalizedModel(spec, global, new double[0]);
		Subject s = Subject.univariate("one", new double[1][0], new double[] { 4.2 });
		Path path = decoder.decode(model, s);
		assertEquals(1, path.length());

		double[] score = new double[2];
		model.logEmissions(s, 0, score);
		for (int k = 0; k < 2; k++)
			score[k] += model.logInitial(k);
		assertEquals(LogSpace.argMax(score), path.getState(0));
		assertEquals(1, path.getState(0));
		assertEquals(score[1], path.getLogProbability(), 1E-12);
	}

	@Test
	public void testNonFiniteInput() {
		ModelSpecification spec = ModelSpecification.builder(2, EmissionFamily.GAUSSIAN).withInputDimension(1)
				.withEmissionCovariates(0).build();
		GlobalParameters global = SyntheticData.randomParameters(spec,
				RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed), 1.0);
		Subject s = Subject.univariate("bad", new double[][] { { 0.0 }, { Double.POSITIVE_INFINITY } },
				new double[] { 0.0, 1.0 });
		try {
			decoder.decode(new PersonalizedModel(spec, global, new double[0]), s);
			fail("expected NumericalInstabilityException");
		} catch (NumericalInstabilityException ex) {
			assertEquals("bad", ex.getSubjectId());
		}
	}

	@Test
	public void testNonFiniteUnusedInput() {
		ModelSpecification spec = ModelSpecification.builder(2, EmissionFamily.GAUSSIAN).withInputDimension(2)
				.withEmissionCovariates(0).build();
		GlobalParameters global = SyntheticData.randomParameters(spec,
				RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed), 1.0);
		Subject s = Subject.univariate("unused", new double[][] { { 0.0, 1.0 }, { 0.5, Double.NaN } },
				new double[] { 0.0, 1.0 });
		try {
			decoder.decode(new PersonalizedModel(spec, global, new double[0]), s);
			fail("expected NumericalInstabilityException");
		} catch (NumericalInstabilityException ex) {
			assertEquals("unused", ex.getSubjectId());
		}
	}

}
