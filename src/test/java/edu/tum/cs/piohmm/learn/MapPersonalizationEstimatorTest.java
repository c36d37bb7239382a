package edu.tum.cs.piohmm.learn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.Test;

import edu.tum.cs.piohmm.NonConvergenceException;
import edu.tum.cs.piohmm.SyntheticData;
import edu.tum.cs.piohmm.inference.ForwardBackwardEngine;
import edu.tum.cs.piohmm.model.EmissionFamily;
import edu.tum.cs.piohmm.model.GlobalParameters;
import edu.tum.cs.piohmm.model.ModelSpecification;
import edu.tum.cs.piohmm.model.PersonalizationLayout;
import edu.tum.cs.piohmm.model.PersonalizationTarget;
import edu.tum.cs.piohmm.model.PersonalizedModel;
import edu.tum.cs.piohmm.model.Subject;

public class MapPersonalizationEstimatorTest {

	private static final long seed = 5519L;

	private final ForwardBackwardEngine engine = new ForwardBackwardEngine();

	@Test
	public void testGaussianInterceptOffset() {
		ModelSpecification spec = ModelSpecification.builder(2, EmissionFamily.GAUSSIAN)
				.withPersonalization(PersonalizationTarget.EMISSION).build();
		double[] mean = { -1.0, 3.0 };
		double[] var = { 1.0, 2.0 };
		double priorVar = 0.5;
		GlobalParameters global = new GlobalParameters(new double[] { 0.5, 0.5 }, new double[2][2][1],
				new double[][][] { { { mean[0] } }, { { mean[1] } } }, new double[][] { { var[0] }, { var[1] } },
				new double[][] { { priorVar } });
		Subject s = Subject.univariate("s", new double[4][0], new double[] { 0.2, 2.5, -0.7, 3.4 });
		SubjectStatistics stats = SubjectStatistics.compute(engine, new PersonalizedModel(spec, global,
				new double[1]), s);
		PersonalizationPrior prior = new PersonalizationPrior(global.getCovariance());

		// the subject objective is quadratic in the offset
		double[][] gamma = stats.getPosterior().stateMarginals();
		double num = 0.0;
		double den = 1.0 / priorVar;
		for (int t = 0; t < s.length(); t++) {
			for (int k = 0; k < 2; k++) {
				num += gamma[t][k] * (s.getOutput(t)[0] - mean[k]) / var[k];
				den += gamma[t][k] / var[k];
			}
		}
		double[] b = new MapPersonalizationEstimator(20, 1E-10).estimate(spec, global, prior, stats, new double[1]);
		assertEquals(1, b.length);
		assertEquals(num / den, b[0], 1E-8);
	}

	@Test
	public void testNonConvergence() {
		ModelSpecification spec = ModelSpecification.builder(2, EmissionFamily.POISSON)
				.withPersonalization(PersonalizationTarget.EMISSION).build();
		GlobalParameters global = new GlobalParameters(new double[] { 0.5, 0.5 }, new double[2][2][1],
				new double[][][] { { { 0.0 } }, { { 1.0 } } }, null, new double[][] { { 10.0 } });
		Subject s = Subject.univariate("slow", new double[5][0], new double[] { 20, 25, 18, 30, 22 });
		SubjectStatistics stats = SubjectStatistics.compute(engine, new PersonalizedModel(spec, global,
				new double[1]), s);
		PersonalizationPrior prior = new PersonalizationPrior(global.getCovariance());
		try {
			new MapPersonalizationEstimator(1, 1E-10).estimate(spec, global, prior, stats, new double[1]);
			fail("expected NonConvergenceException");
		} catch (NonConvergenceException ex) {
			assertEquals("slow", ex.getSubjectId());
		}
		// enough iterations reach the optimum
		double[] b = new MapPersonalizationEstimator(50, 1E-10).estimate(spec, global, prior, stats, new double[1]);
		assertEquals(1, b.length);
	}

	@Test
	public void testDerivatives() {
		UniformRandomProvider rand = RandomSource.create(RandomSource.XOR_SHIFT_1024_S, seed);
		for (EmissionFamily family : EmissionFamily.values()) {
			ModelSpecification.Builder builder = ModelSpecification.builder(3, family).withInputDimension(2)
					.withTransitionCovariates(0).withEmissionCovariates(1)
					.withPersonalization(PersonalizationTarget.TRANSITION, PersonalizationTarget.EMISSION);
			if (family == EmissionFamily.CATEGORICAL)
				builder.withNumCategories(3);
			ModelSpecification spec = builder.build();
			int q = new PersonalizationLayout(spec).getDimension();

			GlobalParameters global = SyntheticData.randomParameters(spec, rand, 1.0);
			double[] bTrue = SyntheticData.randomVector(q, rand, 0.5);
			Subject s = SyntheticData.sample("s", spec, global, bTrue, SyntheticData.randomInputs(15, 2, rand),
					rand).subject;
			SubjectStatistics stats = SubjectStatistics.compute(engine, new PersonalizedModel(spec, global, bTrue),
					s);
			PersonalizationPrior prior = new PersonalizationPrior(global.getCovariance());
			MapPersonalizationEstimator.SubjectObjective f = new MapPersonalizationEstimator.SubjectObjective(spec,
					global, prior, stats);
			assertEquals(q, f.getDimension());

			double[] b = SyntheticData.randomVector(q, rand, 0.5);
			double[] grad = new double[q];
			double[][] hess = new double[q][q];
			double value = f.evaluate(b, grad, hess);
			assertEquals(f.value(b), value, 1E-10);

			double h = 1E-5;
			for (int i = 0; i < q; i++) {
				double[] up = b.clone();
				double[] down = b.clone();
				up[i] += h;
				down[i] -= h;
				double numeric = (f.value(up) - f.value(down)) / (2.0 * h);
				assertEquals(family + " gradient " + i, numeric, grad[i], 1E-5 * Math.max(1.0, Math.abs(numeric)));

				double[] gUp = new double[q];
				double[] gDown = new double[q];
				f.evaluate(up, gUp, new double[q][q]);
				f.evaluate(down, gDown, new double[q][q]);
				for (int j = 0; j < q; j++) {
					double numericH = (gUp[j] - gDown[j]) / (2.0 * h);
					assertEquals(family + " hessian " + i + "," + j, numericH, hess[j][i],
							1E-5 * Math.max(1.0, Math.abs(numericH)));
				}
			}
		}
	}

}
