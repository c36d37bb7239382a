package edu.tum.cs.piohmm.math;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import edu.tum.cs.piohmm.NumericalInstabilityException;

public class NewtonMaximizerTest {

	/** -(x - a)' A (x - a) with positive definite A */
	private static class Quadratic implements ConcaveObjective {
		private final double[] a = { 1.0, -2.0, 0.5 };
		private final double[][] m = { { 2.0, 0.5, 0.0 }, { 0.5, 1.0, 0.2 }, { 0.0, 0.2, 3.0 } };

		@Override
		public int getDimension() {
			return 3;
		}

		@Override
		public double value(double[] x) {
			double v = 0.0;
			for (int i = 0; i < 3; i++)
				for (int j = 0; j < 3; j++)
					v -= (x[i] - a[i]) * m[i][j] * (x[j] - a[j]);
			return v;
		}

		@Override
		public double evaluate(double[] x, double[] gradient, double[][] hessian) {
			for (int i = 0; i < 3; i++) {
				for (int j = 0; j < 3; j++) {
					gradient[i] -= 2.0 * m[i][j] * (x[j] - a[j]);
					hessian[i][j] -= 2.0 * m[i][j];
				}
			}
			return value(x);
		}
	}

	/** -cosh(x - 3), a smooth concave function with a non-quadratic shape */
	private static class NegCosh implements ConcaveObjective {
		@Override
		public int getDimension() {
			return 1;
		}

		@Override
		public double value(double[] x) {
			return -Math.cosh(x[0] - 3.0);
		}

		@Override
		public double evaluate(double[] x, double[] gradient, double[][] hessian) {
			gradient[0] -= Math.sinh(x[0] - 3.0);
			hessian[0][0] -= Math.cosh(x[0] - 3.0);
			return value(x);
		}
	}

	@Test
	public void testQuadratic() {
		NewtonMaximizer.Result r = new NewtonMaximizer(10, 1E-10).maximize(new Quadratic(), new double[3]);
		assertTrue(r.converged);
		assertArrayEquals(new double[] { 1.0, -2.0, 0.5 }, r.x, 1E-10);
		assertEquals(0.0, r.value, 1E-15);
		assertTrue(r.numIterations <= 2);
	}

	@Test
	public void testNonQuadratic() {
		NewtonMaximizer.Result r = new NewtonMaximizer(50, 1E-10).maximize(new NegCosh(), new double[] { -4.0 });
		assertTrue(r.converged);
		assertEquals(3.0, r.x[0], 1E-5);
	}

	@Test
	public void testIterationBound() {
		double[] start = { 10.0 };
		NegCosh f = new NegCosh();
		NewtonMaximizer.Result r = new NewtonMaximizer(1, 1E-10).maximize(f, start);
		assertFalse(r.converged);
		assertEquals(10.0, start[0], 0.0);
		assertTrue(r.value > f.value(start));
	}

	@Test
	public void testEmptyProblem() {
		ConcaveObjective empty = new ConcaveObjective() {
			@Override
			public int getDimension() {
				return 0;
			}

			@Override
			public double value(double[] x) {
				return -1.0;
			}

			@Override
			public double evaluate(double[] x, double[] gradient, double[][] hessian) {
				return -1.0;
			}
		};
		NewtonMaximizer.Result r = new NewtonMaximizer(5, 1E-8).maximize(empty, new double[0]);
		assertTrue(r.converged);
		assertEquals(-1.0, r.value, 0.0);
	}

	@Test
	public void testNonFiniteStart() {
		try {
			new NewtonMaximizer(5, 1E-8).maximize(new Quadratic(), new double[] { Double.NaN, 0.0, 0.0 });
			fail("expected NumericalInstabilityException");
		} catch (NumericalInstabilityException ex) {
			// expected
		}
	}

}
