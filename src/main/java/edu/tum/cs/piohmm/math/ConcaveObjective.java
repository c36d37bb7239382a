package edu.tum.cs.piohmm.math;

/** A twice differentiable concave function to be maximized by {@link NewtonMaximizer}. */
public interface ConcaveObjective {

	int getDimension();

	double value(double[] x);

	/**
	 * Computes the value at x and accumulates the gradient and the (negative semi-definite) Hessian into the given
	 * arrays, which the caller has zeroed.
	 */
	double evaluate(double[] x, double[] gradient, double[][] hessian);

}
