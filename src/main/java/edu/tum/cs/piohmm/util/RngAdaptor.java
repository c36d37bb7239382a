package edu.tum.cs.piohmm.util;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/** Exposes a Commons RNG provider to Commons Math classes such as the k-means++ clusterer. */
public class RngAdaptor implements RandomGenerator {

	private final UniformRandomProvider rng;
	private final NormalizedGaussianSampler gaussian;

	public RngAdaptor(UniformRandomProvider rng) {
		this.rng = rng;
		this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
	}

	@Override
	public boolean nextBoolean() {
		return rng.nextBoolean();
	}

	@Override
	public void nextBytes(byte[] b) {
		rng.nextBytes(b);
	}

	@Override
	public double nextDouble() {
		return rng.nextDouble();
	}

	@Override
	public float nextFloat() {
		return rng.nextFloat();
	}

	@Override
	public double nextGaussian() {
		return gaussian.sample();
	}

	@Override
	public int nextInt() {
		return rng.nextInt();
	}

	@Override
	public int nextInt(int n) {
		return rng.nextInt(n);
	}

	@Override
	public long nextLong() {
		return rng.nextLong();
	}

	@Override
	public void setSeed(int seed) {
		throw new UnsupportedOperationException("provider is seeded by RandomSource.create");
	}

	@Override
	public void setSeed(int[] seed) {
		throw new UnsupportedOperationException("provider is seeded by RandomSource.create");
	}

	@Override
	public void setSeed(long seed) {
		throw new UnsupportedOperationException("provider is seeded by RandomSource.create");
	}

}
