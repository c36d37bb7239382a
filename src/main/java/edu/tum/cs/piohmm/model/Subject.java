package edu.tum.cs.piohmm.model;

import java.io.Serializable;

/**
 * Longitudinal record of one tracked subject: per time step an input (covariate) vector and an observed output
 * vector, aligned index for index. Optional visit times allow irregular spacing; an optional observation mask marks
 * missed visits whose output carries no evidence.
 */
public class Subject implements Serializable {

	private static final long serialVersionUID = 2953036460390108170L;

	private final String id;
	private final double[][] inputs;
	private final double[][] outputs;
	private final double[] times;
	private final boolean[] observed;

	public Subject(String id, double[][] inputs, double[][] outputs) {
		this(id, inputs, outputs, null, null);
	}

	/**
	 * @param times strictly increasing visit times, or null for 0, 1, ..., T-1
	 * @param observed observation mask, or null if every output was observed
	 */
	public Subject(String id, double[][] inputs, double[][] outputs, double[] times, boolean[] observed) {
		if (id == null)
			throw new IllegalArgumentException("subject id must not be null");
		if ((inputs == null) || (outputs == null) || (outputs.length == 0))
			throw new IllegalArgumentException("subject '" + id + "' has an empty sequence");
		if (inputs.length != outputs.length)
			throw new IllegalArgumentException("subject '" + id + "': " + inputs.length + " input rows, but " +
					outputs.length + " output rows");
		int numInputs = inputs[0].length;
		int numOutputs = outputs[0].length;
		for (int t = 0; t < outputs.length; t++) {
			if ((inputs[t].length != numInputs) || (outputs[t].length != numOutputs))
				throw new IllegalArgumentException("subject '" + id + "': ragged row at step " + t);
		}
		if (times != null) {
			if (times.length != outputs.length)
				throw new IllegalArgumentException("subject '" + id + "': times not aligned with outputs");
			for (int t = 1; t < times.length; t++) {
				if (!(times[t] > times[t - 1]))
					throw new IllegalArgumentException("subject '" + id + "': times not strictly increasing at step " +
							t);
			}
		}
		if ((observed != null) && (observed.length != outputs.length))
			throw new IllegalArgumentException("subject '" + id + "': observation mask not aligned with outputs");

		this.id = id;
		this.inputs = copy(inputs);
		this.outputs = copy(outputs);
		this.times = (times != null) ? times.clone() : null;
		this.observed = (observed != null) ? observed.clone() : null;
	}

	/** Convenience constructor for subjects with a single output column. */
	public static Subject univariate(String id, double[][] inputs, double[] outputs) {
		double[][] y = new double[outputs.length][1];
		for (int t = 0; t < outputs.length; t++)
			y[t][0] = outputs[t];
		return new Subject(id, inputs, y);
	}

	private static double[][] copy(double[][] m) {
		double[][] c = new double[m.length][];
		for (int i = 0; i < m.length; i++)
			c[i] = m[i].clone();
		return c;
	}

	public String getId() {
		return id;
	}

	public int length() {
		return outputs.length;
	}

	public int getInputDimension() {
		return inputs[0].length;
	}

	public int getOutputDimension() {
		return outputs[0].length;
	}

	public double getInput(int t, int column) {
		return inputs[t][column];
	}

	public double[] getOutput(int t) {
		return outputs[t];
	}

	public double getTime(int t) {
		return (times != null) ? times[t] : t;
	}

	public boolean isObserved(int t) {
		return (observed == null) || observed[t];
	}

	/** @return a copy of this subject with one input value replaced */
	public Subject withInput(int t, int column, double value) {
		double[][] in = copy(inputs);
		in[t][column] = value;
		return new Subject(id, in, outputs, times, observed);
	}

	@Override
	public String toString() {
		return "Subject [id=" + id + ", length=" + outputs.length + "]";
	}

}
