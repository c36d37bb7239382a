package edu.tum.cs.piohmm.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import edu.tum.cs.piohmm.ConfigurationException;

/**
 * Complete state of a fitted model: the specification, the current global parameter snapshot and one
 * personalization vector per known subject. Subjects without an entry use the zero vector.
 */
public class ParameterSet implements Serializable {

	private static final long serialVersionUID = 4410295872318563349L;

	private final ModelSpecification spec;
	private final PersonalizationLayout layout;
	private GlobalParameters global;
	private final Map<String, double[]> personalization = new LinkedHashMap<String, double[]>();

	public ParameterSet(ModelSpecification spec, GlobalParameters global) {
		this.spec = spec;
		this.layout = new PersonalizationLayout(spec);
		setGlobal(global);
	}

	public ModelSpecification getSpecification() {
		return spec;
	}

	public PersonalizationLayout getLayout() {
		return layout;
	}

	public GlobalParameters getGlobal() {
		return global;
	}

	public void setGlobal(GlobalParameters global) {
		global.validate(spec);
		this.global = global;
	}

	public boolean hasPersonalization(String subjectId) {
		return personalization.containsKey(subjectId);
	}

	/** @return a copy of the subject's personalization vector, or the zero vector if none was estimated */
	public double[] getPersonalization(String subjectId) {
		double[] b = personalization.get(subjectId);
		return (b != null) ? b.clone() : new double[layout.getDimension()];
	}

	public void setPersonalization(String subjectId, double[] b) {
		if (b.length != layout.getDimension())
			throw new ConfigurationException("personalization vector of length " + b.length + ", expected " +
					layout.getDimension(), subjectId);
		personalization.put(subjectId, b.clone());
	}

	public Set<String> getSubjectIds() {
		return Collections.unmodifiableSet(personalization.keySet());
	}

	public ParameterSet copy() {
		ParameterSet c = new ParameterSet(spec, global);
		for (Map.Entry<String, double[]> e : personalization.entrySet())
			c.personalization.put(e.getKey(), e.getValue().clone());
		return c;
	}

	/** Materializes the model of one subject under the current parameters. */
	public PersonalizedModel model(String subjectId) {
		return new PersonalizedModel(spec, global, getPersonalization(subjectId));
	}

}
