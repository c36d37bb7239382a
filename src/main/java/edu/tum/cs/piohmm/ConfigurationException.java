package edu.tum.cs.piohmm;

/** Invalid model specification or subject data; never recoverable. */
public class ConfigurationException extends PiohmmException {

	private static final long serialVersionUID = -5410396018733325826L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, String subjectId) {
		super(message, subjectId);
	}

	public ConfigurationException(String message, String subjectId, Throwable cause) {
		super(message, subjectId, cause);
	}

	@Override
	public ConfigurationException forSubject(String subjectId) {
		return new ConfigurationException(getMessage(), subjectId, this);
	}

}
