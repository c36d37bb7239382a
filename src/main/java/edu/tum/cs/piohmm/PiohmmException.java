package edu.tum.cs.piohmm;

/**
 * Base class of all errors raised while fitting or decoding a personalized input-output HMM. Carries the
 * identifier of the offending subject where the error can be attributed to one.
 */
public class PiohmmException extends RuntimeException {

	private static final long serialVersionUID = -2675021950465391380L;

	private final String subjectId;

	public PiohmmException(String message) {
		this(message, null, null);
	}

	public PiohmmException(String message, String subjectId) {
		this(message, subjectId, null);
	}

	public PiohmmException(String message, String subjectId, Throwable cause) {
		super((subjectId != null) ? message + " (subject '" + subjectId + "')" : message, cause);
		this.subjectId = subjectId;
	}

	/** @return identifier of the subject that caused the error, or null */
	public String getSubjectId() {
		return subjectId;
	}

	/** Returns an exception of the same kind that names the given subject. */
	public PiohmmException forSubject(String subjectId) {
		return new PiohmmException(getMessage(), subjectId, this);
	}

}
