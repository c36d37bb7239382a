package edu.tum.cs.piohmm;

/** The monitored EM objective decreased between two iterations, which indicates a defect. */
public class MonotonicityViolationException extends PiohmmException {

	private static final long serialVersionUID = -1268870415069124687L;

	public MonotonicityViolationException(String message) {
		super(message);
	}

	public MonotonicityViolationException(String message, String subjectId) {
		super(message, subjectId);
	}

	public MonotonicityViolationException(String message, String subjectId, Throwable cause) {
		super(message, subjectId, cause);
	}

	@Override
	public MonotonicityViolationException forSubject(String subjectId) {
		return new MonotonicityViolationException(getMessage(), subjectId, this);
	}

}
