package edu.tum.cs.piohmm;

/** The per-subject personalization search did not reach a fixed point within its iteration limit. */
public class NonConvergenceException extends PiohmmException {

	private static final long serialVersionUID = 8817532305413396240L;

	public NonConvergenceException(String message) {
		super(message);
	}

	public NonConvergenceException(String message, String subjectId) {
		super(message, subjectId);
	}

	public NonConvergenceException(String message, String subjectId, Throwable cause) {
		super(message, subjectId, cause);
	}

	@Override
	public NonConvergenceException forSubject(String subjectId) {
		return new NonConvergenceException(getMessage(), subjectId, this);
	}

}
