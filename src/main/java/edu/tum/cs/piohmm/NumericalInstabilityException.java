package edu.tum.cs.piohmm;

/** Underflow or non-finite probabilities during forward-backward or decoding. */
public class NumericalInstabilityException extends PiohmmException {

	private static final long serialVersionUID = 3120974436178316542L;

	public NumericalInstabilityException(String message) {
		super(message);
	}

	public NumericalInstabilityException(String message, String subjectId) {
		super(message, subjectId);
	}

	public NumericalInstabilityException(String message, String subjectId, Throwable cause) {
		super(message, subjectId, cause);
	}

	@Override
	public NumericalInstabilityException forSubject(String subjectId) {
		return new NumericalInstabilityException(getMessage(), subjectId, this);
	}

}
