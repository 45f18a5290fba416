package works.ragged.exceptions;

/**
 * The input does not have the structure of a serialized Form:
 * a required member is missing, or a member has the wrong JSON type.
 */
public final class MalformedFormException extends FormFormatException {
	public MalformedFormException(String message) {
		super(message);
	}

	public MalformedFormException(String message, Throwable cause) {
		super(message, cause);
	}
}
