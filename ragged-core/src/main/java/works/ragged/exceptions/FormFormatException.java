package works.ragged.exceptions;

/**
 * A serialized Form could not be read.
 */
public sealed abstract class FormFormatException extends IllegalArgumentException permits
	MalformedFormException,
	UnrecognizedFormClassException,
	UnsupportedLegacyFormatException
{
	protected FormFormatException(String message) {
		super(message);
	}

	protected FormFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
