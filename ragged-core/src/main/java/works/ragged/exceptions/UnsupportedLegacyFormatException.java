package works.ragged.exceptions;

/**
 * The input uses a legacy construct that we deliberately don't convert.
 */
public final class UnsupportedLegacyFormatException extends FormFormatException {
	public UnsupportedLegacyFormatException(String message) {
		super(message);
	}
}
