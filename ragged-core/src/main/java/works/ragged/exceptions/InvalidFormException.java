package works.ragged.exceptions;

/**
 * A {@link works.ragged.forms.Form Form} was constructed with a field value
 * outside that field's domain.
 */
public class InvalidFormException extends IllegalArgumentException {
	private final Class<?> formClass;
	private final String fieldName;

	public Class<?> formClass() {
		return this.formClass;
	}

	public String fieldName() {
		return this.fieldName;
	}

	public InvalidFormException(Class<?> formClass, String fieldName, String message) {
		super(fullMessage(formClass, fieldName, message));
		this.formClass = formClass;
		this.fieldName = fieldName;
	}

	public InvalidFormException(Class<?> formClass, String fieldName, String message, Throwable cause) {
		super(fullMessage(formClass, fieldName, message), cause);
		this.formClass = formClass;
		this.fieldName = fieldName;
	}

	private static String fullMessage(Class<?> formClass, String fieldName, String message) {
		return "Invalid field " + formClass.getSimpleName() + "." + fieldName + ": " + message;
	}
}
