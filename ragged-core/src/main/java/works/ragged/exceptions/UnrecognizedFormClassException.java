package works.ragged.exceptions;

public final class UnrecognizedFormClassException extends FormFormatException {
	private final String formClass;

	public UnrecognizedFormClassException(String formClass) {
		super("input class: '" + formClass + "' was not recognised");
		this.formClass = formClass;
	}

	public String formClass() {
		return formClass;
	}
}
