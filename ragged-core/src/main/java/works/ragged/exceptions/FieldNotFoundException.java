package works.ragged.exceptions;

public class FieldNotFoundException extends IndexOutOfBoundsException {
	public FieldNotFoundException(String s) {
		super(s);
	}

	public static FieldNotFoundException noField(String field, int numFields) {
		return new FieldNotFoundException("no field '" + field + "' in record with " + numFields + " fields");
	}

	public static FieldNotFoundException noIndex(int index, int numFields) {
		return new FieldNotFoundException("no index " + index + " in record with " + numFields + " fields");
	}
}
