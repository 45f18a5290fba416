package works.ragged.forms;

import java.time.Duration;
import java.time.Instant;
import works.ragged.Parameters;
import works.ragged.types.ArrayType;
import works.ragged.types.Primitive;

import static works.ragged.Parameters.ARRAY;

/**
 * The forms that single host values take when promoted to a length-one array.
 * Scanning values and filling buffers is left to callers.
 */
public final class ScalarForms {
	private ScalarForms() { }

	/**
	 * A new form each time, since form keys are mutable.
	 */
	public static ListOffsetForm string() {
		return new ListOffsetForm(
			IndexType.I64,
			new NumpyForm(Primitive.UINT8, Parameters.of(ARRAY, "char")),
			Parameters.of(ARRAY, "string"),
			null);
	}

	public static ListOffsetForm bytestring() {
		return new ListOffsetForm(
			IndexType.I64,
			new NumpyForm(Primitive.UINT8, Parameters.of(ARRAY, "byte")),
			Parameters.of(ARRAY, "bytestring"),
			null);
	}

	/**
	 * @throws IllegalArgumentException if {@code value} has no scalar form
	 */
	public static Form formOf(Object value) {
		if (value instanceof String) {
			return string();
		} else if (value instanceof byte[]) {
			return bytestring();
		} else if (value instanceof Boolean) {
			return new NumpyForm(Primitive.BOOL);
		} else if (value instanceof Byte) {
			return new NumpyForm(Primitive.INT8);
		} else if (value instanceof Short) {
			return new NumpyForm(Primitive.INT16);
		} else if (value instanceof Integer) {
			return new NumpyForm(Primitive.INT32);
		} else if (value instanceof Long) {
			return new NumpyForm(Primitive.INT64);
		} else if (value instanceof Float) {
			return new NumpyForm(Primitive.FLOAT32);
		} else if (value instanceof Double) {
			return new NumpyForm(Primitive.FLOAT64);
		} else if (value instanceof Instant) {
			return new NumpyForm(Primitive.datetime64("ns"));
		} else if (value instanceof Duration) {
			return new NumpyForm(Primitive.timedelta64("ns"));
		} else {
			String className = value == null ? "null" : value.getClass().getName();
			throw new IllegalArgumentException("No scalar form for " + className);
		}
	}

	public static ArrayType arrayTypeOf(Object value) {
		return formOf(value).arrayType(1);
	}
}
