package works.ragged.types;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The dtype of a leaf buffer: one of a fixed set of numeric kinds,
 * plus a time unit for the two temporal kinds.
 */
public record Primitive(Kind kind, @Nullable String unit) {
	public enum Kind {
		BOOL("bool", 1),
		INT8("int8", 1),
		UINT8("uint8", 1),
		INT16("int16", 2),
		UINT16("uint16", 2),
		INT32("int32", 4),
		UINT32("uint32", 4),
		INT64("int64", 8),
		UINT64("uint64", 8),
		FLOAT16("float16", 2),
		FLOAT32("float32", 4),
		FLOAT64("float64", 8),
		FLOAT128("float128", 16),
		COMPLEX64("complex64", 8),
		COMPLEX128("complex128", 16),
		COMPLEX256("complex256", 32),
		DATETIME64("datetime64", 8),
		TIMEDELTA64("timedelta64", 8),
		;

		final String text;
		final int itemSize;

		Kind(String text, int itemSize) {
			this.text = text;
			this.itemSize = itemSize;
		}

		public boolean isTemporal() {
			return this == DATETIME64 || this == TIMEDELTA64;
		}
	}

	public static final Primitive BOOL = new Primitive(Kind.BOOL, null);
	public static final Primitive INT8 = new Primitive(Kind.INT8, null);
	public static final Primitive UINT8 = new Primitive(Kind.UINT8, null);
	public static final Primitive INT16 = new Primitive(Kind.INT16, null);
	public static final Primitive UINT16 = new Primitive(Kind.UINT16, null);
	public static final Primitive INT32 = new Primitive(Kind.INT32, null);
	public static final Primitive UINT32 = new Primitive(Kind.UINT32, null);
	public static final Primitive INT64 = new Primitive(Kind.INT64, null);
	public static final Primitive UINT64 = new Primitive(Kind.UINT64, null);
	public static final Primitive FLOAT16 = new Primitive(Kind.FLOAT16, null);
	public static final Primitive FLOAT32 = new Primitive(Kind.FLOAT32, null);
	public static final Primitive FLOAT64 = new Primitive(Kind.FLOAT64, null);
	public static final Primitive FLOAT128 = new Primitive(Kind.FLOAT128, null);
	public static final Primitive COMPLEX64 = new Primitive(Kind.COMPLEX64, null);
	public static final Primitive COMPLEX128 = new Primitive(Kind.COMPLEX128, null);
	public static final Primitive COMPLEX256 = new Primitive(Kind.COMPLEX256, null);

	private static final Pattern TEMPORAL = Pattern.compile("(datetime64|timedelta64)\\[(\\d*(?:Y|M|W|D|h|m|s|ms|us|ns|ps|fs|as))]");
	private static final Pattern UNIT = Pattern.compile("\\d*(?:Y|M|W|D|h|m|s|ms|us|ns|ps|fs|as)");

	public Primitive {
		requireNonNull(kind);
		if (kind.isTemporal()) {
			if (unit == null || !UNIT.matcher(unit).matches()) {
				throw new IllegalArgumentException(kind.text + " requires a time unit, not " + unit);
			}
		} else if (unit != null) {
			throw new IllegalArgumentException(kind.text + " does not take a unit");
		}
	}

	public static Primitive datetime64(String unit) {
		return new Primitive(Kind.DATETIME64, unit);
	}

	public static Primitive timedelta64(String unit) {
		return new Primitive(Kind.TIMEDELTA64, unit);
	}

	/**
	 * @throws IllegalArgumentException if {@code name} isn't a supported dtype
	 */
	public static Primitive of(String name) {
		requireNonNull(name);
		Matcher m = TEMPORAL.matcher(name);
		if (m.matches()) {
			Kind kind = m.group(1).equals("datetime64") ? Kind.DATETIME64 : Kind.TIMEDELTA64;
			return new Primitive(kind, m.group(2));
		}
		for (Kind kind : Kind.values()) {
			if (!kind.isTemporal() && kind.text.equals(name)) {
				return new Primitive(kind, null);
			}
		}
		throw new IllegalArgumentException("unsupported primitive type: '" + name + "'");
	}

	public String name() {
		return unit == null ? kind.text : kind.text + "[" + unit + "]";
	}

	/**
	 * @return the width in bytes of one element
	 */
	public int itemSize() {
		return kind.itemSize;
	}

	@Override
	public String toString() {
		return name();
	}
}
