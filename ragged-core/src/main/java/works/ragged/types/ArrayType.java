package works.ragged.types;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The type of a whole array: a {@link Type} for its elements plus a top-level length.
 */
public record ArrayType(Type content, long length) {
	public static final long UNKNOWN_LENGTH = -1;

	public ArrayType {
		requireNonNull(content);
		if (length < 0 && length != UNKNOWN_LENGTH) {
			throw new IllegalArgumentException("ArrayType 'length' must be a non-negative integer or unknown length, not " + length);
		}
	}

	public boolean isLengthKnown() {
		return length != UNKNOWN_LENGTH;
	}

	/**
	 * An unknown length matches any length.
	 */
	public boolean isEqualTo(ArrayType other, boolean allParameters) {
		return (!isLengthKnown() || !other.isLengthKnown() || length == other.length)
			&& content.isEqualTo(other.content, allParameters);
	}

	/**
	 * Lengths must match exactly, unknown included.
	 * Use {@link #isEqualTo} to let an unknown length match anything.
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof ArrayType a
			&& length == a.length
			&& content.equals(a.content);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, length);
	}

	@Override
	public String toString() {
		return (isLengthKnown() ? Long.toString(length) : "??") + " * " + content;
	}
}
