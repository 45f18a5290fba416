package works.ragged.types;

import java.util.Objects;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * Lists of {@link #content} that all have the same {@link #size}.
 */
public record RegularType(Type content, long size, Parameters parameters) implements Type {
	public static final long UNKNOWN_SIZE = -1;

	public RegularType {
		requireNonNull(content);
		requireNonNull(parameters);
		if (size < 0 && size != UNKNOWN_SIZE) {
			throw new IllegalArgumentException("RegularType 'size' must be non-negative or unknown, not " + size);
		}
	}

	public RegularType(Type content, long size) {
		this(content, size, Parameters.empty());
	}

	public boolean isSizeKnown() {
		return size != UNKNOWN_SIZE;
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		return other instanceof RegularType r
			&& (size == r.size || !isSizeKnown() || !r.isSizeKnown())
			&& Type.parametersMatch(parameters, r.parameters, allParameters)
			&& content.isEqualTo(r.content, allParameters);
	}

	@Override
	public RegularType withParameters(Parameters parameters) {
		return new RegularType(content, size, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RegularType r && isEqualTo(r, false);
	}

	/**
	 * Excludes {@link #size} because an unknown size equals every size.
	 */
	@Override
	public int hashCode() {
		return Objects.hash(content, parameters.typeParameters());
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
