package works.ragged.types;

import java.util.Objects;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * Variable-length lists of {@link #content}.
 */
public record ListType(Type content, Parameters parameters) implements Type {
	public ListType {
		requireNonNull(content);
		requireNonNull(parameters);
	}

	public ListType(Type content) {
		this(content, Parameters.empty());
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		return other instanceof ListType l
			&& Type.parametersMatch(parameters, l.parameters, allParameters)
			&& content.isEqualTo(l.content, allParameters);
	}

	@Override
	public ListType withParameters(Parameters parameters) {
		return new ListType(content, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ListType l && isEqualTo(l, false);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, parameters.typeParameters());
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
