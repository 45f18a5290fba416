package works.ragged.types;

import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * The type of an array about which nothing is known, such as an empty one.
 */
public record UnknownType(Parameters parameters) implements Type {
	public UnknownType {
		requireNonNull(parameters);
	}

	public UnknownType() {
		this(Parameters.empty());
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		return other instanceof UnknownType u
			&& Type.parametersMatch(parameters, u.parameters, allParameters);
	}

	@Override
	public UnknownType withParameters(Parameters parameters) {
		return new UnknownType(parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UnknownType u && isEqualTo(u, false);
	}

	@Override
	public int hashCode() {
		return parameters.typeParameters().hashCode();
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
