package works.ragged.types;

import java.util.Objects;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

public record NumpyType(Primitive primitive, Parameters parameters) implements Type {
	public NumpyType {
		requireNonNull(primitive);
		requireNonNull(parameters);
	}

	public NumpyType(Primitive primitive) {
		this(primitive, Parameters.empty());
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		return other instanceof NumpyType n
			&& primitive.equals(n.primitive)
			&& Type.parametersMatch(parameters, n.parameters, allParameters);
	}

	@Override
	public NumpyType withParameters(Parameters parameters) {
		return new NumpyType(primitive, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NumpyType n && isEqualTo(n, false);
	}

	@Override
	public int hashCode() {
		return Objects.hash(primitive, parameters.typeParameters());
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
