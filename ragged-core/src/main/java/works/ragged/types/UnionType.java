package works.ragged.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * Values that may be any one of several {@link #contents}.
 */
public record UnionType(List<Type> contents, Parameters parameters) implements Type {
	public UnionType {
		contents = List.copyOf(contents);
		requireNonNull(parameters);
	}

	public UnionType(List<Type> contents) {
		this(contents, Parameters.empty());
	}

	/**
	 * Branch order doesn't matter.
	 */
	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		if (!(other instanceof UnionType u)
			|| contents.size() != u.contents.size()
			|| !Type.parametersMatch(parameters, u.parameters, allParameters)) {
			return false;
		}
		List<Type> remaining = new ArrayList<>(u.contents);
		outer:
		for (Type mine : contents) {
			for (int i = 0; i < remaining.size(); i++) {
				if (mine.isEqualTo(remaining.get(i), allParameters)) {
					remaining.remove(i);
					continue outer;
				}
			}
			return false;
		}
		return true;
	}

	@Override
	public UnionType withParameters(Parameters parameters) {
		return new UnionType(contents, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UnionType u && isEqualTo(u, false);
	}

	@Override
	public int hashCode() {
		int contentsHash = 0;
		for (Type content : contents) {
			contentsHash += content.hashCode();
		}
		return Objects.hash(UnionType.class, contentsHash, parameters.typeParameters());
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
