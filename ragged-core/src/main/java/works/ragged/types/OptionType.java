package works.ragged.types;

import java.util.Objects;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * Values of {@link #content} that may be missing.
 * <p>
 * The constructor builds exactly the node it's given;
 * {@link #of} is the canonicalizing alternative.
 */
public record OptionType(Type content, Parameters parameters) implements Type {
	public OptionType {
		requireNonNull(content);
		requireNonNull(parameters);
	}

	public OptionType(Type content) {
		this(content, Parameters.empty());
	}

	/**
	 * Like the constructor, but an option of an option becomes a single option
	 * (with our parameters taking precedence), and an option of a union
	 * becomes a union of options.
	 */
	public static Type of(Type content, Parameters parameters) {
		if (content instanceof OptionType inner) {
			return new OptionType(inner.content, inner.parameters.union(parameters));
		} else if (content instanceof UnionType union) {
			return new OptionType(union, parameters).simplifyOptionUnion();
		} else {
			return new OptionType(content, parameters);
		}
	}

	public static Type of(Type content) {
		return of(content, Parameters.empty());
	}

	/**
	 * @return if our content is a union, the equivalent union of options; otherwise {@code this}
	 */
	public Type simplifyOptionUnion() {
		if (content instanceof UnionType union) {
			return new UnionType(
				union.contents().stream()
					.map(c -> c instanceof OptionType o
						? (Type) o
						: new OptionType(c))
					.toList(),
				union.parameters().union(parameters));
		} else {
			return this;
		}
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		return other instanceof OptionType o
			&& Type.parametersMatch(parameters, o.parameters, allParameters)
			&& content.isEqualTo(o.content, allParameters);
	}

	@Override
	public OptionType withParameters(Parameters parameters) {
		return new OptionType(content, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof OptionType o && isEqualTo(o, false);
	}

	@Override
	public int hashCode() {
		return Objects.hash(OptionType.class, content, parameters.typeParameters());
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
