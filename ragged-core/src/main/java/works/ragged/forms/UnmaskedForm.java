package works.ragged.forms;

import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.OptionType;
import works.ragged.types.Type;

/**
 * An option dimension that happens to have no missing values, so it needs no buffers.
 */
public final class UnmaskedForm extends ContentForm {
	public UnmaskedForm(Form content, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
	}

	public UnmaskedForm(Form content) {
		this(content, Parameters.empty(), null);
	}

	public static Form simplified(Form content, Parameters parameters, @Nullable String formKey) {
		Form absorbed = IndexedOptionForm.absorbOption(content, parameters);
		return absorbed != null ? absorbed : new UnmaskedForm(content, parameters, formKey);
	}

	@Override
	public UnmaskedForm withContent(Form content) {
		return new UnmaskedForm(content, parameters(), formKey());
	}

	@Override
	public UnmaskedForm withParameters(Parameters parameters) {
		return new UnmaskedForm(content(), parameters, formKey());
	}

	@Override
	public UnmaskedForm withFormKey(@Nullable String formKey) {
		return new UnmaskedForm(content(), parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitUnmasked(this);
	}

	@Override
	public boolean isOption() {
		return true;
	}

	@Override
	public boolean isIdentityLike() {
		return content().isIdentityLike();
	}

	@Override
	public Type type() {
		return OptionType.of(content().type(), parameters());
	}

	@Override
	Stream<ExpectedBuffer> ownBuffers(BufferKeyFunction getKey) {
		return Stream.empty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof UnmaskedForm that
			&& baseEquals(that)
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(UnmaskedForm.class, content(), parameters());
	}
}
