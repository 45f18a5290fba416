package works.ragged.forms;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.OptionType;
import works.ragged.types.Type;

/**
 * An option dimension with one mask byte per element.
 * An element is present when its byte is nonzero if {@link #validWhen()}
 * is true, and when it is zero otherwise.
 */
public final class ByteMaskedForm extends ContentForm {
	static final Set<IndexType> ALLOWED_MASK = EnumSet.of(IndexType.I8);

	private final IndexType mask;
	private final boolean validWhen;

	public ByteMaskedForm(IndexType mask, Form content, boolean validWhen, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.mask = checkIndex(ByteMaskedForm.class, "mask", mask, ALLOWED_MASK);
		this.validWhen = validWhen;
	}

	public ByteMaskedForm(Form content, boolean validWhen) {
		this(IndexType.I8, content, validWhen, Parameters.empty(), null);
	}

	public static Form simplified(IndexType mask, Form content, boolean validWhen, Parameters parameters, @Nullable String formKey) {
		Form absorbed = IndexedOptionForm.absorbOption(content, parameters);
		return absorbed != null ? absorbed : new ByteMaskedForm(mask, content, validWhen, parameters, formKey);
	}

	public IndexType mask() {
		return mask;
	}

	public boolean validWhen() {
		return validWhen;
	}

	@Override
	public ByteMaskedForm withContent(Form content) {
		return new ByteMaskedForm(mask, content, validWhen, parameters(), formKey());
	}

	public ByteMaskedForm withMask(IndexType mask) {
		return new ByteMaskedForm(mask, content(), validWhen, parameters(), formKey());
	}

	public ByteMaskedForm withValidWhen(boolean validWhen) {
		return new ByteMaskedForm(mask, content(), validWhen, parameters(), formKey());
	}

	@Override
	public ByteMaskedForm withParameters(Parameters parameters) {
		return new ByteMaskedForm(mask, content(), validWhen, parameters, formKey());
	}

	@Override
	public ByteMaskedForm withFormKey(@Nullable String formKey) {
		return new ByteMaskedForm(mask, content(), validWhen, parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitByteMasked(this);
	}

	@Override
	public boolean isOption() {
		return true;
	}

	@Override
	public Type type() {
		return OptionType.of(content().type(), parameters());
	}

	@Override
	Stream<ExpectedBuffer> ownBuffers(BufferKeyFunction getKey) {
		return expected(getKey, "mask", mask.primitive());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof ByteMaskedForm that
			&& baseEquals(that)
			&& mask == that.mask
			&& validWhen == that.validWhen
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(ByteMaskedForm.class, mask, validWhen, content(), parameters());
	}
}
