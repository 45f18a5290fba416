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
 * An option dimension with one mask bit per element, packed eight to a byte.
 *
 * @see ByteMaskedForm
 */
public final class BitMaskedForm extends ContentForm {
	static final Set<IndexType> ALLOWED_MASK = EnumSet.of(IndexType.U8);

	private final IndexType mask;
	private final boolean validWhen;
	private final boolean lsbOrder;

	/**
	 * @param lsbOrder if true, the first element of each group of eight is the
	 *                 least significant bit of its byte; otherwise the most significant
	 */
	public BitMaskedForm(IndexType mask, Form content, boolean validWhen, boolean lsbOrder, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.mask = checkIndex(BitMaskedForm.class, "mask", mask, ALLOWED_MASK);
		this.validWhen = validWhen;
		this.lsbOrder = lsbOrder;
	}

	public BitMaskedForm(Form content, boolean validWhen, boolean lsbOrder) {
		this(IndexType.U8, content, validWhen, lsbOrder, Parameters.empty(), null);
	}

	public static Form simplified(IndexType mask, Form content, boolean validWhen, boolean lsbOrder, Parameters parameters, @Nullable String formKey) {
		Form absorbed = IndexedOptionForm.absorbOption(content, parameters);
		return absorbed != null ? absorbed : new BitMaskedForm(mask, content, validWhen, lsbOrder, parameters, formKey);
	}

	public IndexType mask() {
		return mask;
	}

	public boolean validWhen() {
		return validWhen;
	}

	public boolean lsbOrder() {
		return lsbOrder;
	}

	@Override
	public BitMaskedForm withContent(Form content) {
		return new BitMaskedForm(mask, content, validWhen, lsbOrder, parameters(), formKey());
	}

	public BitMaskedForm withMask(IndexType mask) {
		return new BitMaskedForm(mask, content(), validWhen, lsbOrder, parameters(), formKey());
	}

	public BitMaskedForm withValidWhen(boolean validWhen) {
		return new BitMaskedForm(mask, content(), validWhen, lsbOrder, parameters(), formKey());
	}

	public BitMaskedForm withLsbOrder(boolean lsbOrder) {
		return new BitMaskedForm(mask, content(), validWhen, lsbOrder, parameters(), formKey());
	}

	@Override
	public BitMaskedForm withParameters(Parameters parameters) {
		return new BitMaskedForm(mask, content(), validWhen, lsbOrder, parameters, formKey());
	}

	@Override
	public BitMaskedForm withFormKey(@Nullable String formKey) {
		return new BitMaskedForm(mask, content(), validWhen, lsbOrder, parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitBitMasked(this);
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
		return o instanceof BitMaskedForm that
			&& baseEquals(that)
			&& mask == that.mask
			&& validWhen == that.validWhen
			&& lsbOrder == that.lsbOrder
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(BitMaskedForm.class, mask, validWhen, lsbOrder, content(), parameters());
	}
}
