package works.ragged.forms;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.OptionType;
import works.ragged.types.Type;

/**
 * An option dimension encoded as a signed gather {@code index}; a negative
 * entry is a missing value.
 */
public final class IndexedOptionForm extends ContentForm {
	static final Set<IndexType> ALLOWED_INDEX = EnumSet.of(IndexType.I32, IndexType.I64);

	private final IndexType index;

	public IndexedOptionForm(IndexType index, Form content, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.index = checkIndex(IndexedOptionForm.class, "index", index, ALLOWED_INDEX);
	}

	public IndexedOptionForm(IndexType index, Form content) {
		this(index, content, Parameters.empty(), null);
	}

	public static Form simplified(IndexType index, Form content, Parameters parameters, @Nullable String formKey) {
		Form absorbed = absorbOption(content, parameters);
		return absorbed != null ? absorbed : new IndexedOptionForm(index, content, parameters, formKey);
	}

	public static Form simplified(IndexType index, Form content) {
		return simplified(index, content, Parameters.empty(), null);
	}

	/**
	 * The collapses shared by every option-flavoured form's {@code simplified} factory.
	 *
	 * @return the collapsed form, or null if {@code content} absorbs nothing
	 * and the option node should be built as requested
	 */
	static @Nullable Form absorbOption(Form content, Parameters parameters) {
		if (content instanceof UnionForm union) {
			LOGGER.debug("Option over union: distributing the option over {} branches", union.contents().size());
			return union.unionOfOptions(IndexType.I64, parameters);
		} else if (content.isIndexed() || content.isOption()) {
			LOGGER.debug("Option over {}: collapsing to one IndexedOptionForm", content.getClass().getSimpleName());
			ContentForm inner = (ContentForm) content;
			return simplified(IndexType.I64, inner.content(), inner.parameters().union(parameters), null);
		} else {
			return null;
		}
	}

	public IndexType index() {
		return index;
	}

	@Override
	public IndexedOptionForm withContent(Form content) {
		return new IndexedOptionForm(index, content, parameters(), formKey());
	}

	public IndexedOptionForm withIndex(IndexType index) {
		return new IndexedOptionForm(index, content(), parameters(), formKey());
	}

	@Override
	public IndexedOptionForm withParameters(Parameters parameters) {
		return new IndexedOptionForm(index, content(), parameters, formKey());
	}

	@Override
	public IndexedOptionForm withFormKey(@Nullable String formKey) {
		return new IndexedOptionForm(index, content(), parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitIndexedOption(this);
	}

	@Override
	public boolean isOption() {
		return true;
	}

	@Override
	public boolean isIndexed() {
		return true;
	}

	@Override
	public Type type() {
		return OptionType.of(content().type(), parameters());
	}

	@Override
	Stream<ExpectedBuffer> ownBuffers(BufferKeyFunction getKey) {
		return expected(getKey, "index", index.primitive());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof IndexedOptionForm that
			&& baseEquals(that)
			&& index == that.index
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(IndexedOptionForm.class, index, content(), parameters());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IndexedOptionForm.class);
}
