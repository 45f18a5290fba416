package works.ragged.forms;

import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.Type;

import static works.ragged.Parameters.ARRAY;

/**
 * A gather: each element is a copy of the content element its {@code index} names.
 * Adds no missing values. With {@code __array__: "categorical"} it's the encoding
 * of a dictionary-compressed column.
 */
public final class IndexedForm extends ContentForm {
	private final IndexType index;

	public IndexedForm(IndexType index, Form content, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.index = checkIndex(IndexedForm.class, "index", index, ListForm.ALLOWED_INDEX);
	}

	public IndexedForm(IndexType index, Form content) {
		this(index, content, Parameters.empty(), null);
	}

	/**
	 * Like the constructor, but a union content absorbs this node, and a
	 * nested index or option collapses into a single node with a 64-bit index.
	 */
	public static Form simplified(IndexType index, Form content, Parameters parameters, @Nullable String formKey) {
		boolean isCategorical = "categorical".equals(parameters.getString(ARRAY));
		if (content instanceof UnionForm union && !isCategorical) {
			LOGGER.debug("Indexed over union: absorbing into the union");
			return union.withParameters(union.parameters().union(parameters));
		} else if (content.isOption()) {
			LOGGER.debug("Indexed over option: collapsing to one IndexedOptionForm");
			ContentForm option = (ContentForm) content;
			return IndexedOptionForm.simplified(IndexType.I64, option.content(), option.parameters().union(parameters), null);
		} else if (content instanceof IndexedForm inner) {
			LOGGER.debug("Indexed over indexed: collapsing to one IndexedForm");
			return simplified(IndexType.I64, inner.content(), inner.parameters().union(parameters), null);
		} else {
			return new IndexedForm(index, content, parameters, formKey);
		}
	}

	public static Form simplified(IndexType index, Form content) {
		return simplified(index, content, Parameters.empty(), null);
	}

	public IndexType index() {
		return index;
	}

	@Override
	public IndexedForm withContent(Form content) {
		return new IndexedForm(index, content, parameters(), formKey());
	}

	public IndexedForm withIndex(IndexType index) {
		return new IndexedForm(index, content(), parameters(), formKey());
	}

	@Override
	public IndexedForm withParameters(Parameters parameters) {
		return new IndexedForm(index, content(), parameters, formKey());
	}

	@Override
	public IndexedForm withFormKey(@Nullable String formKey) {
		return new IndexedForm(index, content(), parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitIndexed(this);
	}

	@Override
	public boolean isIndexed() {
		return true;
	}

	/**
	 * A gather is invisible to the type system; this node's parameters
	 * land on the content's type.
	 */
	@Override
	public Type type() {
		Type contentType = content().type();
		return contentType.withParameters(contentType.parameters().union(parameters()));
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
		return o instanceof IndexedForm that
			&& baseEquals(that)
			&& index == that.index
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(IndexedForm.class, index, content(), parameters());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IndexedForm.class);
}
