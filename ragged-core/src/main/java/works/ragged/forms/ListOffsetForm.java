package works.ragged.forms;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.ListType;
import works.ragged.types.Type;

/**
 * A variable-length list dimension described by one monotonic {@code offsets}
 * buffer, one longer than the list itself.
 */
public final class ListOffsetForm extends ContentForm {
	private final IndexType offsets;

	public ListOffsetForm(IndexType offsets, Form content, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.offsets = checkIndex(ListOffsetForm.class, "offsets", offsets, ListForm.ALLOWED_INDEX);
	}

	public ListOffsetForm(IndexType offsets, Form content) {
		this(offsets, content, Parameters.empty(), null);
	}

	public IndexType offsets() {
		return offsets;
	}

	@Override
	public ListOffsetForm withContent(Form content) {
		return new ListOffsetForm(offsets, content, parameters(), formKey());
	}

	public ListOffsetForm withOffsets(IndexType offsets) {
		return new ListOffsetForm(offsets, content(), parameters(), formKey());
	}

	@Override
	public ListOffsetForm withParameters(Parameters parameters) {
		return new ListOffsetForm(offsets, content(), parameters, formKey());
	}

	@Override
	public ListOffsetForm withFormKey(@Nullable String formKey) {
		return new ListOffsetForm(offsets, content(), parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitListOffset(this);
	}

	@Override
	public boolean isList() {
		return true;
	}

	@Override
	public Type type() {
		return new ListType(content().type(), parameters());
	}

	@Override
	public int purelistDepth() {
		return listPurelistDepth();
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		return listMinmaxDepth();
	}

	@Override
	public BranchDepth branchDepth() {
		return listBranchDepth();
	}

	@Override
	public boolean purelistIsRegular() {
		return false;
	}

	@Override
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		collectListColumns(path, output, listIndicator);
	}

	@Override
	Stream<ExpectedBuffer> ownBuffers(BufferKeyFunction getKey) {
		return expected(getKey, "offsets", offsets.primitive());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof ListOffsetForm that
			&& baseEquals(that)
			&& offsets == that.offsets
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(ListOffsetForm.class, offsets, content(), parameters());
	}
}
