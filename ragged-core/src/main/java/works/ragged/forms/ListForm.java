package works.ragged.forms;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.ListType;
import works.ragged.types.Type;

/**
 * A variable-length list dimension described by separate
 * {@code starts} and {@code stops} buffers.
 */
public final class ListForm extends ContentForm {
	static final Set<IndexType> ALLOWED_INDEX = EnumSet.of(IndexType.I32, IndexType.U32, IndexType.I64);

	private final IndexType starts;
	private final IndexType stops;

	public ListForm(IndexType starts, IndexType stops, Form content, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		this.starts = checkIndex(ListForm.class, "starts", starts, ALLOWED_INDEX);
		this.stops = checkIndex(ListForm.class, "stops", stops, ALLOWED_INDEX);
		if (starts != stops) {
			throw new InvalidFormException(ListForm.class, "stops", "must have the same type as starts (" + starts + "), not " + stops);
		}
	}

	public ListForm(IndexType index, Form content) {
		this(index, index, content, Parameters.empty(), null);
	}

	public IndexType starts() {
		return starts;
	}

	public IndexType stops() {
		return stops;
	}

	@Override
	public ListForm withContent(Form content) {
		return new ListForm(starts, stops, content, parameters(), formKey());
	}

	/**
	 * Starts and stops share a type, so both change together.
	 */
	public ListForm withIndex(IndexType index) {
		return new ListForm(index, index, content(), parameters(), formKey());
	}

	@Override
	public ListForm withParameters(Parameters parameters) {
		return new ListForm(starts, stops, content(), parameters, formKey());
	}

	@Override
	public ListForm withFormKey(@Nullable String formKey) {
		return new ListForm(starts, stops, content(), parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitList(this);
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
		return Stream.concat(
			expected(getKey, "starts", starts.primitive()),
			expected(getKey, "stops", stops.primitive()));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof ListForm that
			&& baseEquals(that)
			&& starts == that.starts
			&& stops == that.stops
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(ListForm.class, starts, stops, content(), parameters());
	}
}
