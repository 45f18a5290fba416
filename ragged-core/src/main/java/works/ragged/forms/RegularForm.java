package works.ragged.forms;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.RegularType;
import works.ragged.types.Type;

/**
 * A list dimension in which every element has the same length, {@link #size()}.
 * Needs no buffers of its own.
 */
public final class RegularForm extends ContentForm {
	public static final long UNKNOWN_SIZE = RegularType.UNKNOWN_SIZE;

	private final long size;

	public RegularForm(Form content, long size, Parameters parameters, @Nullable String formKey) {
		super(content, parameters, formKey);
		if (size < 0 && size != UNKNOWN_SIZE) {
			throw new InvalidFormException(RegularForm.class, "size", "must be non-negative or unknown, not " + size);
		}
		this.size = size;
	}

	public RegularForm(Form content, long size) {
		this(content, size, Parameters.empty(), null);
	}

	public long size() {
		return size;
	}

	public boolean isSizeKnown() {
		return size != UNKNOWN_SIZE;
	}

	@Override
	public RegularForm withContent(Form content) {
		return new RegularForm(content, size, parameters(), formKey());
	}

	public RegularForm withSize(long size) {
		return new RegularForm(content(), size, parameters(), formKey());
	}

	@Override
	public RegularForm withParameters(Parameters parameters) {
		return new RegularForm(content(), size, parameters, formKey());
	}

	@Override
	public RegularForm withFormKey(@Nullable String formKey) {
		return new RegularForm(content(), size, parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitRegular(this);
	}

	@Override
	public boolean isList() {
		return true;
	}

	@Override
	public boolean isRegular() {
		return true;
	}

	@Override
	public Type type() {
		return new RegularType(content().type(), size, parameters());
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
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		collectListColumns(path, output, listIndicator);
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
		return o instanceof RegularForm that
			&& baseEquals(that)
			&& size == that.size
			&& content().equals(that.content());
	}

	@Override
	public int hashCode() {
		return Objects.hash(RegularForm.class, size, content(), parameters());
	}
}
