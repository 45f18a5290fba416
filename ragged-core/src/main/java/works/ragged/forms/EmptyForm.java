package works.ragged.forms;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.Type;
import works.ragged.types.UnknownType;

/**
 * A leaf with no elements and no element type.
 */
public final class EmptyForm extends Form {
	public EmptyForm(Parameters parameters, @Nullable String formKey) {
		super(parameters, formKey);
	}

	public EmptyForm() {
		this(Parameters.empty(), null);
	}

	@Override
	public EmptyForm withParameters(Parameters parameters) {
		return new EmptyForm(parameters, formKey());
	}

	@Override
	public EmptyForm withFormKey(@Nullable String formKey) {
		return new EmptyForm(parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitEmpty(this);
	}

	@Override
	public boolean isUnknown() {
		return true;
	}

	@Override
	public Type type() {
		return new UnknownType(parameters());
	}

	@Override
	public int purelistDepth() {
		return 1;
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		return new MinMaxDepth(1, 1);
	}

	@Override
	public BranchDepth branchDepth() {
		return new BranchDepth(false, 1);
	}

	@Override
	public boolean purelistIsRegular() {
		return true;
	}

	@Override
	public @Nullable JsonNode purelistParameter(String key) {
		return parameter(key);
	}

	@Override
	public boolean isIdentityLike() {
		return true;
	}

	@Override
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		output.add(String.join(".", path));
	}

	@Override
	void collectColumnTypes(List<Type> output) {
		output.add(type());
	}

	@Override
	Form selectColumns(SpecifierMatcher matcher) {
		return this;
	}

	@Override
	Form pruneColumns(boolean isInsideRecordOrUnion) {
		return this;
	}

	@Override
	public Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey, boolean recursive) {
		return Stream.empty();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof EmptyForm that && baseEquals(that);
	}

	@Override
	public int hashCode() {
		return Objects.hash(EmptyForm.class, parameters());
	}
}
