package works.ragged.forms;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.NumpyType;
import works.ragged.types.Primitive;
import works.ragged.types.RegularType;
import works.ragged.types.Type;

/**
 * A leaf of fixed-width elements, each optionally a fixed-shape block
 * described by {@link #innerShape()}.
 */
public final class NumpyForm extends Form {
	private final Primitive primitive;
	private final List<Long> innerShape;

	public NumpyForm(Primitive primitive, List<Long> innerShape, Parameters parameters, @Nullable String formKey) {
		super(parameters, formKey);
		this.primitive = Objects.requireNonNull(primitive, "primitive");
		for (Long size : innerShape) {
			if (size == null || size < 0) {
				throw new InvalidFormException(NumpyForm.class, "inner_shape", "sizes must be non-negative integers, not " + innerShape);
			}
		}
		this.innerShape = List.copyOf(innerShape);
	}

	public NumpyForm(Primitive primitive) {
		this(primitive, List.of(), Parameters.empty(), null);
	}

	public NumpyForm(Primitive primitive, Parameters parameters) {
		this(primitive, List.of(), parameters, null);
	}

	public Primitive primitive() {
		return primitive;
	}

	public List<Long> innerShape() {
		return innerShape;
	}

	public long itemSize() {
		long result = primitive.itemSize();
		for (long size : innerShape) {
			result *= size;
		}
		return result;
	}

	public NumpyForm withPrimitive(Primitive primitive) {
		return new NumpyForm(primitive, innerShape, parameters(), formKey());
	}

	public NumpyForm withInnerShape(List<Long> innerShape) {
		return new NumpyForm(primitive, innerShape, parameters(), formKey());
	}

	@Override
	public NumpyForm withParameters(Parameters parameters) {
		return new NumpyForm(primitive, innerShape, parameters, formKey());
	}

	@Override
	public NumpyForm withFormKey(@Nullable String formKey) {
		return new NumpyForm(primitive, innerShape, parameters(), formKey);
	}

	/**
	 * @return an equivalent form whose inner shape, if any, is expressed as
	 * {@link RegularForm} wrappers around a flat leaf
	 */
	public Form toRegularForm() {
		Form result = new NumpyForm(primitive, List.of(), parameters(), formKey());
		for (int i = innerShape.size() - 1; i >= 0; i--) {
			result = new RegularForm(result, innerShape.get(i), Parameters.empty(), null);
		}
		return result;
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitNumpy(this);
	}

	@Override
	public boolean isNumpy() {
		return true;
	}

	@Override
	public Type type() {
		Type result = new NumpyType(primitive, parameters());
		for (int i = innerShape.size() - 1; i >= 0; i--) {
			result = new RegularType(result, innerShape.get(i), Parameters.empty());
		}
		return result;
	}

	@Override
	public int purelistDepth() {
		return innerShape.size() + 1;
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		int depth = purelistDepth();
		return new MinMaxDepth(depth, depth);
	}

	@Override
	public BranchDepth branchDepth() {
		return new BranchDepth(false, purelistDepth());
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
		return false;
	}

	@Override
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		if (listIndicator != null) {
			for (int i = 0; i < innerShape.size(); i++) {
				path = append(path, listIndicator);
			}
		}
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
		return expected(getKey, "data", primitive);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof NumpyForm that
			&& baseEquals(that)
			&& primitive.equals(that.primitive)
			&& innerShape.equals(that.innerShape);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NumpyForm.class, primitive, innerShape, parameters());
	}
}
