package works.ragged.forms;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.BufferMaterializer;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.buffers.StubBuffers;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.json.FormSerializer;
import works.ragged.json.SerializedForm;
import works.ragged.types.ArrayType;
import works.ragged.types.ListType;
import works.ragged.types.NumpyType;
import works.ragged.types.OptionType;
import works.ragged.types.Primitive;
import works.ragged.types.RecordType;
import works.ragged.types.RegularType;
import works.ragged.types.Type;
import works.ragged.types.UnionType;
import works.ragged.types.UnknownType;

import static java.util.Objects.requireNonNull;

/**
 * Describes the shape of one layer of a ragged array, and by way of its
 * children, the whole array below that layer. Holds no data.
 * <p>
 * Forms are immutable except for {@link #setFormKey form keys}.
 * Derived trees ({@code with*} copies, {@link #selectColumns column selection},
 * the {@code simplified} factories) are new objects that may share
 * unchanged subtrees with the original.
 * <p>
 * Forms serialize through {@link SerializedForm}, which also reads the
 * older positional representation.
 */
public abstract sealed class Form implements Serializable permits
	NumpyForm,
	EmptyForm,
	ContentForm,
	RecordForm,
	UnionForm
{
	@Serial
	private static final long serialVersionUID = 1L;

	private final Parameters parameters;
	private @Nullable String formKey;

	Form(Parameters parameters, @Nullable String formKey) {
		this.parameters = requireNonNull(parameters, "parameters");
		this.formKey = formKey;
	}

	public final Parameters parameters() {
		return parameters;
	}

	public final @Nullable JsonNode parameter(String key) {
		return parameters.get(key);
	}

	public final @Nullable String formKey() {
		return formKey;
	}

	/**
	 * The one mutator on a Form. Not thread-safe: don't call this on a Form
	 * that other threads may be reading.
	 */
	public final void setFormKey(@Nullable String formKey) {
		this.formKey = formKey;
	}

	public abstract Form withParameters(Parameters parameters);

	public abstract Form withFormKey(@Nullable String formKey);

	public abstract <R> R accept(FormVisitor<R> visitor);

	//
	// Classification
	//

	public boolean isNumpy() { return false; }
	public boolean isUnknown() { return false; }
	public boolean isList() { return false; }
	public boolean isRegular() { return false; }
	public boolean isOption() { return false; }
	public boolean isIndexed() { return false; }
	public boolean isRecord() { return false; }
	public boolean isUnion() { return false; }

	//
	// Types
	//

	/**
	 * @return the semantic type of this form, with its physical encoding erased
	 */
	public abstract Type type();

	public final ArrayType arrayType(long length) {
		return new ArrayType(type(), length);
	}

	/**
	 * Lifts a {@link Type} to a Form using one canonical physical encoding
	 * per node: 64-bit offsets for lists, a 64-bit index for options,
	 * 8-bit tags and a 64-bit index for unions.
	 */
	public static Form fromType(Type type) {
		if (type instanceof NumpyType n) {
			return new NumpyForm(n.primitive(), List.of(), n.parameters(), null);
		} else if (type instanceof ListType l) {
			return new ListOffsetForm(IndexType.I64, fromType(l.content()), l.parameters(), null);
		} else if (type instanceof RegularType r) {
			return new RegularForm(fromType(r.content()), r.size(), r.parameters(), null);
		} else if (type instanceof OptionType o) {
			return new IndexedOptionForm(IndexType.I64, fromType(o.content()), o.parameters(), null);
		} else if (type instanceof RecordType r) {
			return new RecordForm(r.contents().stream().map(Form::fromType).toList(), r.fields(), r.parameters(), null);
		} else if (type instanceof UnionType u) {
			return new UnionForm(IndexType.I8, IndexType.I64, u.contents().stream().map(Form::fromType).toList(), u.parameters(), null);
		} else if (type instanceof UnknownType u) {
			return new EmptyForm(u.parameters(), null);
		} else {
			throw new IllegalArgumentException("unsupported type " + type);
		}
	}

	//
	// Depth
	//

	public record MinMaxDepth(int min, int max) { }

	public record BranchDepth(boolean branching, int depth) { }

	/**
	 * @return the number of list dimensions before the first record or union branch;
	 * -1 if union branches disagree
	 */
	public abstract int purelistDepth();

	public abstract MinMaxDepth minmaxDepth();

	public abstract BranchDepth branchDepth();

	/**
	 * @return true if every list dimension down to the first record or union is regular
	 */
	public abstract boolean purelistIsRegular();

	/**
	 * @return the value of {@code key} on the first node, descending through lists and
	 * wrappers, that defines it
	 */
	public abstract @Nullable JsonNode purelistParameter(String key);

	/**
	 * @return true if indexing this form, or its non-list descendants, is an identity operation
	 */
	public abstract boolean isIdentityLike();

	//
	// Columns
	//

	/**
	 * @return dotted paths to every leaf, in tree order
	 */
	public final List<String> columns() {
		return columns(null);
	}

	/**
	 * @param listIndicator if not null, a path segment appended at every list dimension
	 */
	public final List<String> columns(@Nullable String listIndicator) {
		return columns(listIndicator, List.of());
	}

	public final List<String> columns(@Nullable String listIndicator, List<String> columnPrefix) {
		List<String> output = new ArrayList<>();
		collectColumns(columnPrefix, output, listIndicator);
		return output;
	}

	/**
	 * @return the type of each leaf, in the same order as {@link #columns()}
	 */
	public final List<Type> columnTypes() {
		List<Type> output = new ArrayList<>();
		collectColumnTypes(output);
		return output;
	}

	public final Form selectColumns(String specifier) {
		return selectColumns(List.of(specifier));
	}

	public final Form selectColumns(Collection<String> specifiers) {
		return selectColumns(specifiers, true);
	}

	public final Form selectColumns(Collection<String> specifiers, boolean expandBraces) {
		return selectColumns(specifiers, expandBraces, true);
	}

	/**
	 * Restricts this form to the record fields that match any of the given specifiers.
	 * <p>
	 * A specifier is a dot-separated path of shell-style glob patterns,
	 * one per record level. The empty string selects everything.
	 * A field is kept if some specifier still matches it; once a specifier's
	 * segments are used up, everything beneath the matched field is kept.
	 *
	 * @param expandBraces expand {@code {a,b}} alternations before matching
	 * @param pruneUnionsAndRecords remove records and unions left with no fields or branches
	 */
	public final Form selectColumns(Collection<String> specifiers, boolean expandBraces, boolean pruneUnionsAndRecords) {
		Set<String> expanded = new LinkedHashSet<>();
		for (String specifier : specifiers) {
			requireNonNull(specifier, "a column-selection specifier must be a list of strings");
			if (expandBraces) {
				expanded.addAll(BraceExpansion.expand(specifier));
			} else {
				expanded.add(specifier);
			}
		}
		SpecifierMatcher matcher = SpecifierMatcher.of(expanded);
		Form selection = selectColumns(matcher);
		if (!pruneUnionsAndRecords) {
			return selection;
		}
		Form pruned = selection.pruneColumns(false);
		if (pruned == null) {
			LOGGER.debug("Column selection {} left nothing in {}", expanded, this);
			return new RecordForm(List.of(), List.of(), Parameters.empty(), null);
		}
		return pruned;
	}

	abstract void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator);

	abstract void collectColumnTypes(List<Type> output);

	abstract Form selectColumns(SpecifierMatcher matcher);

	/**
	 * @return this form without subtrees that select no columns,
	 * or null if nothing is left and this form should disappear from its parent
	 */
	abstract @Nullable Form pruneColumns(boolean isInsideRecordOrUnion);

	static List<String> append(List<String> path, String segment) {
		List<String> result = new ArrayList<>(path.size() + 1);
		result.addAll(path);
		result.add(segment);
		return result;
	}

	//
	// Buffers
	//

	/**
	 * @param getKey names the buffer for a given form and attribute, such as {@code "offsets"}
	 * @param recursive include the buffers of all descendants
	 * @return the buffers needed to materialize an array of this form, in a stable order
	 */
	public abstract Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey, boolean recursive);

	public final Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey) {
		return expectedFromBuffers(getKey, true);
	}

	/**
	 * Materializes a zero-length array of this form from all-zero stub buffers.
	 */
	public final <A> A lengthZeroArray(BufferMaterializer<A> materializer) {
		return materializer.materialize(this, 0, StubBuffers.lengthZero(), StubBuffers.SHARED_KEY);
	}

	/**
	 * Materializes a length-one array of this form from all-zero stub buffers.
	 * Lists in it are empty; options, indexes and unions select their first element.
	 */
	public final <A> A lengthOneArray(BufferMaterializer<A> materializer) {
		return materializer.materialize(this, 1, StubBuffers.lengthOne(), StubBuffers.SHARED_KEY);
	}

	//
	// Serialization
	//

	/**
	 * @return the verbose dict: a {@link java.util.Map Map} of JSON-compatible values
	 * @see FormSerializer
	 */
	public final Object toDict() {
		return FormSerializer.standard().toDict(this);
	}

	/**
	 * @return the dict; when not verbose, a bare leaf may be just its primitive name
	 */
	public final Object toDict(boolean verbose) {
		return FormSerializer.standard().toDict(this, verbose);
	}

	public final String toJson() {
		return FormSerializer.standard().toJson(this);
	}

	public static Form fromDict(Object input) {
		return FormSerializer.standard().fromDict(input);
	}

	public static Form fromJson(String json) {
		return FormSerializer.standard().fromJson(json);
	}

	@Override
	public String toString() {
		return FormSerializer.standard().toJson(this, false);
	}

	@Serial
	Object writeReplace() {
		return SerializedForm.of(this);
	}

	@Serial
	private void readObject(ObjectInputStream in) throws InvalidObjectException {
		throw new InvalidObjectException("Forms are deserialized through SerializedForm");
	}

	//
	// Helpers for subclasses
	//

	static IndexType checkIndex(Class<?> formClass, String fieldName, IndexType value, Set<IndexType> allowed) {
		requireNonNull(value, fieldName);
		if (!allowed.contains(value)) {
			throw new InvalidFormException(formClass, fieldName, "must be one of " + IndexType.sorted(allowed) + ", not " + value);
		}
		return value;
	}

	static Form checkContent(Class<?> formClass, String fieldName, Form content) {
		if (content == null) {
			throw new InvalidFormException(formClass, fieldName, "must be a Form, not null");
		}
		return content;
	}

	final Stream<ExpectedBuffer> expected(BufferKeyFunction getKey, String attribute, Primitive dtype) {
		return Stream.of(attribute).map(a -> new ExpectedBuffer(getKey.keyFor(this, a), dtype));
	}

	final boolean baseEquals(Form other) {
		return Objects.equals(formKey, other.formKey)
			&& parameters.equals(other.parameters);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Form.class);
}
