package works.ragged.forms;

import java.util.ArrayList;
import java.util.EnumSet;
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
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.Type;
import works.ragged.types.UnionType;

import static java.util.Objects.requireNonNull;

/**
 * Heterogeneous elements: each one's {@code tags} entry picks a branch from
 * {@link #contents()}, and its {@code index} entry picks the element within that branch.
 */
public final class UnionForm extends Form {
	static final Set<IndexType> ALLOWED_TAGS = EnumSet.of(IndexType.I8);

	private final IndexType tags;
	private final IndexType index;
	private final List<Form> contents;

	public UnionForm(IndexType tags, IndexType index, List<Form> contents, Parameters parameters, @Nullable String formKey) {
		super(parameters, formKey);
		this.tags = checkIndex(UnionForm.class, "tags", tags, ALLOWED_TAGS);
		this.index = checkIndex(UnionForm.class, "index", index, ListForm.ALLOWED_INDEX);
		requireNonNull(contents, "contents");
		for (Form content : contents) {
			checkContent(UnionForm.class, "contents", content);
		}
		this.contents = List.copyOf(contents);
	}

	public UnionForm(IndexType index, List<Form> contents) {
		this(IndexType.I8, index, contents, Parameters.empty(), null);
	}

	/**
	 * Like the constructor, but canonicalizes the branches: nested unions are
	 * spliced in, branches of equal {@link Form#type() type} are merged (the first
	 * one is kept), empty branches are dropped beside non-empty ones, and if any
	 * branch is optional then all of them become options.
	 *
	 * @return a union, or the sole branch (carrying our parameters) if only one remains
	 * @throws InvalidFormException if there are no branches
	 */
	public static Form simplified(IndexType tags, IndexType index, List<Form> contents, Parameters parameters, @Nullable String formKey) {
		List<Form> spliced = new ArrayList<>();
		splice(contents, spliced);

		boolean anyNonEmpty = spliced.stream().anyMatch(c -> !(c instanceof EmptyForm));
		if (anyNonEmpty && spliced.removeIf(c -> c instanceof EmptyForm)) {
			LOGGER.trace("Dropped empty branches");
		}
		if (spliced.stream().anyMatch(Form::isOption)) {
			LOGGER.debug("Union with an optional branch: making every branch optional");
			spliced.replaceAll(c -> IndexedOptionForm.simplified(IndexType.I64, c));
		}

		List<Form> merged = new ArrayList<>();
		List<Type> mergedTypes = new ArrayList<>();
		for (Form content : spliced) {
			Type type = content.type();
			if (mergedTypes.contains(type)) {
				LOGGER.trace("Merging branch of duplicate type {}", type);
			} else {
				merged.add(content);
				mergedTypes.add(type);
			}
		}

		if (merged.isEmpty()) {
			throw new InvalidFormException(UnionForm.class, "contents", "must have at least one branch");
		} else if (merged.size() == 1) {
			Form only = merged.get(0);
			LOGGER.debug("Union with one branch: replacing with the branch itself");
			return only.withParameters(only.parameters().union(parameters));
		}
		return new UnionForm(tags, index, merged, parameters, formKey);
	}

	public static Form simplified(IndexType index, List<Form> contents) {
		return simplified(IndexType.I8, index, contents, Parameters.empty(), null);
	}

	private static void splice(List<Form> contents, List<Form> output) {
		for (Form content : contents) {
			if (content instanceof UnionForm nested) {
				LOGGER.trace("Splicing nested union of {} branches", nested.contents.size());
				splice(nested.contents, output);
			} else {
				output.add(content);
			}
		}
	}

	/**
	 * Distributes an option over this union: the result is a union whose
	 * branches are each made optional.
	 *
	 * @param index the index type for the option wrappers
	 * @param parameters the option's parameters, which override ours
	 */
	public UnionForm unionOfOptions(IndexType index, Parameters parameters) {
		return new UnionForm(
			tags,
			this.index,
			contents.stream().map(c -> IndexedOptionForm.simplified(index, c)).toList(),
			parameters().union(parameters),
			formKey());
	}

	public IndexType tags() {
		return tags;
	}

	public IndexType index() {
		return index;
	}

	public List<Form> contents() {
		return contents;
	}

	public Form content(int i) {
		return contents.get(i);
	}

	public UnionForm withTags(IndexType tags) {
		return new UnionForm(tags, index, contents, parameters(), formKey());
	}

	public UnionForm withIndex(IndexType index) {
		return new UnionForm(tags, index, contents, parameters(), formKey());
	}

	public UnionForm withContents(List<Form> contents) {
		return new UnionForm(tags, index, contents, parameters(), formKey());
	}

	@Override
	public UnionForm withParameters(Parameters parameters) {
		return new UnionForm(tags, index, contents, parameters, formKey());
	}

	@Override
	public UnionForm withFormKey(@Nullable String formKey) {
		return new UnionForm(tags, index, contents, parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitUnion(this);
	}

	@Override
	public boolean isUnion() {
		return true;
	}

	@Override
	public Type type() {
		return new UnionType(contents.stream().map(Form::type).toList(), parameters());
	}

	@Override
	public int purelistDepth() {
		if (contents.isEmpty()) {
			return 1;
		}
		int first = contents.get(0).purelistDepth();
		for (Form content : contents) {
			if (content.purelistDepth() != first) {
				return -1;
			}
		}
		return first;
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		if (contents.isEmpty()) {
			return new MinMaxDepth(0, 0);
		}
		int min = Integer.MAX_VALUE;
		int max = Integer.MIN_VALUE;
		for (Form content : contents) {
			MinMaxDepth depth = content.minmaxDepth();
			min = Math.min(min, depth.min());
			max = Math.max(max, depth.max());
		}
		return new MinMaxDepth(min, max);
	}

	@Override
	public BranchDepth branchDepth() {
		return RecordForm.branchDepthOf(contents);
	}

	@Override
	public boolean purelistIsRegular() {
		return contents.stream().allMatch(Form::purelistIsRegular);
	}

	/**
	 * If we don't define {@code key} ourselves, the branches must all agree on it.
	 */
	@Override
	public @Nullable JsonNode purelistParameter(String key) {
		JsonNode own = parameter(key);
		if (own != null || contents.isEmpty()) {
			return own;
		}
		JsonNode first = contents.get(0).purelistParameter(key);
		for (Form content : contents) {
			if (!Objects.equals(first, content.purelistParameter(key))) {
				return null;
			}
		}
		return first;
	}

	@Override
	public boolean isIdentityLike() {
		return false;
	}

	@Override
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		for (Form content : contents) {
			content.collectColumns(path, output, listIndicator);
		}
	}

	@Override
	void collectColumnTypes(List<Type> output) {
		for (Form content : contents) {
			content.collectColumnTypes(output);
		}
	}

	@Override
	Form selectColumns(SpecifierMatcher matcher) {
		return withContents(contents.stream().map(c -> c.selectColumns(matcher)).toList());
	}

	@Override
	@Nullable Form pruneColumns(boolean isInsideRecordOrUnion) {
		List<Form> kept = new ArrayList<>();
		for (Form content : contents) {
			Form pruned = content.pruneColumns(true);
			if (pruned != null) {
				kept.add(pruned);
			}
		}
		if (kept.isEmpty()) {
			LOGGER.trace("Pruning union with no remaining branches");
			return null;
		}
		return withContents(kept);
	}

	@Override
	public Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey, boolean recursive) {
		Stream<ExpectedBuffer> own = Stream.concat(
			expected(getKey, "tags", tags.primitive()),
			expected(getKey, "index", index.primitive()));
		if (recursive) {
			return Stream.concat(own, contents.stream().flatMap(c -> c.expectedFromBuffers(getKey, true)));
		} else {
			return own;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof UnionForm that
			&& baseEquals(that)
			&& tags == that.tags
			&& index == that.index
			&& contents.equals(that.contents);
	}

	@Override
	public int hashCode() {
		return Objects.hash(UnionForm.class, tags, index, contents, parameters());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UnionForm.class);
}
