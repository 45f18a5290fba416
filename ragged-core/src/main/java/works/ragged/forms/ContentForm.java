package works.ragged.forms;

import java.util.List;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.types.Type;

/**
 * A {@link Form} with exactly one child.
 * <p>
 * The defaults here describe a wrapper that adds no list dimension;
 * {@link RegularForm}, {@link ListForm} and {@link ListOffsetForm} override them.
 */
public abstract sealed class ContentForm extends Form permits
	RegularForm,
	ListForm,
	ListOffsetForm,
	IndexedForm,
	IndexedOptionForm,
	ByteMaskedForm,
	BitMaskedForm,
	UnmaskedForm
{
	private final Form content;

	ContentForm(Form content, Parameters parameters, @Nullable String formKey) {
		super(parameters, formKey);
		this.content = checkContent(getClass(), "content", content);
	}

	public final Form content() {
		return content;
	}

	public abstract ContentForm withContent(Form content);

	/**
	 * @return the buffers this node owns itself, not counting its content
	 */
	abstract Stream<ExpectedBuffer> ownBuffers(BufferKeyFunction getKey);

	@Override
	public final Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey, boolean recursive) {
		Stream<ExpectedBuffer> own = ownBuffers(getKey);
		if (recursive) {
			return Stream.concat(own, Stream.of(content).flatMap(c -> c.expectedFromBuffers(getKey, true)));
		} else {
			return own;
		}
	}

	//
	// Depth
	//

	@Override
	public int purelistDepth() {
		return content.purelistDepth();
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		return content.minmaxDepth();
	}

	@Override
	public BranchDepth branchDepth() {
		return content.branchDepth();
	}

	@Override
	public boolean purelistIsRegular() {
		return content.purelistIsRegular();
	}

	@Override
	public @Nullable JsonNode purelistParameter(String key) {
		JsonNode own = parameter(key);
		return own == null ? content.purelistParameter(key) : own;
	}

	@Override
	public boolean isIdentityLike() {
		return false;
	}

	/**
	 * Depth rules shared by the three list variants. A string or bytestring
	 * counts as a single dimension however it's encoded.
	 */
	final int listPurelistDepth() {
		return parameters().isStringLike() ? 1 : content.purelistDepth() + 1;
	}

	final MinMaxDepth listMinmaxDepth() {
		if (parameters().isStringLike()) {
			return new MinMaxDepth(1, 1);
		}
		MinMaxDepth inner = content.minmaxDepth();
		return new MinMaxDepth(inner.min() + 1, inner.max() + 1);
	}

	final BranchDepth listBranchDepth() {
		if (parameters().isStringLike()) {
			return new BranchDepth(false, 1);
		}
		BranchDepth inner = content.branchDepth();
		return new BranchDepth(inner.branching(), inner.depth() + 1);
	}

	//
	// Columns
	//

	@Override
	void collectColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		content.collectColumns(path, output, listIndicator);
	}

	/**
	 * Column rule shared by the three list variants.
	 */
	final void collectListColumns(List<String> path, List<String> output, @Nullable String listIndicator) {
		if (listIndicator == null || parameters().isStringLike()) {
			content.collectColumns(path, output, listIndicator);
		} else {
			content.collectColumns(append(path, listIndicator), output, listIndicator);
		}
	}

	@Override
	final void collectColumnTypes(List<Type> output) {
		if (parameters().isStringLike()) {
			// A string is one column, not a list of characters
			output.add(type());
		} else {
			content.collectColumnTypes(output);
		}
	}

	@Override
	final Form selectColumns(SpecifierMatcher matcher) {
		Form selected = content.selectColumns(matcher);
		return selected == content ? this : withContent(selected);
	}

	@Override
	final @Nullable Form pruneColumns(boolean isInsideRecordOrUnion) {
		Form pruned = content.pruneColumns(isInsideRecordOrUnion);
		if (pruned == null) {
			return null;
		} else if (pruned == content) {
			return this;
		} else {
			return withContent(pruned);
		}
	}
}
