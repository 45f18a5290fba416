package works.ragged.forms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;
import works.ragged.buffers.BufferKeyFunction;
import works.ragged.buffers.ExpectedBuffer;
import works.ragged.exceptions.FieldNotFoundException;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.RecordType;
import works.ragged.types.Type;

import static java.util.Objects.requireNonNull;

/**
 * A record of named fields, or, when {@link #isTuple()}, a tuple whose
 * members are addressed by position. Needs no buffers of its own.
 */
public final class RecordForm extends Form {
	private final List<Form> contents;
	private final @Nullable List<String> fields;

	/**
	 * @param fields the field names, or null for a tuple
	 */
	public RecordForm(List<Form> contents, @Nullable List<String> fields, Parameters parameters, @Nullable String formKey) {
		super(parameters, formKey);
		requireNonNull(contents, "contents");
		for (Form content : contents) {
			checkContent(RecordForm.class, "contents", content);
		}
		this.contents = List.copyOf(contents);
		if (fields == null) {
			this.fields = null;
		} else {
			for (String field : fields) {
				if (field == null) {
					throw new InvalidFormException(RecordForm.class, "fields", "must be strings, not null");
				}
			}
			if (fields.size() != contents.size()) {
				throw new InvalidFormException(RecordForm.class, "fields",
					"must have the same length as contents (" + contents.size() + "), not " + fields.size());
			}
			if (new HashSet<>(fields).size() != fields.size()) {
				throw new InvalidFormException(RecordForm.class, "fields", "must not contain duplicates: " + fields);
			}
			this.fields = List.copyOf(fields);
		}
	}

	public RecordForm(List<Form> contents, @Nullable List<String> fields) {
		this(contents, fields, Parameters.empty(), null);
	}

	public List<Form> contents() {
		return contents;
	}

	public boolean isTuple() {
		return fields == null;
	}

	/**
	 * @return the field names, using {@code "0"}, {@code "1"}, ... for tuples
	 */
	public List<String> fields() {
		if (fields == null) {
			return IntStream.range(0, contents.size()).mapToObj(Integer::toString).toList();
		} else {
			return fields;
		}
	}

	/**
	 * @return the field names exactly as given to the constructor; null for tuples
	 */
	public @Nullable List<String> declaredFields() {
		return fields;
	}

	public String indexToField(int index) {
		if (0 <= index && index < contents.size()) {
			return fields == null ? Integer.toString(index) : fields.get(index);
		} else {
			throw FieldNotFoundException.noIndex(index, contents.size());
		}
	}

	public int fieldToIndex(String field) {
		int result = indexOf(field);
		if (result < 0) {
			throw FieldNotFoundException.noField(field, contents.size());
		}
		return result;
	}

	public boolean hasField(String field) {
		return indexOf(field) >= 0;
	}

	private int indexOf(String field) {
		if (fields == null) {
			try {
				int i = Integer.parseInt(field);
				return 0 <= i && i < contents.size() ? i : -1;
			} catch (NumberFormatException e) {
				return -1;
			}
		} else {
			return fields.indexOf(field);
		}
	}

	public Form content(int index) {
		if (0 <= index && index < contents.size()) {
			return contents.get(index);
		} else {
			throw FieldNotFoundException.noIndex(index, contents.size());
		}
	}

	public Form content(String field) {
		return contents.get(fieldToIndex(field));
	}

	public RecordForm withContents(List<Form> contents) {
		return new RecordForm(contents, fields, parameters(), formKey());
	}

	/**
	 * @param fields the new field names, or null to make this a tuple
	 */
	public RecordForm withFields(@Nullable List<String> fields) {
		return new RecordForm(contents, fields, parameters(), formKey());
	}

	@Override
	public RecordForm withParameters(Parameters parameters) {
		return new RecordForm(contents, fields, parameters, formKey());
	}

	@Override
	public RecordForm withFormKey(@Nullable String formKey) {
		return new RecordForm(contents, fields, parameters(), formKey);
	}

	@Override
	public <R> R accept(FormVisitor<R> visitor) {
		return visitor.visitRecord(this);
	}

	@Override
	public boolean isRecord() {
		return true;
	}

	@Override
	public Type type() {
		return new RecordType(contents.stream().map(Form::type).toList(), fields, parameters());
	}

	@Override
	public int purelistDepth() {
		return 1;
	}

	@Override
	public MinMaxDepth minmaxDepth() {
		if (contents.isEmpty()) {
			return new MinMaxDepth(1, 1);
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
		return branchDepthOf(contents);
	}

	static BranchDepth branchDepthOf(List<Form> contents) {
		if (contents.isEmpty()) {
			return new BranchDepth(false, 1);
		}
		boolean anyBranch = false;
		int minDepth = -1;
		for (Form content : contents) {
			BranchDepth bd = content.branchDepth();
			if (minDepth == -1) {
				minDepth = bd.depth();
			}
			if (bd.branching() || minDepth != bd.depth()) {
				anyBranch = true;
			}
			minDepth = Math.min(minDepth, bd.depth());
		}
		return new BranchDepth(anyBranch, minDepth);
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
		List<String> names = fields();
		for (int i = 0; i < contents.size(); i++) {
			contents.get(i).collectColumns(append(path, names.get(i)), output, listIndicator);
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
		List<String> names = fields();
		List<Form> keptContents = new ArrayList<>();
		List<String> keptFields = new ArrayList<>();
		for (int i = 0; i < contents.size(); i++) {
			SpecifierMatcher next = matcher.matchField(names.get(i));
			if (next != null) {
				keptContents.add(contents.get(i).selectColumns(next));
				keptFields.add(names.get(i));
			}
		}
		return withSurvivors(keptContents, keptFields);
	}

	@Override
	@Nullable Form pruneColumns(boolean isInsideRecordOrUnion) {
		List<String> names = fields();
		List<Form> keptContents = new ArrayList<>();
		List<String> keptFields = new ArrayList<>();
		for (int i = 0; i < contents.size(); i++) {
			Form pruned = contents.get(i).pruneColumns(true);
			if (pruned != null) {
				keptContents.add(pruned);
				keptFields.add(names.get(i));
			}
		}
		if (keptContents.isEmpty() && isInsideRecordOrUnion) {
			LOGGER.trace("Pruning record with no remaining fields");
			return null;
		}
		return withSurvivors(keptContents, keptFields);
	}

	/**
	 * A tuple that loses a member becomes a record named by the original
	 * positions, so the paths of the survivors don't change.
	 */
	private RecordForm withSurvivors(List<Form> keptContents, List<String> keptFields) {
		if (fields == null && keptContents.size() == contents.size()) {
			return new RecordForm(keptContents, null, parameters(), formKey());
		} else {
			return new RecordForm(keptContents, keptFields, parameters(), formKey());
		}
	}

	@Override
	public Stream<ExpectedBuffer> expectedFromBuffers(BufferKeyFunction getKey, boolean recursive) {
		if (recursive) {
			return contents.stream().flatMap(c -> c.expectedFromBuffers(getKey, true));
		} else {
			return Stream.empty();
		}
	}

	private Map<String, Form> asMap() {
		Map<String, Form> result = new HashMap<>();
		List<String> names = fields();
		for (int i = 0; i < contents.size(); i++) {
			result.put(names.get(i), contents.get(i));
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RecordForm that)
			|| !baseEquals(that)
			|| isTuple() != that.isTuple()
			|| contents.size() != that.contents.size()) {
			return false;
		}
		if (isTuple()) {
			return contents.equals(that.contents);
		} else {
			return asMap().equals(that.asMap());
		}
	}

	@Override
	public int hashCode() {
		if (isTuple()) {
			return Objects.hash(RecordForm.class, contents, parameters());
		} else {
			return Objects.hash(RecordForm.class, asMap(), parameters());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordForm.class);
}
