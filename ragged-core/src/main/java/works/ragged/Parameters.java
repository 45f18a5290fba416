package works.ragged;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.JsonNodeType;
import tools.jackson.databind.node.NullNode;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered bag of JSON-valued hints attached to a
 * {@link works.ragged.forms.Form Form} or {@link works.ragged.types.Type Type}.
 * <p>
 * Most keys are opaque to this library. A few, listed in {@link #TYPE_PARAMETER_KEYS},
 * change the meaning of a type and therefore take part in type equality;
 * and a few values of {@code __array__} ({@link #RESERVED_NOMINAL}) are given
 * fixed meanings such as "this list of {@code uint8} is a UTF-8 string".
 * <p>
 * Values are stored as Jackson {@link JsonNode}s, in the form they take when
 * read back from JSON text: a {@link Long} or a {@link Float} becomes whatever
 * node its written number parses to. That keeps equality stable across a
 * trip through JSON. Container values are copied on the way in and on the way
 * out, so a {@code Parameters} can't be modified through a node obtained from it.
 */
public final class Parameters {
	public static final String ARRAY = "__array__";
	public static final String LIST = "__list__";
	public static final String RECORD = "__record__";
	public static final String CATEGORICAL = "__categorical__";
	public static final String DOC = "__doc__";

	public static final Set<String> TYPE_PARAMETER_KEYS = Set.of(ARRAY, LIST, RECORD, CATEGORICAL);

	/**
	 * The {@code __array__} values with system-defined meaning.
	 */
	public static final Set<String> RESERVED_NOMINAL = Set.of(
		"string",
		"bytestring",
		"char",
		"byte",
		"sorted_map",
		"categorical"
	);

	private static final Parameters EMPTY = new Parameters(Map.of());
	private static final JsonMapper MAPPER = JsonMapper.builder().build();

	@NotNull
	private final Map<String, JsonNode> values;

	private Parameters(Map<String, JsonNode> values) {
		this.values = values;
	}

	public static Parameters empty() {
		return EMPTY;
	}

	public static Parameters of(String key, String value) {
		return empty().with(key, value);
	}

	public static Parameters of(String key1, String value1, String key2, String value2) {
		return empty().with(key1, value1).with(key2, value2);
	}

	/**
	 * @param nodes keys and values in the desired order; null values are kept as JSON null
	 */
	static Parameters fromNodes(Map<String, ? extends JsonNode> nodes) {
		if (nodes.isEmpty()) {
			return EMPTY;
		}
		var copy = new LinkedHashMap<String, JsonNode>();
		nodes.forEach((key, value) -> copy.put(requireNonNull(key), normalized(value)));
		return new Parameters(Collections.unmodifiableMap(copy));
	}

	/**
	 * @param plain a JSON-compatible structure: values are null, {@link Boolean},
	 *              {@link Number}, {@link String}, {@link java.util.List List} or {@link Map}.
	 *              A null map means no parameters.
	 */
	public static Parameters fromPlain(@Nullable Map<String, ?> plain) {
		if (plain == null || plain.isEmpty()) {
			return EMPTY;
		}
		var copy = new LinkedHashMap<String, JsonNode>();
		plain.forEach((key, value) -> copy.put(requireNonNull(key), normalized(value)));
		return new Parameters(Collections.unmodifiableMap(copy));
	}

	public Parameters with(String key, String value) {
		return withNormalized(key, normalized(requireNonNull(value)));
	}

	public Parameters with(String key, JsonNode value) {
		return withNormalized(key, normalized(requireNonNull(value)));
	}

	private Parameters withNormalized(String key, JsonNode value) {
		var copy = new LinkedHashMap<>(values);
		copy.put(requireNonNull(key), value);
		return new Parameters(Collections.unmodifiableMap(copy));
	}

	/**
	 * A fresh node equal to what {@code value} becomes after being written
	 * as JSON and read back.
	 */
	private static JsonNode normalized(@Nullable Object value) {
		if (value == null) {
			return NullNode.getInstance();
		}
		return MAPPER.readTree(MAPPER.writeValueAsString(value));
	}

	public Parameters without(String key) {
		if (!values.containsKey(key)) {
			return this;
		}
		var copy = new LinkedHashMap<>(values);
		copy.remove(key);
		return copy.isEmpty() ? EMPTY : new Parameters(Collections.unmodifiableMap(copy));
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public int size() {
		return values.size();
	}

	public Set<String> keys() {
		return values.keySet();
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	/**
	 * @return the value for {@code key}, or null if absent
	 */
	public @Nullable JsonNode get(String key) {
		JsonNode result = values.get(key);
		return result == null ? null : result.deepCopy();
	}

	/**
	 * @return the value for {@code key} if it's a JSON string; otherwise null
	 */
	public @Nullable String getString(String key) {
		JsonNode result = values.get(key);
		if (result != null && result.getNodeType() == JsonNodeType.STRING) {
			return result.asString();
		} else {
			return null;
		}
	}

	/**
	 * @return the {@code __array__} value if it's one of {@link #RESERVED_NOMINAL}; otherwise null
	 */
	public @Nullable String reservedNominal() {
		String array = getString(ARRAY);
		return array != null && RESERVED_NOMINAL.contains(array) ? array : null;
	}

	public boolean isString() {
		return "string".equals(getString(ARRAY));
	}

	public boolean isBytestring() {
		return "bytestring".equals(getString(ARRAY));
	}

	public boolean isStringLike() {
		return isString() || isBytestring();
	}

	/**
	 * Merges two parameter bags. Entries of {@code overrides} replace
	 * those of {@code this} with the same key.
	 */
	public Parameters union(Parameters overrides) {
		if (overrides.isEmpty()) {
			return this;
		} else if (this.isEmpty()) {
			return overrides;
		}
		var merged = new LinkedHashMap<>(values);
		merged.putAll(overrides.values);
		return new Parameters(Collections.unmodifiableMap(merged));
	}

	/**
	 * @return just the entries whose keys are in {@link #TYPE_PARAMETER_KEYS}
	 */
	public Parameters typeParameters() {
		var result = new LinkedHashMap<String, JsonNode>();
		values.forEach((key, value) -> {
			if (TYPE_PARAMETER_KEYS.contains(key) && !value.isNull()) {
				result.put(key, value);
			}
		});
		return result.size() == values.size() ? this : new Parameters(Collections.unmodifiableMap(result));
	}

	/**
	 * Equality restricted to {@link #TYPE_PARAMETER_KEYS}.
	 */
	public boolean typeParametersEqual(Parameters other) {
		for (String key : TYPE_PARAMETER_KEYS) {
			JsonNode mine = values.get(key);
			JsonNode theirs = other.values.get(key);
			boolean mineAbsent = mine == null || mine.isNull();
			boolean theirsAbsent = theirs == null || theirs.isNull();
			if (mineAbsent != theirsAbsent) {
				return false;
			} else if (!mineAbsent && !mine.equals(theirs)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return a JSON-compatible structure of plain Java objects, in key order
	 */
	public Map<String, Object> toPlain() {
		var result = new LinkedHashMap<String, Object>();
		values.forEach((key, value) -> result.put(key, MAPPER.convertValue(value, Object.class)));
		return result;
	}

	/**
	 * @return the entries as compact JSON object text
	 */
	public String toJson() {
		return MAPPER.writeValueAsString(toPlain());
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Parameters that = (Parameters) o;
		return Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return toJson();
	}
}
