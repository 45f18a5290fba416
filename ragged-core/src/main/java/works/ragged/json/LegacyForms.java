package works.ragged.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.ragged.exceptions.MalformedFormException;
import works.ragged.exceptions.UnrecognizedFormClassException;
import works.ragged.exceptions.UnsupportedLegacyFormatException;
import works.ragged.forms.Form;

import static java.util.Map.entry;

/**
 * Class tags, and everything needed to read the older serialized layouts.
 */
final class LegacyForms {
	static final String NUMPY = "NumpyArray";
	static final String EMPTY = "EmptyArray";
	static final String REGULAR = "RegularArray";
	static final String LIST = "ListArray";
	static final String LIST_OFFSET = "ListOffsetArray";
	static final String INDEXED = "IndexedArray";
	static final String INDEXED_OPTION = "IndexedOptionArray";
	static final String BYTE_MASKED = "ByteMaskedArray";
	static final String BIT_MASKED = "BitMaskedArray";
	static final String UNMASKED = "UnmaskedArray";
	static final String RECORD = "RecordArray";
	static final String UNION = "UnionArray";

	static final List<String> CURRENT_CLASSES = List.of(
		NUMPY, EMPTY, REGULAR, LIST, LIST_OFFSET, INDEXED, INDEXED_OPTION,
		BYTE_MASKED, BIT_MASKED, UNMASKED, RECORD, UNION);

	static final String VIRTUAL = "VirtualArray";

	/**
	 * Tags that once encoded the index width in the class name.
	 */
	static final Map<String, String> WIDTH_SUFFIXED_CLASSES = Map.ofEntries(
		entry("ListArray32", LIST),
		entry("ListArrayU32", LIST),
		entry("ListArray64", LIST),
		entry("ListOffsetArray32", LIST_OFFSET),
		entry("ListOffsetArrayU32", LIST_OFFSET),
		entry("ListOffsetArray64", LIST_OFFSET),
		entry("IndexedArray32", INDEXED),
		entry("IndexedArrayU32", INDEXED),
		entry("IndexedArray64", INDEXED),
		entry("IndexedOptionArray32", INDEXED_OPTION),
		entry("IndexedOptionArray64", INDEXED_OPTION),
		entry("UnionArray8_32", UNION),
		entry("UnionArray8_U32", UNION),
		entry("UnionArray8_64", UNION)
	);

	private LegacyForms() { }

	/**
	 * @throws UnsupportedLegacyFormatException for {@code VirtualArray}
	 * @throws UnrecognizedFormClassException for anything else we don't know
	 */
	static String canonicalClass(String formClass, boolean acceptWidthSuffixes) {
		if (CURRENT_CLASSES.contains(formClass)) {
			return formClass;
		} else if (VIRTUAL.equals(formClass)) {
			throw new UnsupportedLegacyFormatException("VirtualArray forms are not supported");
		}
		String canonical = WIDTH_SUFFIXED_CLASSES.get(formClass);
		if (canonical == null || !acceptWidthSuffixes) {
			throw new UnrecognizedFormClassException(formClass);
		}
		LOGGER.warn("Reading legacy class tag \"{}\" as \"{}\"", formClass, canonical);
		return canonical;
	}

	record RecordParts(List<Form> contents, @Nullable List<String> fields) { }

	/**
	 * A record's contents come in three shapes:
	 * <ol>
	 *     <li>a {@code "fields"} member (possibly null) beside a {@code "contents"} list;</li>
	 *     <li>no {@code "fields"}, and {@code "contents"} a mapping from name to content;</li>
	 *     <li>no {@code "fields"}, and {@code "contents"} a list, making a tuple.</li>
	 * </ol>
	 */
	static RecordParts recordParts(Map<?, ?> input, Function<Object, Form> read) {
		Object contents = input.get("contents");
		if (input.containsKey("fields")) {
			if (contents instanceof Map) {
				throw new MalformedFormException("RecordArray contents must not be a mapping when \"fields\" is present");
			}
			List<Form> forms = FormSerializer.requireList(input, "contents").stream().map(read).toList();
			return new RecordParts(forms, fieldNames(input.get("fields")));
		} else if (contents instanceof Map<?, ?> byName) {
			LOGGER.debug("Reading RecordArray with contents keyed by field name");
			List<Form> forms = new ArrayList<>();
			List<String> fields = new ArrayList<>();
			byName.forEach((name, content) -> {
				if (!(name instanceof String field)) {
					throw new MalformedFormException("RecordArray field names must be strings, not " + FormSerializer.describe(name));
				}
				fields.add(field);
				forms.add(read.apply(content));
			});
			return new RecordParts(forms, fields);
		} else {
			LOGGER.debug("Reading RecordArray without fields as a tuple");
			List<Form> forms = FormSerializer.requireList(input, "contents").stream().map(read).toList();
			return new RecordParts(forms, null);
		}
	}

	private static @Nullable List<String> fieldNames(@Nullable Object fields) {
		if (fields == null) {
			return null;
		} else if (fields instanceof List<?> list) {
			List<String> result = new ArrayList<>(list.size());
			for (Object field : list) {
				if (!(field instanceof String name)) {
					throw new MalformedFormException("RecordArray field names must be strings, not " + FormSerializer.describe(field));
				}
				result.add(name);
			}
			return result;
		} else {
			throw new MalformedFormException("\"fields\" must be a list or null, not " + FormSerializer.describe(fields));
		}
	}

	/**
	 * Converts positional state, {@code [has_identities, parameters, form_key, ...]},
	 * to the equivalent dict. Children in the state may be {@link Form}s or dicts.
	 * Identities are no longer supported and are ignored.
	 *
	 * @param formKeyPrefix prepended to a non-null form key
	 */
	static Map<String, Object> positionalToDict(String formClass, List<?> state, String formKeyPrefix) {
		String canonical = canonicalClass(formClass, true);
		LOGGER.warn("Reading positional legacy state for {}", canonical);
		List<String> layout = POSITIONAL_LAYOUTS.get(canonical);
		int expectedSize = 3 + layout.size();
		if (state.size() != expectedSize) {
			throw new MalformedFormException("Positional " + canonical + " state must have " + expectedSize + " entries, not " + state.size());
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("class", canonical);
		for (int i = 0; i < layout.size(); i++) {
			String name = layout.get(i);
			if (!IGNORED_POSITIONAL_ENTRIES.contains(name)) {
				result.put(name, state.get(3 + i));
			}
		}
		result.put("parameters", state.get(1));
		Object formKey = state.get(2);
		if (formKey == null) {
			result.put("form_key", null);
		} else if (formKey instanceof String key) {
			result.put("form_key", formKeyPrefix + key);
		} else {
			throw new MalformedFormException("Positional form_key must be a string or null, not " + FormSerializer.describe(formKey));
		}
		return result;
	}

	/**
	 * The entries that follow {@code [has_identities, parameters, form_key]}.
	 */
	private static final Map<String, List<String>> POSITIONAL_LAYOUTS = Map.ofEntries(
		entry(EMPTY, List.of()),
		entry(NUMPY, List.of("inner_shape", "itemsize", "format", "primitive")),
		entry(REGULAR, List.of("content", "size")),
		entry(LIST, List.of("starts", "stops", "content")),
		entry(LIST_OFFSET, List.of("offsets", "content")),
		entry(INDEXED, List.of("index", "content")),
		entry(INDEXED_OPTION, List.of("index", "content")),
		entry(BYTE_MASKED, List.of("mask", "content", "valid_when")),
		entry(BIT_MASKED, List.of("mask", "content", "valid_when", "lsb_order")),
		entry(UNMASKED, List.of("content")),
		entry(RECORD, List.of("contents", "fields")),
		entry(UNION, List.of("tags", "index", "contents"))
	);

	/**
	 * Implied by {@code primitive}.
	 */
	private static final List<String> IGNORED_POSITIONAL_ENTRIES = List.of("itemsize", "format");

	private static final Logger LOGGER = LoggerFactory.getLogger(LegacyForms.class);
}
