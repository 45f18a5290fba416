package works.ragged.json;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.ragged.Parameters;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.exceptions.MalformedFormException;
import works.ragged.forms.BitMaskedForm;
import works.ragged.forms.ByteMaskedForm;
import works.ragged.forms.ContentForm;
import works.ragged.forms.EmptyForm;
import works.ragged.forms.Form;
import works.ragged.forms.FormVisitor;
import works.ragged.forms.IndexType;
import works.ragged.forms.IndexedForm;
import works.ragged.forms.IndexedOptionForm;
import works.ragged.forms.ListForm;
import works.ragged.forms.ListOffsetForm;
import works.ragged.forms.NumpyForm;
import works.ragged.forms.RecordForm;
import works.ragged.forms.RegularForm;
import works.ragged.forms.UnionForm;
import works.ragged.forms.UnmaskedForm;
import works.ragged.types.Primitive;

import static java.util.Objects.requireNonNull;

/**
 * Converts between {@link Form}s and their JSON-compatible dict representation:
 * nested {@link Map}s, {@link List}s, strings, numbers, booleans and nulls,
 * with a {@code "class"} member naming the variant of each node.
 * <p>
 * Reading accepts every format this library has ever written;
 * the older ones are handled by {@link LegacyForms}.
 */
public final class FormSerializer {
	private static final JsonMapper MAPPER = JsonMapper.builder().build();
	private static final FormSerializer STANDARD = new FormSerializer(SerializerConfig.simple());

	private final SerializerConfig config;

	public FormSerializer(SerializerConfig config) {
		this.config = requireNonNull(config);
	}

	public static FormSerializer standard() {
		return STANDARD;
	}

	public SerializerConfig config() {
		return config;
	}

	//
	// Writing
	//

	/**
	 * @return a {@link Map}, or in non-verbose mode possibly just a primitive name
	 * @see SerializerConfig#verbose()
	 */
	public Object toDict(Form form) {
		return toDict(form, config.verbose());
	}

	public Object toDict(Form form, boolean verbose) {
		return form.accept(new DictWriter(verbose));
	}

	/**
	 * @return the dict as compact JSON text
	 */
	public String toJson(Form form) {
		return toJson(form, config.verbose());
	}

	public String toJson(Form form, boolean verbose) {
		return MAPPER.writeValueAsString(toDict(form, verbose));
	}

	private static final class DictWriter implements FormVisitor<Object> {
		final boolean verbose;

		DictWriter(boolean verbose) {
			this.verbose = verbose;
		}

		@Override
		public Object visitNumpy(NumpyForm form) {
			if (!verbose && form.parameters().isEmpty() && form.formKey() == null && form.innerShape().isEmpty()) {
				return form.primitive().name();
			}
			Map<String, Object> out = start(LegacyForms.NUMPY);
			out.put("primitive", form.primitive().name());
			if (verbose || !form.innerShape().isEmpty()) {
				out.put("inner_shape", form.innerShape());
			}
			return finish(out, form);
		}

		@Override
		public Object visitEmpty(EmptyForm form) {
			return finish(start(LegacyForms.EMPTY), form);
		}

		@Override
		public Object visitRegular(RegularForm form) {
			Map<String, Object> out = start(LegacyForms.REGULAR);
			out.put("size", form.isSizeKnown() ? form.size() : null);
			return withContent(out, form);
		}

		@Override
		public Object visitList(ListForm form) {
			Map<String, Object> out = start(LegacyForms.LIST);
			out.put("starts", form.starts().text());
			out.put("stops", form.stops().text());
			return withContent(out, form);
		}

		@Override
		public Object visitListOffset(ListOffsetForm form) {
			Map<String, Object> out = start(LegacyForms.LIST_OFFSET);
			out.put("offsets", form.offsets().text());
			return withContent(out, form);
		}

		@Override
		public Object visitIndexed(IndexedForm form) {
			Map<String, Object> out = start(LegacyForms.INDEXED);
			out.put("index", form.index().text());
			return withContent(out, form);
		}

		@Override
		public Object visitIndexedOption(IndexedOptionForm form) {
			Map<String, Object> out = start(LegacyForms.INDEXED_OPTION);
			out.put("index", form.index().text());
			return withContent(out, form);
		}

		@Override
		public Object visitByteMasked(ByteMaskedForm form) {
			Map<String, Object> out = start(LegacyForms.BYTE_MASKED);
			out.put("mask", form.mask().text());
			out.put("valid_when", form.validWhen());
			return withContent(out, form);
		}

		@Override
		public Object visitBitMasked(BitMaskedForm form) {
			Map<String, Object> out = start(LegacyForms.BIT_MASKED);
			out.put("mask", form.mask().text());
			out.put("valid_when", form.validWhen());
			out.put("lsb_order", form.lsbOrder());
			return withContent(out, form);
		}

		@Override
		public Object visitUnmasked(UnmaskedForm form) {
			return withContent(start(LegacyForms.UNMASKED), form);
		}

		@Override
		public Object visitRecord(RecordForm form) {
			Map<String, Object> out = start(LegacyForms.RECORD);
			out.put("fields", form.declaredFields());
			out.put("contents", contents(form.contents()));
			return finish(out, form);
		}

		@Override
		public Object visitUnion(UnionForm form) {
			Map<String, Object> out = start(LegacyForms.UNION);
			out.put("tags", form.tags().text());
			out.put("index", form.index().text());
			out.put("contents", contents(form.contents()));
			return finish(out, form);
		}

		private static Map<String, Object> start(String formClass) {
			Map<String, Object> out = new LinkedHashMap<>();
			out.put("class", formClass);
			return out;
		}

		private Map<String, Object> withContent(Map<String, Object> out, ContentForm form) {
			out.put("content", form.content().accept(this));
			return finish(out, form);
		}

		private List<Object> contents(List<Form> contents) {
			List<Object> result = new ArrayList<>(contents.size());
			for (Form content : contents) {
				result.add(content.accept(this));
			}
			return result;
		}

		private Map<String, Object> finish(Map<String, Object> out, Form form) {
			if (verbose || !form.parameters().isEmpty()) {
				out.put("parameters", form.parameters().toPlain());
			}
			if (verbose || form.formKey() != null) {
				out.put("form_key", form.formKey());
			}
			return out;
		}
	}

	//
	// Reading
	//

	/**
	 * @param input a dict as produced by {@link #toDict}, a bare primitive name,
	 *              or the equivalent {@link JsonNode}
	 */
	public Form fromDict(Object input) {
		if (input instanceof JsonNode node) {
			return read(MAPPER.convertValue(node, Object.class));
		} else {
			return read(input);
		}
	}

	public Form fromJson(String json) {
		Object parsed;
		try {
			parsed = MAPPER.readValue(json, Object.class);
		} catch (JacksonException e) {
			throw new MalformedFormException("Unable to parse Form JSON: " + e.getOriginalMessage(), e);
		}
		return read(parsed);
	}

	/**
	 * Reads the positional state written by an older serialization protocol.
	 *
	 * @param formClass the class tag of the node
	 * @param state {@code [has_identities, parameters, form_key, ...]}
	 */
	public Form fromPositional(String formClass, List<?> state) {
		return read(LegacyForms.positionalToDict(formClass, state, config.legacyFormKeyPrefix()));
	}

	/**
	 * Children may already be {@link Form}s, as when reading positional state.
	 */
	Form read(@Nullable Object input) {
		if (input instanceof Form form) {
			return form;
		} else if (input instanceof String primitive) {
			return new NumpyForm(primitive(primitive));
		} else if (input instanceof Map<?, ?> map) {
			return readDict(map);
		} else {
			throw new MalformedFormException("Expected a Form dict or primitive name, not " + describe(input));
		}
	}

	private Form readDict(Map<?, ?> input) {
		String formClass = LegacyForms.canonicalClass(requireString(input, "class"), config.acceptLegacyClassNames());
		Parameters parameters = parameters(input);
		String formKey = optionalString(input, "form_key");
		switch (formClass) {
			case LegacyForms.NUMPY:
				return new NumpyForm(primitive(requireString(input, "primitive")), innerShape(input), parameters, formKey);
			case LegacyForms.EMPTY:
				return new EmptyForm(parameters, formKey);
			case LegacyForms.REGULAR: {
				Object size = input.get("size");
				long s = size == null ? RegularForm.UNKNOWN_SIZE : integer(size, "size");
				return new RegularForm(content(input), s, parameters, formKey);
			}
			case LegacyForms.LIST:
				return new ListForm(
					index(ListForm.class, input, "starts"),
					index(ListForm.class, input, "stops"),
					content(input), parameters, formKey);
			case LegacyForms.LIST_OFFSET:
				return new ListOffsetForm(index(ListOffsetForm.class, input, "offsets"), content(input), parameters, formKey);
			case LegacyForms.INDEXED:
				return new IndexedForm(index(IndexedForm.class, input, "index"), content(input), parameters, formKey);
			case LegacyForms.INDEXED_OPTION:
				return new IndexedOptionForm(index(IndexedOptionForm.class, input, "index"), content(input), parameters, formKey);
			case LegacyForms.BYTE_MASKED:
				return new ByteMaskedForm(
					index(ByteMaskedForm.class, input, "mask"),
					content(input),
					requireBoolean(input, "valid_when"),
					parameters, formKey);
			case LegacyForms.BIT_MASKED:
				return new BitMaskedForm(
					index(BitMaskedForm.class, input, "mask"),
					content(input),
					requireBoolean(input, "valid_when"),
					requireBoolean(input, "lsb_order"),
					parameters, formKey);
			case LegacyForms.UNMASKED:
				return new UnmaskedForm(content(input), parameters, formKey);
			case LegacyForms.RECORD: {
				LegacyForms.RecordParts parts = LegacyForms.recordParts(input, this::read);
				return new RecordForm(parts.contents(), parts.fields(), parameters, formKey);
			}
			case LegacyForms.UNION:
				return new UnionForm(
					index(UnionForm.class, input, "tags"),
					index(UnionForm.class, input, "index"),
					requireList(input, "contents").stream().map(this::read).toList(),
					parameters, formKey);
			default:
				throw new AssertionError("Unexpected canonical class: " + formClass);
		}
	}

	private Form content(Map<?, ?> input) {
		if (!input.containsKey("content")) {
			throw new MalformedFormException("Missing \"content\" in " + input.get("class"));
		}
		return read(input.get("content"));
	}

	private static Primitive primitive(String name) {
		try {
			return Primitive.of(name);
		} catch (IllegalArgumentException e) {
			throw new MalformedFormException(e.getMessage(), e);
		}
	}

	private static IndexType index(Class<? extends Form> formClass, Map<?, ?> input, String key) {
		String text = requireString(input, key);
		try {
			return IndexType.of(text);
		} catch (IllegalArgumentException e) {
			throw new InvalidFormException(formClass, key, "unrecognized index type '" + text + "'", e);
		}
	}

	private static List<Long> innerShape(Map<?, ?> input) {
		Object shape = input.get("inner_shape");
		if (shape == null) {
			return List.of();
		} else if (shape instanceof List<?> list) {
			List<Long> result = new ArrayList<>(list.size());
			for (Object size : list) {
				result.add(integer(size, "inner_shape"));
			}
			return result;
		} else {
			throw new MalformedFormException("\"inner_shape\" must be a list, not " + describe(shape));
		}
	}

	static Parameters parameters(Map<?, ?> input) {
		Object parameters = input.get("parameters");
		if (parameters == null) {
			return Parameters.empty();
		} else if (parameters instanceof Map<?, ?> map) {
			Map<String, Object> plain = new LinkedHashMap<>();
			map.forEach((k, v) -> {
				if (!(k instanceof String key)) {
					throw new MalformedFormException("Parameter keys must be strings, not " + describe(k));
				}
				plain.put(key, v);
			});
			return Parameters.fromPlain(plain);
		} else {
			throw new MalformedFormException("\"parameters\" must be a mapping, not " + describe(parameters));
		}
	}

	static String requireString(Map<?, ?> input, String key) {
		Object value = input.get(key);
		if (value instanceof String s) {
			return s;
		} else if (value == null) {
			throw new MalformedFormException("Missing string \"" + key + "\"");
		} else {
			throw new MalformedFormException("\"" + key + "\" must be a string, not " + describe(value));
		}
	}

	static @Nullable String optionalString(Map<?, ?> input, String key) {
		Object value = input.get(key);
		if (value == null || value instanceof String) {
			return (String) value;
		} else {
			throw new MalformedFormException("\"" + key + "\" must be a string or null, not " + describe(value));
		}
	}

	static boolean requireBoolean(Map<?, ?> input, String key) {
		Object value = input.get(key);
		if (value instanceof Boolean b) {
			return b;
		} else {
			throw new MalformedFormException("\"" + key + "\" must be a boolean, not " + describe(value));
		}
	}

	static List<?> requireList(Map<?, ?> input, String key) {
		Object value = input.get(key);
		if (value instanceof List<?> list) {
			return list;
		} else {
			throw new MalformedFormException("\"" + key + "\" must be a list, not " + describe(value));
		}
	}

	static long integer(Object value, String what) {
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof BigInteger big) {
			try {
				return big.longValueExact();
			} catch (ArithmeticException e) {
				throw new MalformedFormException("\"" + what + "\" is out of range: " + big, e);
			}
		} else {
			throw new MalformedFormException("\"" + what + "\" must be an integer, not " + describe(value));
		}
	}

	static String describe(@Nullable Object value) {
		if (value == null) {
			return "null";
		} else {
			return value.getClass().getSimpleName() + " " + value;
		}
	}
}
