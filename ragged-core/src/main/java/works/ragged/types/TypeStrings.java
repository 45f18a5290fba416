package works.ragged.types;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import works.ragged.Parameters;

import static works.ragged.Parameters.ARRAY;
import static works.ragged.Parameters.RECORD;

/**
 * Renders the conventional one-line type strings, such as
 * {@code var * {x: int64, y: ?string}}.
 */
final class TypeStrings {
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

	private TypeStrings() { }

	static String str(Type type) {
		if (type instanceof NumpyType n) {
			return numpy(n);
		} else if (type instanceof UnknownType u) {
			return withParameters("unknown", u.parameters());
		} else if (type instanceof ListType l) {
			return list(l);
		} else if (type instanceof RegularType r) {
			return regular(r);
		} else if (type instanceof OptionType o) {
			return option(o);
		} else if (type instanceof RecordType r) {
			return record(r);
		} else if (type instanceof UnionType u) {
			return union(u);
		} else {
			throw new AssertionError("Unexpected type: " + type.getClass());
		}
	}

	private static String numpy(NumpyType n) {
		String nominal = n.parameters().reservedNominal();
		if ("char".equals(nominal) || "byte".equals(nominal)) {
			return withParameters(nominal, n.parameters().without(ARRAY));
		} else {
			return withParameters(n.primitive().name(), n.parameters());
		}
	}

	private static String list(ListType l) {
		Parameters parameters = l.parameters();
		if (parameters.isString()) {
			return withParameters("string", parameters.without(ARRAY));
		} else if (parameters.isBytestring()) {
			return withParameters("bytes", parameters.without(ARRAY));
		} else if (parameters.isEmpty()) {
			return "var * " + l.content();
		} else {
			return "[var * " + l.content() + ", parameters=" + parameters.toJson() + "]";
		}
	}

	private static String regular(RegularType r) {
		Parameters parameters = r.parameters();
		String size = r.isSizeKnown() ? Long.toString(r.size()) : "??";
		if (parameters.isString()) {
			return withParameters("string[" + size + "]", parameters.without(ARRAY));
		} else if (parameters.isBytestring()) {
			return withParameters("bytes[" + size + "]", parameters.without(ARRAY));
		} else if (parameters.isEmpty()) {
			return size + " * " + r.content();
		} else {
			return "[" + size + " * " + r.content() + ", parameters=" + parameters.toJson() + "]";
		}
	}

	private static String option(OptionType o) {
		Type content = o.content();
		boolean needsBrackets = content instanceof ListType l && !l.parameters().isStringLike()
			|| content instanceof RegularType r && !r.parameters().isStringLike()
			|| content instanceof UnionType;
		if (!o.parameters().isEmpty()) {
			return "option[" + content + ", parameters=" + o.parameters().toJson() + "]";
		} else if (needsBrackets) {
			return "option[" + content + "]";
		} else {
			return "?" + content;
		}
	}

	private static String record(RecordType r) {
		String name = r.parameters().getString(RECORD);
		Parameters rest = name == null ? r.parameters() : r.parameters().without(RECORD);
		String body;
		if (r.isTuple()) {
			body = joined(r.contents());
		} else {
			StringBuilder sb = new StringBuilder();
			List<String> fields = r.fieldNames();
			for (int i = 0; i < fields.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(fieldName(fields.get(i))).append(": ").append(r.contents().get(i));
			}
			body = sb.toString();
		}
		String open = r.isTuple() ? "(" : "{";
		String close = r.isTuple() ? ")" : "}";
		if (name == null && rest.isEmpty()) {
			return open + body + close;
		} else if (rest.isEmpty()) {
			return name + "[" + body + "]";
		} else {
			String prefix = name == null ? (r.isTuple() ? "tuple" : "struct") : name;
			return prefix + "[" + open + body + close + ", parameters=" + rest.toJson() + "]";
		}
	}

	private static String union(UnionType u) {
		if (u.parameters().isEmpty()) {
			return "union[" + joined(u.contents()) + "]";
		} else {
			return "union[" + joined(u.contents()) + ", parameters=" + u.parameters().toJson() + "]";
		}
	}

	private static String joined(List<Type> types) {
		return types.stream().map(Type::toString).collect(Collectors.joining(", "));
	}

	private static String fieldName(String field) {
		if (IDENTIFIER.matcher(field).matches()) {
			return field;
		} else {
			return '"' + field.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
		}
	}

	private static String withParameters(String base, Parameters parameters) {
		if (parameters.isEmpty()) {
			return base;
		} else {
			return base + "[parameters=" + parameters.toJson() + "]";
		}
	}
}
