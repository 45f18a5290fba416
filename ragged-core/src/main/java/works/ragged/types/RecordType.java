package works.ragged.types;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;
import org.jetbrains.annotations.Nullable;
import works.ragged.Parameters;

import static java.util.Objects.requireNonNull;

/**
 * Records of named {@link #fields}, or, if {@link #fields} is null,
 * tuples whose members are identified by position.
 */
public record RecordType(List<Type> contents, @Nullable List<String> fields, Parameters parameters) implements Type {
	public RecordType {
		contents = List.copyOf(contents);
		if (fields != null) {
			fields = List.copyOf(fields);
			if (fields.size() != contents.size()) {
				throw new IllegalArgumentException("RecordType has " + contents.size() + " contents but " + fields.size() + " fields");
			}
			if (new HashSet<>(fields).size() != fields.size()) {
				throw new IllegalArgumentException("RecordType has duplicate fields: " + fields);
			}
		}
		requireNonNull(parameters);
	}

	public RecordType(List<Type> contents, @Nullable List<String> fields) {
		this(contents, fields, Parameters.empty());
	}

	public boolean isTuple() {
		return fields == null;
	}

	/**
	 * @return the field names, using {@code "0"}, {@code "1"}, ... for tuples
	 */
	public List<String> fieldNames() {
		if (fields == null) {
			return IntStream.range(0, contents.size()).mapToObj(Integer::toString).toList();
		} else {
			return fields;
		}
	}

	private Map<String, Type> asMap() {
		Map<String, Type> result = new HashMap<>();
		List<String> names = fieldNames();
		for (int i = 0; i < contents.size(); i++) {
			result.put(names.get(i), contents.get(i));
		}
		return result;
	}

	@Override
	public boolean isEqualTo(Type other, boolean allParameters) {
		if (!(other instanceof RecordType r)
			|| isTuple() != r.isTuple()
			|| contents.size() != r.contents.size()
			|| !Type.parametersMatch(parameters, r.parameters, allParameters)) {
			return false;
		}
		if (isTuple()) {
			for (int i = 0; i < contents.size(); i++) {
				if (!contents.get(i).isEqualTo(r.contents.get(i), allParameters)) {
					return false;
				}
			}
			return true;
		} else {
			// Field order doesn't matter
			Map<String, Type> theirs = r.asMap();
			for (int i = 0; i < contents.size(); i++) {
				Type their = theirs.get(fields.get(i));
				if (their == null || !contents.get(i).isEqualTo(their, allParameters)) {
					return false;
				}
			}
			return true;
		}
	}

	@Override
	public RecordType withParameters(Parameters parameters) {
		return new RecordType(contents, fields, parameters);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RecordType r && isEqualTo(r, false);
	}

	@Override
	public int hashCode() {
		if (isTuple()) {
			return Objects.hash(contents, parameters.typeParameters());
		} else {
			return Objects.hash(asMap(), parameters.typeParameters());
		}
	}

	@Override
	public String toString() {
		return TypeStrings.str(this);
	}
}
