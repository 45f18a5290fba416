package works.ragged.forms;

import java.util.Collection;
import java.util.List;
import works.ragged.types.Primitive;

/**
 * The integer types available for index, offset, mask and tag buffers.
 * Which ones a given field accepts depends on the field.
 */
public enum IndexType {
	I8("i8", Primitive.INT8),
	U8("u8", Primitive.UINT8),
	I32("i32", Primitive.INT32),
	U32("u32", Primitive.UINT32),
	I64("i64", Primitive.INT64);

	private final String text;
	private final Primitive primitive;

	IndexType(String text, Primitive primitive) {
		this.text = text;
		this.primitive = primitive;
	}

	public String text() {
		return text;
	}

	/**
	 * @return the element type of a buffer holding this index
	 */
	public Primitive primitive() {
		return primitive;
	}

	public static IndexType of(String text) {
		for (IndexType candidate : values()) {
			if (candidate.text.equals(text)) {
				return candidate;
			}
		}
		throw new IllegalArgumentException("unrecognized index type: '" + text + "'");
	}

	static List<IndexType> sorted(Collection<IndexType> types) {
		return types.stream().sorted().toList();
	}

	@Override
	public String toString() {
		return text;
	}
}
