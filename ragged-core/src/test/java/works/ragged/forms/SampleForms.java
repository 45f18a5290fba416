package works.ragged.forms;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import works.ragged.Parameters;
import works.ragged.types.Primitive;

import static works.ragged.Parameters.ARRAY;
import static works.ragged.Parameters.DOC;
import static works.ragged.Parameters.RECORD;

/**
 * One or more instances of every form variant, shared by the tests.
 */
public final class SampleForms {
	private SampleForms() { }

	public static NumpyForm int64() {
		return new NumpyForm(Primitive.INT64);
	}

	public static NumpyForm float64() {
		return new NumpyForm(Primitive.FLOAT64);
	}

	public static NumpyForm bool() {
		return new NumpyForm(Primitive.BOOL);
	}

	public static ListOffsetForm listOf(Form content) {
		return new ListOffsetForm(IndexType.I64, content);
	}

	@SafeVarargs
	public static RecordForm record(Map.Entry<String, Form>... fields) {
		return new RecordForm(
			Stream.of(fields).map(Map.Entry::getValue).toList(),
			Stream.of(fields).map(Map.Entry::getKey).toList());
	}

	public static RecordForm tuple(Form... contents) {
		return new RecordForm(List.of(contents), null);
	}

	public static Stream<Form> everyVariant() {
		return Stream.of(
			int64(),
			new NumpyForm(Primitive.datetime64("ms"), List.of(2L, 3L), Parameters.of(DOC, "timestamps"), "leaf"),
			new NumpyForm(Primitive.FLOAT32, List.of(), Parameters.fromPlain(Map.of("count", 5L, "scale", 0.25f, "big", 1L << 40)), null),
			new EmptyForm(),
			new EmptyForm(Parameters.of(DOC, "nothing"), "empty"),
			new RegularForm(float64(), 3),
			new RegularForm(float64(), RegularForm.UNKNOWN_SIZE, Parameters.empty(), "reg"),
			new ListForm(IndexType.U32, int64()),
			listOf(bool()),
			new ListOffsetForm(IndexType.I32, float64(), Parameters.of(DOC, "floats", "n", "x"), "lo"),
			new ListOffsetForm(IndexType.I64, int64(), Parameters.fromPlain(Map.of("ratio", new BigDecimal("1.50"), "small", (short) 3)), null),
			ScalarForms.string(),
			ScalarForms.bytestring(),
			new IndexedForm(IndexType.I64, int64(), Parameters.of(ARRAY, "categorical"), null),
			new IndexedOptionForm(IndexType.I32, listOf(int64())),
			new ByteMaskedForm(float64(), true),
			new BitMaskedForm(int64(), false, true),
			new UnmaskedForm(bool()),
			record(Map.entry("x", int64()), Map.entry("y", listOf(float64()))),
			new RecordForm(List.of(int64(), int64()), List.of("x", "y"), Parameters.of(RECORD, "Point"), "point"),
			new RecordForm(List.of(int64()), List.of("x"), Parameters.fromPlain(Map.of(
				"units", List.of("m", 2L, true),
				"meta", Map.of("precision", 1.5f, "exact", false))), "annotated"),
			tuple(int64(), ScalarForms.string()),
			tuple(),
			new UnionForm(IndexType.I64, List.of(int64(), ScalarForms.string())),
			new UnionForm(IndexType.I8, IndexType.I32, List.of(bool(), listOf(int64())), Parameters.of(DOC, "either"), "u")
		);
	}
}
