package works.ragged.forms;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.ragged.Parameters;
import works.ragged.types.NumpyType;
import works.ragged.types.Primitive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.ragged.forms.SampleForms.bool;
import static works.ragged.forms.SampleForms.float64;
import static works.ragged.forms.SampleForms.int64;
import static works.ragged.forms.SampleForms.listOf;
import static works.ragged.forms.SampleForms.record;
import static works.ragged.forms.SampleForms.tuple;

class ColumnsTest {
	RecordForm nested;

	@BeforeEach
	void setupNested() {
		nested = record(
			Map.entry("x", record(Map.entry("z", int64()), Map.entry("w", bool()))),
			Map.entry("y", record(Map.entry("z", float64()))),
			Map.entry("q", listOf(record(Map.entry("z", new NumpyForm(Primitive.INT8))))));
	}

	@Test
	void flatRecord() {
		RecordForm flat = record(Map.entry("a", int64()), Map.entry("b", float64()));
		assertEquals(List.of("a", "b"), flat.columns());
		assertEquals(List.of(new NumpyType(Primitive.INT64), new NumpyType(Primitive.FLOAT64)), flat.columnTypes());
		assertEquals(record(Map.entry("a", int64())), flat.selectColumns("a"));
	}

	@Test
	void nestedColumns() {
		assertEquals(List.of("x.z", "x.w", "y.z", "q.z"), nested.columns());
		assertEquals(List.of("x.z", "x.w", "y.z", "q.list.z"), nested.columns("list"));
		assertEquals(List.of("top.x.z", "top.x.w", "top.y.z", "top.q.z"), nested.columns(null, List.of("top")));
	}

	@Test
	void listIndicator_atEveryDimension() {
		RecordForm form = record(
			Map.entry("a", listOf(listOf(int64()))),
			Map.entry("b", new NumpyForm(Primitive.INT32, List.of(3L), Parameters.empty(), null)));
		assertEquals(List.of("a.[].[]", "b.[]"), form.columns("[]"));
	}

	@Test
	void strings_areSingleColumns() {
		RecordForm form = record(Map.entry("name", ScalarForms.string()), Map.entry("tags", listOf(ScalarForms.string())));
		assertEquals(List.of("name", "tags.list"), form.columns("list"));
		assertEquals("string", form.columnTypes().get(0).toString());
		assertEquals("string", form.columnTypes().get(1).toString());
		assertEquals(2, form.columnTypes().size());
	}

	@Test
	void emptySpecifier_selectsEverything() {
		assertEquals(nested, nested.selectColumns(""));
		assertEquals(nested, nested.selectColumns(List.of("x.z", "")));
	}

	@Test
	void exhaustedSpecifier_keepsWholeSubtree() {
		Form selected = nested.selectColumns("x");
		assertEquals(record(Map.entry("x", nested.content("x"))), selected);
		assertEquals(List.of("x.z", "x.w"), selected.columns());
	}

	@Test
	void braces_expandBeforeMatching() {
		Form braced = nested.selectColumns("{x,y}.z");
		assertEquals(nested.selectColumns(List.of("x.z", "y.z")), braced);
		assertEquals(List.of("x.z", "y.z"), braced.columns());
	}

	@Test
	void braces_canBeTakenLiterally() {
		RecordForm literal = record(Map.entry("{x,y}", int64()), Map.entry("x", bool()));
		assertEquals(List.of("{x,y}"), literal.selectColumns(List.of("{x,y}"), false).columns());
		assertEquals(List.of("x"), literal.selectColumns(List.of("{x,y}"), true).columns());
	}

	@Test
	void globs() {
		assertEquals(List.of("x.z", "y.z", "q.z"), nested.selectColumns("*.z").columns());
		assertEquals(List.of("x.z", "x.w", "y.z"), nested.selectColumns("[xy]").columns());
		assertEquals(List.of("q.z"), nested.selectColumns("[!xy]").columns());
		assertEquals(List.of("x.w"), nested.selectColumns("?.w").columns());
		assertEquals(nested, nested.selectColumns("*"));
	}

	@Test
	void selectionDescendsThroughLists() {
		Form selected = nested.selectColumns("q.z");
		assertEquals(record(Map.entry("q", listOf(record(Map.entry("z", new NumpyForm(Primitive.INT8)))))), selected);
	}

	@Test
	void fieldOrder_isPreserved() {
		assertEquals(List.of("x.z", "y.z"), nested.selectColumns(List.of("y.z", "x.z")).columns());
	}

	@Test
	void missingField_prunesItsParents() {
		Form selected = nested.selectColumns("x.nope");
		assertEquals(new RecordForm(List.of(), List.of()), selected);
		assertEquals(List.of(), selected.columns());
	}

	@Test
	void withoutPruning_emptyRecordsRemain() {
		Form selected = nested.selectColumns(List.of("x.nope"), true, false);
		assertEquals(record(Map.entry("x", new RecordForm(List.of(), List.of()))), selected);
	}

	@Test
	void wrappers_disappearWithTheirContent() {
		RecordForm form = record(
			Map.entry("x", new IndexedOptionForm(IndexType.I64, record(Map.entry("z", int64())))),
			Map.entry("y", int64()));
		assertEquals(record(Map.entry("y", int64())), form.selectColumns(List.of("x.nope", "y")));
		assertEquals(
			record(Map.entry("x", new IndexedOptionForm(IndexType.I64, record(Map.entry("z", int64()))))),
			form.selectColumns("x.z"));
	}

	@Test
	void tuples_keepPositionsAsFieldNames() {
		RecordForm triple = tuple(int64(), float64(), bool());
		RecordForm selected = assertInstanceOf(RecordForm.class, triple.selectColumns("1"));
		assertFalse(selected.isTuple());
		assertEquals(List.of("1"), selected.fields());
		assertEquals(float64(), selected.content("1"));

		RecordForm all = assertInstanceOf(RecordForm.class, triple.selectColumns("*"));
		assertTrue(all.isTuple());
		assertEquals(triple, all);
	}

	@Test
	void unions_dropEmptiedBranches() {
		UnionForm union = new UnionForm(IndexType.I64, List.of(
			record(Map.entry("a", int64())),
			record(Map.entry("b", bool()))));
		UnionForm selected = assertInstanceOf(UnionForm.class, union.selectColumns("a"));
		assertEquals(List.of(record(Map.entry("a", int64()))), selected.contents());
		assertEquals(List.of("a"), selected.columns());
	}

	@Test
	void unions_withNothingLeft_becomeEmptyRecords() {
		UnionForm union = new UnionForm(IndexType.I64, List.of(
			record(Map.entry("a", int64())),
			record(Map.entry("b", bool()))));
		assertEquals(new RecordForm(List.of(), List.of()), union.selectColumns("c"));
	}

	@Test
	void leaves_areNeverPruned() {
		assertEquals(int64(), int64().selectColumns("anything"));
		assertEquals(listOf(int64()), listOf(int64()).selectColumns("a.b"));
	}

	@Test
	void nullSpecifier_throws() {
		assertThrows(NullPointerException.class, () -> nested.selectColumns(Arrays.asList("x", null)));
	}

	@Test
	void parametersAndKeys_survive() {
		RecordForm keyed = new RecordForm(
			List.of(int64(), bool()), List.of("a", "b"),
			Parameters.of(Parameters.RECORD, "Pair"), "rec");
		Form selected = keyed.selectColumns("a");
		assertEquals("rec", selected.formKey());
		assertEquals("Pair", selected.parameters().getString(Parameters.RECORD));
	}
}
