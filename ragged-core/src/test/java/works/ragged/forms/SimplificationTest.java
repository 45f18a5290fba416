package works.ragged.forms;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.ragged.Parameters;
import works.ragged.exceptions.InvalidFormException;
import works.ragged.types.NumpyType;
import works.ragged.types.OptionType;
import works.ragged.types.Primitive;
import works.ragged.types.UnionType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.ragged.Parameters.ARRAY;
import static works.ragged.Parameters.DOC;
import static works.ragged.forms.SampleForms.bool;
import static works.ragged.forms.SampleForms.float64;
import static works.ragged.forms.SampleForms.int64;
import static works.ragged.forms.SampleForms.listOf;
import static works.ragged.forms.SampleForms.record;

class SimplificationTest {

	@Test
	void constructors_doNotSimplify() {
		IndexedOptionForm nested = new IndexedOptionForm(IndexType.I64, new IndexedOptionForm(IndexType.I64, int64()));
		assertInstanceOf(IndexedOptionForm.class, nested.content());
		// The type is canonical even when the form isn't
		assertEquals("?int64", nested.type().toString());
	}

	@Test
	void optionOfOption_collapses() {
		Form result = IndexedOptionForm.simplified(IndexType.I32, new IndexedOptionForm(IndexType.I32, int64()));
		assertEquals(new IndexedOptionForm(IndexType.I64, int64()), result);
	}

	@Test
	void optionOfIndexed_collapses() {
		Form result = IndexedOptionForm.simplified(IndexType.I64, new IndexedForm(IndexType.U32, float64()));
		assertEquals(new IndexedOptionForm(IndexType.I64, float64()), result);
	}

	@Test
	void maskedOfOption_collapsesToIndexedOption() {
		Form byteMasked = ByteMaskedForm.simplified(IndexType.I8, new UnmaskedForm(int64()), true, Parameters.empty(), null);
		assertEquals(new IndexedOptionForm(IndexType.I64, int64()), byteMasked);

		Form bitMasked = BitMaskedForm.simplified(IndexType.U8, new ByteMaskedForm(int64(), false), true, true, Parameters.empty(), null);
		assertEquals(new IndexedOptionForm(IndexType.I64, int64()), bitMasked);

		Form unmasked = UnmaskedForm.simplified(new IndexedOptionForm(IndexType.I32, bool()), Parameters.empty(), null);
		assertEquals(new IndexedOptionForm(IndexType.I64, bool()), unmasked);
	}

	@Test
	void collapse_mergesParameters_outerWins() {
		Parameters inner = Parameters.of(DOC, "inner", "x", "1");
		Parameters outer = Parameters.of(DOC, "outer");
		Form result = BitMaskedForm.simplified(IndexType.U8, new UnmaskedForm(int64(), inner, null), true, false, outer, null);
		assertEquals(Parameters.of(DOC, "outer", "x", "1"), result.parameters());
	}

	@Test
	void maskedOfPlainContent_isBuiltAsRequested() {
		Form result = ByteMaskedForm.simplified(IndexType.I8, int64(), false, Parameters.empty(), "k");
		assertEquals(new ByteMaskedForm(IndexType.I8, int64(), false, Parameters.empty(), "k"), result);
	}

	@Test
	void optionOfUnion_becomesUnionOfOptions() {
		UnionForm union = new UnionForm(IndexType.I64, List.of(int64(), listOf(float64())));
		Form result = IndexedOptionForm.simplified(IndexType.I64, union);
		UnionForm resultUnion = assertInstanceOf(UnionForm.class, result);
		assertEquals(2, resultUnion.contents().size());
		assertTrue(resultUnion.contents().stream().allMatch(c -> c instanceof IndexedOptionForm));
		assertEquals(OptionType.of(union.type()), result.type());
	}

	@Test
	void indexedOfIndexed_collapses() {
		Form result = IndexedForm.simplified(IndexType.I32, new IndexedForm(IndexType.I32, int64()));
		assertEquals(new IndexedForm(IndexType.I64, int64()), result);
	}

	@Test
	void indexedOfOption_becomesIndexedOption() {
		Form result = IndexedForm.simplified(IndexType.I32, new ByteMaskedForm(int64(), true));
		assertEquals(new IndexedOptionForm(IndexType.I64, int64()), result);
	}

	@Test
	void indexedOfUnion_isAbsorbed() {
		UnionForm union = new UnionForm(IndexType.I64, List.of(int64(), bool()));
		Form result = IndexedForm.simplified(IndexType.I64, union, Parameters.of(DOC, "d"), null);
		assertEquals(union.withParameters(Parameters.of(DOC, "d")), result);
	}

	@Test
	void categoricalIndexedOfUnion_isKept() {
		UnionForm union = new UnionForm(IndexType.I64, List.of(int64(), bool()));
		Form result = IndexedForm.simplified(IndexType.I64, union, Parameters.of(ARRAY, "categorical"), null);
		IndexedForm indexed = assertInstanceOf(IndexedForm.class, result);
		assertSame(union, indexed.content());
	}

	@Test
	void union_splicesNestedUnions() {
		Form result = UnionForm.simplified(IndexType.I64, List.of(
			int64(),
			new UnionForm(IndexType.I32, List.of(bool(), listOf(int64())))));
		UnionForm union = assertInstanceOf(UnionForm.class, result);
		assertEquals(List.of(int64(), bool(), listOf(int64())), union.contents());
	}

	@Test
	void union_mergesBranchesOfEqualType() {
		Form result = UnionForm.simplified(IndexType.I64, List.of(
			listOf(int64()),
			bool(),
			new ListForm(IndexType.I32, int64())));
		UnionForm union = assertInstanceOf(UnionForm.class, result);
		assertEquals(List.of(listOf(int64()), bool()), union.contents());
	}

	@Test
	void union_ofOneBranch_isTheBranch() {
		Parameters params = Parameters.of(DOC, "only");
		Form result = UnionForm.simplified(IndexType.I8, IndexType.I64, List.of(int64(), int64().withFormKey("dup")), params, null);
		assertEquals(int64().withParameters(params), result);
	}

	@Test
	void union_ofNothing_throws() {
		InvalidFormException e = assertThrows(InvalidFormException.class, () -> UnionForm.simplified(IndexType.I64, List.of()));
		assertEquals("contents", e.fieldName());
	}

	@Test
	void union_dropsEmptyBranches() {
		Form result = UnionForm.simplified(IndexType.I64, List.of(new EmptyForm(), int64(), float64()));
		UnionForm union = assertInstanceOf(UnionForm.class, result);
		assertEquals(List.of(int64(), float64()), union.contents());

		assertEquals(new EmptyForm(), UnionForm.simplified(IndexType.I64, List.of(new EmptyForm(), new EmptyForm())));
	}

	@Test
	void union_withOneOptionalBranch_makesAllOptional() {
		Form result = UnionForm.simplified(IndexType.I64, List.of(
			new ByteMaskedForm(int64(), true),
			float64()));
		UnionForm union = assertInstanceOf(UnionForm.class, result);
		assertEquals(List.of(
			new IndexedOptionForm(IndexType.I64, int64()),
			new IndexedOptionForm(IndexType.I64, float64())), union.contents());
		assertEquals(
			new UnionType(List.of(new OptionType(new NumpyType(Primitive.INT64)), new OptionType(new NumpyType(Primitive.FLOAT64)))),
			union.type());
	}

	@Test
	void union_optionAndPlainOfSameType_merge() {
		Form result = UnionForm.simplified(IndexType.I64, List.of(
			new IndexedOptionForm(IndexType.I64, int64()),
			int64()));
		assertEquals(new IndexedOptionForm(IndexType.I64, int64()), result);
	}

	@Test
	void simplification_isIdempotent() {
		List<Form> inputs = List.of(
			IndexedOptionForm.simplified(IndexType.I32, new UnmaskedForm(new IndexedForm(IndexType.I32, int64()))),
			UnionForm.simplified(IndexType.I64, List.of(
				new ByteMaskedForm(int64(), true),
				new UnionForm(IndexType.I64, List.of(float64(), new EmptyForm(), listOf(bool()))),
				record(Map.entry("x", int64())))),
			IndexedForm.simplified(IndexType.I64, new IndexedForm(IndexType.I64, new IndexedOptionForm(IndexType.I32, bool())))
		);
		for (Form once : inputs) {
			assertEquals(once, resimplify(once));
		}
	}

	@Test
	void simplifiedOptions_neverNestDirectly() {
		Form result = IndexedOptionForm.simplified(IndexType.I64,
			new ByteMaskedForm(new BitMaskedForm(new UnmaskedForm(int64()), true, true), false));
		assertTrue(result.isOption());
		assertFalse(((ContentForm) result).content().isOption());
	}

	private static Form resimplify(Form form) {
		if (form instanceof IndexedOptionForm f) {
			return IndexedOptionForm.simplified(f.index(), f.content(), f.parameters(), f.formKey());
		} else if (form instanceof IndexedForm f) {
			return IndexedForm.simplified(f.index(), f.content(), f.parameters(), f.formKey());
		} else if (form instanceof UnionForm f) {
			return UnionForm.simplified(f.tags(), f.index(), f.contents(), f.parameters(), f.formKey());
		} else {
			return form;
		}
	}
}
