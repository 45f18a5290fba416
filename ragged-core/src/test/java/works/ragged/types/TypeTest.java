package works.ragged.types;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.ragged.Parameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.ragged.Parameters.ARRAY;
import static works.ragged.Parameters.DOC;
import static works.ragged.Parameters.RECORD;

class TypeTest {
	static final NumpyType INT64 = new NumpyType(Primitive.INT64);
	static final NumpyType FLOAT64 = new NumpyType(Primitive.FLOAT64);
	static final ListType STRING = new ListType(
		new NumpyType(Primitive.UINT8, Parameters.of(ARRAY, "char")),
		Parameters.of(ARRAY, "string"));

	@Test
	void strings() {
		assertEquals("int64", INT64.toString());
		assertEquals("var * float64", new ListType(FLOAT64).toString());
		assertEquals("3 * int64", new RegularType(INT64, 3).toString());
		assertEquals("?? * int64", new RegularType(INT64, RegularType.UNKNOWN_SIZE).toString());
		assertEquals("string", STRING.toString());
		assertEquals("?string", new OptionType(STRING).toString());
		assertEquals("option[var * int64]", new OptionType(new ListType(INT64)).toString());
		assertEquals("{x: int64, y: var * float64}",
			new RecordType(List.of(INT64, new ListType(FLOAT64)), List.of("x", "y")).toString());
		assertEquals("(int64, string)", new RecordType(List.of(INT64, STRING), null).toString());
		assertEquals("Point[x: int64, y: int64]",
			new RecordType(List.of(INT64, INT64), List.of("x", "y"), Parameters.of(RECORD, "Point")).toString());
		assertEquals("union[int64, string]", new UnionType(List.of(INT64, STRING)).toString());
		assertEquals("unknown", new UnknownType().toString());
		assertEquals("{\"a b\": int64}", new RecordType(List.of(INT64), List.of("a b")).toString());
	}

	@Test
	void parametersInString() {
		assertEquals("int64[parameters={\"__doc__\":\"d\"}]",
			INT64.withParameters(Parameters.of(DOC, "d")).toString());
	}

	@Test
	void equals_ignoresNonTypeParameters() {
		NumpyType documented = INT64.withParameters(Parameters.of(DOC, "count"));
		assertEquals(INT64, documented);
		assertEquals(INT64.hashCode(), documented.hashCode());
		assertFalse(INT64.isEqualTo(documented, true));
		assertTrue(INT64.isEqualTo(documented, false));
	}

	@Test
	void equals_respectsTypeParameters() {
		assertNotEquals(new ListType(new NumpyType(Primitive.UINT8)), STRING);
		assertNotEquals(
			new RecordType(List.of(INT64), List.of("x")),
			new RecordType(List.of(INT64), List.of("x"), Parameters.of(RECORD, "Point")));
	}

	@Test
	void regularSizes() {
		assertNotEquals(new RegularType(INT64, 3), new RegularType(INT64, 4));
		assertThrows(IllegalArgumentException.class, () -> new RegularType(INT64, -5));
	}

	@Test
	void namedRecords_ignoreFieldOrder() {
		RecordType xy = new RecordType(List.of(INT64, FLOAT64), List.of("x", "y"));
		RecordType yx = new RecordType(List.of(FLOAT64, INT64), List.of("y", "x"));
		assertEquals(xy, yx);
		assertEquals(xy.hashCode(), yx.hashCode());
	}

	@Test
	void tuples_respectOrder() {
		assertNotEquals(
			new RecordType(List.of(INT64, FLOAT64), null),
			new RecordType(List.of(FLOAT64, INT64), null));
		assertNotEquals(
			new RecordType(List.of(INT64, FLOAT64), null),
			new RecordType(List.of(INT64, FLOAT64), List.of("0", "1")));
	}

	@Test
	void record_rejectsBadFields() {
		assertThrows(IllegalArgumentException.class, () -> new RecordType(List.of(INT64), List.of("x", "y")));
		assertThrows(IllegalArgumentException.class, () -> new RecordType(List.of(INT64, INT64), List.of("x", "x")));
		assertEquals(List.of("0", "1"), new RecordType(List.of(INT64, INT64), null).fieldNames());
	}

	@Test
	void unions_ignoreBranchOrder() {
		UnionType a = new UnionType(List.of(INT64, STRING));
		UnionType b = new UnionType(List.of(STRING, INT64));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, new UnionType(List.of(INT64, INT64)));
	}

	@Test
	void optionOf_collapsesNestedOptions() {
		Type nested = OptionType.of(new OptionType(INT64, Parameters.of(DOC, "inner")), Parameters.of(DOC, "outer"));
		OptionType expected = new OptionType(INT64, Parameters.of(DOC, "outer"));
		assertTrue(expected.isEqualTo(nested, true));
	}

	@Test
	void optionOf_distributesOverUnions() {
		Type result = OptionType.of(new UnionType(List.of(INT64, new OptionType(FLOAT64))));
		assertEquals(new UnionType(List.of(new OptionType(INT64), new OptionType(FLOAT64))), result);
	}

	@Test
	void constructor_keepsStructureAsGiven() {
		OptionType doubled = new OptionType(new OptionType(INT64));
		assertEquals("??int64", doubled.toString());
		assertNotEquals(new OptionType(INT64), doubled);
	}

	@Test
	void arrayType_unknownLengthMatchesOnlyInIsEqualTo() {
		ArrayType five = new ArrayType(INT64, 5);
		ArrayType unknown = new ArrayType(INT64, ArrayType.UNKNOWN_LENGTH);
		ArrayType seven = new ArrayType(INT64, 7);
		assertTrue(five.isEqualTo(unknown, true));
		assertTrue(unknown.isEqualTo(seven, true));
		assertFalse(five.isEqualTo(seven, true));
		assertNotEquals(five, unknown);
		assertNotEquals(unknown, seven);
		assertEquals(unknown, new ArrayType(INT64, ArrayType.UNKNOWN_LENGTH));
	}

	@Test
	void arrayType() {
		ArrayType known = new ArrayType(INT64, 3);
		assertEquals("3 * int64", known.toString());
		assertNotEquals(known, new ArrayType(INT64, 4));
		assertEquals(known, new ArrayType(INT64, 3));
		assertEquals(known.hashCode(), new ArrayType(INT64, 3).hashCode());
		assertEquals("?? * var * int64", new ArrayType(new ListType(INT64), ArrayType.UNKNOWN_LENGTH).toString());
	}

	@Test
	void contents_areCopied() {
		List<Type> contents = Arrays.asList(INT64, FLOAT64);
		UnionType union = new UnionType(contents);
		contents.set(0, STRING);
		assertEquals(INT64, union.contents().get(0));
	}
}
