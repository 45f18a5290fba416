package works.ragged.forms;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import works.ragged.Parameters;
import works.ragged.types.ArrayType;
import works.ragged.types.ListType;
import works.ragged.types.NumpyType;
import works.ragged.types.Primitive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.ragged.Parameters.ARRAY;

class ScalarFormsTest {

	@Test
	void string_isListOfChars() {
		ArrayType expected = new ArrayType(
			new ListType(
				new NumpyType(Primitive.UINT8, Parameters.of(ARRAY, "char")),
				Parameters.of(ARRAY, "string")),
			1);
		assertEquals(expected, ScalarForms.arrayTypeOf("hello"));
		assertEquals("1 * string", ScalarForms.arrayTypeOf("").toString());
	}

	@Test
	void bytes_isListOfBytes() {
		assertEquals("1 * bytes", ScalarForms.arrayTypeOf(new byte[] { 1, 2 }).toString());
	}

	@Test
	void numbers() {
		assertEquals("1 * int32", ScalarForms.arrayTypeOf(0).toString());
		assertEquals("1 * int64", ScalarForms.arrayTypeOf(0L).toString());
		assertEquals("1 * float64", ScalarForms.arrayTypeOf(1.5).toString());
		assertEquals("1 * float32", ScalarForms.arrayTypeOf(1.5f).toString());
		assertEquals("1 * bool", ScalarForms.arrayTypeOf(true).toString());
		assertEquals("1 * int8", ScalarForms.arrayTypeOf((byte) 1).toString());
		assertEquals("1 * int16", ScalarForms.arrayTypeOf((short) 1).toString());
	}

	@Test
	void temporal() {
		assertEquals("1 * datetime64[ns]", ScalarForms.arrayTypeOf(Instant.EPOCH).toString());
		assertEquals("1 * timedelta64[ns]", ScalarForms.arrayTypeOf(Duration.ofSeconds(1)).toString());
	}

	@Test
	void unknownValue_throws() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ScalarForms.formOf(new Object()));
		assertEquals("No scalar form for java.lang.Object", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> ScalarForms.formOf(null));
	}

	@Test
	void stringForms_areFreshInstances() {
		ListOffsetForm first = ScalarForms.string();
		ListOffsetForm second = ScalarForms.string();
		assertNotSame(first, second);
		first.setFormKey("mine");
		assertNull(second.formKey());
		assertEquals(IndexType.I64, first.offsets());
	}
}
