package works.ragged.buffers;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import works.ragged.forms.ByteMaskedForm;
import works.ragged.forms.Form;
import works.ragged.forms.IndexType;
import works.ragged.forms.ListForm;
import works.ragged.forms.ListOffsetForm;
import works.ragged.forms.NumpyForm;
import works.ragged.forms.RecordForm;
import works.ragged.forms.UnionForm;
import works.ragged.types.Primitive;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.ragged.buffers.BufferKeyFunction.formKeyAttribute;

class ExpectedBuffersTest {
	final Form form = new RecordForm(
		List.of(
			new ListOffsetForm(IndexType.I64, new NumpyForm(Primitive.FLOAT64)),
			new ByteMaskedForm(new NumpyForm(Primitive.INT32), true)),
		List.of("x", "y"));

	@Test
	void numbered_assignsKeysInPreorder() {
		RecordForm numbered = (RecordForm) FormKeys.numbered(form);
		assertEquals("node0", numbered.formKey());
		assertEquals("node1", numbered.content("x").formKey());
		assertEquals("node2", ((ListOffsetForm) numbered.content("x")).content().formKey());
		assertEquals("node3", numbered.content("y").formKey());
		assertEquals("node4", ((ByteMaskedForm) numbered.content("y")).content().formKey());
		assertNull(form.formKey());
	}

	@Test
	void expectedBuffers_inTreeOrder() {
		List<ExpectedBuffer> expected = List.of(
			new ExpectedBuffer("node1-offsets", Primitive.INT64),
			new ExpectedBuffer("node2-data", Primitive.FLOAT64),
			new ExpectedBuffer("node3-mask", Primitive.INT8),
			new ExpectedBuffer("node4-data", Primitive.INT32));
		assertEquals(expected, FormKeys.numbered(form).expectedFromBuffers(formKeyAttribute()).toList());
	}

	@Test
	void nonRecursive_onlyOwnBuffers() {
		Form numbered = FormKeys.numbered(form, "f");
		assertEquals(List.of(), numbered.expectedFromBuffers(formKeyAttribute(), false).toList());
		Form list = ((RecordForm) numbered).content("x");
		assertEquals(
			List.of(new ExpectedBuffer("f1-offsets", Primitive.INT64)),
			list.expectedFromBuffers(formKeyAttribute(), false).toList());
	}

	@Test
	void listBuffers_startsThenStops() {
		Form list = new ListForm(IndexType.U32, new NumpyForm(Primitive.BOOL)).withFormKey("l");
		assertEquals(
			List.of(new ExpectedBuffer("l-starts", Primitive.UINT32), new ExpectedBuffer("l-stops", Primitive.UINT32)),
			list.expectedFromBuffers(formKeyAttribute(), false).toList());
	}

	@Test
	void unionBuffers_tagsThenIndexThenBranches() {
		Form union = FormKeys.numbered(new UnionForm(IndexType.I32, List.of(
			new NumpyForm(Primitive.INT64),
			new NumpyForm(Primitive.BOOL))));
		assertEquals(
			List.of(
				new ExpectedBuffer("node0-tags", Primitive.INT8),
				new ExpectedBuffer("node0-index", Primitive.INT32),
				new ExpectedBuffer("node1-data", Primitive.INT64),
				new ExpectedBuffer("node2-data", Primitive.BOOL)),
			union.expectedFromBuffers(formKeyAttribute()).toList());
	}

	@Test
	void missingFormKey_throwsWhenConsumed() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> form.expectedFromBuffers(formKeyAttribute()).toList());
		assertThat(e.getMessage(), containsString("\"offsets\""));
	}

	@Test
	void keys_areComputedLazily() {
		AtomicInteger calls = new AtomicInteger();
		BufferKeyFunction counting = (f, attribute) -> {
			calls.incrementAndGet();
			return attribute;
		};
		assertEquals("offsets", form.expectedFromBuffers(counting).findFirst().orElseThrow().key());
		assertEquals(1, calls.get());
	}

	@Test
	void customKeyFunction() {
		List<String> keys = form.expectedFromBuffers((f, attribute) -> f.getClass().getSimpleName() + "." + attribute)
			.map(ExpectedBuffer::key)
			.toList();
		assertEquals(List.of("ListOffsetForm.offsets", "NumpyForm.data", "ByteMaskedForm.mask", "NumpyForm.data"), keys);
	}

	@Test
	void stubBuffers() {
		ByteBuffer zero = StubBuffers.lengthZero().get(StubBuffers.KEY);
		ByteBuffer one = StubBuffers.lengthOne().get(StubBuffers.KEY);
		assertEquals(8, zero.remaining());
		assertEquals(32, one.remaining());
		assertTrue(zero.isReadOnly());
		while (one.hasRemaining()) {
			assertEquals(0, one.get());
		}
	}

	@Test
	void lengthZeroAndOne_passStubsToTheMaterializer() {
		List<Object> calls = new ArrayList<>();
		BufferMaterializer<String> materializer = (f, length, container, getKey) -> {
			calls.add(f);
			calls.add(length);
			calls.add(container.get(getKey.keyFor(f, "data")).remaining());
			return "array of " + length;
		};
		assertEquals("array of 0", form.lengthZeroArray(materializer));
		assertEquals("array of 1", form.lengthOneArray(materializer));
		assertEquals(List.of(form, 0L, 8, form, 1L, 32), calls);
	}

	@Test
	void stubContainers_areImmutable() {
		Map<String, ByteBuffer> container = StubBuffers.lengthZero();
		assertThrows(UnsupportedOperationException.class, () -> container.put("x", ByteBuffer.allocate(1)));
	}
}
