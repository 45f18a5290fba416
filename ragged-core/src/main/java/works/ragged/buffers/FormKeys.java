package works.ragged.buffers;

import works.ragged.forms.BitMaskedForm;
import works.ragged.forms.ByteMaskedForm;
import works.ragged.forms.EmptyForm;
import works.ragged.forms.Form;
import works.ragged.forms.FormVisitor;
import works.ragged.forms.IndexedForm;
import works.ragged.forms.IndexedOptionForm;
import works.ragged.forms.ListForm;
import works.ragged.forms.ListOffsetForm;
import works.ragged.forms.NumpyForm;
import works.ragged.forms.RecordForm;
import works.ragged.forms.RegularForm;
import works.ragged.forms.UnionForm;
import works.ragged.forms.UnmaskedForm;

public final class FormKeys {
	private FormKeys() { }

	/**
	 * @return a copy of {@code form} whose nodes have form keys
	 * {@code node0}, {@code node1}, ... in preorder. The original is unchanged.
	 */
	public static Form numbered(Form form) {
		return form.accept(new Numberer("node"));
	}

	public static Form numbered(Form form, String prefix) {
		return form.accept(new Numberer(prefix));
	}

	private static final class Numberer implements FormVisitor<Form> {
		final String prefix;
		int next = 0;

		Numberer(String prefix) {
			this.prefix = prefix;
		}

		String nextKey() {
			return prefix + next++;
		}

		@Override
		public Form visitNumpy(NumpyForm form) {
			return form.withFormKey(nextKey());
		}

		@Override
		public Form visitEmpty(EmptyForm form) {
			return form.withFormKey(nextKey());
		}

		@Override
		public Form visitRegular(RegularForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitList(ListForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitListOffset(ListOffsetForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitIndexed(IndexedForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitIndexedOption(IndexedOptionForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitByteMasked(ByteMaskedForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitBitMasked(BitMaskedForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitUnmasked(UnmaskedForm form) {
			String key = nextKey();
			return form.withContent(form.content().accept(this)).withFormKey(key);
		}

		@Override
		public Form visitRecord(RecordForm form) {
			String key = nextKey();
			return form.withContents(form.contents().stream().map(c -> c.accept(this)).toList()).withFormKey(key);
		}

		@Override
		public Form visitUnion(UnionForm form) {
			String key = nextKey();
			return form.withContents(form.contents().stream().map(c -> c.accept(this)).toList()).withFormKey(key);
		}
	}
}
