package works.ragged.forms;

/**
 * One method per {@link Form} variant, so that adding a variant breaks every
 * visitor at compile time.
 */
public interface FormVisitor<R> {
	R visitNumpy(NumpyForm form);
	R visitEmpty(EmptyForm form);
	R visitRegular(RegularForm form);
	R visitList(ListForm form);
	R visitListOffset(ListOffsetForm form);
	R visitIndexed(IndexedForm form);
	R visitIndexedOption(IndexedOptionForm form);
	R visitByteMasked(ByteMaskedForm form);
	R visitBitMasked(BitMaskedForm form);
	R visitUnmasked(UnmaskedForm form);
	R visitRecord(RecordForm form);
	R visitUnion(UnionForm form);
}
