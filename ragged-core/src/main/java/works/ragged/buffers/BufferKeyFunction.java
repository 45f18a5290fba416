package works.ragged.buffers;

import works.ragged.forms.Form;

/**
 * Names the buffer that holds one attribute of one form node,
 * such as its {@code "offsets"} or its {@code "data"}.
 */
@FunctionalInterface
public interface BufferKeyFunction {
	String keyFor(Form form, String attribute);

	/**
	 * The conventional naming, {@code "{form_key}-{attribute}"}.
	 *
	 * @throws IllegalArgumentException when applied to a node without a form key
	 * @see FormKeys#numbered
	 */
	static BufferKeyFunction formKeyAttribute() {
		return (form, attribute) -> {
			String formKey = form.formKey();
			if (formKey == null) {
				throw new IllegalArgumentException("Form has no form_key to name its \"" + attribute + "\" buffer: " + form);
			}
			return formKey + "-" + attribute;
		};
	}

	/**
	 * Every buffer gets the same key.
	 */
	static BufferKeyFunction constant(String key) {
		return (form, attribute) -> key;
	}
}
