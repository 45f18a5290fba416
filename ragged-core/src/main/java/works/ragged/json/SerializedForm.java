package works.ragged.json;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import works.ragged.forms.Form;

import static java.util.Objects.requireNonNull;

/**
 * The serialization proxy for {@link Form}s: a class tag and a state.
 * <p>
 * The state is normally the verbose dict. Streams written by an older protocol
 * instead carry positional state, a {@link List} laid out as
 * {@code [has_identities, parameters, form_key, ...]}; that is still read,
 * and its form key gets {@link SerializerConfig#legacyFormKeyPrefix() a prefix}.
 */
public final class SerializedForm implements Serializable {
	@Serial
	private static final long serialVersionUID = 1L;

	private final String formClass;

	/**
	 * A {@link Map} or a {@link List}, made only of serializable objects.
	 */
	private final Object state;

	private SerializedForm(String formClass, Object state) {
		this.formClass = requireNonNull(formClass);
		this.state = requireNonNull(state);
	}

	public static SerializedForm of(Form form) {
		@SuppressWarnings("unchecked")
		Map<String, Object> dict = (Map<String, Object>) FormSerializer.standard().toDict(form, true);
		return new SerializedForm((String) dict.get("class"), dict);
	}

	public static SerializedForm positional(String formClass, List<?> state) {
		return new SerializedForm(formClass, state);
	}

	public String formClass() {
		return formClass;
	}

	public Form toForm() {
		return toForm(FormSerializer.standard());
	}

	public Form toForm(FormSerializer serializer) {
		if (state instanceof Map<?, ?> map) {
			return serializer.fromDict(map);
		} else if (state instanceof List<?> list) {
			return serializer.fromPositional(formClass, list);
		} else {
			throw new IllegalStateException("Unexpected state type: " + state.getClass());
		}
	}

	@Serial
	private Object readResolve() throws ObjectStreamException {
		try {
			return toForm();
		} catch (IllegalArgumentException | IllegalStateException e) {
			InvalidObjectException ex = new InvalidObjectException("Unable to read " + formClass + ": " + e.getMessage());
			ex.initCause(e);
			throw ex;
		}
	}
}
