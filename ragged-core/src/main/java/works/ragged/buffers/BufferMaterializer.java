package works.ragged.buffers;

import java.nio.ByteBuffer;
import java.util.Map;
import works.ragged.forms.Form;

/**
 * Turns a form and the buffers it {@link Form#expectedFromBuffers expects}
 * into an array. Implementations live outside this library.
 *
 * @param <A> the array representation
 */
@FunctionalInterface
public interface BufferMaterializer<A> {
	/**
	 * @param container buffers by key; each key is one that {@code getKey} produces
	 */
	A materialize(Form form, long length, Map<String, ByteBuffer> container, BufferKeyFunction getKey);
}
