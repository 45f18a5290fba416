package works.ragged.buffers;

import works.ragged.types.Primitive;

import static java.util.Objects.requireNonNull;

/**
 * One buffer that a materializer must supply: its key in the buffer
 * container and the type of its elements.
 */
public record ExpectedBuffer(String key, Primitive dtype) {
	public ExpectedBuffer {
		requireNonNull(key);
		requireNonNull(dtype);
	}
}
