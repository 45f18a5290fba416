package works.ragged.buffers;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Canned all-zero buffer containers for synthesizing arrays of length zero or one.
 * Every buffer of the form is read from the same bytes, under the key {@code ""}.
 */
public final class StubBuffers {
	public static final String KEY = "";
	public static final BufferKeyFunction SHARED_KEY = BufferKeyFunction.constant(KEY);

	/**
	 * Enough for the one offset a zero-length list needs.
	 */
	static final int LENGTH_ZERO_BYTES = 8;

	/**
	 * One element of the widest type, complex256. A length-one array reads
	 * at most one element from any buffer.
	 */
	static final int LENGTH_ONE_BYTES = 32;

	private StubBuffers() { }

	public static Map<String, ByteBuffer> lengthZero() {
		return container(LENGTH_ZERO_BYTES);
	}

	public static Map<String, ByteBuffer> lengthOne() {
		return container(LENGTH_ONE_BYTES);
	}

	private static Map<String, ByteBuffer> container(int size) {
		return Map.of(KEY, ByteBuffer.wrap(new byte[size]).asReadOnlyBuffer());
	}
}
