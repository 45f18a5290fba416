package works.ragged.json;

import static java.util.Objects.requireNonNull;

/**
 * Options for {@link FormSerializer}.
 */
public final class SerializerConfig {
	private final boolean verbose;
	private final String legacyFormKeyPrefix;
	private final boolean acceptLegacyClassNames;

	private SerializerConfig(boolean verbose, String legacyFormKeyPrefix, boolean acceptLegacyClassNames) {
		this.verbose = verbose;
		this.legacyFormKeyPrefix = legacyFormKeyPrefix;
		this.acceptLegacyClassNames = acceptLegacyClassNames;
	}

	public static SerializerConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return whether output includes empty parameters, null form keys
	 * and empty inner shapes when no verbosity is specified
	 */
	public boolean verbose() {
		return verbose;
	}

	/**
	 * @return the string prepended to non-null form keys read from positional legacy state
	 */
	public String legacyFormKeyPrefix() {
		return legacyFormKeyPrefix;
	}

	/**
	 * @return whether class tags with index-width suffixes, like {@code ListOffsetArray64},
	 * are read as their unsuffixed equivalents
	 */
	public boolean acceptLegacyClassNames() {
		return acceptLegacyClassNames;
	}

	public Builder toBuilder() {
		return new Builder()
			.verbose(verbose)
			.legacyFormKeyPrefix(legacyFormKeyPrefix)
			.acceptLegacyClassNames(acceptLegacyClassNames);
	}

	public static class Builder {
		private boolean verbose;
		private String legacyFormKeyPrefix;
		private boolean acceptLegacyClassNames;

		Builder() {
			verbose = DEFAULT_VERBOSE;
			legacyFormKeyPrefix = DEFAULT_LEGACY_FORM_KEY_PREFIX;
			acceptLegacyClassNames = true;
		}

		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		public Builder legacyFormKeyPrefix(String legacyFormKeyPrefix) {
			this.legacyFormKeyPrefix = requireNonNull(legacyFormKeyPrefix);
			return this;
		}

		public Builder acceptLegacyClassNames(boolean acceptLegacyClassNames) {
			this.acceptLegacyClassNames = acceptLegacyClassNames;
			return this;
		}

		public SerializerConfig build() {
			return new SerializerConfig(verbose, legacyFormKeyPrefix, acceptLegacyClassNames);
		}

		@Override
		public String toString() {
			return "SerializerConfig.Builder(verbose=" + verbose
				+ ", legacyFormKeyPrefix=" + legacyFormKeyPrefix
				+ ", acceptLegacyClassNames=" + acceptLegacyClassNames + ")";
		}
	}

	public static final boolean DEFAULT_VERBOSE = true;

	/**
	 * Positional state only ever described the first partition of a partitioned array.
	 */
	public static final String DEFAULT_LEGACY_FORM_KEY_PREFIX = "part0-";

	private static final SerializerConfig SIMPLE_CONFIG = new SerializerConfig(DEFAULT_VERBOSE, DEFAULT_LEGACY_FORM_KEY_PREFIX, true);
}
