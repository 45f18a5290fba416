package works.ragged.types;

import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.ragged.Parameters;

/**
 * The semantic shape of an array, with the physical encoding erased.
 * <p>
 * {@link Object#equals equals} compares structure and
 * {@link Parameters#TYPE_PARAMETER_KEYS type parameters} only;
 * use {@link #isEqualTo(Type, boolean)} to compare every parameter.
 */
public sealed interface Type permits
	NumpyType,
	UnknownType,
	ListType,
	RegularType,
	OptionType,
	RecordType,
	UnionType
{
	Parameters parameters();

	default @Nullable JsonNode parameter(String key) {
		return parameters().get(key);
	}

	/**
	 * @param allParameters if false, only {@link Parameters#TYPE_PARAMETER_KEYS} are compared
	 */
	boolean isEqualTo(Type other, boolean allParameters);

	/**
	 * @return a copy of this type with different parameters
	 */
	Type withParameters(Parameters parameters);

	static boolean parametersMatch(Parameters a, Parameters b, boolean allParameters) {
		return allParameters ? a.equals(b) : a.typeParametersEqual(b);
	}
}
