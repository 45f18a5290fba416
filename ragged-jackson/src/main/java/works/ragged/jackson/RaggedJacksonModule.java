package works.ragged.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import works.ragged.forms.Form;
import works.ragged.json.FormSerializer;
import works.ragged.types.ArrayType;
import works.ragged.types.Type;

import static java.util.Objects.requireNonNull;

/**
 * Lets a Jackson mapper read and write {@link Form}s as their dicts,
 * and write {@link Type}s and {@link ArrayType}s as type strings.
 * <p>
 * Types are write-only: there's no type-string parser.
 */
public class RaggedJacksonModule extends JacksonModule {
	private final FormSerializer formSerializer;

	public RaggedJacksonModule() {
		this(FormSerializer.standard());
	}

	public RaggedJacksonModule(FormSerializer formSerializer) {
		this.formSerializer = requireNonNull(formSerializer);
	}

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new RaggedSerializers());
		context.addDeserializers(new RaggedDeserializers());
	}

	private final class RaggedSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (Form.class.isAssignableFrom(theClass)) {
				return formSerializer();
			} else if (Type.class.isAssignableFrom(theClass) || ArrayType.class.isAssignableFrom(theClass)) {
				return typeStringSerializer();
			} else {
				return null;
			}
		}

		private ValueSerializer<Form> formSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Form value, JsonGenerator gen, SerializationContext serializers) {
					gen.writePOJO(formSerializer.toDict(value));
				}
			};
		}

		private ValueSerializer<Object> typeStringSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Object value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeString(value.toString());
				}
			};
		}
	}

	private final class RaggedDeserializers extends Deserializers.Base {
		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			Class<?> theClass = type.getRawClass();
			if (Form.class.isAssignableFrom(theClass)) {
				return formDeserializer(theClass);
			} else {
				return null;
			}
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return Form.class.isAssignableFrom(valueType);
		}

		private ValueDeserializer<Form> formDeserializer(Class<?> expectedClass) {
			return new ValueDeserializer<>() {
				@Override
				public Form deserialize(JsonParser p, DeserializationContext ctxt) {
					Object plain = ctxt.readValue(p, Object.class);
					Form result = formSerializer.fromDict(plain);
					if (!expectedClass.isInstance(result)) {
						throw new StreamReadException(p, "Expected " + expectedClass.getSimpleName() + ", found " + result.getClass().getSimpleName());
					}
					return result;
				}
			};
		}
	}
}
