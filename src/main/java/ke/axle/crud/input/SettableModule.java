package ke.axle.crud.input;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Binds {@link Settable} properties. A JSON {@code null} becomes
 * {@code Settable.of(null)}, a missing property stays unset, and unset
 * properties are left out when writing.
 */
public class SettableModule extends SimpleModule {

    @SuppressWarnings({"unchecked", "rawtypes"})
    public SettableModule() {
        super("SettableModule");
        addSerializer(new SettableSerializer());
        addDeserializer((Class) Settable.class, new SettableDeserializer(null));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.configOverride(Settable.class)
                .setIncludeAsProperty(JsonInclude.Value.construct(JsonInclude.Include.NON_EMPTY,
                        JsonInclude.Include.ALWAYS));
    }

    static class SettableSerializer extends StdSerializer<Settable<?>> {

        @SuppressWarnings({"unchecked", "rawtypes"})
        SettableSerializer() {
            super((Class) Settable.class);
        }

        @Override
        public boolean isEmpty(SerializerProvider provider, Settable<?> value) {
            return value == null || !value.isSet();
        }

        @Override
        public void serialize(Settable<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(value.orElse(null), gen);
        }
    }

    static class SettableDeserializer extends StdDeserializer<Settable<?>> implements ContextualDeserializer {

        private final JavaType valueType;

        SettableDeserializer(JavaType valueType) {
            super(Settable.class);
            this.valueType = valueType;
        }

        @Override
        public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
            JavaType type = property != null ? property.getType() : ctxt.getContextualType();
            if (type == null) {
                return this;
            }
            return new SettableDeserializer(type.containedTypeOrUnknown(0));
        }

        @Override
        public Settable<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JavaType type = valueType != null ? valueType : ctxt.constructType(Object.class);
            return Settable.of(ctxt.readValue(p, type));
        }

        @Override
        public Settable<?> getNullValue(DeserializationContext ctxt) {
            return Settable.of(null);
        }

        @Override
        public Object getAbsentValue(DeserializationContext ctxt) {
            return Settable.unset();
        }
    }
}
