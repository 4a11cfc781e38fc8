package dk.cloudcreate.essentials.eventsourcing.store.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.jackson.immutable.EssentialsImmutableJacksonModule;
import dk.cloudcreate.essentials.jackson.types.EssentialTypesJacksonModule;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}.<br>
 * The default {@link ObjectMapper} (see {@link #createDefaultObjectMapper()}) serializes fields only, ignores
 * transient fields and unknown properties, and supports essentials types (e.g. {@link dk.cloudcreate.essentials.types.CharSequenceType}
 * based ids) as well as immutable classes without a default constructor.
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_SETTERS)
                         .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .enable(MapperFeature.AUTO_DETECT_CREATORS)
                         .enable(MapperFeature.AUTO_DETECT_FIELDS)
                         .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .addModule(new EssentialTypesJacksonModule())
                         .addModule(new EssentialsImmutableJacksonModule())
                         .visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .visibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY)
                         .build();
    }

    @Override
    public String serialize(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return objectMapper.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize '{}' to JSON",
                                                     objectToSerialize.getClass().getName()),
                                                 e);
        }
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to '{}'",
                                                       javaType.getName()),
                                                   e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
