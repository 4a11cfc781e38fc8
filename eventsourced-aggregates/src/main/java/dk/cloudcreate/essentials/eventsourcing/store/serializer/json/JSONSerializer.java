package dk.cloudcreate.essentials.eventsourcing.store.serializer.json;

/**
 * JSON serializer and deserializer used for events and state snapshots
 */
public interface JSONSerializer {
    /**
     * Serialize a java object to JSON
     *
     * @param objectToSerialize the java object that will be serialized to JSON
     * @return the JSON
     * @throws JSONSerializationException in case the <code>objectToSerialize</code> couldn't be serialized to JSON
     */
    String serialize(Object objectToSerialize);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);
}
