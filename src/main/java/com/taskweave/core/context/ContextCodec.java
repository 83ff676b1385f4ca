package com.taskweave.core.context;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskweave.core.persistence.ContextPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON codec for {@link ContextSnapshot}s. Output is compact UTF-8 JSON that
 * round-trips every version, map and log entry in order.
 */
public class ContextCodec {

    private static final Logger log = LoggerFactory.getLogger(ContextCodec.class);

    private static final ObjectMapper ARTIFACT_MAPPER = defaultMapper();

    private final ObjectMapper objectMapper;

    public ContextCodec() {
        this(defaultMapper());
    }

    public ContextCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(ContextSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to serialize context " + snapshot.id(), e);
        }
    }

    /**
     * @throws ContextPersistenceException if the bytes are not JSON or lack the id and metadata of a context
     */
    public ContextSnapshot decode(byte[] bytes) {
        ContextSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(bytes, ContextSnapshot.class);
        } catch (IOException e) {
            throw new ContextPersistenceException("Failed to deserialize context", e);
        }
        if (snapshot == null || snapshot.id() == null) {
            throw new ContextPersistenceException("Stored document is not a context: missing id");
        }
        ContextMetadata meta = snapshot.metadata();
        if (meta == null || meta.createdAt() == null || meta.updatedAt() == null || meta.ttl() == null) {
            throw new ContextPersistenceException("Stored context " + snapshot.id() + " has incomplete metadata");
        }
        return snapshot;
    }

    /**
     * Returns {@code value} as it reads back after a JSON round trip: maps become
     * {@code LinkedHashMap}, collections {@code ArrayList}, integral numbers
     * {@code Integer} or {@code Long}, dates ISO-8601 strings. A value with no
     * JSON form is returned unchanged; such a context cannot be serialized.
     */
    static Object jsonForm(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Integer) {
            return value;
        }
        try {
            return ARTIFACT_MAPPER.readValue(ARTIFACT_MAPPER.writeValueAsBytes(value), Object.class);
        } catch (IOException e) {
            log.debug("Keeping {} as-is, it has no JSON form: {}", value.getClass().getName(), e.getMessage());
            return value;
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
