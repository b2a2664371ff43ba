package com.failuresentinel.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a {@link NotificationPayload} to JSON bytes for a notification
 * channel. Timestamps are written as ISO-8601 strings.
 */
public class NotificationPayloadSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationPayloadSerializer.class);

    private ObjectMapper mapper;

    /**
     * @return JSON bytes, or an empty array if serialization fails
     */
    public byte[] serialize(NotificationPayload payload) {
        try {
            return objectMapper().writeValueAsBytes(payload);
        } catch (Exception e) {
            LOG.error("Failed to serialize notification payload: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private synchronized ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
