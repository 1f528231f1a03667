package com.nayem.tether.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collection;
import java.util.List;

/**
 * Encodes request and response envelopes as JSON for the coordination channels.
 * <p>
 * Call arguments and results are written with their Java type so that they decode to the
 * same type on the other side: a {@code long} stays a {@code Long}, a record stays a
 * record. Only types from {@code java.lang}, {@code java.util}, {@code java.time},
 * {@code java.math} and the trusted packages are accepted on decode.
 * </p>
 */
public class EnvelopeCodec {

    private static final List<String> JDK_PACKAGES = List.of("java.lang.", "java.util.", "java.time.", "java.math.");

    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper    Base mapper; it is copied, never modified
     * @param trustedPackages Package prefixes of application types allowed as arguments and results
     */
    public EnvelopeCodec(ObjectMapper objectMapper, Collection<String> trustedPackages) {
        BasicPolymorphicTypeValidator.Builder validator = BasicPolymorphicTypeValidator.builder();
        JDK_PACKAGES.forEach(validator::allowIfSubType);
        trustedPackages.forEach(validator::allowIfSubType);

        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .activateDefaultTyping(validator.build(), ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    }

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this(objectMapper, List.of());
    }

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public String encodeRequest(RequestEnvelope envelope) {
        return write(envelope);
    }

    public RequestEnvelope decodeRequest(String payload) {
        return read(payload, RequestEnvelope.class);
    }

    public String encodeResponse(ResponseEnvelope envelope) {
        return write(envelope);
    }

    public ResponseEnvelope decodeResponse(String payload) {
        return read(payload, ResponseEnvelope.class);
    }

    private String write(Object envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("Failed to encode " + envelope.getClass().getSimpleName(), e);
        }
    }

    private <E> E read(String payload, Class<E> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
