package io.github.hotbrkm.autobulk.dispatcher.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.autobulk.dispatcher.job.RecipientSpec;

import java.util.Objects;

/**
 * JSON form of {@link RecipientSpec} stored in {@code jobs.recipient_spec}.
 */
final class RecipientSpecCodec {

    private final ObjectMapper objectMapper;

    RecipientSpecCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    String encode(RecipientSpec spec) {
        try {
            return objectMapper.writerFor(RecipientSpec.class).writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize recipient spec", e);
        }
    }

    RecipientSpec decode(String json) {
        try {
            return objectMapper.readValue(json, RecipientSpec.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to read recipient spec: " + json, e);
        }
    }
}
