package com.stori.backend.repositories.store;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stori.backend.exceptions.BadRequestException;

/**
 * Turns the store's last evaluated key into an opaque URL-safe cursor and back.
 */
@Component
public class PageCursorCodec {

    private static final TypeReference<Map<String, String>> KEY_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PageCursorCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Map<String, String> lastEvaluatedKey) {
        if (lastEvaluatedKey == null || lastEvaluatedKey.isEmpty()) {
            return null;
        }
        try {
            byte[] json = objectMapper.writeValueAsBytes(lastEvaluatedKey);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode pagination cursor", e);
        }
    }

    public Map<String, String> decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return null;
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(cursor.trim());
            Map<String, String> key = objectMapper.readValue(json, KEY_TYPE);
            if (key == null || key.isEmpty()) {
                throw new BadRequestException("Invalid pagination cursor");
            }
            return key;
        } catch (IllegalArgumentException | IOException e) {
            throw new BadRequestException("Invalid pagination cursor");
        }
    }
}
