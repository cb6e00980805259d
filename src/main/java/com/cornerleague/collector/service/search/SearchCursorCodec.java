package com.cornerleague.collector.service.search;

import com.cornerleague.collector.exception.InvalidCursorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@Component
@RequiredArgsConstructor
public class SearchCursorCodec {

    private final ObjectMapper mapper;

    public String encode(SearchCursor cursor) {
        try {
            byte[] json = mapper.writeValueAsBytes(cursor);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode search cursor", e);
        }
    }

    public SearchCursor decode(String token) {
        if (token == null || token.isBlank()) return null;
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.trim());
            SearchCursor cursor = mapper.readValue(new String(json, StandardCharsets.UTF_8), SearchCursor.class);
            if (cursor.sort() == null || cursor.canonicalUrl() == null) {
                throw new InvalidCursorException("Cursor is missing its position", null);
            }
            return cursor;
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new InvalidCursorException("Malformed cursor", e);
        }
    }
}
