package com.communityhub.web.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiResponse")
class ApiResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("failure serializes as {success:false, message}")
    void failureShape() throws Exception {
        String json = objectMapper.writeValueAsString(ApiResponse.fail("Chat session not found"));

        assertThat(json).isEqualTo("{\"success\":false,\"message\":\"Chat session not found\"}");
    }

    @Test
    @DisplayName("success carries data")
    void successShape() throws Exception {
        String json = objectMapper.writeValueAsString(ApiResponse.ok(42));

        assertThat(json).isEqualTo("{\"success\":true,\"data\":42}");
    }
}
