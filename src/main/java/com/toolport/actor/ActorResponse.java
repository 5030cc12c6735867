package com.toolport.actor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public record ActorResponse(int status, JsonNode body) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ActorResponse ok(Object body) {
        return new ActorResponse(200, MAPPER.valueToTree(body));
    }

    public static ActorResponse error(int status, String message) {
        return new ActorResponse(status, MAPPER.createObjectNode().put("error", message));
    }

    public static ActorResponse unauthorized() {
        return error(401, "unauthorized");
    }

    public String bodyAsString() {
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Response body is not serializable", e);
        }
    }
}
