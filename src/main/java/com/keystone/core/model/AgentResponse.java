package com.keystone.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply from a worker agent: {@code {status: success|failure, result|error}}.
 */
public record AgentResponse(
    String status,
    Map<String, Object> result,
    String error
) implements Serializable {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    public AgentResponse {
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static AgentResponse success(Map<String, Object> result) {
        return new AgentResponse(SUCCESS, result, null);
    }

    public static AgentResponse failure(String error) {
        return new AgentResponse(FAILURE, Map.of(), error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equalsIgnoreCase(status);
    }
}
