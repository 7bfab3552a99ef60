package com.codesandbox.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /v1/sandbox/run.
 *
 * Required: language, code.
 * Optional: preload, enable_network. Both are accepted for compatibility
 *   with existing clients and have no effect on execution.
 */
public record RunCodeRequest(
        String language,
        String code,
        String preload,
        @JsonProperty("enable_network") Boolean enableNetwork
) {}
