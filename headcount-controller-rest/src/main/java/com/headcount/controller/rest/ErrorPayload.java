package com.headcount.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Structured error payload returned by REST endpoints. {@code field} and {@code allowed} are only set when a
 * request identifier was rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(
        Instant timestamp, int status, String error, String message, String path, String field, List<String> allowed) {}
