package com.tessera.security.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body returned to callers for every rejected request:
 * <pre>
 * { "error": "permission_denied", "message": "...", "details": {...}, "request_id": "..." }
 * </pre>
 *
 * @param error     stable machine-readable code (see {@link ErrorCode#code()})
 * @param message   human-readable text
 * @param details   optional structured details; omitted when empty
 * @param requestId request identifier for support correlation
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorEnvelope(
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("request_id") String requestId
) {

    public ErrorEnvelope {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
