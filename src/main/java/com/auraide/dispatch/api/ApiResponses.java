package com.auraide.dispatch.api;

import com.auraide.sandbox.CapabilityResult;
import com.auraide.sandbox.ProviderType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers shared by the controllers.
 */
final class ApiResponses {

    private ApiResponses() {}

    /**
     * 200 with the value, or 501 naming the missing capability.
     */
    static ResponseEntity<Object> capability(CapabilityResult<?> result) {
        if (result.supported()) {
            return ResponseEntity.ok(result.value());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", result.reason());
        body.put("capability", result.capability().wireName());
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(body);
    }

    /**
     * Parses an optional {@code provider} query parameter.
     *
     * @throws IllegalArgumentException for an unknown provider name
     */
    static ProviderType provider(String value) {
        return value == null || value.isBlank() ? null : ProviderType.fromWire(value);
    }
}
