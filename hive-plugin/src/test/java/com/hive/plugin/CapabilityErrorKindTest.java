package com.hive.plugin;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CapabilityErrorKindTest {

    @Test
    void fromHttpStatus_classifiesApiErrors() {
        assertEquals(CapabilityErrorKind.AUTH, CapabilityErrorKind.fromHttpStatus(401));
        assertEquals(CapabilityErrorKind.AUTH, CapabilityErrorKind.fromHttpStatus(403));
        assertEquals(CapabilityErrorKind.NOT_FOUND, CapabilityErrorKind.fromHttpStatus(404));
        assertEquals(CapabilityErrorKind.RATE_LIMITED, CapabilityErrorKind.fromHttpStatus(429));
        assertEquals(CapabilityErrorKind.INVALID_ARGS, CapabilityErrorKind.fromHttpStatus(422));
        assertEquals(CapabilityErrorKind.TIMEOUT, CapabilityErrorKind.fromHttpStatus(504));
        assertEquals(CapabilityErrorKind.UPSTREAM_FAILURE, CapabilityErrorKind.fromHttpStatus(500));
        assertNull(CapabilityErrorKind.fromHttpStatus(200));
    }

    @Test
    void forHttpStatus_buildsClassifiedException() {
        CapabilityException e = CapabilityException.forHttpStatus(429, "Rate limit exceeded");

        assertEquals(CapabilityErrorKind.RATE_LIMITED, e.getKind());
        assertEquals("Rate limit exceeded (HTTP 429)", e.getMessage());
        assertEquals(CapabilityErrorKind.UPSTREAM_FAILURE, CapabilityException.forHttpStatus(302, "odd").getKind());
    }

    @Test
    void fromValue_isLenient() {
        assertEquals(CapabilityErrorKind.RATE_LIMITED, CapabilityErrorKind.fromValue("rate-limited"));
        assertEquals(CapabilityErrorKind.UPSTREAM_FAILURE, CapabilityErrorKind.fromValue("weird"));
        assertEquals(CapabilityErrorKind.UPSTREAM_FAILURE, CapabilityErrorKind.fromValue(null));
    }
}
