package com.hive.plugin.credential;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialRequirementsTest {

    private static final CredentialSpec CALCOM = new CredentialSpec("calcom", "CALCOM_API_KEY",
            List.of("calcom_list_bookings", "calcom_create_booking"), true, "Cal.com API key");
    private static final CredentialSpec OPTIONAL = new CredentialSpec("analytics", "ANALYTICS_KEY",
            List.of("calcom_list_bookings"), false, null);

    @Test
    void missingFor_reportsOnlyRequiredUnavailableCredentials() {
        CredentialRequirements requirements = new CredentialRequirements(List.of(CALCOM, OPTIONAL));
        CredentialStore empty = new EnvCredentialStore(Map.of(), null, List.of(CALCOM, OPTIONAL));

        assertEquals(List.of("calcom"), requirements.missingFor(List.of("calcom_list_bookings", "calcom_create_booking"), empty));
        assertTrue(requirements.missingFor(List.of("other_tool"), empty).isEmpty());
    }

    @Test
    void envStore_readsSpecEnvVarAndPrefersOverrides() {
        EnvCredentialStore store = new EnvCredentialStore(Map.of("CALCOM_API_KEY", "cal_live_123", "BLANK", " "),
                Map.of("manual", "m-1"), List.of(CALCOM));

        assertTrue(store.isAvailable("calcom"));
        assertEquals("cal_live_123", store.get("calcom"));
        assertEquals("m-1", store.get("manual"));
        assertFalse(store.isAvailable("BLANK"));
        MissingCredentialException e = assertThrows(MissingCredentialException.class, () -> store.get("nope"));
        assertEquals("nope", e.getCredentialName());
    }
}
