package net.spookly.routeusage.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SessionAffinityTypeTest {
    @Test
    void parsesWireSpellings() {
        assertEquals(SessionAffinityType.GENERATED_COOKIE, SessionAffinityType.parse("GENERATED_COOKIE"));
        assertEquals(SessionAffinityType.CLIENT_IP, SessionAffinityType.parse(" client_ip "));
    }

    @Test
    void unknownValuesMapToNone() {
        assertEquals(SessionAffinityType.NONE, SessionAffinityType.parse(null));
        assertEquals(SessionAffinityType.NONE, SessionAffinityType.parse(""));
        assertEquals(SessionAffinityType.NONE, SessionAffinityType.parse("HEADER_FIELD"));
    }
}
