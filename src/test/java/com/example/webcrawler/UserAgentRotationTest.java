package com.example.webcrawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UserAgentRotationTest {
    @Test
    void cyclesThroughAgentsInOrder() {
        UserAgentRotation rotation = new UserAgentRotation(List.of("one", "two"));
        assertEquals("one", rotation.next());
        assertEquals("two", rotation.next());
        assertEquals("one", rotation.next());
    }

    @Test
    void requiresAtLeastOneAgent() {
        assertThrows(IllegalArgumentException.class, () -> new UserAgentRotation(List.of()));
    }
}
