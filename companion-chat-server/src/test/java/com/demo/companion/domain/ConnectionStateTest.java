package com.demo.companion.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ConnectionStateTest {

    @Test
    void followsConnectLifecycle() {
        ConnectionWrapper connection = ConnectionWrapper.builder()
                .connectionId("c1")
                .userId("u1")
                .state(ConnectionState.CONNECTING)
                .build();

        assertTrue(connection.transitionTo(ConnectionState.AUTHENTICATED));
        assertTrue(connection.transitionTo(ConnectionState.ACTIVE));
        assertFalse(connection.transitionTo(ConnectionState.AUTHENTICATED));
        assertTrue(connection.transitionTo(ConnectionState.CLOSED));
        assertFalse(connection.transitionTo(ConnectionState.ACTIVE));
        assertEquals(ConnectionState.CLOSED, connection.getState());
    }

    @Test
    void unauthenticatedConnectionCanOnlyClose() {
        assertFalse(ConnectionState.CONNECTING.canTransitionTo(ConnectionState.ACTIVE));
        assertTrue(ConnectionState.CONNECTING.canTransitionTo(ConnectionState.CLOSED));
    }

    @Test
    void stateHasNoMutatorBesidesTransition() {
        boolean hasSetter = Arrays.stream(ConnectionWrapper.class.getMethods())
                .anyMatch(method -> method.getName().equals("setState"));

        assertFalse(hasSetter);
    }
}
