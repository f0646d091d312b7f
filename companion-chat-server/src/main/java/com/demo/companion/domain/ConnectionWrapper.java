package com.demo.companion.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * A live connection tagged with its user. State only changes through
 * {@link #transitionTo}.
 */
@Getter
@ToString(exclude = "wsSession")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionWrapper {
    @EqualsAndHashCode.Include
    private String connectionId;
    private String userId;
    private WebSocketSession wsSession;
    private Instant connectedAt;
    private volatile ConnectionState state;

    public boolean isOpen() {
        return state != ConnectionState.CLOSED && wsSession != null && wsSession.isOpen();
    }

    /**
     * Move to the next lifecycle state; illegal transitions are ignored and
     * reported as false.
     */
    public synchronized boolean transitionTo(ConnectionState next) {
        if (state == null || state.canTransitionTo(next)) {
            state = next;
            return true;
        }
        return false;
    }
}
