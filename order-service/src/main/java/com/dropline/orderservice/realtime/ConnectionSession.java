package com.dropline.orderservice.realtime;

import com.dropline.common.exception.EventDeliveryException;
import com.dropline.orderservice.security.Actor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server side of one stream connection.
 *
 * <p>CONNECTING -> OPEN -> CLOSING -> CLOSED. Only an OPEN session takes frames; once it
 * starts closing every delivery is dropped without error. The wrapped WebSocket session is
 * expected to serialize concurrent sends (see {@code ConcurrentWebSocketSessionDecorator}).
 */
@Slf4j
public class ConnectionSession {

    public enum State {
        CONNECTING,
        OPEN,
        CLOSING,
        CLOSED
    }

    private final WebSocketSession delegate;
    private final Actor actor;
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);

    public ConnectionSession(WebSocketSession delegate, Actor actor) {
        this.delegate = delegate;
        this.actor = actor;
    }

    public String getId() {
        return delegate.getId();
    }

    public Actor getActor() {
        return actor;
    }

    public State getState() {
        return state.get();
    }

    public boolean open() {
        return state.compareAndSet(State.CONNECTING, State.OPEN);
    }

    public boolean isOpen() {
        return state.get() == State.OPEN && delegate.isOpen();
    }

    /**
     * Writes one frame.
     *
     * @return false if the session is no longer open and the frame was dropped
     * @throws EventDeliveryException if the transport refused the frame
     */
    public boolean deliver(TextMessage frame) {
        if (!isOpen()) {
            log.debug("Dropping frame for inactive session: sessionId={}, state={}", getId(), state.get());
            return false;
        }
        try {
            delegate.sendMessage(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            throw new EventDeliveryException("Failed to send frame to session " + getId(), e);
        }
    }

    /**
     * Starts closing the transport. The CLOSED state is reached through {@link #markClosed()}
     * once the container reports the connection gone.
     */
    public void close(CloseStatus status) {
        State previous = state.getAndUpdate(s -> s == State.CLOSED ? s : State.CLOSING);
        if (previous == State.CLOSED || previous == State.CLOSING) {
            return;
        }
        try {
            delegate.close(status);
        } catch (IOException e) {
            log.warn("Error while closing session: sessionId={}, error={}", getId(), e.getMessage());
        }
    }

    public void markClosed() {
        state.set(State.CLOSED);
    }

    @Override
    public String toString() {
        return "ConnectionSession[" + getId() + ", " + state.get() + "]";
    }
}
