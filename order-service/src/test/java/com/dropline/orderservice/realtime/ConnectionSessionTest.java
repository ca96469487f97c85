package com.dropline.orderservice.realtime;

import com.dropline.common.exception.EventDeliveryException;
import com.dropline.orderservice.model.ActorRole;
import com.dropline.orderservice.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConnectionSessionTest {

    private WebSocketSession delegate;
    private ConnectionSession session;

    @BeforeEach
    void setUp() {
        delegate = mock(WebSocketSession.class);
        when(delegate.getId()).thenReturn("s1");
        when(delegate.isOpen()).thenReturn(true);
        session = new ConnectionSession(delegate,
                Actor.builder().userId(UUID.randomUUID()).role(ActorRole.CUSTOMER).build());
    }

    @Test
    void framesAreDroppedUntilOpen() throws IOException {
        assertThat(session.getState()).isEqualTo(ConnectionSession.State.CONNECTING);
        assertThat(session.deliver(new TextMessage("{}"))).isFalse();

        assertThat(session.open()).isTrue();
        assertThat(session.deliver(new TextMessage("{}"))).isTrue();

        verify(delegate, times(1)).sendMessage(any());
    }

    @Test
    void closingSessionDropsFramesWithoutError() throws IOException {
        session.open();

        session.close(CloseStatus.NORMAL);

        assertThat(session.getState()).isEqualTo(ConnectionSession.State.CLOSING);
        assertThat(session.deliver(new TextMessage("{}"))).isFalse();
        verify(delegate).close(CloseStatus.NORMAL);
        verify(delegate, never()).sendMessage(any());
    }

    @Test
    void closeIsOnlyForwardedOnce() throws IOException {
        session.open();

        session.close(CloseStatus.NORMAL);
        session.close(CloseStatus.SERVER_ERROR);
        session.markClosed();
        session.close(CloseStatus.NORMAL);

        assertThat(session.getState()).isEqualTo(ConnectionSession.State.CLOSED);
        verify(delegate, times(1)).close(any());
    }

    @Test
    void transportFailureIsReported() throws IOException {
        session.open();
        doThrow(new IOException("broken pipe")).when(delegate).sendMessage(any());

        assertThatThrownBy(() -> session.deliver(new TextMessage("{}")))
                .isInstanceOf(EventDeliveryException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void closedTransportIsNotOpen() {
        session.open();
        when(delegate.isOpen()).thenReturn(false);

        assertThat(session.isOpen()).isFalse();
    }
}
