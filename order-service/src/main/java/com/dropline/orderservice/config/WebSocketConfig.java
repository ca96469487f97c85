package com.dropline.orderservice.config;

import com.dropline.orderservice.realtime.OrderEventWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Plain WebSocket (no STOMP) endpoint for the order event stream.
 * Clients connect to {@code ws://host:port/ws} with an {@code Authorization: Bearer} header.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final OrderEventWebSocketHandler orderEventWebSocketHandler;
    private final WebSocketAuthInterceptor webSocketAuthInterceptor;
    private final RealtimeProperties realtimeProperties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(orderEventWebSocketHandler, realtimeProperties.getEndpointPath())
                .addInterceptors(webSocketAuthInterceptor)
                .setAllowedOriginPatterns(realtimeProperties.getAllowedOrigins().toArray(String[]::new));
    }
}
