package com.dropline.orderservice.config;

import com.dropline.common.exception.AccessDeniedException;
import com.dropline.orderservice.security.Actor;
import com.dropline.orderservice.security.ActorResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.security.Principal;
import java.util.Map;

/**
 * Binds the caller's identity to the stream session at upgrade time.
 *
 * <p>The bearer token in the upgrade request's {@code Authorization} header has already been
 * validated by the resource server filter chain; this interceptor turns the resulting
 * {@link JwtAuthenticationToken} into an {@link Actor} and stores it in the session attributes.
 * No authentication frame is exchanged on the channel itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketAuthInterceptor implements HandshakeInterceptor {

    public static final String ACTOR_ATTRIBUTE = "dropline.actor";

    private final ActorResolver actorResolver;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Principal principal = request.getPrincipal();
        if (!(principal instanceof JwtAuthenticationToken jwtAuthentication)) {
            log.warn("Stream handshake rejected: no bearer token. remote={}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        try {
            Actor actor = actorResolver.resolve(jwtAuthentication.getToken());
            attributes.put(ACTOR_ATTRIBUTE, actor);
            log.info("Stream handshake authenticated: userId={}, role={}", actor.getUserId(), actor.getRole());
            return true;
        } catch (AccessDeniedException e) {
            log.warn("Stream handshake rejected: {}", e.getMessage());
            response.setStatusCode(HttpStatus.FORBIDDEN);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Stream handshake failed: {}", exception.getMessage());
        }
    }
}
