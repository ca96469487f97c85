package com.dropline.orderservice.security;

import com.dropline.common.exception.AccessDeniedException;
import com.dropline.orderservice.config.SecurityProperties;
import com.dropline.orderservice.model.ActorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds an {@link Actor} from a validated JWT.
 *
 * <p>Roles come from {@code resource_access.<client-id>.roles}. When several are present the
 * strongest wins: ADMIN, DISPATCHER, VENDOR, DELIVERY_AGENT, then CUSTOMER (also the default).
 * Vendors carry the store they act for in a custom claim, {@code vendor_id} by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActorResolver {

    private static final Map<String, ActorRole> ROLE_ALIASES = Map.of(
            "DELIVERY", ActorRole.DELIVERY_AGENT,
            "COURIER", ActorRole.DELIVERY_AGENT,
            "USER", ActorRole.CUSTOMER);

    private static final List<ActorRole> PRECEDENCE = List.of(
            ActorRole.ADMIN, ActorRole.DISPATCHER, ActorRole.VENDOR, ActorRole.DELIVERY_AGENT);

    private final SecurityProperties securityProperties;

    public Actor resolve(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            throw new AccessDeniedException("Access Denied: authentication required");
        }

        UUID userId;
        try {
            userId = UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            log.warn("JWT subject is not a UUID: sub={}", jwt.getSubject());
            throw new AccessDeniedException("Access Denied: unrecognized subject");
        }

        Set<ActorRole> roles = extractClientRoles(jwt).stream()
                .map(ActorResolver::toRole)
                .flatMap(Optional::stream)
                .collect(Collectors.toSet());

        ActorRole role = PRECEDENCE.stream()
                .filter(roles::contains)
                .findFirst()
                .orElse(ActorRole.CUSTOMER);

        UUID vendorId = role == ActorRole.VENDOR ? extractVendorId(jwt) : null;
        if (role == ActorRole.VENDOR && vendorId == null) {
            log.warn("Vendor JWT missing '{}' claim: userId={}", securityProperties.getVendorIdClaim(), userId);
        }

        return Actor.builder()
                .userId(userId)
                .role(role)
                .vendorId(vendorId)
                .build();
    }

    private List<String> extractClientRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(securityProperties.getClientId()))
                .filter(Map.class::isInstance)
                .map(client -> (Map<?, ?>) client)
                .map(clientMap -> clientMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }

    private UUID extractVendorId(Jwt jwt) {
        Object claim = jwt.getClaim(securityProperties.getVendorIdClaim());
        if (claim == null || claim.toString().isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(claim.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed '{}' claim: value={}", securityProperties.getVendorIdClaim(), claim);
            return null;
        }
    }

    private static Optional<ActorRole> toRole(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (ROLE_ALIASES.containsKey(normalized)) {
            return Optional.of(ROLE_ALIASES.get(normalized));
        }
        try {
            return Optional.of(ActorRole.valueOf(normalized));
        } catch (IllegalArgumentException e) {
            // roles of other applications share the claim
            return Optional.empty();
        }
    }
}
