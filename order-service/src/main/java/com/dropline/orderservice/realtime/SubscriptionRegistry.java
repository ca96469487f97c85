package com.dropline.orderservice.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Which open sessions listen to which orders. In memory only; a restart drops every
 * subscription and clients rejoin on reconnect.
 */
@Component
@Slf4j
public class SubscriptionRegistry {

    private final ConcurrentMap<UUID, Set<ConnectionSession>> sessionsByOrder = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<UUID>> ordersBySession = new ConcurrentHashMap<>();

    /**
     * @return true if the session was not yet subscribed to the order
     */
    public boolean subscribe(ConnectionSession session, UUID orderId) {
        if (session.getState() == ConnectionSession.State.CLOSED) {
            return false;
        }

        boolean[] added = {false};
        sessionsByOrder.compute(orderId, (id, sessions) -> {
            Set<ConnectionSession> bucket = sessions != null ? sessions : ConcurrentHashMap.newKeySet();
            added[0] = bucket.add(session);
            return bucket;
        });
        ordersBySession.computeIfAbsent(session.getId(), id -> ConcurrentHashMap.newKeySet()).add(orderId);

        // closed while we were adding
        if (session.getState() == ConnectionSession.State.CLOSED) {
            removeSession(session);
            return false;
        }

        log.debug("Session subscribed: sessionId={}, orderId={}", session.getId(), orderId);
        return added[0];
    }

    public boolean unsubscribe(ConnectionSession session, UUID orderId) {
        boolean removed = removeFromOrder(session, orderId);
        ordersBySession.computeIfPresent(session.getId(), (id, orders) -> {
            orders.remove(orderId);
            return orders.isEmpty() ? null : orders;
        });
        if (removed) {
            log.debug("Session unsubscribed: sessionId={}, orderId={}", session.getId(), orderId);
        }
        return removed;
    }

    /**
     * Snapshot of the sessions subscribed to an order.
     */
    public Set<ConnectionSession> subscribersOf(UUID orderId) {
        Set<ConnectionSession> sessions = sessionsByOrder.get(orderId);
        return sessions == null ? Set.of() : Set.copyOf(sessions);
    }

    /**
     * Drops every subscription of the session.
     *
     * @return number of orders the session was subscribed to
     */
    public int removeSession(ConnectionSession session) {
        Set<UUID> orders = ordersBySession.remove(session.getId());
        if (orders == null) {
            return 0;
        }
        orders.forEach(orderId -> removeFromOrder(session, orderId));
        log.debug("Session subscriptions removed: sessionId={}, orders={}", session.getId(), orders.size());
        return orders.size();
    }

    public int orderCount() {
        return sessionsByOrder.size();
    }

    public int subscriptionCount() {
        return sessionsByOrder.values().stream().mapToInt(Set::size).sum();
    }

    private boolean removeFromOrder(ConnectionSession session, UUID orderId) {
        boolean[] removed = {false};
        sessionsByOrder.computeIfPresent(orderId, (id, sessions) -> {
            removed[0] = sessions.remove(session);
            return sessions.isEmpty() ? null : sessions;
        });
        return removed[0];
    }
}
