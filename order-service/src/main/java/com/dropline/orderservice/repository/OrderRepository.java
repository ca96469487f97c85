package com.dropline.orderservice.repository;

import com.dropline.orderservice.model.Order;
import com.dropline.orderservice.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    List<Order> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Order> findByVendorIdOrderByCreatedAtDesc(UUID vendorId);

    List<Order> findByDeliveryPersonIdOrderByCreatedAtDesc(UUID deliveryPersonId);

    List<Order> findAllByOrderByCreatedAtDesc();

    /**
     * Moves the order to {@code target} only if it is still in {@code expected}.
     * Returns the number of rows changed: 0 means another writer got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Order o
               SET o.status = :target,
                   o.actualDeliveryTime = :actualDeliveryTime,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             WHERE o.id = :id
               AND o.status = :expected
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") OrderStatus expected,
                            @Param("target") OrderStatus target,
                            @Param("actualDeliveryTime") Instant actualDeliveryTime,
                            @Param("now") Instant now);

    /**
     * Attaches a delivery agent if none is attached yet and the order is still with the vendor.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Order o
               SET o.deliveryPersonId = :agentId,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             WHERE o.id = :id
               AND o.deliveryPersonId IS NULL
               AND o.status IN :assignable
            """)
    int assignDeliveryPersonIfUnassigned(@Param("id") UUID id,
                                         @Param("agentId") UUID agentId,
                                         @Param("assignable") Collection<OrderStatus> assignable,
                                         @Param("now") Instant now);
}
