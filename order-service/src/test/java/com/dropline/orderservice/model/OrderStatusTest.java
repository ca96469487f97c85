package com.dropline.orderservice.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderStatusTest {

    @Test
    @DisplayName("forward path runs pending to delivered one step at a time")
    void forwardPath() {
        List<OrderStatus> path = new ArrayList<>();
        OrderStatus current = OrderStatus.PENDING;
        path.add(current);
        while (current.next().isPresent()) {
            current = current.next().get();
            path.add(current);
        }

        assertThat(path).containsExactly(
                OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY,
                OrderStatus.PICKED_UP, OrderStatus.IN_TRANSIT, OrderStatus.DELIVERED);
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"}, mode = EnumSource.Mode.EXCLUDE)
    void nonTerminalStatusesCanBeCancelled(OrderStatus status) {
        assertThat(status.isTerminal()).isFalse();
        assertThat(status.canTransitionTo(OrderStatus.CANCELLED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    void terminalStatusesAcceptNothing(OrderStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (OrderStatus target : OrderStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).as("%s -> %s", terminal, target).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(OrderStatus.class)
    void sameStatusIsNotATransition(OrderStatus status) {
        assertThat(status.canTransitionTo(status)).isFalse();
    }

    @Test
    void skippingAStepIsRejected() {
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PICKED_UP)).isFalse();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.PREPARING)).isFalse();
        assertThat(OrderStatus.IN_TRANSIT.canTransitionTo(OrderStatus.READY)).isFalse();
    }

    @Test
    void agentAssignableUntilReady() {
        assertThat(OrderStatus.READY.acceptsAgentAssignment()).isTrue();
        assertThat(OrderStatus.PENDING.acceptsAgentAssignment()).isTrue();
        assertThat(OrderStatus.PICKED_UP.acceptsAgentAssignment()).isFalse();
        assertThat(OrderStatus.CANCELLED.acceptsAgentAssignment()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"picked_up", "PICKED_UP", " Picked_Up "})
    void parsesWireValueAndConstantName(String raw) {
        assertThat(OrderStatus.fromValue(raw)).isEqualTo(OrderStatus.PICKED_UP);
    }

    @Test
    void unknownValueIsRejected() {
        assertThatThrownBy(() -> OrderStatus.fromValue("on_the_way"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("on_the_way");
    }
}
