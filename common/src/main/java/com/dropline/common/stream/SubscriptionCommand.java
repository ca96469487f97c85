package com.dropline.common.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Client to server control frame.
 *
 * <p>Two shapes are accepted:
 * <pre>
 * {"action": "join_order", "orderId": "..."}
 * {"type": "join_order", "data": {"orderId": "..."}}
 * </pre>
 * The second one is what older browser clients send.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriptionCommand {
    private String action;
    private String type;
    private String orderId;
    private Map<String, Object> data;

    public static SubscriptionCommand join(UUID orderId) {
        return SubscriptionCommand.builder()
                .action(FrameTypes.JOIN_ORDER)
                .orderId(orderId.toString())
                .build();
    }

    public static SubscriptionCommand leave(UUID orderId) {
        return SubscriptionCommand.builder()
                .action(FrameTypes.LEAVE_ORDER)
                .orderId(orderId.toString())
                .build();
    }

    @JsonIgnore
    public String effectiveAction() {
        return action != null ? action : type;
    }

    @JsonIgnore
    public String effectiveOrderId() {
        if (orderId != null) {
            return orderId;
        }
        if (data != null && data.get("orderId") != null) {
            return String.valueOf(data.get("orderId"));
        }
        return null;
    }
}
