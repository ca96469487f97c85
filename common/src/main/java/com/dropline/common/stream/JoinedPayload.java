package com.dropline.common.stream;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Reply to a successful join. Carries the status at subscribe time so the client
 * does not miss an update that raced the join.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinedPayload {
    private UUID orderId;
    private String status;
}
