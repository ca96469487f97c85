package com.dropline.common.stream;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every server to client message: {@code {"type": "...", "data": {...}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamFrame {
    private String type;
    private Object data;

    public static StreamFrame of(String type, Object data) {
        return new StreamFrame(type, data);
    }
}
