package com.dropline.orderservice.event;

import com.dropline.common.stream.FrameTypes;

public enum OrderEventType {
    STATUS_CHANGED(FrameTypes.STATUS_CHANGED),
    CHAT_MESSAGE(FrameTypes.CHAT_MESSAGE),
    AGENT_ASSIGNED(FrameTypes.AGENT_ASSIGNED);

    private final String frameType;

    OrderEventType(String frameType) {
        this.frameType = frameType;
    }

    /**
     * Value of the {@code type} field in stream frames.
     */
    public String getFrameType() {
        return frameType;
    }
}
