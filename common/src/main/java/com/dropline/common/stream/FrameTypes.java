package com.dropline.common.stream;

/**
 * Values of the {@code type}/{@code action} field on the order event stream.
 */
public final class FrameTypes {

    // server -> client
    public static final String CHAT_MESSAGE = "chat_message";
    public static final String STATUS_CHANGED = "status_changed";
    public static final String AGENT_ASSIGNED = "agent_assigned";
    public static final String JOINED = "joined";
    public static final String ERROR = "error";

    // client -> server
    public static final String JOIN_ORDER = "join_order";
    public static final String LEAVE_ORDER = "leave_order";

    private FrameTypes() {
    }
}
