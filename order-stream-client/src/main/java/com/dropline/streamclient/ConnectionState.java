package com.dropline.streamclient;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    OPEN,
    RECONNECTING,
    // reconnect attempts exhausted; a new connect() starts over
    FAILED,
    // closed by the caller, terminal
    CLOSED
}
