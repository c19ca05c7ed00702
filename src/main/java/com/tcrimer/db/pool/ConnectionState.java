package com.tcrimer.db.pool;

public enum ConnectionState {
    IDLE,
    IN_USE,
    BROKEN
}
