package com.tcrimer.db;

public enum BackendKind {
    PRIMARY,
    FALLBACK
}
