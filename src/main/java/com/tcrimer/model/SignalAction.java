package com.tcrimer.model;

public enum SignalAction {
    BUY,
    SELL,
    HOLD
}
