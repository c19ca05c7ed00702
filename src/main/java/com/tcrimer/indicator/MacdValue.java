package com.tcrimer.indicator;

public record MacdValue(double macd, double signal) {

    public double histogram() {
        return macd - signal;
    }
}
