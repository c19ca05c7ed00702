package com.tcrimer.indicator;

public record BollingerBand(double upper, double middle, double lower) {
}
