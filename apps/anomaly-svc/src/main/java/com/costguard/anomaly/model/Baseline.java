package com.costguard.anomaly.model;

/**
 * Robust description of normal spend over a window: the median daily total and its median absolute deviation.
 * {@code mad} has already been floored and is never zero.
 */
public record Baseline(double median, double mad) {
}
