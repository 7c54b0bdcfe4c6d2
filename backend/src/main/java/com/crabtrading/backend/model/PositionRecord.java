package com.crabtrading.backend.model;

/**
 * Signed quantity held in one symbol and its weighted-average cost per unit.
 */
public record PositionRecord(double qty, double avgCost) {
}
