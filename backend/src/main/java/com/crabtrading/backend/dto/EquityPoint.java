package com.crabtrading.backend.dto;

public record EquityPoint(String at, double equity) {
}
