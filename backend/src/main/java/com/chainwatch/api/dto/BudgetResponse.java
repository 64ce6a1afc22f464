package com.chainwatch.api.dto;

public record BudgetResponse(long consumedUnits, long capacity, long remainingUnits, boolean exhausted, int ticksSinceReset) {
}
