package com.chainwatch.ingestion.adapter;

import com.chainwatch.common.ComputeBudgetTracker;
import com.chainwatch.ingestion.config.ComputeBudgetProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Charges the compute budget for one upstream operation at its configured unit cost.
 */
@Component
@RequiredArgsConstructor
public class BudgetMeter {

    private final ComputeBudgetTracker budgetTracker;
    private final ComputeBudgetProperties properties;

    public void charge(String operation) {
        budgetTracker.addUnits(properties.unitCostOf(operation));
    }
}
