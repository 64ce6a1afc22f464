package com.chainwatch.api.controller;

import com.chainwatch.api.dto.BudgetResponse;
import com.chainwatch.api.dto.CandidateResponse;
import com.chainwatch.common.ComputeBudgetTracker;
import com.chainwatch.ingestion.discovery.MonitoredCandidates;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only views of the discovery state and the compute budget.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitorController {

    private final MonitoredCandidates monitoredCandidates;
    private final ComputeBudgetTracker computeBudgetTracker;

    @GetMapping("/candidates")
    public List<CandidateResponse> candidates() {
        return monitoredCandidates.snapshot().stream().map(CandidateResponse::from).toList();
    }

    @GetMapping("/budget")
    public BudgetResponse budget() {
        return new BudgetResponse(
                computeBudgetTracker.getConsumedUnits(),
                computeBudgetTracker.getCapacity(),
                computeBudgetTracker.getRemainingUnits(),
                computeBudgetTracker.isExhausted(),
                computeBudgetTracker.getTicksSinceReset());
    }
}
