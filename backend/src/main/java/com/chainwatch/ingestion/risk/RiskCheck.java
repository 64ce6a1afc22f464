package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.CheckOutcome;

/**
 * One independent check on a discovered token. Upstream failures yield {@link CheckOutcome#UNKNOWN}, never an
 * exception.
 */
public interface RiskCheck {

    CheckOutcome evaluate(CandidateToken candidate);
}
