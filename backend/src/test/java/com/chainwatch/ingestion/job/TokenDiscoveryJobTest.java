package com.chainwatch.ingestion.job;

import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.discovery.CandidateMonitor;
import com.chainwatch.ingestion.discovery.TokenDiscoveryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TokenDiscoveryJobTest {

    @Mock
    private TokenDiscoveryService tokenDiscoveryService;
    @Mock
    private CandidateMonitor candidateMonitor;

    @InjectMocks
    private TokenDiscoveryJob job;

    @Test
    @DisplayName("discovery runs before the classification cycle")
    void runScheduled_discoversThenClassifies() {
        job.runScheduled();

        InOrder order = inOrder(tokenDiscoveryService, candidateMonitor);
        order.verify(tokenDiscoveryService).runTick();
        order.verify(candidateMonitor).runCycle();
    }

    @Test
    @DisplayName("failed discovery skips the cycle and is logged")
    void runScheduled_discoveryFailureSkipsCycle() {
        doThrow(new UpstreamException("explorer down")).when(tokenDiscoveryService).runTick();

        job.runScheduled();

        verifyNoInteractions(candidateMonitor);
    }
}
