package peopleops.compensation.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import peopleops.compensation.config.JobQueueConfig;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.services.JobClaimService;

/**
 * Unit tests for {@link StaleJobReclaimScheduler}.
 */
class StaleJobReclaimSchedulerTest {

    @Mock
    JobClaimService claimService;

    @Mock
    JobQueueConfig config;

    @InjectMocks
    StaleJobReclaimScheduler scheduler;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        meterRegistry = new SimpleMeterRegistry();
        scheduler.metrics = new JobQueueMetrics(meterRegistry);
        when(config.livenessWindow()).thenReturn(Duration.ofMinutes(15));
    }

    @Test
    void testReclaim_releasesStaleJobsAndCounts() {
        when(config.reclaimEnabled()).thenReturn(true);
        when(claimService.reclaimStaleJobs(Duration.ofMinutes(15))).thenReturn(3);

        assertEquals(3, scheduler.reclaim());
        assertEquals(3.0, meterRegistry.get("compensation_jobs_reclaimed_total").counter().count());
    }

    @Test
    void testReclaim_disabled() {
        when(config.reclaimEnabled()).thenReturn(false);

        assertEquals(0, scheduler.reclaim());
        verify(claimService, never()).reclaimStaleJobs(any());
    }
}
