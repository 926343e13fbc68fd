package com.delta.research.pipeline.api;

import com.delta.research.pipeline.model.WorkerStatusResponse;
import com.delta.research.pipeline.service.ResearchWorkerDaemon;
import com.delta.research.pipeline.service.ResearchWorkerService;
import com.delta.research.pipeline.service.ResearchWorkerService.Outcome;
import com.delta.research.pipeline.service.ResearchWorkerService.WorkerResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerControllerTest {

    @Mock
    private ResearchWorkerService workerService;
    @Mock
    private ResearchWorkerDaemon workerDaemon;

    @Test
    void runOnceReportsTheClaimedJob() {
        UUID jobId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        when(workerService.runOnce()).thenReturn(new WorkerResult(jobId, runId, Outcome.REQUEUED));
        when(workerService.getWorkerId()).thenReturn("worker-1@host");

        Map<String, Object> body = new WorkerController(workerService, workerDaemon).runOnce();

        assertEquals("worker-1@host", body.get("worker_id"));
        assertEquals(true, body.get("claimed"));
        assertEquals(jobId, body.get("job_id"));
        assertEquals(runId, body.get("run_id"));
        assertEquals("requeued", body.get("outcome"));
    }

    @Test
    void runOnceWithEmptyQueueClaimsNothing() {
        when(workerService.runOnce()).thenReturn(null);
        when(workerService.getWorkerId()).thenReturn("worker-1@host");

        Map<String, Object> body = new WorkerController(workerService, workerDaemon).runOnce();

        assertEquals(false, body.get("claimed"));
        assertFalse(body.containsKey("job_id"));
    }

    @Test
    void startDelegatesToTheDaemon() {
        when(workerDaemon.getStatus()).thenReturn(new WorkerStatusResponse("worker-1@host", true, 2, 0L, 1L));

        WorkerStatusResponse status = new WorkerController(workerService, workerDaemon).start();

        verify(workerDaemon).start();
        assertTrue(status.daemonRunning());
        assertEquals(2, status.activeWorkers());
    }
}
