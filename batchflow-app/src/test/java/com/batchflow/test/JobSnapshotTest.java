package com.batchflow.test;

import com.batchflow.domain.job.model.valobj.JobQuery;
import com.batchflow.domain.job.model.valobj.JobSnapshot;
import com.batchflow.domain.job.model.valobj.JobStatsSnapshot;
import com.batchflow.domain.job.model.valobj.JobView;
import com.batchflow.test.support.FakeTaskRunner;
import com.batchflow.test.support.OrchestratorTestFixture;
import com.batchflow.trigger.event.JobSnapshotPoller;
import com.batchflow.trigger.job.JobStatsBroadcastDaemon;
import com.batchflow.types.enums.JobEventTypeEnum;
import com.batchflow.types.enums.JobStatusEnum;
import com.batchflow.types.exception.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.batchflow.test.support.OrchestratorTestFixture.await;

public class JobSnapshotTest {

    private final FakeTaskRunner runner = new FakeTaskRunner();
    private final OrchestratorTestFixture fixture = new OrchestratorTestFixture(runner);

    @AfterEach
    public void tearDown() {
        fixture.close();
    }

    @Test
    public void shouldCaptureJobsStatsAndLatestSequence() {
        Long first = fixture.createJob(2, 1, 0);
        Long second = fixture.createJob(3, 1, 0);

        JobSnapshot snapshot = fixture.orchestrator.snapshot();

        Assertions.assertEquals(fixture.eventPublisher.latestSequence(), snapshot.sequence());
        Assertions.assertEquals(2, snapshot.jobs().size());
        Assertions.assertEquals(2L, snapshot.stats().getTotalJobs());
        Assertions.assertEquals(5L, snapshot.stats().getPendingTasks());
        Assertions.assertNotNull(snapshot.capturedAt());
        Assertions.assertTrue(snapshot.jobs().stream().anyMatch(job -> job.getId().equals(first)));
        Assertions.assertTrue(snapshot.jobs().stream().anyMatch(job -> job.getId().equals(second)));
    }

    @Test
    public void shouldReadJobDetailUnderJobLock() throws Exception {
        Long jobId = fixture.createJob(2, 1, 0);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> fixture.lockManager.runWithLock(jobId, () -> {
            locked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        Assertions.assertTrue(locked.await(5, TimeUnit.SECONDS));

        CompletableFuture<JobView> view = CompletableFuture.supplyAsync(() -> fixture.orchestrator.getJob(jobId));
        Thread.sleep(100L);
        Assertions.assertFalse(view.isDone());

        release.countDown();
        Assertions.assertEquals(2, view.get(5, TimeUnit.SECONDS).tasks().size());
        holder.join(5000L);
    }

    @Test
    public void shouldReturnJobWithTasksInExecutionOrder() {
        Long jobId = fixture.createJob(3, 1, 0);

        JobView view = fixture.orchestrator.getJob(jobId);

        Assertions.assertEquals(jobId, view.job().getId());
        Assertions.assertEquals(3, view.tasks().size());
        for (int i = 0; i < 3; i++) {
            Assertions.assertEquals(i, view.tasks().get(i).getIndex());
        }
        Assertions.assertThrows(NotFoundException.class, () -> fixture.orchestrator.getJob(404L));
    }

    @Test
    public void shouldFilterStatsByQuery() {
        fixture.createJob(1, 1, 0);
        Long started = fixture.orchestrator.createJob(OrchestratorTestFixture.command("empty", 0, 1, 0)
                .autoStart(true).build());

        JobStatsSnapshot completed = fixture.orchestrator.getStats(JobQuery.builder()
                .statuses(Set.of(JobStatusEnum.COMPLETED))
                .build());

        Assertions.assertEquals(1L, completed.getTotalJobs());
        Assertions.assertEquals(1L, completed.getCompletedJobs());
        Assertions.assertEquals(0L, completed.getPendingJobs());
        Assertions.assertEquals(JobStatusEnum.COMPLETED, fixture.job(started).getStatus());
    }

    @Test
    public void shouldBroadcastStatsOnlyWhenChanged() {
        JobStatsBroadcastDaemon daemon = new JobStatsBroadcastDaemon(fixture.queryService, fixture.eventPublisher);

        Assertions.assertTrue(daemon.broadcastIfChanged());
        Assertions.assertFalse(daemon.broadcastIfChanged());

        fixture.createJob(1, 1, 0);
        Assertions.assertTrue(daemon.broadcastIfChanged());
        Assertions.assertEquals(JobEventTypeEnum.STATS_UPDATED,
                fixture.orchestrator.replayEvents(0L).events().get(2).getEventType());
    }

    @Test
    public void shouldPollSnapshotsUntilCancelled() {
        List<JobSnapshot> received = new CopyOnWriteArrayList<>();
        JobSnapshotPoller.PollingHandle handle = fixture.orchestrator.pollSnapshots(Duration.ofMillis(20), received::add);

        await("two snapshots polled", () -> received.size() >= 2);
        handle.cancel();
        Assertions.assertTrue(handle.isCancelled());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> fixture.orchestrator.pollSnapshots(Duration.ZERO, received::add));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> fixture.orchestrator.pollSnapshots(Duration.ofMillis(20), null));
    }
}
