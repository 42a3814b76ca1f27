package com.bulkresizer.service;

import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.JobOutcome.FailureKind;
import com.bulkresizer.model.ResizeJob;
import com.bulkresizer.model.ResizeParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResizeWorkerPoolTest {

    @Mock
    private ResizeJobProcessor processor;

    private ResizeParams params;

    @BeforeEach
    void setUp() {
        params = ResizeParams.builder(10, 10).build();
    }

    @Test
    void should_ReturnOneOutcomePerJob_When_SomeJobsFail() {
        List<ResizeJob> jobs = jobs(10);
        when(processor.process(any())).thenAnswer(invocation -> {
            ResizeJob job = invocation.getArgument(0);
            return job.getSourcePath().getFileName().toString().equals("img3.jpg")
                    ? JobOutcome.failure(job, FailureKind.DECODE, "corrupt", 0)
                    : JobOutcome.success(job, 0);
        });

        List<JobOutcome> outcomes;
        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, 3, 4)) {
            outcomes = pool.run(jobs);
        }

        assertThat(outcomes).hasSize(10);
        assertThat(outcomes).filteredOn(JobOutcome::isSuccess).hasSize(9);
        assertThat(outcomes).extracting(JobOutcome::getJob).containsExactlyElementsOf(jobs);
        verify(processor, times(10)).process(any());
    }

    @Test
    void should_RunJobsOnSeveralThreads_When_ConcurrencyAboveOne() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(processor.process(any())).thenAnswer(invocation -> {
            threads.add(Thread.currentThread().getName());
            bothStarted.countDown();
            bothStarted.await(5, TimeUnit.SECONDS);
            return JobOutcome.success(invocation.getArgument(0), 0);
        });

        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, 2, 1)) {
            pool.run(jobs(2));
        }

        assertThat(threads).hasSize(2).allMatch(name -> name.startsWith("resizer-"));
    }

    @Test
    @Timeout(10)
    void should_KeepDispatching_When_OneJobIsSlow() {
        CountDownLatch othersDone = new CountDownLatch(3);
        when(processor.process(any())).thenAnswer(invocation -> {
            ResizeJob job = invocation.getArgument(0);
            if (job.getSourcePath().getFileName().toString().equals("img0.jpg")) {
                // only finishes once every other job got through on the remaining worker
                assertThat(othersDone.await(5, TimeUnit.SECONDS)).isTrue();
            } else {
                othersDone.countDown();
            }
            return JobOutcome.success(job, 0);
        });

        List<JobOutcome> outcomes;
        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, 2, 1)) {
            outcomes = pool.run(jobs(4));
        }

        assertThat(outcomes).hasSize(4).allMatch(JobOutcome::isSuccess);
    }

    @Test
    @Timeout(10)
    void should_WaitForOtherChunks_When_AWorkerDiesWithError() {
        AtomicBoolean slowJobFinished = new AtomicBoolean(false);
        when(processor.process(any())).thenAnswer(invocation -> {
            ResizeJob job = invocation.getArgument(0);
            if (job.getSourcePath().getFileName().toString().equals("img0.jpg")) {
                throw new OutOfMemoryError("Java heap space");
            }
            Thread.sleep(300);
            slowJobFinished.set(true);
            return JobOutcome.success(job, 0);
        });

        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, 2, 1)) {
            assertThatThrownBy(() -> pool.run(jobs(2)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasCauseInstanceOf(OutOfMemoryError.class);
            assertThat(slowJobFinished).isTrue();
        }
    }

    @Test
    void should_ReturnEmpty_When_NoJobs() {
        try (ResizeWorkerPool pool = new ResizeWorkerPool(processor, 2, 16)) {
            assertThat(pool.run(List.of())).isEmpty();
        }
    }

    @Test
    void should_RejectRun_When_PoolIsClosed() {
        ResizeWorkerPool pool = new ResizeWorkerPool(processor, 1, 1);
        pool.close();

        assertThatThrownBy(() -> pool.run(jobs(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_RejectInvalidSizes() {
        assertThatThrownBy(() -> new ResizeWorkerPool(processor, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResizeWorkerPool(processor, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_SplitIntoChunksOfGivenSize() {
        List<List<Integer>> chunks = ResizeWorkerPool.chunk(List.of(1, 2, 3, 4, 5), 2);

        assertThat(chunks).containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
        assertThat(ResizeWorkerPool.chunk(List.of(), 16)).isEmpty();
    }

    private List<ResizeJob> jobs(int count) {
        List<ResizeJob> jobs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            jobs.add(new ResizeJob(Path.of("img" + i + ".jpg"), Path.of("out", "img" + i + ".jpg"), params));
        }
        return jobs;
    }
}
