package com.umitunal.jobmgr.storage;

import com.umitunal.jobmgr.config.ManagerConfig;
import com.umitunal.jobmgr.core.Job;
import com.umitunal.jobmgr.core.JobStore;
import com.umitunal.jobmgr.error.CorruptStoreException;
import com.umitunal.jobmgr.error.JobNotFoundException;
import com.umitunal.jobmgr.error.StorageException;
import com.umitunal.jobmgr.error.StoreBusyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class FlatFileJobStoreTest {

    @TempDir
    Path tempDir;

    private static final int ANY_CAPACITY = 100;

    private FlatFileJobStore store;
    private StoreLayout layout;

    @BeforeEach
    void setUp() throws Exception {
        store = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());
        layout = store.getLayout();
    }

    private void assertFilesAligned() throws Exception {
        assertThat(Files.readAllLines(layout.statusFile(), UTF_8))
                .hasSameSizeAs(Files.readAllLines(layout.jobsFile(), UTF_8));
    }

    @Test
    @DisplayName("Should create the store files on first use")
    void testInitialize() throws Exception {
        assertThat(layout.jobsFile()).exists();
        assertThat(layout.statusFile()).exists();
        assertThat(layout.pidsFile()).exists();
        assertThat(layout.outputDirectory()).isDirectory();
        assertThat(store.list()).isEmpty();
    }

    @Test
    @DisplayName("Should number jobs in insertion order, starting at 1, as PENDING")
    void testAdd() throws Exception {
        // When
        Job first = store.add("echo hi", "/tmp");
        Job second = store.add("ls -la", "/home");

        // Then
        assertThat(first.getId()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(2);
        assertThat(store.list())
                .extracting(Job::toListLine)
                .containsExactly("1. [PENDING] echo hi", "2. [PENDING] ls -la");
        assertThat(store.get(2).getWorkdir()).isEqualTo("/home");
        assertFilesAligned();
    }

    @Test
    @DisplayName("Should reject empty commands")
    void testAddEmpty() {
        assertThatThrownBy(() -> store.add("   ", "/tmp"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should return the same list on repeated reads")
    void testListIdempotent() throws Exception {
        store.add("echo a", "/tmp");
        store.add("echo b", "/tmp");

        assertThat(store.list()).isEqualTo(store.list());
    }

    @Test
    @DisplayName("Should keep commands with special characters intact across instances")
    void testSpecialCharacters() throws Exception {
        // Given
        String command = "printf '%s|%s\\n' \"a b\" 'c'; echo \"multi\nline\"";
        store.add(command, "/tmp/dir with spaces");

        // When
        FlatFileJobStore reopened = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());

        // Then
        Job job = reopened.get(1);
        assertThat(job.getCommand()).isEqualTo(command);
        assertThat(job.getWorkdir()).isEqualTo("/tmp/dir with spaces");
        assertThat(Files.readAllLines(layout.jobsFile(), UTF_8)).hasSize(1);
    }

    @Test
    @DisplayName("Should shift later ids down after a delete")
    void testDeleteShiftsIds() throws Exception {
        // Given
        store.add("echo 1", "/tmp");
        store.add("echo 2", "/tmp");
        store.add("echo 3", "/tmp");

        // When
        Job removed = store.delete(2);

        // Then
        assertThat(removed.getCommand()).isEqualTo("echo 2");
        assertThat(store.list())
                .extracting(Job::toListLine)
                .containsExactly("1. [PENDING] echo 1", "2. [PENDING] echo 3");
        assertFilesAligned();
    }

    @Test
    @DisplayName("Should report unknown ids as not found")
    void testUnknownId() throws Exception {
        store.add("echo 1", "/tmp");

        assertThatThrownBy(() -> store.get(0)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.delete(2)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.updateStatus(5, Job.Status.RUNNING))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should claim a pending job exactly once")
    void testClaim() throws Exception {
        // Given
        Job job = store.add("echo hi", "/tmp");

        // When
        JobStore.Claim first = store.claim(job.getKey(), ANY_CAPACITY);
        JobStore.Claim second = store.claim(job.getKey(), ANY_CAPACITY);

        // Then
        assertThat(first).isEqualTo(JobStore.Claim.CLAIMED);
        assertThat(second).isEqualTo(JobStore.Claim.NOT_PENDING);
        assertThat(store.get(1).getStatus()).isEqualTo(Job.Status.RUNNING);
        assertThat(store.claim("no-such-key", ANY_CAPACITY)).isEqualTo(JobStore.Claim.NOT_PENDING);
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent claimers win")
    void testConcurrentClaim() throws Exception {
        // Given
        Job job = store.add("echo hi", "/tmp");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            // A separate instance per thread behaves like a separate process
            FlatFileJobStore contender = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());
            futures.add(executor.submit(() -> {
                start.await();
                if (contender.claim(job.getKey(), ANY_CAPACITY) == JobStore.Claim.CLAIMED) {
                    winners.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(winners.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse a claim while the store holds capacity active jobs")
    void testClaimAtCapacity() throws Exception {
        // Given
        Job first = store.add("sleep 10", "/tmp");
        Job second = store.add("sleep 10", "/tmp");
        Job third = store.add("sleep 10", "/tmp");
        FlatFileJobStore otherProcess = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());
        store.claim(first.getKey(), 2);
        otherProcess.claim(second.getKey(), 2);
        store.updateStatus(2, Job.Status.PAUSED);

        // When
        JobStore.Claim refused = store.claim(third.getKey(), 2);
        JobStore.Claim refusedElsewhere = otherProcess.claim(third.getKey(), 2);
        store.finish(first.getKey(), Job.Status.COMPLETED);
        JobStore.Claim admitted = otherProcess.claim(third.getKey(), 2);

        // Then
        assertThat(refused).isEqualTo(JobStore.Claim.AT_CAPACITY);
        assertThat(refusedElsewhere).isEqualTo(JobStore.Claim.AT_CAPACITY);
        assertThat(admitted).isEqualTo(JobStore.Claim.CLAIMED);
        assertThat(store.get(3).getStatus()).isEqualTo(Job.Status.RUNNING);
    }

    @Test
    @DisplayName("Should let only capacity of many concurrent claimers on different jobs win")
    void testConcurrentClaimsRespectCapacity() throws Exception {
        // Given
        int threads = 8;
        int capacity = 3;
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            keys.add(store.add("sleep " + i, "/tmp").getKey());
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (String key : keys) {
            FlatFileJobStore contender = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());
            futures.add(executor.submit(() -> {
                start.await();
                if (contender.claim(key, capacity) == JobStore.Claim.CLAIMED) {
                    winners.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(winners.get()).isEqualTo(capacity);
        assertThat(store.metrics().getRunningJobs()).isEqualTo(capacity);
    }

    @Test
    @DisplayName("Should not lose concurrent status updates and additions")
    void testNoLostUpdates() throws Exception {
        // Given
        int jobs = 20;
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < jobs; i++) {
            keys.add(store.add("echo " + i, "/tmp").getKey());
        }
        ExecutorService executor = Executors.newFixedThreadPool(6);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (String key : keys) {
            futures.add(executor.submit(() -> {
                FlatFileJobStore other = new FlatFileJobStore(ManagerConfig.newBuilder(tempDir).build());
                other.claim(key, ANY_CAPACITY);
                other.finish(key, Job.Status.COMPLETED);
                return null;
            }));
        }
        for (int i = 0; i < 5; i++) {
            int n = i;
            futures.add(executor.submit(() -> store.add("late " + n, "/tmp")));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        List<Job> all = store.list();
        assertThat(all).hasSize(jobs + 5);
        assertThat(all.subList(0, jobs)).allMatch(job -> job.getStatus() == Job.Status.COMPLETED);
        assertThat(all.subList(jobs, jobs + 5)).allMatch(job -> job.getStatus() == Job.Status.PENDING);
        assertFilesAligned();
    }

    @Test
    @DisplayName("Should keep the pid binding only while the job is active")
    void testBindAndFinish() throws Exception {
        // Given
        Job job = store.add("sleep 1", "/tmp");
        store.claim(job.getKey(), ANY_CAPACITY);

        // When
        store.bindProcess(job.getKey(), 4242);

        // Then
        assertThat(store.get(1).getPid()).hasValue(4242L);
        assertThat(Files.readString(layout.pidsFile(), UTF_8)).contains("4242");

        Job finished = store.finish(job.getKey(), Job.Status.ERROR);
        assertThat(finished.getPid()).isEmpty();
        assertThat(Files.readAllLines(layout.pidsFile(), UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("Should only accept terminal statuses in finish")
    void testFinishRequiresTerminal() throws Exception {
        Job job = store.add("echo", "/tmp");

        assertThatThrownBy(() -> store.finish(job.getKey(), Job.Status.PAUSED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should apply the process action before recording the new status")
    void testSignalBound() throws Exception {
        // Given
        Job job = store.add("sleep 10", "/tmp");
        store.claim(job.getKey(), ANY_CAPACITY);
        store.bindProcess(job.getKey(), 777);
        List<Long> signalled = new ArrayList<>();

        // When
        Job paused = store.signalBound(1, Job.Status.PAUSED, signalled::add);

        // Then
        assertThat(signalled).containsExactly(777L);
        assertThat(paused.getStatus()).isEqualTo(Job.Status.PAUSED);
        assertThat(store.get(1).getPid()).hasValue(777L);
    }

    @Test
    @DisplayName("Should leave the status untouched when the process action fails")
    void testSignalBoundFailure() throws Exception {
        // Given
        Job job = store.add("sleep 10", "/tmp");
        store.claim(job.getKey(), ANY_CAPACITY);
        store.bindProcess(job.getKey(), 777);

        // When / Then
        assertThatThrownBy(() -> store.signalBound(1, Job.Status.PAUSED, pid -> {
            throw new JobNotFoundException("Process " + pid + " is no longer running");
        })).isInstanceOf(JobNotFoundException.class);
        assertThat(store.get(1).getStatus()).isEqualTo(Job.Status.RUNNING);
    }

    @Test
    @DisplayName("Should refuse to signal jobs without a bound process")
    void testSignalUnbound() throws Exception {
        store.add("echo hi", "/tmp");

        assertThatThrownBy(() -> store.signalBound(1, Job.Status.PAUSED, pid -> { }))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessageContaining("PENDING");
    }

    @Test
    @DisplayName("Should refuse to delete a running job")
    void testDeleteActive() throws Exception {
        Job job = store.add("sleep 10", "/tmp");
        store.claim(job.getKey(), ANY_CAPACITY);

        assertThatThrownBy(() -> store.delete(1)).isInstanceOf(StoreBusyException.class);
        assertThat(store.list()).hasSize(1);
    }

    @Test
    @DisplayName("Should leave all files untouched when clean is refused")
    void testDeleteAllBusy() throws Exception {
        // Given
        store.add("echo a", "/tmp");
        Job running = store.add("sleep 10", "/tmp");
        store.claim(running.getKey(), ANY_CAPACITY);
        String jobsBefore = Files.readString(layout.jobsFile(), UTF_8);
        String statusBefore = Files.readString(layout.statusFile(), UTF_8);

        // When / Then
        assertThatThrownBy(() -> store.deleteAll(() -> { })).isInstanceOf(StoreBusyException.class);
        assertThat(Files.readString(layout.jobsFile(), UTF_8)).isEqualTo(jobsBefore);
        assertThat(Files.readString(layout.statusFile(), UTF_8)).isEqualTo(statusBefore);
    }

    @Test
    @DisplayName("Should keep every job when the pre-commit step of deleteAll fails")
    void testDeleteAllStepFails() throws Exception {
        // Given
        store.add("echo a", "/tmp");
        store.add("echo b", "/tmp");
        String jobsBefore = Files.readString(layout.jobsFile(), UTF_8);

        // When / Then
        assertThatThrownBy(() -> store.deleteAll(() -> {
            throw new StorageException("Cannot clear output", new IOException("read-only file system"));
        })).isInstanceOf(StorageException.class);
        assertThat(store.list()).hasSize(2);
        assertThat(Files.readString(layout.jobsFile(), UTF_8)).isEqualTo(jobsBefore);
    }

    @Test
    @DisplayName("Should empty all three files on deleteAll")
    void testDeleteAll() throws Exception {
        store.add("echo a", "/tmp");
        store.add("echo b", "/tmp");

        store.deleteAll(() -> { });

        assertThat(store.list()).isEmpty();
        assertThat(Files.size(layout.jobsFile())).isZero();
        assertThat(Files.size(layout.statusFile())).isZero();
        assertThat(Files.size(layout.pidsFile())).isZero();
    }

    @Test
    @DisplayName("Should prune finished jobs and renumber the rest")
    void testDeleteFinished() throws Exception {
        // Given
        Job done = store.add("echo done", "/tmp");
        store.add("echo waiting", "/tmp");
        Job failed = store.add("false", "/tmp");
        store.claim(done.getKey(), ANY_CAPACITY);
        store.finish(done.getKey(), Job.Status.COMPLETED);
        store.claim(failed.getKey(), ANY_CAPACITY);
        store.finish(failed.getKey(), Job.Status.ERROR);

        // When
        List<Job> removed = store.deleteFinished();

        // Then
        assertThat(removed).extracting(Job::getCommand).containsExactly("echo done", "false");
        assertThat(store.list())
                .extracting(Job::toListLine)
                .containsExactly("1. [PENDING] echo waiting");
    }

    @Test
    @DisplayName("Should report a corrupt status file instead of guessing")
    void testCorruptStatus() throws Exception {
        // Given
        store.add("echo a", "/tmp");
        store.add("echo b", "/tmp");
        Files.writeString(layout.statusFile(), "PENDING\n", UTF_8);

        // When / Then
        assertThatThrownBy(() -> store.list())
                .isInstanceOf(CorruptStoreException.class)
                .hasMessageContaining("status.txt");
        assertThatThrownBy(() -> store.add("echo c", "/tmp"))
                .isInstanceOf(CorruptStoreException.class);
        assertThat(Files.readAllLines(layout.jobsFile(), UTF_8)).hasSize(2);
    }

    @Test
    @DisplayName("Should report malformed job lines with their line number")
    void testCorruptJobs() throws Exception {
        store.add("echo a", "/tmp");
        List<String> lines = Files.readAllLines(layout.jobsFile(), UTF_8);
        lines.add("echo b|/tmp");
        Files.write(layout.jobsFile(), lines, UTF_8);
        Files.writeString(layout.statusFile(), "PENDING\nPENDING\n", UTF_8);

        assertThatThrownBy(() -> store.list())
                .isInstanceOf(CorruptStoreException.class)
                .satisfies(e -> assertThat(((CorruptStoreException) e).getLine()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should not leave temporary files behind")
    void testNoTempFiles() throws Exception {
        for (int i = 0; i < 5; i++) {
            store.add("echo " + i, "/tmp");
        }
        store.delete(3);

        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                    .allMatch(name -> !name.endsWith(".tmp"))
                    .doesNotContain(layout.commitFile().getFileName().toString());
        }
    }
}
