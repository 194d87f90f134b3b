package com.conveyal.catchment.analyst.cluster;

import com.conveyal.catchment.common.JsonUtilities;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStatusStoreTest {

    @Test
    void keepsTheHistoryOfEachJob () {
        InMemoryJobStatusStore store = new InMemoryJobStatusStore();
        assertNull(store.getStatus("a"));
        assertTrue(store.getHistory("a").isEmpty());
        store.setStatus("a", JobStatus.IN_PROGRESS);
        store.setStatus("b", JobStatus.IN_PROGRESS);
        store.setStatus("a", JobStatus.SUCCESS);
        assertEquals(JobStatus.SUCCESS, store.getStatus("a"));
        assertEquals(JobStatus.IN_PROGRESS, store.getStatus("b"));
        assertEquals(List.of(JobStatus.IN_PROGRESS, JobStatus.SUCCESS), store.getHistory("a"));
    }

    @Test
    void terminalStatusIsFinal () {
        InMemoryJobStatusStore store = new InMemoryJobStatusStore();
        store.setStatus("a", JobStatus.IN_PROGRESS);
        store.setStatus("a", JobStatus.DISCONNECTED_ORIGIN);
        assertThrows(IllegalStateException.class, () -> store.setStatus("a", JobStatus.SUCCESS));
        assertThrows(IllegalStateException.class, () -> store.setStatus("a", JobStatus.IN_PROGRESS));
        assertEquals(JobStatus.DISCONNECTED_ORIGIN, store.getStatus("a"));
    }

    @Test
    void historiesCanBeReadWhileJobsAreUpdated () throws Exception {
        InMemoryJobStatusStore store = new InMemoryJobStatusStore();
        int jobs = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            Future<Integer> reader = executor.submit(() -> {
                int reads = 0;
                do {
                    for (int i = 0; i < jobs; i += 7) {
                        List<JobStatus> history = store.getHistory("job-" + i);
                        // Each history seen must be a complete prefix of the sequence written.
                        assertTrue(history.size() <= 2);
                        if (!history.isEmpty()) assertEquals(JobStatus.IN_PROGRESS, history.get(0));
                        if (history.size() == 2) assertEquals(JobStatus.SUCCESS, history.get(1));
                        reads++;
                    }
                } while (writing.get());
                return reads;
            });
            List<Future<?>> writers = new ArrayList<>();
            for (int w = 0; w < 3; w++) {
                int offset = w;
                writers.add(executor.submit(() -> {
                    for (int i = offset; i < jobs; i += 3) {
                        store.setStatus("job-" + i, JobStatus.IN_PROGRESS);
                        store.setStatus("job-" + i, JobStatus.SUCCESS);
                    }
                }));
            }
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
            writing.set(false);
            assertTrue(reader.get(30, TimeUnit.SECONDS) > 0);
        } finally {
            writing.set(false);
            executor.shutdownNow();
        }
        for (int i = 0; i < jobs; i++) {
            assertEquals(List.of(JobStatus.IN_PROGRESS, JobStatus.SUCCESS), store.getHistory("job-" + i));
        }
    }

    @Test
    void historyIsASnapshot () {
        InMemoryJobStatusStore store = new InMemoryJobStatusStore();
        store.setStatus("a", JobStatus.IN_PROGRESS);
        List<JobStatus> before = store.getHistory("a");
        store.setStatus("a", JobStatus.FAILURE);
        assertEquals(List.of(JobStatus.IN_PROGRESS), before);
        assertThrows(UnsupportedOperationException.class, () -> before.add(JobStatus.SUCCESS));
    }

    @Test
    void statusesUseLowerCaseNames () {
        assertEquals("\"disconnected_origin\"", JsonUtilities.objectToJsonString(JobStatus.DISCONNECTED_ORIGIN));
        assertEquals("\"in_progress\"", JsonUtilities.objectToJsonString(JobStatus.IN_PROGRESS));
    }
}
