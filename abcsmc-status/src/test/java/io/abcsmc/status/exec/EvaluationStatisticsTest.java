package io.abcsmc.status.exec;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.abcsmc.status.eventing.RunState;
import io.abcsmc.status.eventing.StatusUpdate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EvaluationStatisticsTest {

    @Test
    void countersAreConsistentUnderConcurrentUpdates() throws Exception {
        EvaluationStatistics stats = new EvaluationStatistics();
        ExecutorService pool = WorkerPools.newFixedPool("stats-test", 4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 1000; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    stats.incrementSubmitted();
                    if (index % 10 == 0) {
                        stats.incrementFailed();
                    } else {
                        stats.recordCompleted(index % 3 == 0);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            assertTrue(WorkerPools.shutdown(pool, Duration.ofSeconds(5)));
        }

        assertEquals(1000, stats.getSubmitted());
        assertEquals(100, stats.getFailed());
        assertEquals(900, stats.getCompleted());
        assertEquals(0, stats.getPending());
        assertEquals(1000, stats.getEvaluated());
        // multiples of 3 that are not multiples of 10 in [0, 1000)
        assertEquals(334 - 34, stats.getAccepted());
    }

    @Test
    void snapshotReflectsCounters() {
        EvaluationStatistics stats = new EvaluationStatistics();
        stats.incrementSubmitted();
        stats.incrementSubmitted();
        stats.recordCompleted(true);
        stats.incrementCancelled();

        StatusUpdate update = stats.snapshot(RunState.RUNNING, 4);
        assertEquals(1, update.accepted);
        assertEquals(1, update.evaluations);
        assertEquals(0.25, update.progress, 1e-12);
        assertEquals(0, stats.getPending());
    }

    @Test
    void workerThreadsAreNamedDaemons() throws Exception {
        ExecutorService pool = WorkerPools.newFixedPool("named", 1);
        try {
            Thread worker = pool.submit(Thread::currentThread).get();
            assertTrue(worker.isDaemon());
            assertEquals("named-1", worker.getName());
        } finally {
            WorkerPools.shutdown(pool, Duration.ofSeconds(1));
        }
        assertThrows(IllegalArgumentException.class, () -> WorkerPools.newFixedPool("x", 0));
    }
}
