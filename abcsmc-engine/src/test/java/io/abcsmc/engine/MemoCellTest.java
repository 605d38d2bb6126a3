package io.abcsmc.engine;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MemoCellTest {

    @Test
    void computesOnceUntilReset() {
        MemoCell<String> cell = new MemoCell<>();
        AtomicInteger calls = new AtomicInteger();
        assertFalse(cell.isPresent());

        assertEquals("v1", cell.get(() -> "v" + calls.incrementAndGet()));
        assertEquals("v1", cell.get(() -> "v" + calls.incrementAndGet()));
        assertTrue(cell.isPresent());

        cell.reset();
        assertEquals("v2", cell.get(() -> "v" + calls.incrementAndGet()));
        assertEquals(2, calls.get());
    }

    @Test
    void nullValuesAreRejected() {
        MemoCell<String> cell = new MemoCell<>();
        assertThrows(NullPointerException.class, () -> cell.get(() -> null));
        assertFalse(cell.isPresent());
    }
}
