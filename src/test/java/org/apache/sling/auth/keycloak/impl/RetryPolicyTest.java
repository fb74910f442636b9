/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
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
package org.apache.sling.auth.keycloak.impl;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    @Test
    void testConstruction_InvalidValues_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1));
    }

    @Test
    void testExecute_SucceedsFirstTime() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = new RetryPolicy(3, 0).execute("test call", () -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(1, calls.get());
    }

    @Test
    void testExecute_RetriesIoFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = new RetryPolicy(3, 1).execute("test call", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("Connection reset");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void testExecute_GivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, 0);

        IOException e = assertThrows(IOException.class, () -> policy.execute("test call", () -> {
            throw new IOException("attempt " + calls.incrementAndGet());
        }));

        assertEquals("attempt 2", e.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void testExecute_RuntimeFailureNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, 0);

        assertThrows(IllegalStateException.class, () -> policy.execute("test call", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void testExecute_InterruptedDuringBackoff() {
        RetryPolicy policy = new RetryPolicy(3, 10_000);
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> policy.execute("test call", () -> {
                throw new IOException("Connection refused");
            }));
        } finally {
            Thread.interrupted();
        }
    }
}
