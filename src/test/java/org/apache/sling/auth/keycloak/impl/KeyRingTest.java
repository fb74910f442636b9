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
import java.net.URL;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jose.util.Resource;
import com.nimbusds.jose.util.ResourceRetriever;
import org.apache.sling.auth.keycloak.AuthenticationErrorCode;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.apache.sling.auth.keycloak.impl.KeycloakTestSupport.KEY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link KeyRing}.
 */
class KeyRingTest {

    private static final long TTL_MILLIS = 300_000;
    private static final long MIN_REFRESH_MILLIS = 10_000;

    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicReference<String> document = new AtomicReference<>();
    private final AtomicInteger failuresToSend = new AtomicInteger();

    private KeycloakTestSupport support;
    private KeycloakTestSupport.MutableClock clock;
    private URL jwkSetUrl;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        support = new KeycloakTestSupport();
        clock = new KeycloakTestSupport.MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        jwkSetUrl = new URL("http://localhost/realms/test-realm/protocol/openid-connect/certs");
        document.set(new JWKSet(support.getRsaKey().toPublicJWK()).toString());
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private final ResourceRetriever countingRetriever = url -> {
        fetches.incrementAndGet();
        if (failuresToSend.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("Connection refused");
        }
        return new Resource(document.get(), "application/json");
    };

    private KeyRing keyRing(ResourceRetriever retriever, int maxAttempts) {
        return new KeyRing(jwkSetUrl, retriever, new RetryPolicy(maxAttempts, 0), TTL_MILLIS, MIN_REFRESH_MILLIS, clock);
    }

    private KeyRing keyRing() {
        return keyRing(countingRetriever, 3);
    }

    // ============ Caching ============

    @Test
    void testGetKey_FetchesOnceAndCaches() throws Exception {
        KeyRing keyRing = keyRing();

        JWK first = keyRing.getKey(KEY_ID);
        JWK second = keyRing.getKey(KEY_ID);

        assertEquals(KEY_ID, first.getKeyID());
        assertSame(first, second);
        assertEquals(1, fetches.get());
    }

    @Test
    void testGetKey_RefetchesAfterTtl() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        clock.advanceMillis(TTL_MILLIS);
        keyRing.getKey(KEY_ID);

        assertEquals(2, fetches.get());
    }

    @Test
    void testGetKey_ZeroTtlFetchesEveryTime() throws Exception {
        KeyRing keyRing = new KeyRing(jwkSetUrl, countingRetriever, new RetryPolicy(1, 0), 0, 0, clock);

        keyRing.getKey(KEY_ID);
        keyRing.getKey(KEY_ID);

        assertEquals(2, fetches.get());
    }

    @Test
    void testInvalidate_ForcesRefetch() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        keyRing.invalidate();
        keyRing.getKey(KEY_ID);

        assertEquals(2, fetches.get());
    }

    // ============ Unknown key ids ============

    @Test
    void testGetKey_UnknownKidRightAfterFetch_DoesNotRefetch() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey("unknown-kid"));

        assertEquals(AuthenticationErrorCode.KEY_NOT_FOUND, e.getCode());
        assertEquals(1, fetches.get());
    }

    @Test
    void testGetKey_UnknownKidOnFirstFetch_KeyNotFound() {
        KeyRing keyRing = keyRing();

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey("unknown-kid"));

        assertEquals(AuthenticationErrorCode.KEY_NOT_FOUND, e.getCode());
        assertEquals(1, fetches.get());
    }

    @Test
    void testGetKey_RotatedKeyPickedUpAfterMinimumInterval() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        RSAKey rotated = new RSAKeyGenerator(2048).keyID("rotated-key").generate();
        document.set(new JWKSet(List.of(support.getRsaKey().toPublicJWK(), rotated.toPublicJWK())).toString());

        assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey("rotated-key"));
        assertEquals(1, fetches.get());

        clock.advanceMillis(MIN_REFRESH_MILLIS);
        JWK key = keyRing.getKey("rotated-key");

        assertEquals("rotated-key", key.getKeyID());
        assertEquals(2, fetches.get());
    }

    // ============ Failures ============

    @Test
    void testGetKey_TransientFailureIsRetried() throws Exception {
        failuresToSend.set(2);
        KeyRing keyRing = keyRing();

        JWK key = keyRing.getKey(KEY_ID);

        assertNotNull(key);
        assertEquals(3, fetches.get());
    }

    @Test
    void testGetKey_ProviderDownWithoutCache_Unavailable() {
        failuresToSend.set(Integer.MAX_VALUE);
        KeyRing keyRing = keyRing();

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey(KEY_ID));

        assertEquals(AuthenticationErrorCode.KEY_RING_UNAVAILABLE, e.getCode());
        assertEquals(3, fetches.get());
    }

    @Test
    void testGetKey_InvalidDocument_Unavailable() {
        document.set("<html>Bad Gateway</html>");
        KeyRing keyRing = keyRing(countingRetriever, 1);

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey(KEY_ID));

        assertEquals(AuthenticationErrorCode.KEY_RING_UNAVAILABLE, e.getCode());
    }

    @Test
    void testGetKey_ProviderDownWithStaleCache_ServesStaleKeys() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        clock.advanceMillis(TTL_MILLIS + 1);
        failuresToSend.set(Integer.MAX_VALUE);
        JWK key = keyRing.getKey(KEY_ID);

        assertEquals(KEY_ID, key.getKeyID());
        assertEquals(4, fetches.get());

        // the stale set is kept for the minimum refresh interval without hitting the provider again
        keyRing.getKey(KEY_ID);
        assertEquals(4, fetches.get());

        clock.advanceMillis(MIN_REFRESH_MILLIS);
        failuresToSend.set(0);
        keyRing.getKey(KEY_ID);
        assertEquals(5, fetches.get());
    }

    @Test
    void testGetKey_ProviderDownWithStaleCache_UnknownKidsDoNotRefetch() throws Exception {
        KeyRing keyRing = keyRing();
        keyRing.getKey(KEY_ID);

        clock.advanceMillis(TTL_MILLIS + 1);
        failuresToSend.set(Integer.MAX_VALUE);
        keyRing.getKey(KEY_ID);
        assertEquals(4, fetches.get());

        for (int i = 0; i < 5; i++) {
            String kid = "unknown-kid-" + i;
            AuthenticationFailedException e =
                    assertThrows(AuthenticationFailedException.class, () -> keyRing.getKey(kid));
            assertEquals(AuthenticationErrorCode.KEY_NOT_FOUND, e.getCode());
        }
        assertEquals(4, fetches.get());
    }

    // ============ Concurrency ============

    @Test
    void testGetKey_ConcurrentMissesShareOneFetch() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        ResourceRetriever slowRetriever = url -> {
            fetchStarted.countDown();
            try {
                releaseFetch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            return countingRetriever.retrieveResource(url);
        };
        KeyRing keyRing = keyRing(slowRetriever, 1);

        int threads = 16;
        executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        List<Future<JWK>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                ready.countDown();
                return keyRing.getKey(KEY_ID);
            }));
        }

        assertTrue(ready.await(10, TimeUnit.SECONDS));
        assertTrue(fetchStarted.await(10, TimeUnit.SECONDS));
        Thread.sleep(200);
        releaseFetch.countDown();

        for (Future<JWK> result : results) {
            assertEquals(KEY_ID, result.get(10, TimeUnit.SECONDS).getKeyID());
        }
        assertEquals(1, fetches.get());
    }

    @Test
    void testGetKey_InterruptedWaiterDoesNotDisturbFetch() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        ResourceRetriever slowRetriever = url -> {
            fetchStarted.countDown();
            try {
                releaseFetch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            return countingRetriever.retrieveResource(url);
        };
        KeyRing keyRing = keyRing(slowRetriever, 1);
        executor = Executors.newFixedThreadPool(1);

        Future<JWK> owner = executor.submit(() -> keyRing.getKey(KEY_ID));
        assertTrue(fetchStarted.await(10, TimeUnit.SECONDS));

        AtomicReference<AuthenticationFailedException> waiterFailure = new AtomicReference<>();
        AtomicReference<Boolean> waiterInterrupted = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                keyRing.getKey(KEY_ID);
            } catch (AuthenticationFailedException e) {
                waiterFailure.set(e);
            }
            waiterInterrupted.set(Thread.currentThread().isInterrupted());
        });
        waiter.start();
        Thread.sleep(200);
        waiter.interrupt();
        waiter.join(10_000);

        assertThat(waiterFailure.get()).isNotNull();
        assertEquals(AuthenticationErrorCode.KEY_RING_UNAVAILABLE, waiterFailure.get().getCode());
        assertTrue(waiterInterrupted.get());

        releaseFetch.countDown();
        assertEquals(KEY_ID, owner.get(10, TimeUnit.SECONDS).getKeyID());
        assertEquals(1, fetches.get());
    }
}
