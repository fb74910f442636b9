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
import java.text.ParseException;
import java.time.Clock;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.util.Resource;
import com.nimbusds.jose.util.ResourceRetriever;
import org.apache.sling.auth.keycloak.AuthenticationErrorCode;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of the realm's signing keys, indexed by key id.
 *
 * <p>Reads go through a volatile snapshot and take no lock. A miss, an expired snapshot or an
 * unknown key id triggers a refresh of the whole key set; concurrent refreshes are coalesced so
 * that one fetch is in flight at any time and the other callers wait for its result.</p>
 *
 * <p>An unknown key id only forces a refetch when the snapshot is older than the minimum refresh
 * interval. When the provider is unreachable and a previous snapshot exists, that snapshot keeps
 * being served for another minimum refresh interval, during which unknown key ids fail without
 * contacting the provider.</p>
 */
class KeyRing {

    private static final Logger logger = LoggerFactory.getLogger(KeyRing.class);

    private final URL jwkSetUrl;
    private final ResourceRetriever retriever;
    private final RetryPolicy retryPolicy;
    private final long ttlMillis;
    private final long minRefreshIntervalMillis;
    private final Clock clock;

    private final AtomicReference<CompletableFuture<CachedKeys>> inFlight = new AtomicReference<>();
    private volatile CachedKeys cached;

    KeyRing(
            @NotNull URL jwkSetUrl,
            @NotNull ResourceRetriever retriever,
            @NotNull RetryPolicy retryPolicy,
            long ttlMillis,
            long minRefreshIntervalMillis,
            @NotNull Clock clock) {
        this.jwkSetUrl = jwkSetUrl;
        this.retriever = retriever;
        this.retryPolicy = retryPolicy;
        this.ttlMillis = ttlMillis;
        this.minRefreshIntervalMillis = minRefreshIntervalMillis;
        this.clock = clock;
    }

    @NotNull
    URL jwkSetUrl() {
        return jwkSetUrl;
    }

    /**
     * Returns the key with the given id, fetching the key set if needed.
     *
     * @param keyId the {@code kid} of the key
     * @return the key
     * @throws AuthenticationFailedException {@link AuthenticationErrorCode#KEY_NOT_FOUND} if the key set does
     *         not contain the key, {@link AuthenticationErrorCode#KEY_RING_UNAVAILABLE} if no key set could be
     *         obtained
     */
    @NotNull
    JWK getKey(@NotNull String keyId) throws AuthenticationFailedException {
        CachedKeys current = cached;
        long now = clock.millis();
        if (current != null && !current.isExpired(now)) {
            JWK key = current.keys.getKeyByKeyId(keyId);
            if (key != null) {
                return key;
            }
            if (now - current.checkedAt < minRefreshIntervalMillis) {
                logger.debug("Key {} is unknown and the key set was checked {} ms ago", keyId, now - current.checkedAt);
                throw keyNotFound(keyId);
            }
        }

        CachedKeys refreshed = refresh(current);
        JWK key = refreshed.keys.getKeyByKeyId(keyId);
        if (key == null) {
            logger.debug("Key {} is not part of the key set published at {}", keyId, jwkSetUrl);
            throw keyNotFound(keyId);
        }
        return key;
    }

    /**
     * Drops the cached key set. The next lookup fetches it again.
     */
    void invalidate() {
        cached = null;
        logger.info("Key set cache for {} cleared", jwkSetUrl);
    }

    @NotNull
    private CachedKeys refresh(@Nullable CachedKeys observed) throws AuthenticationFailedException {
        while (true) {
            CompletableFuture<CachedKeys> running = inFlight.get();
            if (running == null) {
                CompletableFuture<CachedKeys> mine = new CompletableFuture<>();
                if (inFlight.compareAndSet(null, mine)) {
                    return fetchAsOwner(observed, mine);
                }
                continue;
            }
            try {
                return await(running);
            } catch (CancellationException e) {
                // the fetching request went away; the next iteration starts a new fetch
                logger.debug("Key set fetch was abandoned, retrying");
            }
        }
    }

    @NotNull
    private CachedKeys fetchAsOwner(@Nullable CachedKeys observed, @NotNull CompletableFuture<CachedKeys> mine)
            throws AuthenticationFailedException {
        CachedKeys result;
        try {
            CachedKeys latest = cached;
            if (latest != null && latest != observed && !latest.isExpired(clock.millis())) {
                // refreshed by another thread after the caller took its snapshot
                result = latest;
            } else {
                result = load(latest);
                cached = result;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            inFlight.compareAndSet(mine, null);
            mine.cancel(false);
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_RING_UNAVAILABLE, "Interrupted while fetching the key set", e);
        } catch (AuthenticationFailedException | RuntimeException e) {
            inFlight.compareAndSet(mine, null);
            mine.completeExceptionally(e);
            throw e;
        }
        inFlight.compareAndSet(mine, null);
        mine.complete(result);
        return result;
    }

    @NotNull
    private CachedKeys await(@NotNull CompletableFuture<CachedKeys> running) throws AuthenticationFailedException {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_RING_UNAVAILABLE, "Interrupted while waiting for the key set", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthenticationFailedException) {
                AuthenticationFailedException failure = (AuthenticationFailedException) cause;
                throw new AuthenticationFailedException(failure.getCode(), failure.getDetail(), failure);
            }
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_RING_UNAVAILABLE, "Key set could not be retrieved", cause);
        }
    }

    @NotNull
    private CachedKeys load(@Nullable CachedKeys previous) throws AuthenticationFailedException, InterruptedException {
        try {
            JWKSet keys = retryPolicy.execute("Fetching key set from " + jwkSetUrl, this::fetch);
            long now = clock.millis();
            logger.debug("Fetched {} keys from {}", keys.getKeys().size(), jwkSetUrl);
            return new CachedKeys(keys, now, now, now + ttlMillis);
        } catch (IOException e) {
            if (previous != null) {
                long now = clock.millis();
                logger.warn(
                        "Key set at {} is unavailable ({}), serving the keys fetched {} ms ago",
                        jwkSetUrl,
                        e.getMessage(),
                        now - previous.fetchedAt);
                return new CachedKeys(previous.keys, previous.fetchedAt, now, now + minRefreshIntervalMillis);
            }
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_RING_UNAVAILABLE, "Key set could not be retrieved", e);
        }
    }

    @NotNull
    private JWKSet fetch() throws IOException {
        Resource resource = retriever.retrieveResource(jwkSetUrl);
        try {
            return JWKSet.parse(resource.getContent());
        } catch (ParseException e) {
            throw new IOException("Invalid key set document: " + e.getMessage(), e);
        }
    }

    @NotNull
    private static AuthenticationFailedException keyNotFound(@NotNull String keyId) {
        return new AuthenticationFailedException(
                AuthenticationErrorCode.KEY_NOT_FOUND, "Token signing key " + keyId + " is unknown.");
    }

    /**
     * Immutable snapshot of the key set. {@code checkedAt} is the last fetch attempt, which is later
     * than {@code fetchedAt} when a stale key set is being served.
     */
    private static class CachedKeys {
        final JWKSet keys;
        final long fetchedAt;
        final long checkedAt;
        final long expiresAt;

        CachedKeys(JWKSet keys, long fetchedAt, long checkedAt, long expiresAt) {
            this.keys = keys;
            this.fetchedAt = fetchedAt;
            this.checkedAt = checkedAt;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
