/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sling.auth.keycloak.impl;

import java.io.IOException;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff for calls to the identity provider.
 *
 * <p>Only {@link IOException}s are retried. Anything else, in particular a well-formed refusal by
 * the provider, is surfaced immediately.</p>
 */
class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    interface ProviderCall<T> {
        T call() throws IOException;
    }

    private final int maxAttempts;
    private final long backoffMillis;

    RetryPolicy(int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must not be negative, was " + backoffMillis);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code call}, retrying on {@link IOException}.
     *
     * @param operation description used in log messages
     * @param call the call to make
     * @return the result of the first successful attempt
     * @throws IOException the failure of the last attempt
     * @throws InterruptedException if the thread is interrupted while backing off
     */
    <T> T execute(@NotNull String operation, @NotNull ProviderCall<T> call) throws IOException, InterruptedException {
        long delay = backoffMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                logger.warn(
                        "{} failed (attempt {} of {}): {}. Retrying in {} ms",
                        operation,
                        attempt,
                        maxAttempts,
                        e.getMessage(),
                        delay);
                if (delay > 0) {
                    Thread.sleep(delay);
                }
                delay *= 2;
            }
        }
    }
}
