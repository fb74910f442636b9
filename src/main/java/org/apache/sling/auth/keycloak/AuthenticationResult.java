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
package org.apache.sling.auth.keycloak;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of running the authenticator chain for one request.
 *
 * <p>Distinguishes "nobody had an opinion" ({@link Status#ABSTAINED}) from "credentials were
 * present and refused" ({@link Status#REJECTED}); only the latter must be answered with
 * {@code 401}.</p>
 */
public final class AuthenticationResult {

    public enum Status {
        ABSTAINED,
        AUTHENTICATED,
        REJECTED
    }

    private static final AuthenticationResult ABSTAINED = new AuthenticationResult(Status.ABSTAINED, null, null);

    private final Status status;
    private final KeycloakPrincipal principal;
    private final AuthenticationFailedException failure;

    private AuthenticationResult(Status status, KeycloakPrincipal principal, AuthenticationFailedException failure) {
        this.status = status;
        this.principal = principal;
        this.failure = failure;
    }

    public static @NotNull AuthenticationResult abstained() {
        return ABSTAINED;
    }

    public static @NotNull AuthenticationResult authenticated(@NotNull KeycloakPrincipal principal) {
        return new AuthenticationResult(Status.AUTHENTICATED, principal, null);
    }

    public static @NotNull AuthenticationResult rejected(@NotNull AuthenticationFailedException failure) {
        return new AuthenticationResult(Status.REJECTED, null, failure);
    }

    public @NotNull Status getStatus() {
        return status;
    }

    /**
     * @return the principal
     * @throws IllegalStateException if the status is not {@link Status#AUTHENTICATED}
     */
    public @NotNull KeycloakPrincipal getPrincipal() {
        if (status != Status.AUTHENTICATED) {
            throw new IllegalStateException("No principal available for status " + status);
        }
        return principal;
    }

    /**
     * @return the failure
     * @throws IllegalStateException if the status is not {@link Status#REJECTED}
     */
    public @NotNull AuthenticationFailedException getFailure() {
        if (status != Status.REJECTED) {
            throw new IllegalStateException("No failure available for status " + status);
        }
        return failure;
    }

    @Override
    public String toString() {
        switch (status) {
            case AUTHENTICATED:
                return "AUTHENTICATED[" + principal.getName() + "]";
            case REJECTED:
                return "REJECTED[" + failure.getCode().code() + "]";
            default:
                return "ABSTAINED";
        }
    }
}
