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
 * Classification of an authentication failure.
 *
 * <p>The {@link #code() code} is the stable identifier rendered to clients in the
 * {@code 401} response body; the default detail is used when the failing component
 * has nothing more specific to say.</p>
 */
public enum AuthenticationErrorCode {
    AUTHORIZATION_NOT_FOUND("authorization_not_found", "Authorization header not found."),
    BAD_ACCESS_TOKEN("bad_access_token", "Malformed access token."),
    APP_SECRET_NOT_AUTHORIZED("app_secret_not_authorized", "App secret is not authorized."),
    BAD_SIGNATURE("bad_signature", "Token signature is invalid."),
    TOKEN_EXPIRED("token_expired", "Token has expired."),
    TOKEN_NOT_YET_VALID("token_not_yet_valid", "Token is not yet valid."),
    INVALID_ISSUER("invalid_issuer", "Token was not issued by the expected realm."),
    INVALID_AUDIENCE("invalid_audience", "Token audience is not accepted."),
    INVALID_AZP("invalid_azp", "Token authorized party is not accepted."),
    KEY_NOT_FOUND("key_not_found", "Token signing key is unknown."),
    KEY_RING_UNAVAILABLE("key_ring_unavailable", "Identity provider keys are unavailable."),
    TOKEN_ISSUANCE_FAILED("token_issuance_failed", "Token could not be issued.");

    private final String code;
    private final String defaultDetail;

    AuthenticationErrorCode(@NotNull String code, @NotNull String defaultDetail) {
        this.code = code;
        this.defaultDetail = defaultDetail;
    }

    public @NotNull String code() {
        return code;
    }

    public @NotNull String defaultDetail() {
        return defaultDetail;
    }
}
