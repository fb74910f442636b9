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

import javax.servlet.http.HttpServletRequest;

import java.util.Set;

import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.apache.sling.auth.keycloak.OidcClient;
import org.apache.sling.auth.keycloak.Token;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Validation of the bearer token carried by a request.
 */
final class BearerTokens {

    private BearerTokens() {}

    /**
     * Validates the request's bearer token with {@code client}.
     *
     * @param request the request
     * @param client the client verifying the token
     * @param expectedAudiences accepted {@code aud} values
     * @param expectedAuthorizedParties accepted {@code azp} values
     * @return the principal of the validated token, or {@code null} if the request has no {@code Authorization}
     *         header
     * @throws AuthenticationFailedException if the header is malformed or the token is rejected
     */
    @Nullable
    static KeycloakPrincipal authenticate(
            @NotNull HttpServletRequest request,
            @NotNull OidcClient client,
            @NotNull Set<String> expectedAudiences,
            @NotNull Set<String> expectedAuthorizedParties)
            throws AuthenticationFailedException {
        String rawToken = AuthorizationHeaders.bearerToken(request);
        if (rawToken == null) {
            return null;
        }
        Token token = Token.parse(rawToken, client);
        token.validate(expectedAudiences, expectedAuthorizedParties);
        return new KeycloakPrincipal(token);
    }
}
