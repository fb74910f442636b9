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

import java.util.List;
import java.util.Set;

import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.apache.sling.auth.keycloak.OidcClient;
import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts tokens addressed to the confidential client.
 *
 * <p>Besides tokens the confidential client requested itself, this accepts tokens the public
 * client obtained and exchanged for the confidential audience; those keep the public client as
 * their authorized party.</p>
 */
class ConfidentialBearerAuthenticator implements Authenticator {

    static final String NAME = "confidential-bearer";

    private static final Logger logger = LoggerFactory.getLogger(ConfidentialBearerAuthenticator.class);

    private final OidcClient confidentialClient;
    private final Set<String> expectedAudiences;
    private final Set<String> expectedAuthorizedParties;

    ConfidentialBearerAuthenticator(@NotNull OidcClient confidentialClient, @NotNull OidcClient publicClient) {
        this.confidentialClient = confidentialClient;
        this.expectedAudiences = Set.of(confidentialClient.clientId());
        this.expectedAuthorizedParties =
                Set.copyOf(List.of(confidentialClient.clientId(), publicClient.clientId()));
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @Nullable KeycloakPrincipal authenticate(@NotNull HttpServletRequest request)
            throws AuthenticationFailedException {
        KeycloakPrincipal principal = BearerTokens.authenticate(
                request, confidentialClient, expectedAudiences, expectedAuthorizedParties);
        if (principal != null) {
            logger.debug(
                    "Confidential bearer token accepted for {} (authorized party {})",
                    principal.getName(),
                    principal.getAuthorizedParty());
        }
        return principal;
    }
}
