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
import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts tokens the public client obtained for itself, as presented by browser and
 * command line front ends.
 */
class PublicBearerAuthenticator implements Authenticator {

    static final String NAME = "public-bearer";

    private static final Logger logger = LoggerFactory.getLogger(PublicBearerAuthenticator.class);

    private final OidcClient publicClient;
    private final Set<String> expectedAudiences;

    PublicBearerAuthenticator(@NotNull OidcClient publicClient) {
        this.publicClient = publicClient;
        this.expectedAudiences = Set.of(publicClient.clientId());
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @Nullable KeycloakPrincipal authenticate(@NotNull HttpServletRequest request)
            throws AuthenticationFailedException {
        // the public client is both the audience and the requesting party
        KeycloakPrincipal principal =
                BearerTokens.authenticate(request, publicClient, expectedAudiences, expectedAudiences);
        if (principal != null) {
            logger.debug("Public bearer token accepted for {}", principal.getName());
        }
        return principal;
    }
}
