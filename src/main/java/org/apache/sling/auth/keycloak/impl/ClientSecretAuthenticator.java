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

import org.apache.sling.auth.keycloak.AuthenticationErrorCode;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.apache.sling.auth.keycloak.OidcClient;
import org.apache.sling.auth.keycloak.Token;
import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates machine clients presenting a pre-shared secret in the {@code X-CLIENT-SECRET}
 * header.
 *
 * <p>The secret selects a client from the {@link ClientRegistry}; a token is then minted for that
 * client and trusted as issued.</p>
 */
class ClientSecretAuthenticator implements Authenticator {

    static final String NAME = "client-secret";

    private static final Logger logger = LoggerFactory.getLogger(ClientSecretAuthenticator.class);

    private final ClientRegistry registry;

    ClientSecretAuthenticator(@NotNull ClientRegistry registry) {
        this.registry = registry;
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @Nullable KeycloakPrincipal authenticate(@NotNull HttpServletRequest request)
            throws AuthenticationFailedException {
        String secret = AuthorizationHeaders.clientSecret(request);
        if (secret == null) {
            return null;
        }

        OidcClient client = registry.lookup(secret);
        if (client == null) {
            logger.debug("Client secret presented from {} is not registered", request.getRemoteAddr());
            throw new AuthenticationFailedException(AuthenticationErrorCode.APP_SECRET_NOT_AUTHORIZED);
        }

        Token token = Token.issueTrusted(client);
        KeycloakPrincipal principal = new KeycloakPrincipal(token);
        logger.debug("Authenticated client {} as {}", client.clientId(), principal.getName());
        return principal;
    }
}
