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
import java.util.stream.Collectors;

import org.apache.sling.auth.keycloak.AuthenticationErrorCode;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.AuthenticationResult;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs authenticators in order until one of them accepts or rejects the request.
 *
 * <p>An authenticator returning {@code null} passes the request on to the next one. The first
 * failure ends the chain. If every authenticator abstains the request is either left
 * unauthenticated or, when authentication is required, rejected with
 * {@link AuthenticationErrorCode#AUTHORIZATION_NOT_FOUND}.</p>
 */
class AuthenticatorChain {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticatorChain.class);

    private final List<Authenticator> authenticators;
    private final boolean requireAuthentication;

    AuthenticatorChain(@NotNull List<Authenticator> authenticators, boolean requireAuthentication) {
        this.authenticators = List.copyOf(authenticators);
        this.requireAuthentication = requireAuthentication;
    }

    @NotNull
    AuthenticationResult authenticate(@NotNull HttpServletRequest request) {
        for (Authenticator authenticator : authenticators) {
            KeycloakPrincipal principal;
            try {
                principal = authenticator.authenticate(request);
            } catch (AuthenticationFailedException e) {
                logger.debug(
                        "{} rejected request to {}: {} ({})",
                        authenticator.name(),
                        request.getRequestURI(),
                        e.getCode().code(),
                        e.getDetail());
                return AuthenticationResult.rejected(e);
            }
            if (principal != null) {
                logger.debug("{} authenticated {}", authenticator.name(), principal.getName());
                return AuthenticationResult.authenticated(principal);
            }
            logger.debug("{} abstained", authenticator.name());
        }

        if (requireAuthentication) {
            logger.debug("No credentials found on request to {}", request.getRequestURI());
            return AuthenticationResult.rejected(
                    new AuthenticationFailedException(AuthenticationErrorCode.AUTHORIZATION_NOT_FOUND));
        }
        return AuthenticationResult.abstained();
    }

    @NotNull
    List<String> names() {
        return authenticators.stream().map(Authenticator::name).collect(Collectors.toList());
    }
}
