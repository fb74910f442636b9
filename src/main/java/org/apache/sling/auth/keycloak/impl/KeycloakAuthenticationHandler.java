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
import javax.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.sling.auth.core.spi.AuthenticationHandler;
import org.apache.sling.auth.core.spi.AuthenticationInfo;
import org.apache.sling.auth.core.spi.DefaultAuthenticationFeedbackHandler;
import org.apache.sling.auth.keycloak.AuthenticationResult;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication handler that runs a configurable chain of Keycloak authenticators.
 *
 * <p>Several instances can be configured to apply different authenticators to different paths,
 * e.g. only {@code public-bearer} on a token exchange endpoint and {@code client-secret},
 * {@code confidential-bearer} everywhere else.</p>
 */
@Component(service = AuthenticationHandler.class, immediate = true)
@Designate(ocd = KeycloakAuthenticationHandler.Config.class, factory = true)
public class KeycloakAuthenticationHandler extends DefaultAuthenticationFeedbackHandler
        implements AuthenticationHandler {

    private static final Logger logger = LoggerFactory.getLogger(KeycloakAuthenticationHandler.class);

    public static final String AUTH_TYPE = "keycloak";

    /** Name of the request and authentication info attribute holding the {@link KeycloakPrincipal}. */
    public static final String ATTR_PRINCIPAL = KeycloakPrincipal.class.getName();

    /** Name of the authentication info attribute holding the raw access token. */
    public static final String ATTR_ACCESS_TOKEN = "keycloak.access_token";

    @ObjectClassDefinition(
            name = "Apache Sling Keycloak Authentication Handler",
            description = "Authenticates requests carrying a Keycloak bearer token or a registered client secret")
    @interface Config {
        @AttributeDefinition(
                name = "Path",
                description =
                        "Repository path for which this authentication handler should be used by Sling. If this is "
                                + "empty, the authentication handler will be disabled. By default this is set to \"/\".")
        String[] path() default {"/"};

        @AttributeDefinition(
                name = "Authenticators",
                description = "Authenticators to run, in order. One of client-secret, public-bearer, "
                        + "confidential-bearer.",
                cardinality = Integer.MAX_VALUE)
        String[] authenticators() default {ClientSecretAuthenticator.NAME, ConfidentialBearerAuthenticator.NAME};

        @AttributeDefinition(
                name = "Require Authentication",
                description = "Reject requests for which no authenticator found credentials, instead of "
                        + "letting them continue anonymously")
        boolean requireAuthentication() default false;

        @AttributeDefinition(name = "Service Ranking", description = "Service ranking for this authentication handler")
        int service_ranking() default 0;

        String webconsole_configurationFactory_nameHint() default "Path: {path}, authenticators: {authenticators}";
    }

    private final String realm;
    private final AuthenticatorChain chain;

    @Activate
    public KeycloakAuthenticationHandler(@Reference KeycloakRealm keycloakRealm, Config config) {
        String[] names = config.authenticators();
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("At least one authenticator must be configured");
        }
        List<Authenticator> authenticators = new ArrayList<>();
        for (String name : names) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException(
                        "Authenticators configuration contains empty or null values. All entries must be non-empty strings.");
            }
            authenticators.add(AuthenticatorType.forName(name).create(keycloakRealm));
        }
        this.realm = keycloakRealm.realm();
        this.chain = new AuthenticatorChain(authenticators, config.requireAuthentication());

        logger.info(
                "KeycloakAuthenticationHandler activated for paths {} with authenticators {}, authentication {}",
                String.join(", ", config.path()),
                chain.names(),
                config.requireAuthentication() ? "required" : "optional");
    }

    @Override
    public AuthenticationInfo extractCredentials(
            @NotNull HttpServletRequest request, @NotNull HttpServletResponse response) {
        AuthenticationResult result;
        try {
            result = chain.authenticate(request);
        } catch (RuntimeException e) {
            logger.error("Unexpected error while authenticating request to {}", request.getRequestURI(), e);
            response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            return AuthenticationInfo.FAIL_AUTH;
        }

        switch (result.getStatus()) {
            case AUTHENTICATED:
                return createAuthenticationInfo(request, result.getPrincipal());
            case REJECTED:
                try {
                    AuthenticationFailureResponse.write(response, realm, result.getFailure());
                } catch (IOException e) {
                    logger.error("Failed to send authentication failure response: {}", e.getMessage(), e);
                }
                return AuthenticationInfo.FAIL_AUTH;
            default:
                return null;
        }
    }

    private @NotNull AuthenticationInfo createAuthenticationInfo(
            @NotNull HttpServletRequest request, @NotNull KeycloakPrincipal principal) {
        AuthenticationInfo authInfo = new AuthenticationInfo(AUTH_TYPE, principal.getName());
        authInfo.put(ATTR_PRINCIPAL, principal);
        authInfo.put(ATTR_ACCESS_TOKEN, principal.getToken().getValue());
        request.setAttribute(ATTR_PRINCIPAL, principal);
        return authInfo;
    }

    @Override
    public boolean requestCredentials(@NotNull HttpServletRequest request, @NotNull HttpServletResponse response)
            throws IOException {
        // bearer clients obtain their tokens elsewhere
        logger.debug("requestCredentials: not supported for bearer authentication");
        return false;
    }

    @Override
    public void dropCredentials(HttpServletRequest request, HttpServletResponse response) {
        logger.debug("dropCredentials: nothing to drop for bearer authentication");
    }
}
