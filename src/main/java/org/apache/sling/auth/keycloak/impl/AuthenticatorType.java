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

import org.apache.sling.auth.keycloak.spi.Authenticator;
import org.jetbrains.annotations.NotNull;

/**
 * The authenticators that can be named in a handler configuration.
 */
enum AuthenticatorType {
    CLIENT_SECRET(ClientSecretAuthenticator.NAME) {
        @Override
        @NotNull
        Authenticator create(@NotNull KeycloakRealm realm) {
            return new ClientSecretAuthenticator(realm.clientRegistry());
        }
    },
    PUBLIC_BEARER(PublicBearerAuthenticator.NAME) {
        @Override
        @NotNull
        Authenticator create(@NotNull KeycloakRealm realm) {
            return new PublicBearerAuthenticator(realm.publicClient());
        }
    },
    CONFIDENTIAL_BEARER(ConfidentialBearerAuthenticator.NAME) {
        @Override
        @NotNull
        Authenticator create(@NotNull KeycloakRealm realm) {
            return new ConfidentialBearerAuthenticator(realm.confidentialClient(), realm.publicClient());
        }
    };

    private final String configName;

    AuthenticatorType(String configName) {
        this.configName = configName;
    }

    @NotNull
    String configName() {
        return configName;
    }

    @NotNull
    abstract Authenticator create(@NotNull KeycloakRealm realm);

    /**
     * @param name the configured name, e.g. {@code confidential-bearer}
     * @return the matching type
     * @throws IllegalArgumentException if no authenticator has that name
     */
    @NotNull
    static AuthenticatorType forName(@NotNull String name) {
        for (AuthenticatorType type : values()) {
            if (type.configName.equals(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown authenticator '" + name + "'");
    }
}
