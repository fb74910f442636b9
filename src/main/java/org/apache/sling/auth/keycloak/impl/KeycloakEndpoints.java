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

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

import org.jetbrains.annotations.NotNull;

/**
 * The well-known locations of a Keycloak realm, derived from the server URL and the realm name.
 */
class KeycloakEndpoints {

    private static final String OPENID_CONNECT_PATH = "/protocol/openid-connect";

    private final String issuer;
    private final URI tokenEndpoint;
    private final URL jwkSetUrl;

    KeycloakEndpoints(@NotNull String serverUrl, @NotNull String realm) {
        String base = serverUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.issuer = base + "/realms/" + realm;
        try {
            this.tokenEndpoint = new URI(issuer + OPENID_CONNECT_PATH + "/token");
            this.jwkSetUrl = new URI(issuer + OPENID_CONNECT_PATH + "/certs").toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Keycloak server URL '" + serverUrl + "' or realm '" + realm + "'", e);
        }
    }

    /**
     * @return the value Keycloak puts into the {@code iss} claim of tokens of this realm
     */
    @NotNull
    String issuer() {
        return issuer;
    }

    @NotNull
    URI tokenEndpoint() {
        return tokenEndpoint;
    }

    @NotNull
    URL jwkSetUrl() {
        return jwkSetUrl;
    }
}
