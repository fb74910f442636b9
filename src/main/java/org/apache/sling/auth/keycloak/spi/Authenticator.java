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
package org.apache.sling.auth.keycloak.spi;

import javax.servlet.http.HttpServletRequest;

import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.KeycloakPrincipal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One authentication scheme in an ordered chain.
 *
 * <p>Implementations first check for the header they are responsible for. If it is absent they
 * return {@code null} and the next authenticator is asked. If it is present but the credentials
 * cannot be accepted they throw, which ends the chain: a request carrying bad credentials for one
 * scheme must never fall through to a weaker scheme.</p>
 *
 * <p>Implementations are stateless and may be invoked concurrently.</p>
 */
public interface Authenticator {

    /**
     * Returns the name used to reference this authenticator from configuration.
     *
     * @return the authenticator name
     */
    @NotNull
    String name();

    /**
     * Authenticates the request.
     *
     * @param request the incoming request
     * @return the authenticated principal, or {@code null} if this authenticator does not apply to the request
     * @throws AuthenticationFailedException if the request carries credentials for this scheme which are rejected
     */
    @Nullable
    KeycloakPrincipal authenticate(@NotNull HttpServletRequest request) throws AuthenticationFailedException;
}
