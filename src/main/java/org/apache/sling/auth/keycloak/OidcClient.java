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
package org.apache.sling.auth.keycloak;

import com.nimbusds.jwt.JWTClaimsSet;
import org.jetbrains.annotations.NotNull;

/**
 * A client registration at the identity provider.
 *
 * <p>Instances are created once when the realm configuration is activated and are shared,
 * read-only, by all request threads.</p>
 *
 * @see Token
 */
public interface OidcClient {

    /**
     * @return the client identifier registered at the identity provider
     */
    @NotNull String clientId();

    /**
     * @return the issuer identifier of the realm this client belongs to
     */
    @NotNull String issuer();

    /**
     * Obtains an access token for this client using the client credentials grant.
     *
     * @return the raw compact access token
     * @throws AuthenticationFailedException with {@link AuthenticationErrorCode#TOKEN_ISSUANCE_FAILED} if the
     *         provider could not be reached or refused the request
     */
    @NotNull String issueToken() throws AuthenticationFailedException;

    /**
     * Verifies the signature and the time window of a bearer token and returns its claims.
     *
     * <p>Audience and authorized party are not checked here; they depend on the route and are
     * enforced by {@link Token#validate(java.util.Set, java.util.Set)}.</p>
     *
     * @param rawToken the compact serialized token
     * @return the verified claims
     * @throws AuthenticationFailedException if the token is malformed, badly signed, outside its
     *         validity window, or its signing key cannot be resolved
     */
    @NotNull JWTClaimsSet verify(@NotNull String rawToken) throws AuthenticationFailedException;
}
