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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Extraction of credentials from request headers.
 */
final class AuthorizationHeaders {

    static final String HEADER_AUTHORIZATION = "Authorization";
    static final String HEADER_CLIENT_SECRET = "X-CLIENT-SECRET";
    static final String BEARER_PREFIX = "Bearer ";

    private AuthorizationHeaders() {}

    /**
     * Returns the token of an {@code Authorization: Bearer <token>} header.
     *
     * @param request the request
     * @return the token, or {@code null} if the request has no {@code Authorization} header
     * @throws AuthenticationFailedException {@link AuthenticationErrorCode#AUTHORIZATION_NOT_FOUND} if the
     *         header is blank, {@link AuthenticationErrorCode#BAD_ACCESS_TOKEN} if it does not hold exactly one
     *         bearer token
     */
    @Nullable
    static String bearerToken(@NotNull HttpServletRequest request) throws AuthenticationFailedException {
        String header = request.getHeader(HEADER_AUTHORIZATION);
        if (header == null) {
            return null;
        }
        String value = header.trim();
        if (value.isEmpty()) {
            throw new AuthenticationFailedException(AuthenticationErrorCode.AUTHORIZATION_NOT_FOUND);
        }
        // the scheme name is case-insensitive (RFC 7235)
        if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_ACCESS_TOKEN, "Authorization header is not a bearer token.");
        }
        String token = value.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty() || containsWhitespace(token)) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_ACCESS_TOKEN, "Authorization header is not a bearer token.");
        }
        return token;
    }

    /**
     * @param request the request
     * @return the client secret header value, or {@code null} if the header is absent
     */
    @Nullable
    static String clientSecret(@NotNull HttpServletRequest request) {
        return request.getHeader(HEADER_CLIENT_SECRET);
    }

    private static boolean containsWhitespace(@NotNull String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
