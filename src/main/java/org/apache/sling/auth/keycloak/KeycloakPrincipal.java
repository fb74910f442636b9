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

import java.security.Principal;
import java.text.ParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nimbusds.jwt.JWTClaimsSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The identity established by a trusted {@link Token}.
 *
 * <p>This is a read-only view over the token's claims. Realm roles are read from
 * {@code realm_access.roles}, client roles from {@code resource_access.<client>.roles} and
 * groups from {@code groups}.</p>
 */
public final class KeycloakPrincipal implements Principal {

    private static final Logger logger = LoggerFactory.getLogger(KeycloakPrincipal.class);

    private final Token token;
    private final String subject;
    private final String username;
    private final String authorizedParty;
    private final String email;
    private final Set<String> realmRoles;
    private final Map<String, Set<String>> clientRoles;
    private final Set<String> groups;

    /**
     * @param token a {@link TokenState#VALIDATED validated} or {@link TokenState#PRE_TRUSTED pre-trusted} token
     * @throws IllegalArgumentException if the token is not trusted
     */
    public KeycloakPrincipal(@NotNull Token token) {
        if (!token.isTrusted()) {
            throw new IllegalArgumentException("No principal can be derived from a token in state " + token.getState());
        }
        this.token = token;
        JWTClaimsSet claims = token.getClaims();
        this.subject = claims.getSubject();
        this.authorizedParty = stringClaim(claims, Token.CLAIM_AUTHORIZED_PARTY);
        this.email = stringClaim(claims, "email");
        this.username = firstNonNull(
                stringClaim(claims, "preferred_username"),
                subject,
                authorizedParty,
                token.getClient().clientId());
        this.realmRoles = rolesOf(objectClaim(claims, "realm_access"));
        this.clientRoles = clientRolesOf(objectClaim(claims, "resource_access"));
        this.groups = stringSetClaim(claims, "groups");
    }

    /**
     * @return the {@code preferred_username}, falling back to the subject or the authorized party
     */
    @Override
    public @NotNull String getName() {
        return username;
    }

    public @Nullable String getSubject() {
        return subject;
    }

    /**
     * @return the client the token was originally requested by
     */
    public @Nullable String getAuthorizedParty() {
        return authorizedParty;
    }

    public @Nullable String getEmail() {
        return email;
    }

    public @NotNull Set<String> getRealmRoles() {
        return realmRoles;
    }

    public @NotNull Set<String> getClientRoles(@NotNull String clientId) {
        return clientRoles.getOrDefault(clientId, Collections.emptySet());
    }

    public @NotNull Set<String> getGroups() {
        return groups;
    }

    public boolean hasRealmRole(@NotNull String role) {
        return realmRoles.contains(role);
    }

    public @NotNull Token getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "KeycloakPrincipal[" + username + "]";
    }

    private static String firstNonNull(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Token carries no usable identity");
    }

    private static @Nullable String stringClaim(@NotNull JWTClaimsSet claims, @NotNull String name) {
        try {
            return claims.getStringClaim(name);
        } catch (ParseException e) {
            logger.debug("Ignoring malformed claim {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static @Nullable Map<String, Object> objectClaim(@NotNull JWTClaimsSet claims, @NotNull String name) {
        try {
            return claims.getJSONObjectClaim(name);
        } catch (ParseException e) {
            logger.debug("Ignoring malformed claim {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static @NotNull Set<String> stringSetClaim(@NotNull JWTClaimsSet claims, @NotNull String name) {
        try {
            List<String> values = claims.getStringListClaim(name);
            return values == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
        } catch (ParseException e) {
            logger.debug("Ignoring malformed claim {}: {}", name, e.getMessage());
            return Collections.emptySet();
        }
    }

    private static @NotNull Set<String> rolesOf(@Nullable Map<?, ?> access) {
        if (access == null || !(access.get("roles") instanceof Collection)) {
            return Collections.emptySet();
        }
        Set<String> roles = new LinkedHashSet<>();
        for (Object role : (Collection<?>) access.get("roles")) {
            if (role instanceof String) {
                roles.add((String) role);
            }
        }
        return Collections.unmodifiableSet(roles);
    }

    private static @NotNull Map<String, Set<String>> clientRolesOf(@Nullable Map<String, Object> resourceAccess) {
        if (resourceAccess == null) {
            return Collections.emptyMap();
        }
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : resourceAccess.entrySet()) {
            if (entry.getValue() instanceof Map) {
                result.put(entry.getKey(), rolesOf((Map<?, ?>) entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
