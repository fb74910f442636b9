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

import java.text.ParseException;
import java.util.List;
import java.util.Set;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An access token together with its validation state.
 *
 * <p>Tokens are request scoped and not thread-safe. A token is created either from a bearer
 * header with {@link #parse(String, OidcClient)}, in which case it starts out
 * {@link TokenState#UNVALIDATED}, or freshly minted with {@link #issueTrusted(OidcClient)}, in
 * which case it is {@link TokenState#PRE_TRUSTED}.</p>
 *
 * <p>Verified claims are only available once the token is {@link TokenState#VALIDATED} or
 * {@link TokenState#PRE_TRUSTED}.</p>
 */
public final class Token {

    private static final Logger logger = LoggerFactory.getLogger(Token.class);

    static final String CLAIM_AUTHORIZED_PARTY = "azp";

    private final String value;
    private final OidcClient client;
    private final JWTClaimsSet unverifiedClaims;

    private TokenState state;
    private JWTClaimsSet claims;
    private AuthenticationErrorCode rejectionReason;

    private Token(
            @NotNull String value,
            @NotNull OidcClient client,
            @NotNull JWTClaimsSet unverifiedClaims,
            @NotNull TokenState state) {
        this.value = value;
        this.client = client;
        this.unverifiedClaims = unverifiedClaims;
        this.state = state;
    }

    /**
     * Decodes a token presented by a caller. Nothing is verified yet.
     *
     * @param value the compact serialized token
     * @param client the client whose realm must have signed the token
     * @return an unvalidated token
     * @throws AuthenticationFailedException with {@link AuthenticationErrorCode#BAD_ACCESS_TOKEN} if the value
     *         is not a JWT
     */
    public static @NotNull Token parse(@NotNull String value, @NotNull OidcClient client)
            throws AuthenticationFailedException {
        return new Token(value, client, decode(value, AuthenticationErrorCode.BAD_ACCESS_TOKEN), TokenState.UNVALIDATED);
    }

    /**
     * Mints a token for {@code client} through the client credentials grant and trusts it
     * without verifying its signature.
     *
     * <p>This is the only way to obtain a {@link TokenState#PRE_TRUSTED} token. The token was
     * just handed to this process by the identity provider over an authenticated channel in
     * exchange for the client's own secret, so its claims are taken as issued. Note that this
     * means self-issued tokens never exercise the verification path.</p>
     *
     * @param client the client to mint a token for
     * @return a pre-trusted token whose claims are the minted token's payload
     * @throws AuthenticationFailedException with {@link AuthenticationErrorCode#TOKEN_ISSUANCE_FAILED}
     */
    public static @NotNull Token issueTrusted(@NotNull OidcClient client) throws AuthenticationFailedException {
        String value = client.issueToken();
        JWTClaimsSet issued = decode(value, AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED);
        Token token = new Token(value, client, issued, TokenState.PRE_TRUSTED);
        token.claims = issued;
        logger.debug("Trusting token issued to client {} for subject {}", client.clientId(), issued.getSubject());
        return token;
    }

    private static @NotNull JWTClaimsSet decode(@NotNull String value, @NotNull AuthenticationErrorCode failure)
            throws AuthenticationFailedException {
        try {
            JWTClaimsSet claimsSet = JWTParser.parse(value).getJWTClaimsSet();
            if (claimsSet == null) {
                // encrypted tokens carry no readable payload
                throw new AuthenticationFailedException(failure);
            }
            return claimsSet;
        } catch (ParseException e) {
            throw new AuthenticationFailedException(failure, failure.defaultDetail(), e);
        }
    }

    /**
     * Validates the token against the owning client and the route's expectations.
     *
     * <p>The token's {@code aud} claim must contain at least one of {@code expectedAudiences} and
     * its {@code azp} claim must be one of {@code expectedAuthorizedParties}. On success the
     * token becomes {@link TokenState#VALIDATED}; on failure it becomes
     * {@link TokenState#REJECTED} and the failure is rethrown.</p>
     *
     * @param expectedAudiences accepted audiences
     * @param expectedAuthorizedParties accepted authorized parties
     * @throws AuthenticationFailedException if the token is rejected
     * @throws IllegalStateException if the token is not {@link TokenState#UNVALIDATED}
     */
    public void validate(@NotNull Set<String> expectedAudiences, @NotNull Set<String> expectedAuthorizedParties)
            throws AuthenticationFailedException {
        if (state != TokenState.UNVALIDATED) {
            throw new IllegalStateException("A token can only be validated once, current state is " + state);
        }
        try {
            JWTClaimsSet verified = client.verify(value);
            checkAudience(verified, expectedAudiences);
            checkAuthorizedParty(verified, expectedAuthorizedParties);
            claims = verified;
            state = TokenState.VALIDATED;
            logger.debug("Token validated for subject {}", verified.getSubject());
        } catch (AuthenticationFailedException e) {
            state = TokenState.REJECTED;
            rejectionReason = e.getCode();
            logger.debug("Token rejected: {} ({})", e.getCode().code(), e.getDetail());
            throw e;
        } catch (RuntimeException e) {
            state = TokenState.REJECTED;
            rejectionReason = AuthenticationErrorCode.BAD_ACCESS_TOKEN;
            logger.debug("Token rejected after an unexpected verification error: {}", e.toString());
            throw e;
        }
    }

    private static void checkAudience(@NotNull JWTClaimsSet claimsSet, @NotNull Set<String> expectedAudiences)
            throws AuthenticationFailedException {
        List<String> audiences = claimsSet.getAudience();
        for (String audience : audiences) {
            if (expectedAudiences.contains(audience)) {
                return;
            }
        }
        logger.debug("Token audience {} does not match any of {}", audiences, expectedAudiences);
        throw new AuthenticationFailedException(AuthenticationErrorCode.INVALID_AUDIENCE);
    }

    private static void checkAuthorizedParty(
            @NotNull JWTClaimsSet claimsSet, @NotNull Set<String> expectedAuthorizedParties)
            throws AuthenticationFailedException {
        String authorizedParty;
        try {
            authorizedParty = claimsSet.getStringClaim(CLAIM_AUTHORIZED_PARTY);
        } catch (ParseException e) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.INVALID_AZP, AuthenticationErrorCode.INVALID_AZP.defaultDetail(), e);
        }
        if (authorizedParty == null || !expectedAuthorizedParties.contains(authorizedParty)) {
            logger.debug("Token authorized party '{}' is not one of {}", authorizedParty, expectedAuthorizedParties);
            throw new AuthenticationFailedException(AuthenticationErrorCode.INVALID_AZP);
        }
    }

    public @NotNull String getValue() {
        return value;
    }

    public @NotNull OidcClient getClient() {
        return client;
    }

    public @NotNull TokenState getState() {
        return state;
    }

    /**
     * @return whether the claims of this token may be relied upon
     */
    public boolean isTrusted() {
        return state == TokenState.VALIDATED || state == TokenState.PRE_TRUSTED;
    }

    /**
     * @return the reason of the rejection, in case the token is {@link TokenState#REJECTED}
     */
    public @Nullable AuthenticationErrorCode getRejectionReason() {
        return rejectionReason;
    }

    /**
     * Returns the decoded payload without any guarantee about its authenticity.
     *
     * @return the unverified claims
     */
    public @NotNull JWTClaimsSet getUnverifiedClaims() {
        return unverifiedClaims;
    }

    /**
     * Returns the trusted claims of this token.
     *
     * @return the claims
     * @throws IllegalStateException in case the token is neither {@link TokenState#VALIDATED} nor
     *         {@link TokenState#PRE_TRUSTED}
     */
    public @NotNull JWTClaimsSet getClaims() {
        if (!isTrusted()) {
            throw new IllegalStateException("Can't retrieve claims when the token state is " + state);
        }
        return claims;
    }
}
