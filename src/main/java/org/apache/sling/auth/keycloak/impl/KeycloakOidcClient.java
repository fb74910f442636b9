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

import java.io.IOException;
import java.security.Key;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.Set;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.oauth2.sdk.ClientCredentialsGrant;
import com.nimbusds.oauth2.sdk.ErrorObject;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.TokenResponse;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import org.apache.sling.auth.keycloak.AuthenticationErrorCode;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.apache.sling.auth.keycloak.OidcClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OidcClient} backed by a Keycloak realm.
 *
 * <p>Tokens are minted with the client credentials grant, authenticating with HTTP Basic.
 * Bearer tokens are verified offline against the realm's published keys, which are shared by all
 * clients of the realm through a single {@link KeyRing}.</p>
 */
class KeycloakOidcClient implements OidcClient {

    private static final Logger logger = LoggerFactory.getLogger(KeycloakOidcClient.class);
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final KeycloakEndpoints endpoints;
    private final String clientId;
    private final String clientSecret;
    private final KeyRing keyRing;
    private final RetryPolicy retryPolicy;
    private final Set<JWSAlgorithm> allowedAlgorithms;
    private final long clockSkewMillis;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    KeycloakOidcClient(
            @NotNull KeycloakEndpoints endpoints,
            @NotNull String clientId,
            @Nullable String clientSecret,
            @NotNull KeyRing keyRing,
            @NotNull RetryPolicy retryPolicy,
            @NotNull Set<JWSAlgorithm> allowedAlgorithms,
            long clockSkewMillis,
            int connectTimeoutMillis,
            int readTimeoutMillis,
            @NotNull Clock clock) {
        this.endpoints = endpoints;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.keyRing = keyRing;
        this.retryPolicy = retryPolicy;
        this.allowedAlgorithms = Set.copyOf(allowedAlgorithms);
        this.clockSkewMillis = clockSkewMillis;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
        this.clock = clock;
    }

    @Override
    public @NotNull String clientId() {
        return clientId;
    }

    @Override
    public @NotNull String issuer() {
        return endpoints.issuer();
    }

    @Override
    public @NotNull String issueToken() throws AuthenticationFailedException {
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED,
                    "Client " + clientId + " has no secret and cannot request tokens.");
        }

        TokenRequest tokenRequest = new TokenRequest(
                endpoints.tokenEndpoint(),
                new ClientSecretBasic(new ClientID(clientId), new Secret(clientSecret)),
                new ClientCredentialsGrant(),
                null);

        HTTPResponse httpResponse;
        try {
            httpResponse = retryPolicy.execute("Token request for client " + clientId, () -> {
                HTTPRequest httpRequest = tokenRequest.toHTTPRequest();
                httpRequest.setConnectTimeout(connectTimeoutMillis);
                httpRequest.setReadTimeout(readTimeoutMillis);
                httpRequest.setAccept(CONTENT_TYPE_JSON);
                HTTPResponse response = httpRequest.send();
                if (response.getStatusCode() >= 500) {
                    throw new IOException("Token endpoint answered with status " + response.getStatusCode());
                }
                return response;
            });
        } catch (IOException e) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, "Token endpoint is unavailable.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, "Interrupted while requesting a token.", e);
        }

        TokenResponse tokenResponse;
        try {
            tokenResponse = TokenResponse.parse(httpResponse);
        } catch (com.nimbusds.oauth2.sdk.ParseException e) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, "Token endpoint sent an invalid response.", e);
        }

        if (!tokenResponse.indicatesSuccess()) {
            ErrorObject error = tokenResponse.toErrorResponse().getErrorObject();
            logger.warn(
                    "Token request for client {} refused: {} {} ({})",
                    clientId,
                    error.getHTTPStatusCode(),
                    error.getCode(),
                    error.getDescription());
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, "Token request refused by the identity provider.");
        }

        logger.debug("Token issued for client {}", clientId);
        return tokenResponse.toSuccessResponse().getTokens().getAccessToken().getValue();
    }

    @Override
    public @NotNull JWTClaimsSet verify(@NotNull String rawToken) throws AuthenticationFailedException {
        SignedJWT signedJWT = parseSigned(rawToken);
        JWSHeader header = signedJWT.getHeader();

        if (!allowedAlgorithms.contains(header.getAlgorithm())) {
            logger.debug("Token algorithm {} is not one of {}", header.getAlgorithm(), allowedAlgorithms);
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_SIGNATURE, "Token signature algorithm is not accepted.");
        }

        String keyId = header.getKeyID();
        if (keyId == null || keyId.isEmpty()) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_NOT_FOUND, "Token does not name its signing key.");
        }
        JWK jwk = keyRing.getKey(keyId);
        if (KeyUse.ENCRYPTION.equals(jwk.getKeyUse())) {
            logger.debug("Key {} is an encryption key", keyId);
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.KEY_NOT_FOUND, "Token signing key " + keyId + " is unknown.");
        }

        try {
            JWSVerifier verifier = verifierFactory.createJWSVerifier(header, publicKey(jwk));
            if (!signedJWT.verify(verifier)) {
                throw new AuthenticationFailedException(AuthenticationErrorCode.BAD_SIGNATURE);
            }
        } catch (JOSEException e) {
            logger.debug("Signature of token signed with key {} could not be verified: {}", keyId, e.getMessage());
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_SIGNATURE, AuthenticationErrorCode.BAD_SIGNATURE.defaultDetail(), e);
        }

        JWTClaimsSet claimsSet;
        try {
            claimsSet = signedJWT.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_ACCESS_TOKEN, AuthenticationErrorCode.BAD_ACCESS_TOKEN.defaultDetail(), e);
        }

        checkIssuer(claimsSet);
        checkValidityWindow(claimsSet);
        return claimsSet;
    }

    private static @NotNull SignedJWT parseSigned(@NotNull String rawToken) throws AuthenticationFailedException {
        JWT jwt;
        try {
            jwt = JWTParser.parse(rawToken);
        } catch (ParseException e) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.BAD_ACCESS_TOKEN, AuthenticationErrorCode.BAD_ACCESS_TOKEN.defaultDetail(), e);
        }
        if (!(jwt instanceof SignedJWT)) {
            logger.debug("Token is not a signed JWT");
            throw new AuthenticationFailedException(AuthenticationErrorCode.BAD_ACCESS_TOKEN);
        }
        return (SignedJWT) jwt;
    }

    private static @NotNull Key publicKey(@NotNull JWK jwk) throws JOSEException {
        if (jwk instanceof RSAKey) {
            return ((RSAKey) jwk).toRSAPublicKey();
        }
        if (jwk instanceof ECKey) {
            return ((ECKey) jwk).toECPublicKey();
        }
        throw new JOSEException("Unsupported key type " + jwk.getKeyType());
    }

    private void checkIssuer(@NotNull JWTClaimsSet claimsSet) throws AuthenticationFailedException {
        String issuer = claimsSet.getIssuer();
        if (!endpoints.issuer().equals(issuer)) {
            logger.debug("Issuer mismatch: expected {}, got {}", endpoints.issuer(), issuer);
            throw new AuthenticationFailedException(AuthenticationErrorCode.INVALID_ISSUER);
        }
    }

    private void checkValidityWindow(@NotNull JWTClaimsSet claimsSet) throws AuthenticationFailedException {
        long now = clock.millis();

        Date expirationTime = claimsSet.getExpirationTime();
        if (expirationTime == null) {
            throw new AuthenticationFailedException(
                    AuthenticationErrorCode.TOKEN_EXPIRED, "Token does not carry an expiration time.");
        }
        if (now >= expirationTime.getTime() + clockSkewMillis) {
            logger.debug("Token expired at {}", expirationTime);
            throw new AuthenticationFailedException(AuthenticationErrorCode.TOKEN_EXPIRED);
        }

        Date notBeforeTime = claimsSet.getNotBeforeTime();
        if (notBeforeTime != null && now + clockSkewMillis < notBeforeTime.getTime()) {
            logger.debug("Token not valid before {}", notBeforeTime);
            throw new AuthenticationFailedException(AuthenticationErrorCode.TOKEN_NOT_YET_VALID);
        }
    }
}
