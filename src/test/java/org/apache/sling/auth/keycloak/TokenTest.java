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
package org.apache.sling.auth.keycloak;

import java.util.List;
import java.util.Set;

import com.nimbusds.jwt.JWTClaimsSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Token}.
 */
class TokenTest {

    private static final String PUBLIC = "web-ui";
    private static final String CONFIDENTIAL = "api-backend";

    private FakeOidcClient client;

    @BeforeEach
    void setUp() {
        client = new FakeOidcClient(CONFIDENTIAL);
    }

    private static String token(String authorizedParty, String... audiences) {
        return FakeOidcClient.unsignedToken(new JWTClaimsSet.Builder()
                .subject("user-1")
                .audience(List.of(audiences))
                .claim("azp", authorizedParty)
                .claim("preferred_username", "jdoe")
                .build());
    }

    @Test
    void testParse_StartsUnvalidated() throws Exception {
        Token token = Token.parse(token(PUBLIC, CONFIDENTIAL), client);

        assertEquals(TokenState.UNVALIDATED, token.getState());
        assertFalse(token.isTrusted());
        assertEquals("user-1", token.getUnverifiedClaims().getSubject());
        assertThrows(IllegalStateException.class, token::getClaims);
        assertTrue(client.verified().isEmpty());
    }

    @Test
    void testParse_Garbage_BadAccessToken() {
        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> Token.parse("garbage", client));

        assertEquals(AuthenticationErrorCode.BAD_ACCESS_TOKEN, e.getCode());
    }

    @Test
    void testValidate_MatchingAudienceAndParty_Validated() throws Exception {
        String raw = token(PUBLIC, CONFIDENTIAL, "account");
        Token token = Token.parse(raw, client);

        token.validate(Set.of(CONFIDENTIAL), Set.of(CONFIDENTIAL, PUBLIC));

        assertEquals(TokenState.VALIDATED, token.getState());
        assertTrue(token.isTrusted());
        assertEquals(token.getUnverifiedClaims().toJSONObject(), token.getClaims().toJSONObject());
        assertEquals(List.of(raw), client.verified());
        assertNull(token.getRejectionReason());
    }

    @Test
    void testValidate_AudienceMismatch_Rejected() throws Exception {
        Token token = Token.parse(token(PUBLIC, PUBLIC), client);

        AuthenticationFailedException e = assertThrows(
                AuthenticationFailedException.class,
                () -> token.validate(Set.of(CONFIDENTIAL), Set.of(CONFIDENTIAL, PUBLIC)));

        assertEquals(AuthenticationErrorCode.INVALID_AUDIENCE, e.getCode());
        assertEquals(TokenState.REJECTED, token.getState());
        assertEquals(AuthenticationErrorCode.INVALID_AUDIENCE, token.getRejectionReason());
        assertThrows(IllegalStateException.class, token::getClaims);
    }

    @Test
    void testValidate_AuthorizedPartyMismatch_Rejected() throws Exception {
        Token token = Token.parse(token("intruder", CONFIDENTIAL), client);

        AuthenticationFailedException e = assertThrows(
                AuthenticationFailedException.class,
                () -> token.validate(Set.of(CONFIDENTIAL), Set.of(CONFIDENTIAL, PUBLIC)));

        assertEquals(AuthenticationErrorCode.INVALID_AZP, e.getCode());
        assertEquals(TokenState.REJECTED, token.getState());
    }

    @Test
    void testValidate_MissingAuthorizedParty_Rejected() throws Exception {
        String raw = FakeOidcClient.unsignedToken(
                new JWTClaimsSet.Builder().subject("user-1").audience(CONFIDENTIAL).build());
        Token token = Token.parse(raw, client);

        AuthenticationFailedException e = assertThrows(
                AuthenticationFailedException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(CONFIDENTIAL)));

        assertEquals(AuthenticationErrorCode.INVALID_AZP, e.getCode());
    }

    @Test
    void testValidate_VerificationFailure_RejectedWithReason() throws Exception {
        client.willFail(new AuthenticationFailedException(AuthenticationErrorCode.BAD_SIGNATURE));
        Token token = Token.parse(token(PUBLIC, CONFIDENTIAL), client);

        AuthenticationFailedException e = assertThrows(
                AuthenticationFailedException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC)));

        assertEquals(AuthenticationErrorCode.BAD_SIGNATURE, e.getCode());
        assertEquals(AuthenticationErrorCode.BAD_SIGNATURE, token.getRejectionReason());
    }

    @Test
    void testValidate_UnexpectedVerificationError_Rejected() throws Exception {
        client.willFailUnexpectedly(new IllegalStateException("verifier crashed"));
        Token token = Token.parse(token(PUBLIC, CONFIDENTIAL), client);

        assertThrows(IllegalStateException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC)));

        assertEquals(TokenState.REJECTED, token.getState());
        assertEquals(AuthenticationErrorCode.BAD_ACCESS_TOKEN, token.getRejectionReason());
        assertThrows(IllegalStateException.class, token::getClaims);
        assertThrows(IllegalStateException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC)));
    }

    @Test
    void testValidate_Twice_IllegalState() throws Exception {
        Token token = Token.parse(token(PUBLIC, CONFIDENTIAL), client);
        token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC));

        assertThrows(IllegalStateException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC)));
        assertEquals(1, client.verified().size());
    }

    @Test
    void testValidate_AfterRejection_IllegalState() throws Exception {
        Token token = Token.parse(token(PUBLIC, PUBLIC), client);
        assertThrows(AuthenticationFailedException.class, () -> token.validate(Set.of(CONFIDENTIAL), Set.of(PUBLIC)));

        assertThrows(IllegalStateException.class, () -> token.validate(Set.of(PUBLIC), Set.of(PUBLIC)));
    }

    @Test
    void testIssueTrusted_PreTrustedWithoutVerification() throws Exception {
        String raw = token(CONFIDENTIAL, "account");
        client.willIssue(raw);

        Token token = Token.issueTrusted(client);

        assertEquals(TokenState.PRE_TRUSTED, token.getState());
        assertTrue(token.isTrusted());
        assertEquals(raw, token.getValue());
        assertEquals("jdoe", token.getClaims().getStringClaim("preferred_username"));
        assertTrue(client.verified().isEmpty());
        assertThrows(IllegalStateException.class, () -> token.validate(Set.of("account"), Set.of(CONFIDENTIAL)));
    }

    @Test
    void testIssueTrusted_IssuanceFailure_Propagates() {
        client.willFail(new AuthenticationFailedException(AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED));

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> Token.issueTrusted(client));

        assertEquals(AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, e.getCode());
    }

    @Test
    void testIssueTrusted_UndecodableToken_TokenIssuanceFailed() {
        client.willIssue("opaque-reference-token");

        AuthenticationFailedException e =
                assertThrows(AuthenticationFailedException.class, () -> Token.issueTrusted(client));

        assertEquals(AuthenticationErrorCode.TOKEN_ISSUANCE_FAILED, e.getCode());
    }
}
