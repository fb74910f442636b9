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

import static org.osgi.service.component.annotations.ConfigurationPolicy.REQUIRE;

import java.text.ParseException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.nimbusds.jose.Algorithm;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.JSONObjectUtils;
import com.nimbusds.jose.util.ResourceRetriever;
import org.apache.sling.auth.keycloak.OidcClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Deactivate;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.AttributeType;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Keycloak realm this instance trusts, together with its registered clients.
 *
 * <p>On activation the configuration is validated and the shared {@link KeyRing}, the public and
 * confidential clients and the {@link ClientRegistry} of machine clients are built. All of them
 * are immutable afterwards and shared by every authentication handler.</p>
 */
@Component(service = KeycloakRealm.class, configurationPolicy = REQUIRE)
@Designate(ocd = KeycloakRealm.Config.class)
public class KeycloakRealm {

    private static final Logger logger = LoggerFactory.getLogger(KeycloakRealm.class);

    /** Upper bound for the size of a key set document. */
    static final int JWK_SET_SIZE_LIMIT = 50 * 1024;

    @ObjectClassDefinition(
            name = "Apache Sling Keycloak Realm",
            description = "Keycloak server, realm and client registrations used to authenticate requests")
    @interface Config {
        @AttributeDefinition(
                name = "Server URL",
                description = "Base URL of the Keycloak server, e.g. https://auth.example.org/auth")
        String serverUrl();

        @AttributeDefinition(name = "Realm", description = "Name of the Keycloak realm")
        String realm();

        @AttributeDefinition(
                name = "Public Client ID",
                description = "Client ID of the public client used by browser and command line front ends")
        String publicClientId();

        @AttributeDefinition(
                name = "Confidential Client ID",
                description = "Client ID of the confidential client representing this API")
        String confidentialClientId();

        @AttributeDefinition(
                name = "Confidential Client Secret",
                description = "Secret of the confidential client. Only needed if the client requests tokens itself.",
                type = AttributeType.PASSWORD)
        String confidentialClientSecret();

        @AttributeDefinition(
                name = "API Clients",
                description = "JSON object mapping the pre-shared secret of each machine client to its client ID, "
                        + "e.g. {\"s3cr3t\": \"reporting-job\"}. Requests presenting a secret in the X-CLIENT-SECRET "
                        + "header are authenticated as the mapped client.",
                type = AttributeType.PASSWORD)
        String apiClients() default "{}";

        @AttributeDefinition(
                name = "Clock Skew (seconds)",
                description = "Tolerance applied when checking the exp and nbf claims of a token")
        long clockSkewSeconds() default 60;

        @AttributeDefinition(
                name = "Key Cache TTL (seconds)",
                description = "How long the realm's signing keys are cached. Set to 0 to fetch them for every token.")
        long jwkCacheTtlSeconds() default 300;

        @AttributeDefinition(
                name = "Key Refresh Minimum Interval (seconds)",
                description = "Minimum age of the cached keys before a token with an unknown key ID causes a refetch")
        long jwkRefreshMinIntervalSeconds() default 10;

        @AttributeDefinition(
                name = "Connect Timeout (milliseconds)",
                description = "Connect timeout for calls to the Keycloak server")
        int connectTimeoutMillis() default 5000;

        @AttributeDefinition(
                name = "Read Timeout (milliseconds)",
                description = "Read timeout for calls to the Keycloak server")
        int readTimeoutMillis() default 5000;

        @AttributeDefinition(
                name = "Max Attempts",
                description = "Number of attempts for a call to the Keycloak server failing with a network error")
        int maxAttempts() default 3;

        @AttributeDefinition(
                name = "Retry Backoff (milliseconds)",
                description = "Delay before the first retry. The delay doubles with each further retry.")
        long retryBackoffMillis() default 200;

        @AttributeDefinition(
                name = "Allowed Algorithms",
                description = "JWS algorithms accepted for token signatures",
                cardinality = Integer.MAX_VALUE)
        String[] allowedAlgorithms() default {"RS256"};
    }

    private final String realm;
    private final KeyRing keyRing;
    private final OidcClient publicClient;
    private final OidcClient confidentialClient;
    private final ClientRegistry clientRegistry;

    @Activate
    public KeycloakRealm(Config config) {
        this(
                config,
                new DefaultResourceRetriever(
                        config.connectTimeoutMillis(), config.readTimeoutMillis(), JWK_SET_SIZE_LIMIT),
                Clock.systemUTC());
    }

    KeycloakRealm(@NotNull Config config, @NotNull ResourceRetriever retriever, @NotNull Clock clock) {
        String serverUrl = required(config.serverUrl(), "Server URL");
        this.realm = required(config.realm(), "Realm");
        String publicClientId = required(config.publicClientId(), "Public client ID");
        String confidentialClientId = required(config.confidentialClientId(), "Confidential client ID");

        requireAtLeast(config.clockSkewSeconds(), 0, "Clock skew");
        requireAtLeast(config.jwkCacheTtlSeconds(), 0, "Key cache TTL");
        requireAtLeast(config.jwkRefreshMinIntervalSeconds(), 0, "Key refresh minimum interval");
        requireAtLeast(config.connectTimeoutMillis(), 1, "Connect timeout");
        requireAtLeast(config.readTimeoutMillis(), 1, "Read timeout");
        requireAtLeast(config.maxAttempts(), 1, "Max attempts");
        requireAtLeast(config.retryBackoffMillis(), 0, "Retry backoff");

        if (!serverUrl.toLowerCase().startsWith("https://")) {
            logger.warn("Keycloak server URL {} does not use HTTPS", serverUrl);
        }

        KeycloakEndpoints endpoints = new KeycloakEndpoints(serverUrl, realm);
        Set<JWSAlgorithm> algorithms = parseAlgorithms(config.allowedAlgorithms());
        RetryPolicy retryPolicy = new RetryPolicy(config.maxAttempts(), config.retryBackoffMillis());

        KeyRing sharedKeys = new KeyRing(
                endpoints.jwkSetUrl(),
                retriever,
                retryPolicy,
                TimeUnit.SECONDS.toMillis(config.jwkCacheTtlSeconds()),
                TimeUnit.SECONDS.toMillis(config.jwkRefreshMinIntervalSeconds()),
                clock);
        this.keyRing = sharedKeys;

        ClientFactory clients = (clientId, secret) -> new KeycloakOidcClient(
                endpoints,
                clientId,
                secret,
                sharedKeys,
                retryPolicy,
                algorithms,
                TimeUnit.SECONDS.toMillis(config.clockSkewSeconds()),
                config.connectTimeoutMillis(),
                config.readTimeoutMillis(),
                clock);

        this.publicClient = clients.create(publicClientId, null);
        this.confidentialClient = clients.create(confidentialClientId, emptyToNull(config.confidentialClientSecret()));

        Map<String, OidcClient> machineClients = new LinkedHashMap<>();
        parseApiClients(config.apiClients())
                .forEach((secret, clientId) -> machineClients.put(secret, clients.create(clientId, secret)));
        this.clientRegistry = new ClientRegistry(machineClients);

        logger.info(
                "Keycloak realm {} at {} activated: public client {}, confidential client {}, {} API clients, "
                        + "algorithms {}",
                realm,
                endpoints.issuer(),
                publicClientId,
                confidentialClientId,
                clientRegistry.size(),
                algorithms);
    }

    @Deactivate
    void deactivate() {
        keyRing.invalidate();
        logger.info("Keycloak realm {} deactivated", realm);
    }

    @NotNull
    public String realm() {
        return realm;
    }

    @NotNull
    OidcClient publicClient() {
        return publicClient;
    }

    @NotNull
    OidcClient confidentialClient() {
        return confidentialClient;
    }

    @NotNull
    ClientRegistry clientRegistry() {
        return clientRegistry;
    }

    @NotNull
    KeyRing keyRing() {
        return keyRing;
    }

    @FunctionalInterface
    private interface ClientFactory {
        OidcClient create(String clientId, String secret);
    }

    @NotNull
    static Map<String, String> parseApiClients(@Nullable String json) {
        if (json == null || json.trim().isEmpty()) {
            return Map.of();
        }
        Map<String, Object> parsed;
        try {
            parsed = JSONObjectUtils.parse(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("API clients configuration is not a JSON object: " + e.getMessage(), e);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : parsed.entrySet()) {
            if (entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("API clients configuration contains an empty secret");
            }
            if (!(entry.getValue() instanceof String) || ((String) entry.getValue()).trim().isEmpty()) {
                throw new IllegalArgumentException(
                        "API clients configuration must map each secret to a non-empty client ID");
            }
            result.put(entry.getKey(), ((String) entry.getValue()).trim());
        }
        return result;
    }

    @NotNull
    static Set<JWSAlgorithm> parseAlgorithms(@Nullable String[] names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("At least one signature algorithm must be allowed");
        }
        Set<JWSAlgorithm> algorithms = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException(
                        "Allowed algorithms configuration contains empty or null values. All entries must be non-empty strings.");
            }
            JWSAlgorithm algorithm = JWSAlgorithm.parse(name.trim());
            if (Algorithm.NONE.getName().equals(algorithm.getName())) {
                throw new IllegalArgumentException("Unsigned tokens can not be allowed");
            }
            if (!JWSAlgorithm.Family.RSA.contains(algorithm) && !JWSAlgorithm.Family.EC.contains(algorithm)) {
                throw new IllegalArgumentException("Unsupported signature algorithm '" + name + "'");
            }
            algorithms.add(algorithm);
        }
        return algorithms;
    }

    private static @NotNull String required(@Nullable String value, @NotNull String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must be configured");
        }
        return value.trim();
    }

    private static void requireAtLeast(long value, long minimum, @NotNull String name) {
        if (value < minimum) {
            throw new IllegalArgumentException(name + " must be at least " + minimum + ", was " + value);
        }
    }

    private static @Nullable String emptyToNull(@Nullable String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
