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

import java.util.Map;

import org.apache.sling.auth.keycloak.OidcClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Machine clients known by their pre-shared secret.
 *
 * <p>Built once from configuration and never modified afterwards, so lookups need no
 * synchronization.</p>
 */
class ClientRegistry {

    private final Map<String, OidcClient> clientsBySecret;

    ClientRegistry(@NotNull Map<String, OidcClient> clientsBySecret) {
        this.clientsBySecret = Map.copyOf(clientsBySecret);
    }

    /**
     * @param secret the value of the client secret header
     * @return the client registered for {@code secret}, or {@code null} if there is none
     */
    @Nullable
    OidcClient lookup(@NotNull String secret) {
        return clientsBySecret.get(secret);
    }

    int size() {
        return clientsBySecret.size();
    }
}
