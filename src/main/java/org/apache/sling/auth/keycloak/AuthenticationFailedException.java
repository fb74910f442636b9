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

import org.jetbrains.annotations.NotNull;

/**
 * Signals that presented credentials were examined and rejected.
 *
 * <p>Throwing this from an {@link org.apache.sling.auth.keycloak.spi.Authenticator} stops the
 * authenticator chain; the request is answered with {@code 401} and the {@link #getCode() code}.</p>
 */
public class AuthenticationFailedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final AuthenticationErrorCode code;

    public AuthenticationFailedException(@NotNull AuthenticationErrorCode code) {
        this(code, code.defaultDetail());
    }

    public AuthenticationFailedException(@NotNull AuthenticationErrorCode code, @NotNull String detail) {
        super(detail);
        this.code = code;
    }

    public AuthenticationFailedException(
            @NotNull AuthenticationErrorCode code, @NotNull String detail, @NotNull Throwable cause) {
        super(detail, cause);
        this.code = code;
    }

    public @NotNull AuthenticationErrorCode getCode() {
        return code;
    }

    public @NotNull String getDetail() {
        return getMessage();
    }
}
