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

import javax.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.nimbusds.jose.util.JSONObjectUtils;
import org.apache.sling.auth.keycloak.AuthenticationFailedException;
import org.jetbrains.annotations.NotNull;

/**
 * Writes the {@code 401} answer for a rejected request.
 *
 * <p>The body is a JSON object with the error {@code code} and a human readable {@code detail}.</p>
 */
final class AuthenticationFailureResponse {

    static final String HEADER_WWW_AUTHENTICATE = "WWW-Authenticate";
    static final String CONTENT_TYPE_JSON = "application/json";

    private AuthenticationFailureResponse() {}

    static void write(
            @NotNull HttpServletResponse response, @NotNull String realm, @NotNull AuthenticationFailedException failure)
            throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HEADER_WWW_AUTHENTICATE, "Bearer realm=\"" + realm + "\"");
        response.setContentType(CONTENT_TYPE_JSON);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", failure.getCode().code());
        body.put("detail", failure.getDetail());
        response.getWriter().write(JSONObjectUtils.toJSONString(body));
        response.flushBuffer();
    }
}
