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

/**
 * Validation state of a {@link Token}.
 *
 * <p>A token leaves {@link #UNVALIDATED} exactly once and never returns to it.</p>
 */
public enum TokenState {
    /** Parsed from a request header, not yet checked. */
    UNVALIDATED,
    /** Signature, validity window, audience and authorized party were accepted. */
    VALIDATED,
    /** Validation failed; the token must not authenticate anybody. */
    REJECTED,
    /** Minted by this process through the client credentials grant and trusted without verification. */
    PRE_TRUSTED
}
