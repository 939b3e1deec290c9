/*
 * Copyright 2025 devteam@scivicslab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.shellsession;

import java.util.UUID;

/**
 * Generates process-unique session identifiers.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class SessionIds {

    private SessionIds() {
        // Utility class
    }

    /**
     * Generates a new session id.
     *
     * <p>Only hex digits are used so the id can be embedded in shell
     * single-quoted strings without escaping.</p>
     *
     * @return 32 character lowercase hex string
     */
    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
