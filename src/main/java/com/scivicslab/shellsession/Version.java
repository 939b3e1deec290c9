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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Build version of shell-session, taken from the filtered
 * {@code version.properties} resource.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public final class Version {

    private static final String UNKNOWN = "unknown";

    private static final String VERSION = load();

    private Version() {
        // Utility class
    }

    private static String load() {
        try (InputStream is = Version.class.getResourceAsStream("/version.properties")) {
            if (is == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(is);
            String value = props.getProperty("version", UNKNOWN);
            // Unfiltered resource when running from an IDE
            return value.startsWith("${") ? UNKNOWN : value;
        } catch (IOException e) {
            return UNKNOWN;
        }
    }

    /**
     * Returns the bare version (e.g., "1.0.0").
     *
     * @return the version string
     */
    public static String get() {
        return VERSION;
    }

    /**
     * Returns the version line printed by {@code --version}.
     *
     * @return formatted version string (e.g., "shell-session 1.0.0")
     */
    public static String full() {
        return "shell-session " + VERSION;
    }
}
