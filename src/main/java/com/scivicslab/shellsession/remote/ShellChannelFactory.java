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

package com.scivicslab.shellsession.remote;

import java.io.IOException;
import java.util.Map;

/**
 * Opens interactive shell channels on an already authenticated connection.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@FunctionalInterface
public interface ShellChannelFactory {

    /**
     * Opens a new shell channel.
     *
     * @param environment variables to negotiate for the channel
     * @return the open channel
     * @throws IOException if the channel cannot be opened
     */
    ShellChannel open(Map<String, String> environment) throws IOException;
}
