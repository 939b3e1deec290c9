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

import java.time.Duration;

/**
 * Thrown when a command does not signal completion within the timeout.
 *
 * <p>The transport is left open, but output of the timed-out command may
 * still arrive later.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class ReadTimeoutException extends PartialOutputException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public ReadTimeoutException(Duration timeout, String partialStdout, String partialStderr) {
        super("Timeout of " + timeout.toMillis() + " ms reached while reading from shell."
            + " Note that interactive commands are not supported and can time out."
            + " Use a corresponding non-interactive command if possible.",
            partialStdout, partialStderr);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
