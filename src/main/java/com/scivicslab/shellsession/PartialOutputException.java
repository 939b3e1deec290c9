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

/**
 * A session failure that carries whatever output was buffered before it happened.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public abstract class PartialOutputException extends SessionException {

    private static final long serialVersionUID = 1L;

    private final String partialStdout;
    private final String partialStderr;

    protected PartialOutputException(String message, String partialStdout, String partialStderr) {
        super(message + "\nCurrent buffer: stdout='" + partialStdout + "', stderr='" + partialStderr + "'");
        this.partialStdout = partialStdout;
        this.partialStderr = partialStderr;
    }

    public String getPartialStdout() {
        return partialStdout;
    }

    public String getPartialStderr() {
        return partialStderr;
    }
}
