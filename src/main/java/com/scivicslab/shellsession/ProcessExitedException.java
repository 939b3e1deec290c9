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
 * Thrown when the shell process or channel terminates while a command's
 * output is being read.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class ProcessExitedException extends PartialOutputException {

    private static final long serialVersionUID = 1L;

    public ProcessExitedException(String partialStdout, String partialStderr) {
        super("Shell exited unexpectedly.", partialStdout, partialStderr);
    }
}
