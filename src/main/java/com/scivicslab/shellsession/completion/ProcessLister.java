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

package com.scivicslab.shellsession.completion;

import java.io.IOException;
import java.util.List;

/**
 * Lists the command lines of the processes running on the local machine.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessLister {

    /**
     * Takes a snapshot of the process table.
     *
     * @return one command line per process, header excluded
     * @throws IOException if the snapshot cannot be taken
     */
    List<String> listCommandLines() throws IOException;
}
