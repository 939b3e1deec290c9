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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessLister} that runs {@code ps -e -o args}.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class PsProcessLister implements ProcessLister {

    private static final long PS_TIMEOUT_SECONDS = 10;

    @Override
    public List<String> listCommandLines() throws IOException {
        ProcessBuilder pb = new ProcessBuilder("ps", "-e", "-o", "args");
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process = pb.start();
        String output;
        try (InputStream in = process.getInputStream()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            output = buffer.toString(StandardCharsets.UTF_8);
        }

        try {
            if (!process.waitFor(PS_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("ps did not finish within " + PS_TIMEOUT_SECONDS + " seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while listing processes", e);
        }

        String[] lines = output.split("\\R");
        List<String> result = new ArrayList<>();
        // lines[0] is the "COMMAND" header
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (!line.isEmpty()) {
                result.add(line);
            }
        }
        return result;
    }
}
