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

package com.scivicslab.shellsession.marker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives a fresh {@link MarkerSet} for every call on one session.
 *
 * <p>Markers combine the session id with a monotonically increasing call
 * counter, so two calls never share a marker even when they run the same
 * command text.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class MarkerFactory {

    private final String sessionId;
    private final AtomicLong counter = new AtomicLong();

    public MarkerFactory(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new IllegalArgumentException("Session id cannot be null or empty");
        }
        this.sessionId = sessionId;
    }

    /**
     * Returns the markers for the next call.
     *
     * @return a marker set with a new sequence number
     */
    public MarkerSet next() {
        return new MarkerSet(sessionId, counter.incrementAndGet());
    }
}
