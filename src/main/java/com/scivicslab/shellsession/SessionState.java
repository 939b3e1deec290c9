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
 * Lifecycle states of a {@link Session}.
 *
 * <pre>
 * UNINITIALIZED --setup--&gt; READY --execute--&gt; EXECUTING --&gt; READY
 *       any state --teardown--&gt; CLOSED
 * </pre>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public enum SessionState {
    UNINITIALIZED,
    READY,
    EXECUTING,
    CLOSED
}
