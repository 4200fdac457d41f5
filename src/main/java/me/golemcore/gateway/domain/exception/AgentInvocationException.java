package me.golemcore.gateway.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * The agent process could not be started or exited with a non-zero status.
 *
 * <p>
 * The message carries the diagnostic text captured from the process (its
 * standard error) so it can be shown to the user verbatim.
 */
public class AgentInvocationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Integer exitCode;

    public AgentInvocationException(String message, Integer exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public AgentInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    /**
     * Exit status of the process, or {@code null} if it never started.
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
