package me.golemcore.relay.domain.model;

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
 * Classified failure of a generation call.
 *
 * <p>
 * Raised by generation adapters and converted into a user-visible failure
 * notice at the dispatch boundary. {@link #getStatusCode()} is set only for
 * {@link GenerationFailureKind#UPSTREAM_ERROR}.
 *
 * @since 1.0
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final GenerationFailureKind kind;
    private final Integer statusCode;

    public GenerationException(GenerationFailureKind kind, String message) {
        this(kind, null, message, null);
    }

    public GenerationException(GenerationFailureKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public GenerationException(GenerationFailureKind kind, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static GenerationException upstream(int statusCode, String message) {
        return new GenerationException(GenerationFailureKind.UPSTREAM_ERROR, statusCode, message, null);
    }

    public GenerationFailureKind getKind() {
        return kind;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
