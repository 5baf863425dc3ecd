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

import lombok.Builder;
import lombok.Value;

/**
 * A single call to the text-generation service.
 *
 * @since 1.0
 */
@Value
@Builder
public class GenerationRequest {

    /** Relay request id, used for logging only. */
    String requestId;

    /** Full prompt, instruction prefix included. */
    String text;

    /** API key chosen by the rotator for this call. */
    String credential;

    @Override
    public String toString() {
        return "GenerationRequest(requestId=" + requestId + ", textLength="
                + (text != null ? text.length() : 0) + ")";
    }
}
