package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.GenerationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external text-generation service (Gemini). Each call is a
 * single attempt: implementations never retry, the dispatch step decides what
 * to tell the user.
 */
public interface GenerationPort {

    /**
     * Returns the provider identifier (e.g., "gemini").
     */
    String getProviderId();

    /**
     * Sends the prompt with the given credential. The future completes with the
     * generated text, or exceptionally with a
     * {@link me.golemcore.relay.domain.model.GenerationException} describing the
     * failure.
     */
    CompletableFuture<String> generate(GenerationRequest request);
}
