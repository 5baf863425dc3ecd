package me.golemcore.relay.adapter.outbound.generation;

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

import me.golemcore.relay.domain.model.GenerationException;
import me.golemcore.relay.domain.model.GenerationFailureKind;
import me.golemcore.relay.domain.model.GenerationRequest;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.port.outbound.GenerationPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Gemini {@code generateContent} adapter using Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.generation.api-url} - Base URL of the API
 * <li>{@code bot.generation.model} - model name in the request path
 * <li>{@code bot.generation.timeout} - HTTP read timeout
 * </ul>
 *
 * <p>
 * The API key is not configured here: it arrives with every request from the
 * key rotator and travels in the {@code x-goog-api-key} header, never in the
 * URL. Feign puts the request URL into its exception messages, so failures are
 * logged and wrapped with the underlying cause only.
 *
 * <p>
 * One HTTP exchange per call, never retried. Failures are mapped to
 * {@link GenerationException}:
 * <ul>
 * <li>non-2xx status - {@link GenerationFailureKind#UPSTREAM_ERROR}</li>
 * <li>I/O failure - {@link GenerationFailureKind#NETWORK_ERROR}, or
 * {@link GenerationFailureKind#TIMEOUT} for socket timeouts</li>
 * <li>undecodable body or no candidate text -
 * {@link GenerationFailureKind#MALFORMED_RESPONSE}</li>
 * </ul>
 *
 * <p>
 * Lazy initialization: the Feign client is created on first use.
 *
 * @see me.golemcore.relay.infrastructure.http.FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeminiGenerationAdapter implements GenerationPort {

    private final BotProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile GeminiApi client;

    @Override
    public String getProviderId() {
        return "gemini";
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            GeminiApi api = ensureClient();
            GenerateContentResponse response;
            try {
                response = api.generateContent(properties.getGeneration().getModel(), request.getCredential(),
                        buildRequest(request.getText()));
            } catch (FeignException e) {
                throw classify(request.getRequestId(), e);
            }
            return extractText(request.getRequestId(), response);
        });
    }

    private synchronized GeminiApi ensureClient() {
        if (client == null) {
            BotProperties.GenerationProperties generation = properties.getGeneration();
            client = feignClientFactory.create(GeminiApi.class, generation.getApiUrl(), generation.getTimeout());
            log.info("Gemini adapter initialized with URL: {}", generation.getApiUrl());
        }
        return client;
    }

    private GenerateContentRequest buildRequest(String text) {
        BotProperties.GenerationProperties generation = properties.getGeneration();

        Part part = new Part();
        part.setText(text);
        Content content = new Content();
        content.setParts(List.of(part));

        GenerationConfig config = new GenerationConfig();
        config.setTemperature(generation.getTemperature());
        config.setTopK(generation.getTopK());
        config.setTopP(generation.getTopP());
        config.setMaxOutputTokens(generation.getMaxOutputTokens());

        GenerateContentRequest apiRequest = new GenerateContentRequest();
        apiRequest.setContents(List.of(content));
        apiRequest.setGenerationConfig(config);
        return apiRequest;
    }

    private String extractText(String requestId, GenerateContentResponse response) {
        if (response == null || response.getCandidates() == null || response.getCandidates().isEmpty()) {
            log.error("Invalid Gemini response format for request {}: no candidates", requestId);
            throw new GenerationException(GenerationFailureKind.MALFORMED_RESPONSE, "No candidates in response");
        }
        Content content = response.getCandidates().get(0).getContent();
        if (content == null || content.getParts() == null || content.getParts().isEmpty()
                || content.getParts().get(0).getText() == null) {
            log.error("Invalid Gemini response format for request {}: no text part", requestId);
            throw new GenerationException(GenerationFailureKind.MALFORMED_RESPONSE, "No text in first candidate");
        }
        log.info("Successful Gemini response for request {}", requestId);
        return content.getParts().get(0).getText();
    }

    private GenerationException classify(String requestId, FeignException e) {
        if (e instanceof RetryableException) {
            String cause = describeCause(e);
            if (e.getCause() instanceof InterruptedIOException) {
                log.error("Gemini call timed out for request {}: {}", requestId, cause);
                return new GenerationException(GenerationFailureKind.TIMEOUT, cause, e.getCause());
            }
            log.error("Network error for request {}: {}", requestId, cause);
            return new GenerationException(GenerationFailureKind.NETWORK_ERROR, cause, e.getCause());
        }
        // decoder failures surface either as DecodeException or as a read error on a 2xx response
        if (e instanceof DecodeException || (e.status() >= 200 && e.status() < 300)) {
            String cause = describeCause(e);
            log.error("Undecodable Gemini response for request {}: {}", requestId, cause);
            return new GenerationException(GenerationFailureKind.MALFORMED_RESPONSE, cause, e.getCause());
        }
        if (e.status() > 0) {
            log.error("Gemini API error for request {}: {} - {}", requestId, e.status(), e.contentUTF8());
            return GenerationException.upstream(e.status(), "HTTP " + e.status());
        }
        log.error("Unexpected Gemini failure for request {}: {}", requestId, describeCause(e));
        return new GenerationException(GenerationFailureKind.UNEXPECTED, describeCause(e), e.getCause());
    }

    private static String describeCause(FeignException e) {
        Throwable cause = e.getCause();
        if (cause == null) {
            return e.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }

    // Feign API interface
    public interface GeminiApi {
        @RequestLine("POST /models/{model}:generateContent")
        @Headers({"Content-Type: application/json", "x-goog-api-key: {apiKey}"})
        GenerateContentResponse generateContent(@Param("model") String model, @Param("apiKey") String apiKey,
                GenerateContentRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerateContentRequest {
        private List<Content> contents;
        private GenerationConfig generationConfig;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GenerationConfig {
        private Double temperature;
        private Integer topK;
        private Double topP;
        private Integer maxOutputTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Content {
        private String role;
        private List<Part> parts;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateContentResponse {
        private List<Candidate> candidates;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        private Content content;
        private String finishReason;
    }
}
