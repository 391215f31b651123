package com.whereq.transcribe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.PermanentSubmissionException;
import com.whereq.transcribe.exception.TranscriptionException;
import com.whereq.transcribe.exception.TransientSubmissionException;
import com.whereq.transcribe.model.RemoteJobState;
import com.whereq.transcribe.model.RemoteJobStatus;
import com.whereq.transcribe.model.TranscriptionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Base64;
import java.util.Locale;

/**
 * Transcription client for the Gemini batch API.
 * <p>
 * Each job is submitted as a batch holding one inlined request, so the batch name
 * doubles as the job's remote handle.
 */
@Slf4j
@Component
public class GeminiTranscriptionClient implements TranscriptionClient {

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TranscribeProperties.GeminiConfig config;
    private final Duration requestTimeout;

    public GeminiTranscriptionClient(WebClient.Builder webClientBuilder,
                                     ObjectMapper objectMapper,
                                     TranscribeProperties properties) {
        this.config = properties.getGemini();
        this.objectMapper = objectMapper;
        this.requestTimeout = config.getRequestTimeout();

        WebClient.Builder builder = webClientBuilder.clone().baseUrl(config.getBaseUrl());
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader(API_KEY_HEADER, config.getApiKey());
        } else {
            log.warn("Gemini API key not configured. Please set transcribe.gemini.api-key");
        }
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> submit(TranscriptionRequest request) {
        return Mono.fromCallable(() -> buildBatchRequest(request))
            .flatMap(body -> webClient.post()
                .uri("/models/{model}:batchGenerateContent", config.getModel())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(requestTimeout))
            .map(response -> {
                String handle = response.path("name").asText("");
                if (handle.isBlank()) {
                    throw new TransientSubmissionException("Transcription service returned no batch name");
                }
                return handle;
            })
            .onErrorMap(WebClientResponseException.class, this::classifySubmitError)
            .onErrorMap(e -> !(e instanceof TranscriptionException),
                e -> new TransientSubmissionException("Failed to reach transcription service: " + describe(e), e))
            .doOnSuccess(handle -> log.info("Submitted job {} as {}", request.getJobId(), handle));
    }

    @Override
    public Mono<RemoteJobStatus> status(String handle) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/" + handle).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(requestTimeout)
            .map(this::parseStatus);
    }

    ObjectNode buildBatchRequest(TranscriptionRequest request) {
        ObjectNode generateRequest = objectMapper.createObjectNode();
        ArrayNode parts = generateRequest.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", request.getPrompt() == null ? "" : request.getPrompt());
        ObjectNode inlineData = parts.addObject().putObject("inline_data");
        inlineData.put("mime_type", request.getMimeType());
        inlineData.put("data", Base64.getEncoder().encodeToString(request.getContent()));

        ObjectNode generationConfig = generateRequest.putObject("generation_config");
        generationConfig.put("temperature", config.getTemperature());
        generationConfig.put("max_output_tokens", config.getMaxOutputTokens());

        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode batch = body.putObject("batch");
        batch.put("display_name", request.getJobId());
        ObjectNode inlined = batch.putObject("input_config").putObject("requests")
            .putArray("requests").addObject();
        inlined.set("request", generateRequest);
        inlined.putObject("metadata").put("key", request.getJobId());
        return body;
    }

    RemoteJobStatus parseStatus(JsonNode response) {
        JsonNode error = response.path("error");
        if (error.isObject()) {
            return RemoteJobStatus.failed(error.path("message").asText("Batch failed"));
        }

        String rawState = response.path("metadata").path("state").asText(response.path("state").asText(""));
        String state = rawState.toUpperCase(Locale.ROOT);

        if (state.contains("SUCCEEDED")) {
            JsonNode inlined = firstInlinedResponse(response);
            if (inlined.path("error").isObject()) {
                return RemoteJobStatus.failed(inlined.path("error").path("message").asText("Request failed"));
            }
            return RemoteJobStatus.succeeded(inlined.path("response"));
        }
        if (state.contains("FAILED") || state.contains("CANCELLED") || state.contains("EXPIRED")) {
            return RemoteJobStatus.failed("Batch ended in state " + rawState);
        }
        if (state.contains("PENDING") || state.contains("RUNNING")) {
            return RemoteJobStatus.running(rawState);
        }
        return RemoteJobStatus.builder().state(RemoteJobState.UNKNOWN).rawState(rawState).build();
    }

    private JsonNode firstInlinedResponse(JsonNode response) {
        JsonNode inlined = response.path("response").path("inlinedResponses").path("inlinedResponses").path(0);
        if (inlined.isMissingNode()) {
            inlined = response.path("metadata").path("output").path("inlinedResponses").path("inlinedResponses").path(0);
        }
        return inlined;
    }

    private TranscriptionException classifySubmitError(WebClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        String detail = "Transcription service error (" + status.value() + "): " + e.getResponseBodyAsString();
        if (status.is5xxServerError() || status.value() == 429 || status.value() == 408) {
            return new TransientSubmissionException(detail, e);
        }
        return new PermanentSubmissionException(detail, e);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
