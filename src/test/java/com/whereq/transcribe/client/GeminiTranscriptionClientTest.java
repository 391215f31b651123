package com.whereq.transcribe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.PermanentSubmissionException;
import com.whereq.transcribe.exception.TransientSubmissionException;
import com.whereq.transcribe.model.RemoteJobState;
import com.whereq.transcribe.model.RemoteJobStatus;
import com.whereq.transcribe.model.TranscriptionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiTranscriptionClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();

    private TranscribeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TranscribeProperties();
        properties.getGemini().setApiKey("test-key");
    }

    private GeminiTranscriptionClient clientResponding(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        });
        return new GeminiTranscriptionClient(builder, objectMapper, properties);
    }

    private TranscriptionRequest request() {
        return TranscriptionRequest.builder()
            .jobId("job-1")
            .prompt("Transcribe with speaker labels")
            .mimeType("audio/mpeg")
            .content("audio".getBytes(StandardCharsets.UTF_8))
            .build();
    }

    @Test
    void submitPostsBatchAndReturnsBatchName() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{\"name\":\"batches/abc123\"}");

        StepVerifier.create(client.submit(request()))
            .expectNext("batches/abc123")
            .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString())
            .isEqualTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:batchGenerateContent");
        assertThat(sent.headers().getFirst("x-goog-api-key")).isEqualTo("test-key");
    }

    @Test
    void serverErrorIsTransient() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{}}");

        StepVerifier.create(client.submit(request()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(TransientSubmissionException.class)
                .hasMessageContaining("503"))
            .verify();
    }

    @Test
    void rateLimitIsTransient() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.TOO_MANY_REQUESTS, "{}");

        StepVerifier.create(client.submit(request()))
            .expectError(TransientSubmissionException.class)
            .verify();
    }

    @Test
    void badRequestIsPermanent() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.BAD_REQUEST,
            "{\"error\":{\"message\":\"Unsupported mime type\"}}");

        StepVerifier.create(client.submit(request()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(PermanentSubmissionException.class)
                .hasMessageContaining("Unsupported mime type"))
            .verify();
    }

    @Test
    void responseWithoutNameIsTransient() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        StepVerifier.create(client.submit(request()))
            .expectError(TransientSubmissionException.class)
            .verify();
    }

    @Test
    void connectionFailureIsTransient() {
        WebClient.Builder builder = WebClient.builder()
            .exchangeFunction(request -> Mono.error(new IOException("Connection refused")));
        GeminiTranscriptionClient client = new GeminiTranscriptionClient(builder, objectMapper, properties);

        StepVerifier.create(client.submit(request()))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(TransientSubmissionException.class)
                .hasMessageContaining("Connection refused"))
            .verify();
    }

    @Test
    void statusGetsBatchByHandle() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK,
            "{\"name\":\"batches/abc123\",\"metadata\":{\"state\":\"BATCH_STATE_RUNNING\"}}");

        StepVerifier.create(client.status("batches/abc123"))
            .expectNextMatches(status -> status.getState() == RemoteJobState.RUNNING)
            .verifyComplete();

        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.url().toString())
            .isEqualTo("https://generativelanguage.googleapis.com/v1beta/batches/abc123");
    }

    @Test
    void batchRequestCarriesPromptMediaAndJobId() {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        ObjectNode body = client.buildBatchRequest(request());

        JsonNode batch = body.path("batch");
        assertThat(batch.path("display_name").asText()).isEqualTo("job-1");
        JsonNode inlined = batch.path("input_config").path("requests").path("requests").path(0);
        assertThat(inlined.path("metadata").path("key").asText()).isEqualTo("job-1");

        JsonNode parts = inlined.path("request").path("contents").path(0).path("parts");
        assertThat(parts.path(0).path("text").asText()).isEqualTo("Transcribe with speaker labels");
        assertThat(parts.path(1).path("inline_data").path("mime_type").asText()).isEqualTo("audio/mpeg");
        assertThat(parts.path(1).path("inline_data").path("data").asText())
            .isEqualTo(Base64.getEncoder().encodeToString("audio".getBytes(StandardCharsets.UTF_8)));

        JsonNode generationConfig = inlined.path("request").path("generation_config");
        assertThat(generationConfig.path("temperature").asDouble()).isEqualTo(0.1);
        assertThat(generationConfig.path("max_output_tokens").asInt()).isEqualTo(65536);
    }

    @Test
    void succeededBatchYieldsFirstInlinedResponse() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        RemoteJobStatus status = client.parseStatus(objectMapper.readTree("""
            {
              "metadata": {"state": "BATCH_STATE_SUCCEEDED"},
              "response": {"inlinedResponses": {"inlinedResponses": [
                {"response": {"candidates": [{"content": {"parts": [{"text": "Hello class"}]}}]}}
              ]}}
            }
            """));

        assertThat(status.getState()).isEqualTo(RemoteJobState.SUCCEEDED);
        assertThat(status.getResult().path("candidates").path(0).path("content").path("parts").path(0)
            .path("text").asText()).isEqualTo("Hello class");
    }

    @Test
    void succeededBatchReadsOutputFromMetadata() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        RemoteJobStatus status = client.parseStatus(objectMapper.readTree("""
            {
              "metadata": {"state": "BATCH_STATE_SUCCEEDED",
                "output": {"inlinedResponses": {"inlinedResponses": [
                  {"response": {"candidates": []}}
                ]}}}
            }
            """));

        assertThat(status.getState()).isEqualTo(RemoteJobState.SUCCEEDED);
        assertThat(status.getResult().has("candidates")).isTrue();
    }

    @Test
    void failedInlinedRequestIsFailure() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        RemoteJobStatus status = client.parseStatus(objectMapper.readTree("""
            {
              "state": "BATCH_STATE_SUCCEEDED",
              "response": {"inlinedResponses": {"inlinedResponses": [
                {"error": {"message": "Audio could not be decoded"}}
              ]}}
            }
            """));

        assertThat(status.getState()).isEqualTo(RemoteJobState.FAILED);
        assertThat(status.getErrorMessage()).isEqualTo("Audio could not be decoded");
    }

    @Test
    void terminalBatchStatesAreFailures() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        for (String state : List.of("BATCH_STATE_FAILED", "BATCH_STATE_CANCELLED", "BATCH_STATE_EXPIRED")) {
            RemoteJobStatus status = client.parseStatus(
                objectMapper.readTree("{\"metadata\":{\"state\":\"" + state + "\"}}"));
            assertThat(status.getState()).isEqualTo(RemoteJobState.FAILED);
            assertThat(status.getErrorMessage()).contains(state);
        }
    }

    @Test
    void errorObjectIsFailure() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        RemoteJobStatus status = client.parseStatus(
            objectMapper.readTree("{\"error\":{\"code\":500,\"message\":\"Internal error\"}}"));

        assertThat(status.getState()).isEqualTo(RemoteJobState.FAILED);
        assertThat(status.getErrorMessage()).isEqualTo("Internal error");
    }

    @Test
    void unrecognizedStateIsUnknown() throws Exception {
        GeminiTranscriptionClient client = clientResponding(HttpStatus.OK, "{}");

        RemoteJobStatus pending = client.parseStatus(objectMapper.readTree("{\"state\":\"BATCH_STATE_PENDING\"}"));
        RemoteJobStatus unknown = client.parseStatus(objectMapper.readTree("{\"state\":\"BATCH_STATE_PAUSED\"}"));

        assertThat(pending.getState()).isEqualTo(RemoteJobState.RUNNING);
        assertThat(unknown.getState()).isEqualTo(RemoteJobState.UNKNOWN);
        assertThat(unknown.getRawState()).isEqualTo("BATCH_STATE_PAUSED");
    }
}
