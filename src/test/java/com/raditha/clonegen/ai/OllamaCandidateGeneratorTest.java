package com.raditha.clonegen.ai;

import com.raditha.clonegen.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OllamaCandidateGeneratorTest {

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private Map<String, Object> config;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        config = new HashMap<>();
        config.put("base_url", "http://ollama.example.test:11434/");
        config.put("max_retries", 2);
        config.put("retry_delay_ms", 0);
    }

    private void reply(String first, String... rest) throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(first, rest);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(response);
    }

    @Test
    void testProposeFirstAttempt() throws Exception {
        reply("{\"response\": \"x = 2\", \"done\": true}");
        OllamaCandidateGenerator generator = new OllamaCandidateGenerator(config, httpClient);

        assertEquals("x = 2", generator.propose("x = 1", Language.PYTHON));
        verify(httpClient, times(1)).send(any(HttpRequest.class),
                ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    void testEmptyReplyIsRetried() throws Exception {
        reply("{\"response\": \"\"}", "{\"response\": \"x = 3\"}");
        OllamaCandidateGenerator generator = new OllamaCandidateGenerator(config, httpClient);

        assertEquals("x = 3", generator.propose("x = 1", Language.PYTHON));
        verify(httpClient, times(2)).send(any(HttpRequest.class),
                ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    void testRetriesExhausted() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new HttpTimeoutException("request timed out"));
        OllamaCandidateGenerator generator = new OllamaCandidateGenerator(config, httpClient);

        CandidateGenerationException e = assertThrows(CandidateGenerationException.class,
                () -> generator.propose("x = 1", Language.PYTHON));
        assertInstanceOf(HttpTimeoutException.class, e.getCause());
        verify(httpClient, times(2)).send(any(HttpRequest.class),
                ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    void testBuildRequest() throws Exception {
        OllamaCandidateGenerator generator = new OllamaCandidateGenerator(config, httpClient);

        HttpRequest request = generator.buildRequest("prompt", 100);

        assertEquals("http://ollama.example.test:11434/api/generate", request.uri().toString());
        assertEquals(Duration.ofSeconds(30), request.timeout().orElseThrow());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
    }

    @Test
    void testExtractResponse() throws Exception {
        assertEquals("code", OllamaCandidateGenerator.extractResponse("{\"response\": \"code\"}"));
        assertEquals("", OllamaCandidateGenerator.extractResponse("{\"error\": \"model not found\"}"));
        assertThrows(CandidateGenerationException.class, () -> OllamaCandidateGenerator.extractResponse("nope"));
    }
}
