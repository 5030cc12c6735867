package com.toolport.actor.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolport.actor.ToolActor;
import com.toolport.catalog.ToolCatalog;
import com.toolport.executor.ToolExecutor;
import com.toolport.shared.config.ActorConfig;
import com.toolport.toolkits.math.MathTools;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HttpServerRouterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SECRET = "worker-secret";

    private HttpServerRouter router;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());
        var actor = new ToolActor(catalog, new ToolExecutor(),
                new ActorConfig("/actor", SECRET, false, true, ActorConfig.HOST_PLAIN, 0));

        router = new HttpServerRouter("127.0.0.1", 0, 2);
        actor.registerRoutes(router);
        router.start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + router.port() + path);
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> invoke(String body, String secret) throws Exception {
        var builder = HttpRequest.newBuilder(uri("/actor/tools/invoke"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (secret != null) {
            builder.header("Authorization", "Bearer " + secret);
        }
        return send(builder.build());
    }

    @Test
    void servesHealthWithoutAuth() throws Exception {
        var response = send(HttpRequest.newBuilder(uri("/actor/health")).GET().build());

        assertEquals(200, response.statusCode());
        assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");
        var body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals(7, body.get("tool_count").asInt());
    }

    @Test
    void invokesToolEndToEnd() throws Exception {
        var response = invoke("{\"tool\": {\"name\": \"Multiply\", \"version\": \"0.1.0\"},"
                + " \"invocation_id\": \"abc\", \"inputs\": {\"a\": 6, \"b\": 7}}", SECRET);

        assertEquals(200, response.statusCode());
        var body = MAPPER.readTree(response.body());
        assertTrue(body.get("success").asBoolean());
        assertEquals(42, body.at("/output/value").asInt());
        assertEquals("abc", body.get("invocation_id").asText());
    }

    @Test
    void rejectsMissingSecret() throws Exception {
        var response = invoke("{\"tool\": {\"name\": \"Add\"}, \"inputs\": {\"a\": 1, \"b\": 2}}", null);

        assertEquals(401, response.statusCode());
        assertEquals("unauthorized", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void rejectsMalformedBody() throws Exception {
        var response = invoke("{\"tool\": ", SECRET);
        assertEquals(400, response.statusCode());
    }

    @Test
    void missingSecretWinsOverMalformedBody() throws Exception {
        var response = invoke("{not json", null);

        assertEquals(401, response.statusCode());
        assertEquals("unauthorized", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        var response = send(HttpRequest.newBuilder(uri("/actor/nope")).GET().build());
        assertEquals(404, response.statusCode());
    }

    @Test
    void wrongMethodIsNotAllowed() throws Exception {
        var response = send(HttpRequest.newBuilder(uri("/actor/health"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        assertEquals(405, response.statusCode());
    }

    @Test
    void passesQueryParameters() throws Exception {
        var response = send(HttpRequest.newBuilder(uri("/actor/tools/definition?name=Math.Divide&format=openai"))
                .header("Authorization", "Bearer " + SECRET)
                .GET()
                .build());

        assertEquals(200, response.statusCode());
        assertEquals("Math_Divide", MAPPER.readTree(response.body()).at("/function/name").asText());
    }
}
