package com.scriptdeck.runner;

import com.scriptdeck.runner.api.dto.RunResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full stack: HTTP run request → real bash process → WebSocket viewer.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ScriptDeckApplicationTest {

    @TempDir static Path root;

    @DynamicPropertySource
    static void directories(DynamicPropertyRegistry registry) {
        registry.add("scriptdeck.catalog.scripts-dir", () -> root.resolve("scripts").toString());
        registry.add("scriptdeck.catalog.repos-dir",   () -> root.resolve("repos").toString());
        registry.add("scriptdeck.jobs.logs-dir",       () -> root.resolve("logs").toString());
        registry.add("scriptdeck.stream.poll-interval-ms", () -> "50");
    }

    @LocalServerPort int port;
    @Autowired TestRestTemplate rest;

    @Test
    void runScript_viewerReceivesLogStateAndDone() throws Exception {
        Files.writeString(root.resolve("scripts/hello.sh"), """
                read who
                echo "PROGRESS 50 Greeting"
                echo "hello $who"
                """);

        ResponseEntity<RunResponse> run = rest.postForEntity("/run",
                Map.of("script", "hello.sh", "inputVars", List.of("viewer")), RunResponse.class);
        assertThat(run.getStatusCode()).isEqualTo(HttpStatus.OK);
        String jobId = run.getBody().jobId();

        List<String> messages = collect(jobId);

        assertThat(messages).contains("LOG PROGRESS 50 Greeting", "LOG hello viewer");
        assertThat(messages).anyMatch(m -> m.startsWith("STATE "));
        assertThat(messages.get(messages.size() - 1)).isEqualTo("DONE rc=0");

        ResponseEntity<String> transcript = rest.getForEntity("/logs/{id}.log", String.class, jobId);
        assertThat(transcript.getBody()).isEqualTo("PROGRESS 50 Greeting\nhello viewer\n");
    }

    @Test
    void unknownJob_viewerGetsErrorAndIsClosed() throws Exception {
        List<String> messages = collect("does-not-exist");

        assertThat(messages).containsExactly("ERROR Job not found");
    }

    @Test
    void unknownScript_returns404() {
        ResponseEntity<String> response = rest.postForEntity("/run", Map.of("script", "missing.py"), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    /** Connect a viewer and gather messages until the server closes the stream. */
    private List<String> collect(String jobId) throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        BlockingQueue<Boolean> closed  = new LinkedBlockingQueue<>();
        TextWebSocketHandler handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                received.add(message.getPayload());
            }

            @Override
            public void afterConnectionClosed(WebSocketSession session,
                                              CloseStatus status) {
                closed.add(Boolean.TRUE);
            }
        };

        new StandardWebSocketClient()
                .execute(handler, "ws://localhost:" + port + "/ws/" + jobId)
                .get(5, TimeUnit.SECONDS);

        assertThat(closed.poll(10, TimeUnit.SECONDS)).as("stream closed by server").isTrue();
        List<String> messages = new ArrayList<>();
        received.drainTo(messages);
        return messages;
    }
}
