/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.folio.server.generation;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpSectionGenerator against a real stub generation endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class HttpSectionGeneratorTest {

    private HttpServer stubServer;
    private HttpSectionGenerator generator;

    private AtomicInteger responseStatus;
    private AtomicReference<String> responseBody;
    private AtomicReference<JsonObject> lastRequest;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        responseStatus = new AtomicInteger(200);
        responseBody = new AtomicReference<>("{}");
        lastRequest = new AtomicReference<>();

        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.post("/generate").handler(ctx -> {
            lastRequest.set(ctx.body().asJsonObject());
            ctx.response()
                .setStatusCode(responseStatus.get())
                .putHeader("content-type", "application/json")
                .end(responseBody.get());
        });

        vertx.createHttpServer()
            .requestHandler(router)
            .listen(0)
            .onSuccess(server -> {
                stubServer = server;
                generator = new HttpSectionGenerator(vertx,
                    "http://localhost:" + server.actualPort() + "/generate", 5000);
                testContext.completeNow();
            })
            .onFailure(testContext::failNow);
    }

    @BeforeEach
    void resetStub() {
        responseStatus.set(200);
        responseBody.set("{}");
        lastRequest.set(null);
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        if (generator != null) {
            generator.close();
        }
        if (stubServer != null) {
            stubServer.close().onComplete(ar -> testContext.completeNow());
        } else {
            testContext.completeNow();
        }
    }

    private static GenerationRequest request() {
        return new GenerationRequest("session-1", "findings", "Findings", "What we found",
            1, "Add numbers", Map.of("intro", "Intro text"));
    }

    @Test
    @DisplayName("Posts the request as snake_case JSON and decodes the content")
    void testGenerate(VertxTestContext testContext) {
        responseBody.set(new JsonObject().put("content", "## Findings").put("model_name", "gpt-x").encode());

        generator.generate(request()).onComplete(testContext.succeeding(content -> testContext.verify(() -> {
            assertEquals("## Findings", content.getContent());
            assertEquals("gpt-x", content.getModelName());

            JsonObject sent = lastRequest.get();
            assertEquals("session-1", sent.getString("session_id"));
            assertEquals("findings", sent.getString("section_id"));
            assertEquals(1, sent.getInteger("revision"));
            assertEquals("Add numbers", sent.getString("feedback"));
            assertEquals("Intro text", sent.getJsonObject("dependency_contents").getString("intro"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("A non-2xx answer fails the attempt")
    void testServerError(VertxTestContext testContext) {
        responseStatus.set(503);

        generator.generate(request()).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(GenerationException.class, err);
            assertTrue(err.getMessage().contains("503"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("An unreadable body fails the attempt")
    void testUnreadableBody(VertxTestContext testContext) {
        responseBody.set("not json");

        generator.generate(request()).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(GenerationException.class, err);
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("An unreachable endpoint fails the attempt")
    void testUnreachable(Vertx vertx, VertxTestContext testContext) {
        HttpSectionGenerator unreachable = new HttpSectionGenerator(vertx, "http://localhost:1/generate", 2000);

        unreachable.generate(request()).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(GenerationException.class, err);
            unreachable.close();
            testContext.completeNow();
        })));
    }
}
