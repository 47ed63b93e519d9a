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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.folio.core.codec.FolioJson;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link SectionGenerator} that posts each request to an external generation service.
 *
 * <p>The endpoint receives the {@link GenerationRequest} as JSON and answers with a
 * {@link GeneratedContent} JSON body. Any non-2xx status, unreadable body or timeout fails the
 * attempt.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpSectionGenerator implements SectionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(HttpSectionGenerator.class);

    private final String endpoint;
    private final WebClient webClient;

    public HttpSectionGenerator(Vertx vertx, String endpoint, long timeoutMs) {
        this.endpoint = endpoint;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setIdleTimeout((int) timeoutMs)
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
            .setUserAgent("Folio-Server/1.0"));
        logger.info("HttpSectionGenerator initialized for {} (timeout={}ms)", endpoint, timeoutMs);
    }

    @Override
    public Future<GeneratedContent> generate(GenerationRequest request) {
        Buffer payload;
        try {
            payload = Buffer.buffer(FolioJson.toJson(request));
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new GenerationException(
                "Cannot encode generation request for section " + request.getSectionId(), e));
        }

        logger.debug("Requesting generation: {}", request);
        return webClient.postAbs(endpoint)
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "application/json")
            .sendBuffer(payload)
            .recover(err -> Future.failedFuture(new GenerationException(
                "Generation endpoint unreachable for section " + request.getSectionId() + ": " + err.getMessage(), err)))
            .compose(response -> decode(response, request));
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public Future<Void> close() {
        webClient.close();
        return Future.succeededFuture();
    }

    private static Future<GeneratedContent> decode(HttpResponse<Buffer> response, GenerationRequest request) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return Future.failedFuture(new GenerationException("Generation endpoint returned HTTP "
                + response.statusCode() + " for section " + request.getSectionId()));
        }
        try {
            GeneratedContent content = FolioJson.mapper().readValue(response.bodyAsString(), GeneratedContent.class);
            if (content == null) {
                return Future.failedFuture(new GenerationException(
                    "Generation endpoint returned an empty body for section " + request.getSectionId()));
            }
            return Future.succeededFuture(content);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Future.failedFuture(new GenerationException(
                "Unreadable generation response for section " + request.getSectionId(), e));
        }
    }
}
