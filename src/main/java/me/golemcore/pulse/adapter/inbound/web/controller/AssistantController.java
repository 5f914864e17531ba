package me.golemcore.pulse.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.pulse.adapter.inbound.web.dto.AskRequest;
import me.golemcore.pulse.adapter.inbound.web.dto.AskResponse;
import me.golemcore.pulse.adapter.inbound.web.dto.MemoryRequest;
import me.golemcore.pulse.adapter.inbound.web.dto.SearchHitDto;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.RoutingDecision;
import me.golemcore.pulse.domain.model.SystemStatus;
import me.golemcore.pulse.domain.model.WriteAck;
import me.golemcore.pulse.domain.service.OrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Chat, history, search and status endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AssistantController {

    private final OrchestratorService orchestrator;

    @PostMapping("/chat")
    public Mono<ResponseEntity<AskResponse>> chat(@RequestBody AskRequest request) {
        return Mono.fromFuture(() -> orchestrator.ask(request.getSessionId(), request.getMessage(),
                request.getModel()))
                .map(reply -> {
                    AskResponse response = AskResponse.from(reply);
                    if (reply.getResult().getErrorKind() == ErrorKind.VALIDATION) {
                        return ResponseEntity.badRequest().body(response);
                    }
                    return ResponseEntity.ok(response);
                });
    }

    @DeleteMapping("/chat/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String sessionId) {
        boolean cancelled = orchestrator.cancel(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of("sessionId", sessionId, "cancelled", cancelled)));
    }

    @GetMapping("/route")
    public Mono<ResponseEntity<?>> route(@RequestParam("q") String query,
            @RequestParam(value = "model", required = false) String model,
            @RequestParam(value = "intent", required = false) String intent) {
        if (query == null || query.isBlank()) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, ErrorKind.VALIDATION, "'q' is required"));
        }
        return Mono.fromCallable(() -> {
            RoutingDecision decision = orchestrator.route(query, model, intent);
            return ResponseEntity.ok(decision);
        });
    }

    @GetMapping("/history/{id}")
    public Mono<ResponseEntity<?>> history(@PathVariable String id) {
        return Mono.fromFuture(() -> orchestrator.historyRead(id))
                .map(result -> {
                    if (!result.isSuccess()) {
                        return failure(result);
                    }
                    if (result.getValue() == null) {
                        return error(HttpStatus.NOT_FOUND, null, "Entity not found: " + id);
                    }
                    return ResponseEntity.ok(result.getValue());
                });
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<?>> search(@RequestParam("q") String query,
            @RequestParam(value = "k", defaultValue = "0") int k) {
        return Mono.fromFuture(() -> orchestrator.semanticSearch(query, k))
                .map(result -> {
                    if (!result.isSuccess()) {
                        return failure(result);
                    }
                    List<SearchHitDto> hits = result.getValue().stream().map(SearchHitDto::from).toList();
                    return ResponseEntity.ok(hits);
                });
    }

    @PostMapping("/memories")
    public Mono<ResponseEntity<WriteAck>> addMemory(@RequestBody MemoryRequest request) {
        return Mono.fromFuture(() -> orchestrator.addMemory(request.getSessionId(), request.getCategory(),
                request.getContent()))
                .map(ack -> {
                    if (ack.isSuccess()) {
                        return ResponseEntity.ok(ack);
                    }
                    HttpStatus status = ack.getErrorKind() == ErrorKind.VALIDATION
                            ? HttpStatus.BAD_REQUEST
                            : HttpStatus.SERVICE_UNAVAILABLE;
                    return ResponseEntity.status(status).body(ack);
                });
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<SystemStatus>> status() {
        return Mono.fromFuture(orchestrator::getStatus).map(ResponseEntity::ok);
    }

    private static ResponseEntity<ApiErrorResponse> failure(ReadResult<?> result) {
        ErrorKind kind = result.getErrorKind();
        HttpStatus status = kind == ErrorKind.VALIDATION ? HttpStatus.BAD_REQUEST : HttpStatus.SERVICE_UNAVAILABLE;
        return error(status, kind, kind.getUserMessage());
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.builder()
                .status(status.value())
                .errorKind(kind != null ? kind.name() : null)
                .message(message)
                .build());
    }
}
