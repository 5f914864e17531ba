package me.golemcore.pulse.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Deterministic outcome of executing a routing decision. Failures carry the
 * last error kind and a message that can be shown to the user as-is.
 */
@Value
@Builder
public class InvocationResult {

    boolean success;
    String text;
    String modelId;
    ErrorKind errorKind;
    String userMessage;
    List<String> attemptedModels;
    int attempts;

    public static InvocationResult succeeded(String modelId, String text, List<String> attemptedModels,
            int attempts) {
        return InvocationResult.builder()
                .success(true)
                .modelId(modelId)
                .text(text)
                .attemptedModels(List.copyOf(attemptedModels))
                .attempts(attempts)
                .build();
    }

    public static InvocationResult failed(ErrorKind errorKind, List<String> attemptedModels, int attempts) {
        return InvocationResult.builder()
                .success(false)
                .errorKind(errorKind)
                .userMessage(errorKind.getUserMessage())
                .attemptedModels(List.copyOf(attemptedModels))
                .attempts(attempts)
                .build();
    }
}
