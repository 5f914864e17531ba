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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Envelope for storage reads.
 * <p>
 * {@code degraded} is set when the value came from the backup tier because the
 * primary could not be used. {@code errorKind} is set only when no tier could
 * answer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReadResult<T> {

    T value;
    boolean degraded;
    ErrorKind errorKind;

    public static <T> ReadResult<T> of(T value) {
        return new ReadResult<>(value, false, null);
    }

    public static <T> ReadResult<T> degraded(T value) {
        return new ReadResult<>(value, true, null);
    }

    public static <T> ReadResult<T> failed(ErrorKind errorKind) {
        return new ReadResult<>(null, true, errorKind);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
