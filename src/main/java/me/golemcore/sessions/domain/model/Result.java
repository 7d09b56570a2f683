package me.golemcore.sessions.domain.model;

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
import lombok.Data;

import java.util.Map;
import java.util.function.Function;

/**
 * Outcome of a session or memory operation: either a value or a typed error.
 *
 * <p>
 * Service APIs return results instead of throwing, so a single bad request
 * never takes down the caller. Factory methods {@link #ok(Object)} and
 * {@link #error(ErrorCode, String)} provide convenient construction.
 *
 * @param <T>
 *            value type
 */
@Data
@Builder
public class Result<T> {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private T value;
    private ErrorCode errorCode;
    private String message;
    private Map<String, Object> details;

    public static <T> Result<T> ok(T value) {
        return Result.<T>builder()
                .success(true)
                .value(value)
                .build();
    }

    public static <T> Result<T> error(ErrorCode code, String message) {
        return Result.<T>builder()
                .success(false)
                .errorCode(code)
                .message(message)
                .details(Map.of())
                .build();
    }

    public static <T> Result<T> error(ErrorCode code, String message, Map<String, Object> details) {
        return Result.<T>builder()
                .success(false)
                .errorCode(code)
                .message(message)
                .details(details != null ? details : Map.of())
                .build();
    }

    /**
     * Re-types a failed result so it can be returned from a caller with a
     * different value type.
     */
    public <R> Result<R> propagate() {
        if (success) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return Result.error(errorCode, message, details);
    }

    public <R> Result<R> map(Function<T, R> mapper) {
        return success ? Result.ok(mapper.apply(value)) : propagate();
    }

    /**
     * Returns the value or throws {@link SessionException} carrying the error.
     */
    public T orElseThrow() {
        if (!success) {
            throw new SessionException(errorCode, message, details);
        }
        return value;
    }
}
