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

/**
 * Error codes returned by session and memory operations.
 *
 * <p>
 * Every failed {@link Result} carries one of these codes together with a
 * human-readable message and optional details (offending field, value).
 */
public enum ErrorCode {

    MISSING_FIELDS("missing_fields"),
    INVALID_TYPE("invalid_type"),
    EMPTY_FIELD("empty_field"),
    INVALID_TRANSITION("invalid_transition"),
    INVALID_IMPORTANCE("invalid_importance"),
    INVALID_SESSION_ID("invalid_session_id"),
    DATA_TOO_LARGE("data_too_large"),
    SESSION_NOT_FOUND("session_not_found"),
    MEMORY_NOT_FOUND("memory_not_found"),
    SAVED_SESSION_NOT_FOUND("saved_session_not_found"),
    QUEUE_FULL("queue_full"),
    EMPTY("empty"),
    TIMEOUT("timeout"),
    HANDLE_CLOSED("handle_closed"),
    PROMOTION_IN_PROGRESS("promotion_in_progress"),
    CONVERSATION_LIMIT("conversation_limit"),
    SESSION_UNAVAILABLE("session_unavailable"),
    STORAGE_FAILURE("storage_failure");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether the error is caused by bad input rather than runtime state.
     */
    public boolean isValidationError() {
        return this == MISSING_FIELDS || this == INVALID_TYPE || this == EMPTY_FIELD
                || this == INVALID_IMPORTANCE || this == INVALID_SESSION_ID || this == DATA_TOO_LARGE;
    }
}
