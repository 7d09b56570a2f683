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
 * Events emitted by the session runtime. Global events go to the shared
 * stream, session events to the per-session stream, {@code BOTH} to each.
 */
public enum SessionEventType {

    SESSION_CREATED("session_created", Scope.GLOBAL),
    SESSION_TERMINATED("session_terminated", Scope.GLOBAL),
    SESSION_STATUS("session_status", Scope.BOTH),
    CONVERSATION_ADDED("conversation_added", Scope.SESSION),
    CONVERSATION_CLEARED("conversation_cleared", Scope.SESSION),
    MEMORY_PROMOTED("memory_promoted", Scope.SESSION),
    MEMORY_STORED("memory_stored", Scope.SESSION);

    private final String value;
    private final Scope scope;

    SessionEventType(String value, Scope scope) {
        this.value = value;
        this.scope = scope;
    }

    public String value() {
        return value;
    }

    public boolean isGlobal() {
        return scope != Scope.SESSION;
    }

    public boolean isSessionScoped() {
        return scope != Scope.GLOBAL;
    }

    private enum Scope {
        GLOBAL, SESSION, BOTH
    }
}
