package me.golemcore.sessions.domain.session;

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

import me.golemcore.sessions.domain.model.SessionState;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Registry of live and recently terminated sessions.
 *
 * <p>
 * All mutations are linearized through one lock; callers never see the
 * underlying map.
 */
@Component
public class SessionRegistry {

    private final Object lock = new Object();
    private final Map<String, SessionEntry> entries = new HashMap<>();

    /**
     * @return false if a session with the same id is already registered
     */
    public boolean register(SessionEntry entry) {
        synchronized (lock) {
            return entries.putIfAbsent(entry.sessionId(), entry) == null;
        }
    }

    /**
     * Applies {@code action} to the entry while holding the registry lock.
     *
     * @return the action's result, or empty if the session is unknown
     */
    public <T> Optional<T> update(String sessionId, Function<SessionEntry, T> action) {
        synchronized (lock) {
            SessionEntry entry = entries.get(sessionId);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(entry));
        }
    }

    /**
     * Entry of a session. Read its state through {@link #snapshot(String)}
     * unless inside {@link #update(String, Function)}.
     */
    public Optional<SessionEntry> lookup(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(sessionId));
        }
    }

    public Optional<SessionState> snapshot(String sessionId) {
        synchronized (lock) {
            SessionEntry entry = entries.get(sessionId);
            return entry != null ? Optional.of(entry.state().snapshot()) : Optional.empty();
        }
    }

    /**
     * Snapshots of all sessions, oldest first.
     */
    public List<SessionState> snapshots() {
        synchronized (lock) {
            return entries.values().stream()
                    .map(e -> e.state().snapshot())
                    .sorted(Comparator.comparing(SessionState::getCreatedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder()))
                            .thenComparing(SessionState::getSessionId))
                    .toList();
        }
    }

    public boolean remove(String sessionId) {
        synchronized (lock) {
            return entries.remove(sessionId) != null;
        }
    }

    /**
     * Removes the entry only if it matches {@code condition}.
     */
    public boolean removeIf(String sessionId, Predicate<SessionEntry> condition) {
        synchronized (lock) {
            SessionEntry entry = entries.get(sessionId);
            if (entry != null && condition.test(entry)) {
                entries.remove(sessionId);
                return true;
            }
            return false;
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
