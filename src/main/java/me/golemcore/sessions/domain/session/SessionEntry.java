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

import me.golemcore.sessions.domain.memory.LongTermStore;
import me.golemcore.sessions.domain.model.SessionState;

/**
 * Registry record of one session: its state and, once allocated, its unit
 * and long-term memory handle. Mutated only inside
 * {@link SessionRegistry#update(String, java.util.function.Function)}.
 */
public class SessionEntry {

    private final SessionState state;
    private volatile SessionUnit unit;
    private volatile LongTermStore longTermStore;

    public SessionEntry(SessionState state) {
        this.state = state;
    }

    public String sessionId() {
        return state.getSessionId();
    }

    public SessionState state() {
        return state;
    }

    public SessionUnit unit() {
        return unit;
    }

    public LongTermStore longTermStore() {
        return longTermStore;
    }

    public void attach(SessionUnit unit, LongTermStore longTermStore) {
        this.unit = unit;
        this.longTermStore = longTermStore;
    }
}
