package me.golemcore.sessions;

import me.golemcore.sessions.domain.model.CreateSessionOptions;
import me.golemcore.sessions.domain.model.Result;
import me.golemcore.sessions.domain.model.SessionStatus;
import me.golemcore.sessions.domain.service.SessionLifecycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "sessions.storage.local.base-path=target/test-workspace",
        "sessions.lifecycle.idle-check-interval-seconds=0"
})
class SessionsApplicationTest {

    @Autowired
    private SessionLifecycleService lifecycleService;

    @Test
    void shouldCreateAndTerminateSessionThroughWiredContext() {
        Result<String> created = lifecycleService.create(CreateSessionOptions.defaults());
        assertTrue(created.isSuccess());

        String sessionId = created.getValue();
        assertEquals(SessionStatus.ACTIVE, lifecycleService.getInfo(sessionId).getValue().getStatus());
        assertTrue(lifecycleService.terminate(sessionId).isSuccess());
    }
}
