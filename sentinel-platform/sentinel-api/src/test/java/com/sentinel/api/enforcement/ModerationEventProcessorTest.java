package com.sentinel.api.enforcement;

import com.sentinel.api.config.TestModerationConfiguration;
import com.sentinel.api.enforcement.ModerationEventProcessor.ModerationEvent;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.core.domain.ModerationAction;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestModerationConfiguration.class)
class ModerationEventProcessorTest {

    @Autowired
    private ModerationEventProcessor processor;

    @Test
    void submitAll_completesEveryEvent() throws Exception {
        List<ModerationEvent> events = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            events.add(new ModerationEvent(UUID.randomUUID(), "good game everyone " + i,
                    ScopeContext.stream(UUID.randomUUID())));
        }

        List<CompletableFuture<EnforcementResult>> futures = processor.submitAll(events);
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        for (CompletableFuture<EnforcementResult> future : futures) {
            EnforcementResult result = future.join();
            assertThat(result.allowed()).isTrue();
            assertThat(result.action()).isEqualTo(ModerationAction.ALLOW);
        }
    }

    @Test
    void failedEvent_completesExceptionally() {
        CompletableFuture<EnforcementResult> future = processor.submit(
                new ModerationEvent(UUID.randomUUID(), "", ScopeContext.stream(UUID.randomUUID())));

        assertThatThrownBy(() -> future.get(30, TimeUnit.SECONDS)).isInstanceOf(Exception.class);
        assertThat(future.isCompletedExceptionally()).isTrue();
    }
}
