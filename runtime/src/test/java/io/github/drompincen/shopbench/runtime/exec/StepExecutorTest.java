package io.github.drompincen.shopbench.runtime.exec;

import io.github.drompincen.shopbench.protocol.api.ModelResponse;
import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import io.github.drompincen.shopbench.runtime.llm.ModelCallException;
import io.github.drompincen.shopbench.runtime.llm.ModelClientRegistry;
import io.github.drompincen.shopbench.runtime.llm.StubModelClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.github.drompincen.shopbench.runtime.plan.TestSteps.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepExecutorTest {

    private static final PlatformConfig CONFIG = new PlatformConfig("https://x", "key", "model");

    private StubModelClient chatgpt;
    private StubModelClient claude;
    private RecordingSleeper sleeper;
    private StepExecutor executor;

    @BeforeEach
    void setUp() {
        chatgpt = new StubModelClient("CHATGPT");
        claude = new StubModelClient("CLAUDE");
        sleeper = new RecordingSleeper();
        executor = new StepExecutor(new ModelClientRegistry(List.of(chatgpt, claude)),
                RetryPolicy.defaults(), ThrottlePolicy.defaults(), sleeper);
    }

    @Test
    void successOnFirstAttemptDoesNotSleep() {
        chatgpt.thenReturn("ok");

        ModelResponse response = executor.execute(step("Q1", "CHATGPT", "1", "1", "hi"), new ConversationHistory(), CONFIG);

        assertThat(response.raw()).isEqualTo("ok");
        assertThat(response.text()).isEqualTo("ok");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void promptCarriesConversationTranscript() {
        ConversationHistory history = new ConversationHistory();
        history.append("A", "B");

        executor.execute(step("Q1", "chatgpt", "2", "2", "C"), history, CONFIG);

        assertThat(chatgpt.prompts()).containsExactly("User: A\nAssistant: B\nUser: C");
    }

    @Test
    void retriesWithLinearBackoffThenSucceeds() {
        chatgpt.thenThrow(new ModelCallException("boom 1", null))
                .thenThrow(new ModelCallException("boom 2", null))
                .thenReturn("third time");

        ModelResponse response = executor.execute(step("Q1", "CHATGPT", "1", "1", "hi"), new ConversationHistory(), CONFIG);

        assertThat(response.raw()).isEqualTo("third time");
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
        assertThat(chatgpt.prompts()).hasSize(3);
    }

    @Test
    void exhaustedRetriesCarryTheLastFailure() {
        ModelCallException last = new ModelCallException("third failure", null);
        chatgpt.thenThrow(new ModelCallException("first", null))
                .thenThrow(new ModelCallException("second", null))
                .thenThrow(last);

        assertThatThrownBy(() -> executor.execute(step("Q1", "CHATGPT", "1", "1", "hi"), new ConversationHistory(), CONFIG))
                .isInstanceOf(RetriesExhaustedException.class)
                .hasCause(last)
                .satisfies(e -> assertThat(((RetriesExhaustedException) e).attempts()).isEqualTo(3));
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    @Test
    void missingConfigFailsImmediatelyWithoutRetry() {
        assertThatThrownBy(() -> executor.execute(step("Q1", "CHATGPT", "1", "1", "hi"), new ConversationHistory(), null))
                .isInstanceOf(PreconditionException.class)
                .hasMessage("Missing config for platform_id=CHATGPT");
        assertThat(chatgpt.prompts()).isEmpty();
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void unknownPlatformIsAPrecondition() {
        assertThatThrownBy(() -> executor.execute(step("Q1", "MYSTERY", "1", "1", "hi"), new ConversationHistory(), CONFIG))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("MYSTERY");
    }

    @Test
    void claudeIsThrottledAfterSuccess() {
        executor.execute(step("Q1", "CLAUDE", "1", "1", "hi"), new ConversationHistory(), CONFIG);

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(10));
    }

    @Test
    void throttleIsNotAppliedWhenEveryAttemptFails() {
        claude.thenThrow(new ModelCallException("a", null))
                .thenThrow(new ModelCallException("b", null))
                .thenThrow(new ModelCallException("c", null));

        assertThatThrownBy(() -> executor.execute(step("Q1", "CLAUDE", "1", "1", "hi"), new ConversationHistory(), CONFIG))
                .isInstanceOf(RetriesExhaustedException.class);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        StepExecutor single = new StepExecutor(new ModelClientRegistry(List.of(chatgpt)),
                new RetryPolicy(0, Duration.ofSeconds(5)), new ThrottlePolicy(Map.of()), sleeper);
        chatgpt.thenThrow(new ModelCallException("only", null));

        assertThatThrownBy(() -> single.execute(step("Q1", "CHATGPT", "1", "1", "hi"), new ConversationHistory(), CONFIG))
                .isInstanceOf(RetriesExhaustedException.class);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void retryPolicyRejectsNegativeCount() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThat(RetryPolicy.defaults().delayAfter(3)).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void throttleLookupIsCaseInsensitive() {
        assertThat(ThrottlePolicy.defaults().delayFor("claude")).isEqualTo(Duration.ofSeconds(10));
        assertThat(ThrottlePolicy.defaults().delayFor("GEMINI")).isEqualTo(Duration.ZERO);
    }
}
