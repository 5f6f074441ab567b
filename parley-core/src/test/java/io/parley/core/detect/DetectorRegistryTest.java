package io.parley.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DetectorRegistryTest {

    @Test
    void shouldResolveIdsIgnoringCaseAndSeparators() {
        DetectorRegistry registry = new DetectorRegistry()
            .register(new SystemFailureDetector())
            .register(new DialogueOfTheDeafDetector());

        assertThat(registry.find("System-Failure")).containsInstanceOf(SystemFailureDetector.class);
        assertThat(registry.find(" dialogue_of_the_deaf ")).isPresent();
        assertThat(registry.find("conversation_flow")).isEmpty();
    }

    @Test
    void shouldResolveAliasesAndKeepRegistrationOrder() {
        DetectorRegistry registry = new DetectorRegistry()
            .register(new ConversationFlowDetector())
            .register(new SystemFailureDetector())
            .alias(ConversationFlowDetector.LEGACY_ID, ConversationFlowDetector.ID);

        assertThat(registry.find("flow-discontinuation")).containsInstanceOf(ConversationFlowDetector.class);
        assertThat(registry.all())
            .extracting(Detector::id)
            .containsExactly(ConversationFlowDetector.ID, SystemFailureDetector.ID);
    }
}
