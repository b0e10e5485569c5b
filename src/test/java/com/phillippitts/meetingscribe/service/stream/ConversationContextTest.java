package com.phillippitts.meetingscribe.service.stream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationContextTest {

    @Test
    void splitsDeliveredTextIntoSentences() {
        ConversationContext context = new ConversationContext(30);

        context.record("Welcome everyone. Shall we start? Sure");

        assertThat(context.history()).containsExactly("Welcome everyone.", "Shall we start?", "Sure");
        assertThat(context.prompt()).isEqualTo("Welcome everyone. Shall we start? Sure");
    }

    @Test
    void keepsAbbreviationsInsideTheirSentence() {
        ConversationContext context = new ConversationContext(30);

        context.record("Ask Mr. Smith about it, e.g. tomorrow. Then decide.");

        assertThat(context.history()).containsExactly("Ask Mr. Smith about it, e.g. tomorrow.", "Then decide.");
    }

    @Test
    void dropsOldestSentencesBeyondHistorySize() {
        ConversationContext context = new ConversationContext(2);

        context.record("One.");
        context.record("Two. Three.");

        assertThat(context.history()).containsExactly("Two.", "Three.");
        assertThat(context.prompt()).isEqualTo("Two. Three.");
    }

    @Test
    void ignoresBlankText() {
        ConversationContext context = new ConversationContext(5);

        context.record("   ");
        context.record(null);

        assertThat(context.size()).isZero();
        assertThat(context.prompt()).isEmpty();
    }

    @Test
    void disabledContextRecordsNothing() {
        ConversationContext context = ConversationContext.disabled();

        context.record("Anything.");

        assertThat(context.history()).isEmpty();
        assertThat(context.historySize()).isZero();
    }

    @Test
    void rejectsNegativeHistorySize() {
        assertThatThrownBy(() -> new ConversationContext(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
