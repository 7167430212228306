package com.bakureserve.service.session;

import com.bakureserve.model.ConciergeMessage;
import com.bakureserve.model.MessageRole;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConciergeSessionTest {

    @Test
    void staleReplyIsDiscarded() {
        ConciergeSession session = new ConciergeSession("s-1");

        long first = session.beginRequest(ConciergeMessage.user("rooftop"));
        long second = session.beginRequest(ConciergeMessage.user("actually brunch"));

        assertThat(session.completeRequest(first, ConciergeMessage.assistant("late", null, null))).isFalse();
        assertThat(session.completeRequest(second, ConciergeMessage.assistant("fresh", null, null))).isTrue();
        assertThat(session.getMessages())
                .extracting(ConciergeMessage::getText)
                .containsExactly("rooftop", "actually brunch", "fresh");
    }

    @Test
    void transcriptIsAppendOnlySnapshot() {
        ConciergeSession session = new ConciergeSession("s-1");
        session.append(ConciergeMessage.assistant("hello", null, null));

        assertThat(session.getMessages()).hasSize(1);
        assertThat(session.getMessages().get(0).getRole()).isEqualTo(MessageRole.ASSISTANT);
        assertThatThrownBy(() -> session.getMessages().add(ConciergeMessage.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
