package io.strata.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.strata.core.privacy.PiiRedactor;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ItemPayloadRedactorTest {
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final ItemPayloadRedactor redactor = new ItemPayloadRedactor(new PiiRedactor());

    @Test
    void shouldRedactOnlyTurnFieldsOfAnItemPayload() throws Exception {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        MemoryItem item = new MemoryItem(
            "item-1",
            "alice",
            "s1",
            new TurnContent(
                "mail jane@example.com about the refund",
                List.of("jane@example.com", "Porto"),
                List.of("refund"),
                new TurnSignals(3.0, 3.0, 3.0, 1)
            ),
            3.519860385419959,
            at,
            at,
            MemoryTier.COLD,
            0
        );

        String redacted = redactor.redact(mapper.writeValueAsString(item));
        MemoryItem restored = mapper.readValue(redacted, MemoryItem.class);

        assertThat(restored.content().text()).isEqualTo("mail [REDACTED_EMAIL] about the refund");
        assertThat(restored.content().entities()).containsExactly("[REDACTED_EMAIL]", "Porto");
        assertThat(restored.content().topics()).containsExactly("refund");
        assertThat(restored.importance()).isEqualTo(3.519860385419959);
        assertThat(restored.id()).isEqualTo("item-1");
        assertThat(restored.createdAt()).isEqualTo(at);
        assertThat(redactor.redact(redacted)).isEqualTo(redacted);
    }

    @Test
    void shouldRedactPlainTextPayloads() {
        assertThat(redactor.redact("call me at 555-123-4567")).isEqualTo("call me at [REDACTED_PHONE]");
        assertThat(redactor.redact("{not json, mail bob@example.org")).isEqualTo("{not json, mail [REDACTED_EMAIL]");
    }
}
