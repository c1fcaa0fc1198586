package io.strata.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.strata.core.archive.PayloadRedaction;
import io.strata.core.privacy.PiiRedactor;
import java.util.Objects;

/**
 * Redacts archived {@link MemoryItem} payloads field by field. Only the turn's text, entities and
 * topics are scrubbed; ids, timestamps and scores are written back untouched so the payload stays
 * a readable item. Anything that is not item JSON is redacted as plain text.
 */
public final class ItemPayloadRedactor implements PayloadRedaction {
    private final PiiRedactor redactor;
    private final ObjectMapper mapper = new ObjectMapper();

    public ItemPayloadRedactor(PiiRedactor redactor) {
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
    }

    @Override
    public String redact(String payload) {
        if (payload == null || !payload.startsWith("{")) {
            return redactor.redact(payload);
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return redactor.redact(payload);
        }
        if (!(root.get("content") instanceof ObjectNode content)) {
            return redactor.redact(payload);
        }

        JsonNode text = content.get("text");
        if (text != null && text.isTextual()) {
            content.put("text", redactor.redact(text.asText()));
        }
        redactValues(content, "entities");
        redactValues(content, "topics");
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize redacted item payload", e);
        }
    }

    private void redactValues(ObjectNode content, String field) {
        if (!(content.get(field) instanceof ArrayNode values)) {
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).isTextual()) {
                values.set(i, TextNode.valueOf(redactor.redact(values.get(i).asText())));
            }
        }
    }
}
