package io.mnemo.core;

import io.mnemo.core.model.ExtractionRequest;
import io.mnemo.core.model.MessageExcerpt;
import io.mnemo.core.model.MoodContext;
import java.time.Instant;
import java.util.List;

public final class Fixtures {
    public static final String SCHEMA = ExtractionRequest.DEFAULT_SCHEMA_VERSION;

    public static final String MEMORY = """
        {
          "id": "m-1",
          "content": "Alex finally told Sam how much their support meant during the move.",
          "emotionalContext": {
            "primaryEmotion": "gratitude",
            "secondaryEmotions": ["relief"],
            "intensity": 0.8,
            "valence": 0.7,
            "themes": ["support", "friendship"]
          },
          "significance": {
            "overall": 7.5,
            "components": {"emotional_impact": 8, "support_impact": 7}
          },
          "relationshipDynamics": {"trust_level": 8, "support_received": true},
          "rationale": "Explicit gratitude after a stressful period.",
          "confidence": 0.8
        }""";

    public static final String VALID_RESPONSE = "{\"schemaVersion\": \"" + SCHEMA + "\", \"memories\": [" + MEMORY + "]}";

    private Fixtures() {
    }

    public static ExtractionRequest request() {
        return new ExtractionRequest(
            List.of(
                new MessageExcerpt("1", "alex", Instant.parse("2026-02-01T09:00:00Z"),
                    "I honestly could not have done the move without you."),
                new MessageExcerpt("2", "sam", Instant.parse("2026-02-01T09:01:00Z"), "Always here for you.")
            ),
            new MoodContext(7.2, List.of("grateful", "warm"), 0.9, 1.5, "positive"),
            SCHEMA,
            1024
        );
    }
}
