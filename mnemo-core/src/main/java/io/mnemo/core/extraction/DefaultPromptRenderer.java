package io.mnemo.core.extraction;

import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.ExtractionRequest;
import io.mnemo.core.model.MessageExcerpt;
import io.mnemo.core.model.MoodContext;
import io.mnemo.core.repair.SchemaValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Renders the output contract as the system message and the mood context plus excerpts as the
 * user message. A corrective instruction, when present, is appended as a trailing system message.
 */
public final class DefaultPromptRenderer implements PromptRenderer {
    private static final String INSTRUCTIONS = """
        You extract emotionally significant memories from a conversation.
        Focus on emotional significance and personal growth, relationship dynamics, breakthroughs and
        realizations, support and vulnerability, and moments of joy or struggle.
        Reply with a single JSON object and nothing else.""";

    @Override
    public List<ChatMessage> render(ExtractionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(INSTRUCTIONS + "\n\n" + outputFormat(request.schemaVersion())));
        messages.add(ChatMessage.user(moodSection(request.moodContext()) + "\n\n" + excerptSection(request.excerpts())));
        if (request.corrective()) {
            messages.add(ChatMessage.system(request.correctiveInstruction()));
        }
        return List.copyOf(messages);
    }

    private String outputFormat(String schemaVersion) {
        return "## OUTPUT FORMAT\n\n"
            + "{\n"
            + "  \"schemaVersion\": \"" + schemaVersion + "\",\n"
            + "  \"memories\": [\n"
            + "    {\n"
            + "      \"content\": string (" + SchemaValidator.MIN_CONTENT + "-" + SchemaValidator.MAX_CONTENT + " chars),\n"
            + "      \"emotionalContext\": {\"primaryEmotion\": string, \"secondaryEmotions\": [string] (max "
            + SchemaValidator.MAX_SECONDARY_EMOTIONS + "), \"intensity\": 0..1, \"valence\": -1..1, \"themes\": [string] (max "
            + SchemaValidator.MAX_THEMES + ")},\n"
            + "      \"significance\": {\"overall\": 0..10, \"components\": {name: 0..10}},\n"
            + "      \"relationshipDynamics\": {key: string | number | boolean} (optional),\n"
            + "      \"rationale\": string (max " + SchemaValidator.MAX_RATIONALE + " chars),\n"
            + "      \"confidence\": 0..1\n"
            + "    }\n"
            + "  ]\n"
            + "}\n\n"
            + "Return between " + SchemaValidator.MIN_MEMORIES + " and " + SchemaValidator.MAX_MEMORIES + " memories.\n"
            + "Significance components: " + String.join(", ", new TreeSet<>(SchemaValidator.SIGNIFICANCE_COMPONENTS)) + ".\n"
            + "Relationship keys: " + String.join(", ", new TreeSet<>(SchemaValidator.RELATIONSHIP_KEYS)) + ".";
    }

    private String moodSection(MoodContext mood) {
        StringBuilder section = new StringBuilder("## MOOD CONTEXT\n\n");
        section.append("Mood score: ").append(String.format(Locale.ROOT, "%.1f", mood.score())).append('\n');
        if (!mood.descriptors().isEmpty()) {
            section.append("Descriptors: ").append(String.join(", ", mood.descriptors())).append('\n');
        }
        section.append("Analysis confidence: ").append(Math.round(mood.confidence() * 100)).append('%');
        if (mood.hasDelta()) {
            section.append("\nMood delta: ")
                .append(mood.deltaDirection())
                .append(" (magnitude ")
                .append(String.format(Locale.ROOT, "%.2f", mood.deltaMagnitude()))
                .append(')');
        }
        return section.toString();
    }

    private String excerptSection(List<MessageExcerpt> excerpts) {
        StringBuilder section = new StringBuilder("## CONVERSATION MESSAGES\n");
        for (MessageExcerpt excerpt : excerpts) {
            section.append("\n**").append(excerpt.authorId()).append("**");
            if (excerpt.timestamp() != null) {
                section.append(" (").append(excerpt.timestamp()).append(')');
            }
            section.append(":\n").append(excerpt.content()).append('\n');
        }
        return section.toString();
    }
}
