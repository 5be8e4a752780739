package io.mnemo.core.repair;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemo.core.metrics.MetricsSink;
import io.mnemo.core.provider.ProviderException;
import io.mnemo.core.retry.ErrorKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw model text into a validated {@link io.mnemo.core.model.ExtractionResult}. Each pass
 * builds on the previous pass's text; the first candidate that validates wins.
 */
public final class ResponseRepairPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ResponseRepairPipeline.class);

    private final ObjectMapper mapper;
    private final SchemaValidator validator;
    private final MetricsSink metrics;

    public ResponseRepairPipeline(ObjectMapper mapper, SchemaValidator validator, MetricsSink metrics) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.metrics = metrics == null ? MetricsSink.noop() : metrics;
    }

    public ResponseRepairPipeline(MetricsSink metrics) {
        this(new ObjectMapper(), new SchemaValidator(), metrics);
    }

    public RepairResult repair(String raw, String expectedVersion) {
        String text = raw == null ? "" : raw.trim();
        List<JsonNode> parsed = new ArrayList<>();
        List<String> lastErrors = List.of("empty response");

        ValidationResult direct = attempt(RepairPass.DIRECT, text, expectedVersion, parsed);
        if (direct.valid()) {
            return new RepairResult(direct.result(), RepairPass.DIRECT, List.of());
        }
        lastErrors = direct.errors();

        String stripped = stripProse(text);
        if (!stripped.equals(text)) {
            ValidationResult result = attempt(RepairPass.STRIP_PROSE, stripped, expectedVersion, parsed);
            if (result.valid()) {
                return success(RepairPass.STRIP_PROSE, result);
            }
            lastErrors = result.errors();
        }

        String balanced = balance(stripped);
        if (!balanced.equals(stripped)) {
            ValidationResult result = attempt(RepairPass.BALANCE, balanced, expectedVersion, parsed);
            if (result.valid()) {
                return success(RepairPass.BALANCE, result);
            }
            lastErrors = result.errors();
        }

        for (JsonNode candidate : parsed) {
            JsonNode adapted = adaptLegacy(candidate, expectedVersion);
            if (adapted == null) {
                continue;
            }
            ValidationResult result = validate(adapted, expectedVersion);
            if (result.valid()) {
                return success(RepairPass.LEGACY_ADAPT, result);
            }
            lastErrors = result.errors();
        }

        metrics.recordRepairAttempt("exhausted", false);
        LOG.warn("Response could not be repaired into schema {}: {}", expectedVersion, lastErrors);
        return new RepairResult(null, null, lastErrors);
    }

    /**
     * Like {@link #repair} but throws a {@code parsing} failure when no pass validates.
     */
    public RepairResult repairOrThrow(String raw, String expectedVersion) {
        RepairResult result = repair(raw, expectedVersion);
        if (!result.success()) {
            throw new ProviderException(ErrorKind.PARSING, "Response failed schema validation: " + result.errors());
        }
        return result;
    }

    private RepairResult success(RepairPass pass, ValidationResult result) {
        metrics.recordRepairAttempt(pass.code(), true);
        LOG.debug("Response repaired by pass {}", pass.code());
        return new RepairResult(result.result(), pass, List.of());
    }

    private ValidationResult attempt(RepairPass pass, String text, String expectedVersion, List<JsonNode> parsed) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid(List.of(pass.code() + ": not valid JSON (" + e.getOriginalMessage() + ")"));
        }
        if (root == null || root.isMissingNode()) {
            return ValidationResult.invalid(List.of(pass.code() + ": no JSON content"));
        }
        parsed.add(root);
        return validate(root, expectedVersion);
    }

    private ValidationResult validate(JsonNode root, String expectedVersion) {
        ValidationResult result = validator.validate(root, expectedVersion);
        metrics.recordSchemaValidation(result.valid());
        return result;
    }

    static String stripProse(String text) {
        String body = text;
        int fence = body.indexOf("```");
        if (fence >= 0) {
            int lineEnd = body.indexOf('\n', fence);
            int close = lineEnd < 0 ? -1 : body.indexOf("```", lineEnd);
            if (lineEnd >= 0) {
                body = close < 0 ? body.substring(lineEnd + 1) : body.substring(lineEnd + 1, close);
            }
        }
        int start = body.indexOf('{');
        if (start < 0) {
            return body.trim();
        }
        int end = body.lastIndexOf('}');
        return end > start ? body.substring(start, end + 1) : body.substring(start).trim();
    }

    /**
     * Drops trailing commas, quotes bare keys, closes an open string and appends missing closing
     * brackets in nesting order. Anything after the outermost value is discarded.
     */
    static String balance(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        Deque<Character> closers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        boolean expectKey = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (expectKey && (Character.isLetter(c) || c == '_' || c == '$')) {
                int end = i;
                while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_'
                    || text.charAt(end) == '$')) {
                    end++;
                }
                int next = end;
                while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
                    next++;
                }
                if (next < text.length() && text.charAt(next) == ':') {
                    out.append('"').append(text, i, end).append('"');
                    i = end;
                    expectKey = false;
                    continue;
                }
            }
            switch (c) {
                case '"' -> {
                    inString = true;
                    expectKey = false;
                    out.append(c);
                }
                case '{' -> {
                    closers.push('}');
                    expectKey = true;
                    out.append(c);
                }
                case '[' -> {
                    closers.push(']');
                    expectKey = false;
                    out.append(c);
                }
                case '}', ']' -> {
                    dropTrailingComma(out);
                    if (!closers.isEmpty() && closers.peek() == c) {
                        closers.pop();
                        out.append(c);
                    }
                    expectKey = false;
                }
                case ',' -> {
                    expectKey = !closers.isEmpty() && closers.peek() == '}';
                    out.append(c);
                }
                default -> {
                    if (!Character.isWhitespace(c)) {
                        expectKey = false;
                    }
                    out.append(c);
                }
            }
            i++;
            if (closers.isEmpty() && out.length() > 0 && (c == '}' || c == ']')) {
                break;
            }
        }
        if (inString) {
            if (escaped) {
                out.setLength(out.length() - 1);
            }
            out.append('"');
        }
        trimDangling(out);
        while (!closers.isEmpty()) {
            dropTrailingComma(out);
            out.append(closers.pop());
        }
        return out.toString();
    }

    private static void dropTrailingComma(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        if (end > 0 && out.charAt(end - 1) == ',') {
            out.setLength(end - 1);
        }
    }

    private static void trimDangling(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        out.setLength(end);
        if (end > 0 && out.charAt(end - 1) == ':') {
            out.append("null");
        }
    }

    /**
     * Converts {@code {schemaVersion, memory:{...}}} into the plural form and fills in a missing
     * schema version. Returns {@code null} when there is nothing to adapt.
     */
    private JsonNode adaptLegacy(JsonNode root, String expectedVersion) {
        if (!root.isObject()) {
            return null;
        }
        boolean singular = root.path("memory").isObject() && !root.has("memories");
        boolean missingVersion = !root.has("schemaVersion");
        if (!singular && !missingVersion) {
            return null;
        }
        ObjectNode adapted = mapper.createObjectNode();
        adapted.put("schemaVersion", missingVersion ? expectedVersion : root.path("schemaVersion").asText());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("memory".equals(field.getKey()) && singular) {
                ArrayNode memories = adapted.putArray("memories");
                memories.add(field.getValue().deepCopy());
            } else if (!"schemaVersion".equals(field.getKey())) {
                adapted.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return adapted;
    }
}
