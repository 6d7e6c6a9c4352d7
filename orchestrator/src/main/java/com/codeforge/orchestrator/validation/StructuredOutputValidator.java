package com.codeforge.orchestrator.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a stage's raw text output into a typed artifact, or rejects it with
 * every violated field.
 *
 * The raw text may be bare JSON, a fenced ```json block, or JSON wrapped in
 * {@code <result>} tags. Only shape and required-field presence are checked;
 * whether the content is any good is the Reviewer's business.
 *
 * Stateless and side-effect free: validating the same input twice yields
 * equal artifacts.
 */
@Component
public class StructuredOutputValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputValidator.class);

    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```", Pattern.DOTALL);

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public StructuredOutputValidator(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Validate {@code raw} against {@code schema} and bind it to {@code type}.
     *
     * @throws ValidationException listing every violation found
     */
    public <T> T validate(String raw, OutputSchema schema, Class<T> type) {
        JsonNode node = parse(raw, schema);

        List<String> violations = new ArrayList<>();
        checkObject(node, schema, "", violations);
        if (!violations.isEmpty()) {
            log.debug("{} output rejected with {} violation(s)", schema.name(), violations.size());
            throw new ValidationException(schema.name(), violations);
        }

        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException(schema.name(),
                    "cannot bind to " + type.getSimpleName() + ": " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    private JsonNode parse(String raw, OutputSchema schema) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(schema.name(), "output is empty");
        }
        String json = extractJson(raw)
                .orElseThrow(() -> new ValidationException(schema.name(), "no JSON object found in output"));
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException(schema.name(),
                    "malformed JSON: " + e.getOriginalMessage());
        }
    }

    /** Locate the JSON payload inside free text. */
    static Optional<String> extractJson(String raw) {
        String text = raw.strip();
        if (text.startsWith("{")) {
            return Optional.of(text);
        }
        Matcher fence = JSON_FENCE.matcher(text);
        if (fence.find()) {
            return Optional.of(fence.group(1).strip());
        }
        Matcher result = RESULT_TAG.matcher(text);
        if (result.find()) {
            return Optional.of(result.group(1).strip());
        }
        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return Optional.of(text.substring(start, end + 1));
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Shape checks
    // ------------------------------------------------------------------

    private void checkObject(JsonNode node, OutputSchema schema, String path, List<String> violations) {
        if (node == null || !node.isObject()) {
            violations.add(label(path) + ": expected an object");
            return;
        }
        for (FieldSpec field : schema.fields()) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();
            JsonNode value = node.get(field.name());
            if (value == null || value.isNull()) {
                if (field.required()) {
                    violations.add(fieldPath + ": required field missing");
                }
                continue;
            }
            checkField(value, field, fieldPath, violations);
        }
    }

    private void checkField(JsonNode value, FieldSpec field, String path, List<String> violations) {
        switch (field.type()) {
            case STRING -> {
                if (!value.isTextual()) {
                    violations.add(path + ": expected string but was " + describe(value));
                } else if (field.required() && value.asText().isBlank()) {
                    violations.add(path + ": must not be blank");
                }
            }
            case INTEGER -> {
                if (!value.isIntegralNumber()) {
                    violations.add(path + ": expected integer but was " + describe(value));
                }
            }
            case BOOLEAN -> {
                if (!value.isBoolean()) {
                    violations.add(path + ": expected boolean but was " + describe(value));
                }
            }
            case STRING_LIST -> {
                if (!value.isArray()) {
                    violations.add(path + ": expected array of strings but was " + describe(value));
                    return;
                }
                for (int i = 0; i < value.size(); i++) {
                    if (!value.get(i).isTextual()) {
                        violations.add(path + "[" + i + "]: expected string but was " + describe(value.get(i)));
                    }
                }
            }
            case OBJECT -> checkObject(value, field.nested(), path, violations);
            case OBJECT_LIST -> {
                if (!value.isArray()) {
                    violations.add(path + ": expected array of objects but was " + describe(value));
                    return;
                }
                for (int i = 0; i < value.size(); i++) {
                    checkObject(value.get(i), field.nested(), path + "[" + i + "]", violations);
                }
            }
        }
    }

    private static String label(String path) {
        return path.isEmpty() ? "$" : path;
    }

    private static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }
}
