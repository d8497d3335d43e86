package uk.gegc.quizforge.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw model completion into a JSON tree, repairing the usual defects:
 * markdown fences, prose around the payload, output truncated mid-array, missing
 * or trailing commas and raw control characters. A payload that already parses is
 * returned untouched.
 */
@Slf4j
public class QuestionJsonRecovery {

    static final int CONTEXT_RADIUS = 100;

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?");
    private static final Pattern ADJACENT_OBJECTS = Pattern.compile("}\\s*\\{");
    private static final Pattern MISSING_COMMA_BEFORE_NEWLINE =
            Pattern.compile("(\"|}|]|\\d|true|false|null)([ \\t]*\\r?\\n\\s*)([\"{\\[])");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public QuestionJsonRecovery(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AIResponseParseException("Empty response from provider");
        }
        String stripped = stripCodeFences(raw);
        String candidate = extractPayload(stripped);
        try {
            return strictReader.readValue(candidate);
        } catch (JsonProcessingException e) {
            log.debug("Provider response is not valid JSON, repairing: {}", e.getOriginalMessage());
        }

        String closed = closeOpenStructures(candidate);
        String repaired = repairStructure(closed);

        if (!repaired.equals(stripped)) {
            log.warn("Repaired malformed JSON in provider response ({} -> {} chars)",
                    raw.length(), repaired.length());
        }

        try {
            return objectMapper.readTree(repaired);
        } catch (JsonProcessingException first) {
            int offset = errorOffset(first, repaired);
            String patched = insertMissingComma(repaired, offset);
            if (patched == null) {
                throw parseFailure(repaired, offset, first);
            }
            try {
                JsonNode node = objectMapper.readTree(patched);
                log.warn("Inserted missing comma near offset {} of provider response", offset);
                return node;
            } catch (JsonProcessingException second) {
                throw parseFailure(patched, errorOffset(second, patched), second);
            }
        }
    }

    static String stripCodeFences(String raw) {
        return CODE_FENCE.matcher(raw).replaceAll("").trim();
    }

    /**
     * Slices the outermost object, or the outermost array when the payload starts with one.
     * An unterminated payload runs to the end of the text.
     */
    static String extractPayload(String text) {
        int firstBrace = text.indexOf('{');
        int firstBracket = text.indexOf('[');
        boolean arrayRoot = firstBracket >= 0 && (firstBrace < 0 || firstBracket < firstBrace);
        char open = arrayRoot ? '[' : '{';
        char close = arrayRoot ? ']' : '}';

        int start = text.indexOf(open);
        if (start < 0) {
            return text;
        }
        int end = text.lastIndexOf(close);
        return end > start ? text.substring(start, end + 1) : text.substring(start);
    }

    /**
     * Closes structures left open by a truncated completion. The text is cut after the last
     * object that completed inside an array, and the still-open brackets are closed.
     */
    static String closeOpenStructures(String text) {
        Deque<Character> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        int safeCut = -1;
        String closersAtCut = "";

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> stack.push(c);
                case '}', ']' -> {
                    if (!stack.isEmpty()) {
                        stack.pop();
                    }
                    if (c == '}' && !stack.isEmpty() && stack.peek() == '[') {
                        safeCut = i + 1;
                        closersAtCut = closers(stack);
                    }
                }
                default -> {
                }
            }
        }

        if (stack.isEmpty() && !inString) {
            return text;
        }
        if (safeCut > 0) {
            return text.substring(0, safeCut) + closersAtCut;
        }
        return text + (inString ? "\"" : "") + closers(stack);
    }

    /**
     * Escapes control characters inside strings, drops them outside, and fixes comma defects
     * between tokens. String contents are never rewritten.
     */
    static String repairStructure(String text) {
        String cleaned = normalizeControlCharacters(text);
        cleaned = replaceOutsideStrings(cleaned, ADJACENT_OBJECTS, "},{");
        cleaned = replaceOutsideStrings(cleaned, MISSING_COMMA_BEFORE_NEWLINE, "$1,$2$3");
        cleaned = replaceOutsideStrings(cleaned, TRAILING_COMMA, "$1");
        return cleaned;
    }

    private static String replaceOutsideStrings(String text, Pattern pattern, String replacement) {
        boolean[] insideString = stringContents(text);
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            boolean touchesString = false;
            for (int i = matcher.start(); i < matcher.end() && !touchesString; i++) {
                touchesString = insideString[i];
            }
            matcher.appendReplacement(out, touchesString ? Matcher.quoteReplacement(matcher.group()) : replacement);
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Marks the characters between the quotes of each string literal; the quotes themselves are not marked.
     */
    private static boolean[] stringContents(String text) {
        boolean[] marks = new boolean[text.length()];
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!inString) {
                inString = c == '"';
                continue;
            }
            if (escaped) {
                escaped = false;
                marks[i] = true;
            } else if (c == '\\') {
                escaped = true;
                marks[i] = true;
            } else if (c == '"') {
                inString = false;
            } else {
                marks[i] = true;
            }
        }
        return marks;
    }

    /**
     * Inserts a comma before the token at the failure offset when the preceding token
     * ends a value. Returns null when the context does not look like a missing comma.
     */
    static String insertMissingComma(String text, int offset) {
        if (offset < 0 || text.isEmpty()) {
            return null;
        }
        int from = Math.min(offset + 1, text.length() - 1);
        int to = Math.max(0, offset - 3);
        for (int q = from; q >= to; q--) {
            char token = text.charAt(q);
            if (token != '"' && token != '{' && token != '[') {
                continue;
            }
            int p = q - 1;
            while (p >= 0 && Character.isWhitespace(text.charAt(p))) {
                p--;
            }
            if (p >= 0 && p < q - 1 && endsValue(text.charAt(p))) {
                return text.substring(0, p + 1) + "," + text.substring(p + 1);
            }
        }
        return null;
    }

    private static boolean endsValue(char c) {
        return c == '"' || c == '}' || c == ']' || Character.isDigit(c) || c == 'e' || c == 'l';
    }

    private static String normalizeControlCharacters(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                    out.append(c);
                    continue;
                }
                if (c == '\\') {
                    escaped = true;
                    out.append(c);
                } else if (c == '"') {
                    inString = false;
                    out.append(c);
                } else if (c < 0x20) {
                    out.append(escapeControl(c));
                } else {
                    out.append(c);
                }
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
            } else if (c >= 0x20 || c == '\n' || c == '\r' || c == '\t') {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String escapeControl(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\b' -> "\\b";
            case '\f' -> "\\f";
            default -> String.format("\\u%04x", (int) c);
        };
    }

    private static String closers(Deque<Character> stack) {
        StringBuilder closing = new StringBuilder();
        for (Character open : stack) {
            closing.append(open == '{' ? '}' : ']');
        }
        return closing.toString();
    }

    private static int errorOffset(JsonProcessingException e, String text) {
        JsonLocation location = e.getLocation();
        if (location == null) {
            return -1;
        }
        long charOffset = location.getCharOffset();
        if (charOffset >= 0) {
            return (int) Math.min(charOffset, text.length());
        }
        int line = location.getLineNr();
        int column = location.getColumnNr();
        if (line < 1 || column < 1) {
            return -1;
        }
        int offset = 0;
        for (int current = 1; current < line && offset < text.length(); offset++) {
            if (text.charAt(offset) == '\n') {
                current++;
            }
        }
        return Math.min(offset + column - 1, text.length());
    }

    private static AIResponseParseException parseFailure(String text, int offset, JsonProcessingException cause) {
        String context = null;
        if (offset >= 0) {
            int from = Math.max(0, offset - CONTEXT_RADIUS);
            int to = Math.min(text.length(), offset + CONTEXT_RADIUS);
            context = text.substring(from, to);
        }
        return new AIResponseParseException(
                "Failed to parse provider response as JSON: " + cause.getOriginalMessage(), context, cause);
    }
}
