package me.golemcore.gateway.adapter.outbound.agent;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.JsonValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the agent's newline-delimited JSON event stream.
 *
 * <p>
 * Every line is parsed on its own; blank, malformed and non-object lines are
 * skipped. The first declared session id wins, while the answer text is taken
 * from the last line that yields a non-empty message, since the stream may
 * emit intermediate assistant content before the final one.
 */
@Component
@Slf4j
public class AgentStreamParser {

    static final Set<String> ASSISTANT_MESSAGE_TYPES = Set.of(
            "message", "assistant_message", "final_message", "agent_message");

    private static final List<String> TEXT_KEYS = List.of("text", "content", "value", "output_text");

    private static final String KEY_TYPE = "type";
    private static final String KEY_ROLE = "role";
    private static final String KEY_ID = "id";
    private static final String KEY_SESSION_ID = "session_id";
    private static final String KEY_THREAD_ID = "thread_id";
    private static final String KEY_MESSAGE = "message";
    private static final String KEY_RESPONSE = "response";

    private final ObjectReader lineReader;

    public AgentStreamParser(ObjectMapper objectMapper) {
        // one JSON value per line; anything after it rejects the line
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parsed stream outcome; either field may be {@code null}.
     */
    public record StreamOutcome(String answer, String sessionId) {
    }

    public StreamOutcome parse(String rawOutput) {
        String answer = null;
        String sessionId = null;
        if (rawOutput == null || rawOutput.isEmpty()) {
            return new StreamOutcome(null, null);
        }

        int skipped = 0;
        for (String rawLine : rawOutput.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            Optional<JsonValue.Obj> payload = parseObject(line);
            if (payload.isEmpty()) {
                skipped++;
                continue;
            }
            JsonValue.Obj event = payload.get();
            if (sessionId == null) {
                sessionId = extractSessionId(event).orElse(null);
            }
            String candidate = extractAnswer(event);
            if (!candidate.isEmpty()) {
                answer = candidate;
            }
        }
        if (skipped > 0) {
            log.debug("[Agent] Skipped {} non-object line(s) in agent output", skipped);
        }
        return new StreamOutcome(answer, sessionId);
    }

    private Optional<JsonValue.Obj> parseObject(String line) {
        try {
            JsonNode node = lineReader.readTree(line);
            if (node != null && node.isObject()) {
                return Optional.of((JsonValue.Obj) toJsonValue(node));
            }
        } catch (JsonProcessingException e) {
            log.trace("[Agent] Ignoring non-JSON line: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }

    /**
     * Session id declared by one event: {@code session_id}; else
     * {@code session.id} or {@code id} of a {@code session} event; else
     * {@code thread_id}, or {@code thread_id}/{@code id} of a
     * {@code thread.started} event.
     */
    static Optional<String> extractSessionId(JsonValue.Obj event) {
        Optional<String> type = event.string(KEY_TYPE);

        Optional<String> sessionId = scalar(event, KEY_SESSION_ID);
        if (sessionId.isEmpty()) {
            Optional<JsonValue.Obj> session = event.object("session");
            if (session.isPresent()) {
                sessionId = scalar(session.get(), KEY_ID);
            } else if (type.filter("session"::equals).isPresent()) {
                sessionId = scalar(event, KEY_ID);
            }
        }
        if (sessionId.isEmpty()) {
            sessionId = scalar(event, KEY_THREAD_ID);
            if (type.filter("thread.started"::equals).isPresent()) {
                sessionId = scalar(event, KEY_THREAD_ID).or(() -> scalar(event, KEY_ID));
            }
        }
        return sessionId.filter(id -> !id.isEmpty());
    }

    /**
     * Assistant text carried by one event, or an empty string.
     */
    static String extractAnswer(JsonValue.Obj event) {
        Optional<String> type = event.string(KEY_TYPE);
        if (type.filter(ASSISTANT_MESSAGE_TYPES::contains).isPresent()) {
            return isAssistantRole(event) ? extractText(event) : "";
        }
        if (type.filter("item.completed"::equals).isPresent()) {
            return event.object("item")
                    .filter(item -> item.string(KEY_TYPE).filter(ASSISTANT_MESSAGE_TYPES::contains).isPresent())
                    .map(AgentStreamParser::extractText)
                    .orElse("");
        }
        if (event.has(KEY_MESSAGE)) {
            return extractText(event.get(KEY_MESSAGE));
        }
        if (event.has(KEY_RESPONSE)) {
            return event.object(KEY_RESPONSE)
                    .map(response -> extractText(response.get("output_text")))
                    .orElse("");
        }
        return "";
    }

    /**
     * Recursively flatten a value to text: strings as is, sequences
     * concatenated, objects via the first present of {@code text},
     * {@code content}, {@code value}, {@code output_text}.
     */
    static String extractText(JsonValue value) {
        if (value instanceof JsonValue.Str str) {
            return str.value();
        }
        if (value instanceof JsonValue.Seq seq) {
            StringBuilder builder = new StringBuilder();
            for (JsonValue item : seq.items()) {
                builder.append(extractText(item));
            }
            return builder.toString();
        }
        if (value instanceof JsonValue.Obj obj) {
            for (String key : TEXT_KEYS) {
                if (obj.has(key)) {
                    return extractText(obj.get(key));
                }
            }
        }
        return "";
    }

    private static boolean isAssistantRole(JsonValue.Obj event) {
        JsonValue role = event.get(KEY_ROLE);
        if (role.kind() == JsonValue.Kind.NULL) {
            return true;
        }
        return role instanceof JsonValue.Str str && "assistant".equals(str.value());
    }

    private static Optional<String> scalar(JsonValue.Obj obj, String key) {
        JsonValue value = obj.get(key);
        if (value instanceof JsonValue.Str str) {
            return Optional.of(str.value());
        }
        if (value instanceof JsonValue.Num num) {
            return Optional.of(num.literal());
        }
        return Optional.empty();
    }

    static JsonValue toJsonValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonValue.NULL;
        }
        if (node.isTextual()) {
            return JsonValue.string(node.textValue());
        }
        if (node.isNumber()) {
            return new JsonValue.Num(node.asText());
        }
        if (node.isBoolean()) {
            return new JsonValue.Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<JsonValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toJsonValue(item));
            }
            return JsonValue.sequence(items);
        }
        if (node.isObject()) {
            Map<String, JsonValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                fields.put(field.getKey(), toJsonValue(field.getValue()));
            }
            return JsonValue.object(fields);
        }
        return JsonValue.NULL;
    }
}
