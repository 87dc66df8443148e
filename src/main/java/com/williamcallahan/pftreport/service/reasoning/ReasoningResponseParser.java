package com.williamcallahan.pftreport.service.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Converts between report records and the snake_case JSON exchanged with the reasoning model.
 */
@Component
public class ReasoningResponseParser {

    private static final Pattern OPENING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\s*```$");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Reads a model reply as {@code type}.
     *
     * @param reply raw reply text, optionally wrapped in a Markdown code fence
     * @param type target record type
     * @return parsed value
     * @throws ReasoningResponseException when the reply is empty or does not match the type
     */
    public <T> T parse(String reply, Class<T> type) {
        String json = stripCodeFence(reply);
        if (json.isEmpty()) {
            throw new ReasoningResponseException("Model reply was empty");
        }
        try {
            T value = mapper.readValue(json, type);
            if (value == null) {
                throw new ReasoningResponseException("Model reply was JSON null");
            }
            return value;
        } catch (JsonProcessingException parseFailure) {
            throw new ReasoningResponseException(
                    "Model reply is not a valid " + type.getSimpleName() + ": " + parseFailure.getOriginalMessage(),
                    parseFailure);
        }
    }

    /**
     * Serializes prompt context in the same naming convention the model is asked to answer in.
     */
    public String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalStateException("Unable to serialize prompt context", serializationFailure);
        }
    }

    static String stripCodeFence(String reply) {
        if (reply == null) {
            return "";
        }
        String trimmed = reply.strip();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            trimmed = OPENING_FENCE.matcher(trimmed).replaceFirst("");
            trimmed = CLOSING_FENCE.matcher(trimmed).replaceFirst("");
        }
        return trimmed.strip();
    }
}
