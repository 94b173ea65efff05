package dumb.lis.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class Json {

    private static final Logger logger = LoggerFactory.getLogger(Json.class);

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing object to JSON: {}", e.getMessage());
            return "{}";
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(InputStream json, Class<T> valueType) throws IOException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(Path json, Class<T> valueType) throws IOException {
        try (var in = Files.newInputStream(json)) {
            return obj(in, valueType);
        }
    }
}
