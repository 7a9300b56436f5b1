package com.connector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Removes sensitive paths from an exchange before it is logged.
 * <p>
 * Paths are written in dotted form relative to the exchange document, e.g. {@code request.headers.authorization}
 * or {@code response.body.access_token}. Header names in the document are lower case.
 */
@Component
public class LogSanitizer {

    private static final Configuration JSON_PATH = Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider())
            .mappingProvider(new JacksonMappingProvider())
            .options(Option.SUPPRESS_EXCEPTIONS)
            .build();

    /**
     * @param exchange The exchange document; it is not modified.
     * @param paths    Dotted paths to delete.
     * @return A sanitized copy.
     */
    public JsonNode sanitize(JsonNode exchange, List<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return exchange;
        }
        DocumentContext document = JsonPath.using(JSON_PATH).parse(exchange.deepCopy());
        for (String path : paths) {
            if (path != null && !path.isBlank()) {
                document.delete(toJsonPath(path));
            }
        }
        return document.json();
    }

    static String toJsonPath(String dotted) {
        if (dotted.startsWith("$")) {
            return dotted;
        }
        StringBuilder path = new StringBuilder("$");
        for (String segment : dotted.split("\\.")) {
            if (segment.equals("*")) {
                path.append("[*]");
            } else {
                path.append("['").append(segment.replace("'", "\\'")).append("']");
            }
        }
        return path.toString();
    }
}
