package org.silverscript.trace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * The JSON mapping of trace artifacts: snake_case property names, absent values omitted.
 */
public final class TraceJson {

    private TraceJson() {}

    /**
     * @param pretty Indent the output.
     * @return A mapper configured for trace artifacts.
     */
    public static ObjectMapper mapper(boolean pretty) {
        ObjectMapper mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        if (pretty) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return mapper;
    }
}
