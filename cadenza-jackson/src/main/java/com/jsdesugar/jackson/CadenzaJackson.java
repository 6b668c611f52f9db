package com.jsdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Creates {@link ObjectMapper}s that read and write the AST as ESTree JSON.
 *
 * <pre>
 * ObjectMapper mapper = CadenzaJackson.createObjectMapper();
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class CadenzaJackson {

    private CadenzaJackson() {
    }

    /**
     * The returned mapper:
     * <ul>
     *   <li>uses the {@code type} property to pick the node class</li>
     *   <li>leaves out null fields, except the ones ESTree always writes (such as
     *       {@code alternate} and {@code handler})</li>
     *   <li>writes whole numbers without a fraction, like JavaScript</li>
     *   <li>ignores properties the AST does not model, such as {@code start} and {@code range}</li>
     * </ul>
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Fields that ESTree keeps as null are re-enabled through mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
