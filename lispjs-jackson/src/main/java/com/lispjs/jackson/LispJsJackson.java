package com.lispjs.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the ObjectMapper shared by the Jackson provider.
 *
 * Reading is strict about shape: every record component must be present and
 * non-null, and node lists may not contain nulls. Unknown properties are
 * still ignored so trees carrying positions from other ESTree tools load.
 */
public final class LispJsJackson {

    private LispJsJackson() {
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new ParameterNamesModule())
            .registerModule(new AstModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .setDefaultSetterInfo(JsonSetter.Value.forContentNulls(Nulls.FAIL));

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true);
        mapper.configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, true);
        return mapper;
    }
}
