package com.lispjs.json;

import com.lispjs.estree.Node;
import com.lispjs.estree.Program;

/**
 * Reads target tree nodes back from JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @param json a serialized Program
     * @return the Program
     * @throws AstJsonException if the JSON is malformed or names an unknown node type
     */
    Program deserializeProgram(String json) throws AstJsonException;

    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
