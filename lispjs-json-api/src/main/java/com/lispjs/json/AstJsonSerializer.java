package com.lispjs.json;

import com.lispjs.estree.Node;

/**
 * Writes target tree nodes as JSON. Each node becomes an object whose
 * {@code "type"} property holds the node's variant.
 */
public interface AstJsonSerializer {

    /**
     * @param node the node to write
     * @return compact JSON
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;
}
