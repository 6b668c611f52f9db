package com.jsdesugar.json;

import com.jsdesugar.ast.Node;

/**
 * Writes AST nodes as ESTree JSON.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize} with indentation, for dumping lowered trees to a log or a
     * file.
     *
     * @throws AstJsonException if the node cannot be written
     */
    String serializePretty(Node node) throws AstJsonException;
}
