package com.jsdesugar.json;

import com.jsdesugar.ast.Node;
import com.jsdesugar.ast.Program;

/**
 * Reads ESTree JSON, as produced by acorn, esprima or {@link AstJsonSerializer}, into AST
 * nodes. Properties the AST does not model are ignored.
 */
public interface AstJsonDeserializer {

    /**
     * @param json a JSON object whose {@code type} is {@code "Program"}
     * @throws AstJsonException if the JSON is malformed or does not describe a program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a single node of a known type, for example a {@code FunctionDeclaration}.
     *
     * @throws AstJsonException if the JSON is malformed or describes another kind of node
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
