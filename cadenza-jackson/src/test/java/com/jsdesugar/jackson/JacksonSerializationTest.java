package com.jsdesugar.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsdesugar.ast.*;
import com.jsdesugar.json.AstJsonException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonSerializationTest {

    private final ObjectMapper mapper = CadenzaJackson.createObjectMapper();

    @Test
    void testDeserializeWithLoc() throws Exception {
        String json = """
            {
              "type": "Program",
              "start": 0,
              "end": 15,
              "loc": {
                "start": { "line": 1, "column": 0 },
                "end": { "line": 1, "column": 15 }
              },
              "body": [],
              "sourceType": "module"
            }
            """;

        Program program = mapper.readValue(json, Program.class);

        assertEquals("module", program.sourceType());
        assertEquals(new SourceLocation.Position(1, 0), program.loc().start());
        assertEquals(new SourceLocation.Position(1, 15), program.loc().end());
    }

    @Test
    void testNodeTypeComesFromTypeProperty() throws Exception {
        String json = """
            { "type": "ExpressionStatement",
              "expression": { "type": "AwaitExpression",
                              "argument": { "type": "CallExpression",
                                            "callee": { "type": "Identifier", "name": "f" },
                                            "arguments": [] } } }
            """;

        Statement statement = mapper.readValue(json, Statement.class);

        ExpressionStatement expressionStatement = assertInstanceOf(ExpressionStatement.class, statement);
        AwaitExpression await = assertInstanceOf(AwaitExpression.class, expressionStatement.expression());
        CallExpression call = assertInstanceOf(CallExpression.class, await.argument());
        assertFalse(call.optional());
    }

    @Test
    void testNullFieldsThatEstreeKeeps() throws Exception {
        IfStatement statement = new IfStatement(null, new Identifier("c"),
            new EmptyStatement(null), null);

        JsonNode json = mapper.valueToTree(statement);

        assertEquals("IfStatement", json.get("type").asText());
        assertTrue(json.has("alternate"));
        assertTrue(json.get("alternate").isNull());
        assertFalse(json.has("loc"));
    }

    @Test
    void testWholeNumbersLoseFraction() throws Exception {
        JsonNode whole = mapper.valueToTree(new Literal(null, 2.0, "2.0"));
        JsonNode fraction = mapper.valueToTree(new Literal(null, 1.5, "1.5"));
        JsonNode notANumber = mapper.valueToTree(new Literal(null, Double.NaN, "NaN"));
        JsonNode nullLiteral = mapper.valueToTree(new Literal(null, null, "null"));

        assertTrue(whole.get("value").isIntegralNumber());
        assertEquals(2, whole.get("value").asInt());
        assertEquals(1.5, fraction.get("value").asDouble());
        assertTrue(notANumber.get("value").isNull());
        assertTrue(nullLiteral.has("value"));
        assertTrue(nullLiteral.get("value").isNull());
    }

    @Test
    void testAccessorsSerializeAsEstree() throws Exception {
        FunctionExpression getter = new FunctionExpression(null, null, false, false, List.of(),
            new BlockStatement(null, List.of()));
        MethodDefinition method = new MethodDefinition(null, new Identifier("size"), getter, "get", false, true);

        JsonNode json = mapper.valueToTree(method);

        assertEquals("MethodDefinition", json.get("type").asText());
        assertTrue(json.get("static").asBoolean());
        assertFalse(json.has("accessor"));
        assertTrue(json.get("value").has("id"));
        assertTrue(json.get("value").get("id").isNull());
    }

    @Test
    void testMalformedJsonIsWrapped() {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();

        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeProgram("{ \"type\": \"Program\", "));
        assertEquals("Failed to deserialize Program", e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void testUnknownNodeTypeIsRejected() {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();

        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserialize(
            "{ \"type\": \"ImportExpression\", \"source\": null }", Expression.class));
    }
}
