package com.jsdesugar.jackson;

import com.jsdesugar.TransformOptions;
import com.jsdesugar.ast.Program;
import com.jsdesugar.codegeneration.GeneratorTransformPass;
import com.jsdesugar.codegeneration.UniqueIdentifierGenerator;
import com.jsdesugar.codegeneration.generator.StateMachineBuilder;
import com.jsdesugar.json.AstJsonProvider;
import com.jsdesugar.util.LoggingErrorReporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the pass over ESTree JSON fixtures. The state machine builder hands the body back
 * as it got it, so the output shows what the pass itself did.
 */
public class GeneratorTransformFixtureTest {

    private static final StateMachineBuilder PASS_THROUGH = (ids, reporter, body) -> body;

    private final AstJsonProvider provider = AstJsonProvider.getProvider();

    private static String readFixture(String name) throws IOException {
        try (InputStream in = GeneratorTransformFixtureTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static GeneratorTransformPass newPass() {
        return new GeneratorTransformPass(new UniqueIdentifierGenerator(), new LoggingErrorReporter(),
            TransformOptions.defaults(), PASS_THROUGH, PASS_THROUGH);
    }

    @Test
    void testProviderIsJackson() {
        assertEquals("Jackson", provider.getName());
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testGeneratorFixture() throws Exception {
        Program input = provider.getDeserializer().deserializeProgram(readFixture("generator.input.json"));
        Program expected = provider.getDeserializer().deserializeProgram(readFixture("generator.expected.json"));

        Program actual = newPass().transformProgram(input);

        assertEquals(expected, actual);
    }

    @Test
    void testFunctionWithoutSuspendPointsIsUntouched() throws Exception {
        Program input = provider.getDeserializer().deserializeProgram(readFixture("plain.input.json"));

        assertSame(input, newPass().transformProgram(input));
    }

    @Test
    void testLoweredProgramSurvivesJson() throws Exception {
        Program input = provider.getDeserializer().deserializeProgram(readFixture("generator.input.json"));
        Program lowered = newPass().transformProgram(input);

        String json = provider.getSerializer().serializePretty(lowered);
        System.out.println("Lowered:\n" + json);

        assertEquals(lowered, provider.getDeserializer().deserializeProgram(json));
    }
}
