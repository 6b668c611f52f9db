package com.jsdesugar.json;

import java.util.ServiceLoader;

/**
 * Entry point for reading and writing ASTs as JSON. Implementations are found through
 * {@link ServiceLoader}; putting cadenza-jackson on the classpath is enough to get one.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * Program program = provider.getDeserializer().deserializeProgram(json);
 * String lowered = provider.getSerializer().serialize(pass.transformProgram(program));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * A short name for the provider, such as {@code "Jackson"}.
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add cadenza-jackson (or another provider) to your dependencies.");
    }

    /**
     * Returns the provider whose {@link #getName() name} matches, ignoring case.
     *
     * @throws IllegalStateException if no such provider is on the classpath
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
