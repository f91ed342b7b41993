package com.rbdesugar.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point for JSON support. Implementations are discovered with {@link ServiceLoader},
 * so putting a provider jar such as desugar-jackson on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * Node parseTree = provider.getDeserializer().deserializeParseTree(json);
 * Expression lowered = Desugar.node2Tree(ctx, parseTree);
 * String out = provider.getSerializer().serialize(lowered);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name used to select this provider with {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add desugar-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * @throws IllegalStateException if no provider with that name is on the classpath
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
