package com.spocparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to JSON support for the policy AST.
 * Implementations are discovered with {@link ServiceLoader}.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serializeToplevels(toplevels, true);
 * List<Toplevel> back = provider.getDeserializer().deserializeToplevels(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name of this provider, e.g. "Jackson".
     */
    String getName();

    /**
     * First provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add spoc-jackson to your dependencies.");
    }

    /**
     * Provider with the given name, compared case insensitive.
     *
     * @throws IllegalStateException if there is none
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
