package com.forcetree.json;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * A JSON binding for the Apex AST. Bindings register themselves in
 * {@code META-INF/services/com.forcetree.json.AstJsonProvider} and are found through
 * {@link ServiceLoader}, so callers depend only on this module at compile time.
 *
 * <p>With {@code com.forcetree:forcetree-jackson} on the runtime classpath:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getCompactSerializer().serialize(unit);
 * CompilationUnit copy = provider.getDeserializer().deserializeCompilationUnit(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * Returns a serializer that writes the {@code loc} of every node, so a deserialized tree
     * points back into the original Apex source.
     *
     * @return the full serializer
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns a serializer that leaves out every {@code loc}. Trees read back from its output
     * carry {@code SourceLocation.UNKNOWN} throughout.
     *
     * @return the compact serializer
     */
    AstJsonSerializer getCompactSerializer();

    /**
     * Returns a deserializer that accepts the output of both serializers.
     *
     * @return the deserializer
     */
    AstJsonDeserializer getDeserializer();

    /**
     * Returns the short name used by {@link #getProvider(String)}, such as "Jackson".
     *
     * @return the provider name
     */
    String getName();

    /**
     * Returns the first binding registered on the classpath.
     *
     * @return the provider
     * @throws IllegalStateException if no binding is registered
     */
    static AstJsonProvider getProvider() {
        List<AstJsonProvider> providers = loadAll();
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                "No Apex AST JSON binding is registered. Add com.forcetree:forcetree-jackson to the runtime classpath.");
        }
        return providers.get(0);
    }

    /**
     * Returns the binding whose {@link #getName()} matches, ignoring case.
     *
     * @param name the provider name, such as "jackson"
     * @return the provider
     * @throws IllegalStateException if no registered binding has that name; the message lists
     *     the names that are registered
     */
    static AstJsonProvider getProvider(String name) {
        List<String> available = new ArrayList<>();
        for (AstJsonProvider provider : loadAll()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
            available.add(provider.getName());
        }
        throw new IllegalStateException(
            "No Apex AST JSON binding named '" + name + "'. Registered bindings: " + available);
    }

    /**
     * @return true if at least one binding is registered
     */
    static boolean isProviderAvailable() {
        return !loadAll().isEmpty();
    }

    private static List<AstJsonProvider> loadAll() {
        List<AstJsonProvider> providers = new ArrayList<>();
        ServiceLoader.load(AstJsonProvider.class).forEach(providers::add);
        return providers;
    }
}
