package com.treewright.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Pairs a serializer and a deserializer that agree on one JSON shape for treewright trees.
 * Providers are registered under {@code META-INF/services} and looked up with
 * {@link ServiceLoader}; treewright-jackson ships the Jackson one.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(tree.getRoot());
 * SyntaxTree copy = provider.getDeserializer().deserializeTree(json);
 * // copy.getText() equals tree.getText()
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}.
     */
    String getName();

    /**
     * The first registered provider.
     *
     * @throws IllegalStateException if none is on the classpath
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider registered; add treewright-jackson to the classpath"
        );
    }

    /**
     * The registered provider whose name equals {@code name}, ignoring case.
     *
     * @throws IllegalStateException if there is no such provider
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "' is registered"
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
