package net.osslabz.wamp.error;

/**
 * Contributes error mappings to {@link ErrorRegistry#getDefault()}.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} when the default registry is first used, so a
 * library declares its error URIs in {@code META-INF/services/net.osslabz.wamp.error.ErrorMappingProvider} instead
 * of relying on class initialization order.
 * <p>
 * A provider should only register URIs within its own namespace.
 */
public interface ErrorMappingProvider {

    void registerMappings(ErrorRegistry registry);
}
