package net.osslabz.wamp.error;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import net.osslabz.wamp.MatchPolicy;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.UriMap;
import net.osslabz.wamp.UriNotFoundException;
import net.osslabz.wamp.WampUris;
import net.osslabz.wamp.message.ErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Translates between WAMP ERROR messages and Java exceptions.
 * <p>
 * The registry keeps two independent tables:
 * <ul>
 *     <li>inbound, error URI to {@link ErrorFactory}, used by {@link #errorToException(ErrorMessage)}</li>
 *     <li>outbound, exception class to error URI, used by {@link #exceptionToInvocationError(Throwable)}</li>
 * </ul>
 * A URI registered in one direction needs no entry in the other.
 * <p>
 * Register mappings during startup. Both tables are concurrent, so a lookup racing a registration is well defined
 * and sees every registration that completed before it.
 */
public class ErrorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ErrorRegistry.class);

    private final UriMap<ErrorFactory> errorFactories = new UriMap<>();

    private final Map<Class<? extends Throwable>, Uri> exceptionUris = new ConcurrentHashMap<>();

    private final InvocationErrorAttachments attachments = new InvocationErrorAttachments();


    /**
     * Process-wide registry, populated on first use by every {@link ErrorMappingProvider} on the class path.
     */
    public static ErrorRegistry getDefault() {

        return DefaultHolder.INSTANCE;
    }


    /**
     * Runs every {@link ErrorMappingProvider} visible to {@code classLoader} against this registry.
     *
     * @return this registry
     */
    public ErrorRegistry loadProviders(ClassLoader classLoader) {

        for (ErrorMappingProvider provider : ServiceLoader.load(ErrorMappingProvider.class, classLoader)) {
            log.debug("Loading error mappings from {}.", provider.getClass().getName());
            provider.registerMappings(this);
        }
        return this;
    }


    public ErrorRegistry registerErrorResponse(String uri, ErrorFactory factory) {

        return registerErrorResponse(Uri.of(uri), MatchPolicy.EXACT, factory);
    }


    public ErrorRegistry registerErrorResponse(String uri, MatchPolicy policy, ErrorFactory factory) {

        Uri parsed = policy == MatchPolicy.WILDCARD ? Uri.ofPattern(uri) : Uri.of(uri);
        return registerErrorResponse(parsed, policy, factory);
    }


    public ErrorRegistry registerErrorResponse(Uri uri, MatchPolicy policy, ErrorFactory factory) {

        if (factory == null) {
            throw new IllegalArgumentException("error factory must not be null");
        }
        this.errorFactories.register(Objects.requireNonNull(uri, "uri"), policy, factory);
        return this;
    }


    /**
     * @throws UriNotFoundException if no factory applies to {@code uri}
     */
    public ErrorFactory getExceptionFactory(Uri uri) {

        return this.errorFactories.resolve(uri);
    }


    /**
     * Creates the exception for a received ERROR message.
     * <p>
     * Never fails for an unknown error URI: an unregistered URI yields an {@link ErrorResponseException} wrapping
     * {@code message}.
     */
    public RuntimeException errorToException(ErrorMessage message) {

        ErrorFactory factory;
        try {
            factory = getExceptionFactory(message.getError());
        } catch (UriNotFoundException e) {
            return new ErrorResponseException(message);
        }

        RuntimeException exception = factory.create(message);
        if (exception == null) {
            throw new IllegalStateException("error factory for '%s' returned null".formatted(message.getError()));
        }
        return exception;
    }


    public ErrorRegistry registerExceptionUri(Class<? extends Throwable> exceptionType, String uri) {

        return registerExceptionUri(exceptionType, Uri.of(uri));
    }


    public ErrorRegistry registerExceptionUri(Class<? extends Throwable> exceptionType, Uri uri) {

        Objects.requireNonNull(exceptionType, "exceptionType");
        Objects.requireNonNull(uri, "uri");

        Uri previous = this.exceptionUris.put(exceptionType, uri);
        if (previous != null && !previous.equals(uri)) {
            log.debug("Remapped {} from '{}' to '{}'.", exceptionType.getName(), previous, uri);
        }
        return this;
    }


    /**
     * Exact lookup, superclasses are not consulted.
     *
     * @throws NoSuchElementException if {@code exceptionType} has no registered URI
     */
    public Uri getExceptionUri(Class<? extends Throwable> exceptionType) {

        Uri uri = this.exceptionUris.get(exceptionType);
        if (uri == null) {
            throw new NoSuchElementException("no uri registered for exception %s".formatted(exceptionType.getName()));
        }
        return uri;
    }


    /**
     * Determines what the remote caller should see for {@code failure}. In order of precedence:
     * <ol>
     *     <li>{@code failure} itself, if it is an {@link InvocationException}</li>
     *     <li>the invocation error attached with {@link #setInvocationError(Throwable, InvocationException)}</li>
     *     <li>a new invocation error with the URI registered for the failure's class and its message as the only
     *     argument</li>
     *     <li>the same with {@link WampUris#RUNTIME_ERROR} if the class has no registered URI</li>
     * </ol>
     */
    public InvocationException exceptionToInvocationError(Throwable failure) {

        Objects.requireNonNull(failure, "failure");

        if (failure instanceof InvocationException invocationException) {
            return invocationException;
        }

        Optional<InvocationException> attached = this.attachments.find(failure);
        if (attached.isPresent()) {
            return attached.get();
        }

        Uri uri;
        try {
            uri = getExceptionUri(failure.getClass());
        } catch (NoSuchElementException e) {
            log.info("No uri registered for exception {}. Using {}.", failure.getClass().getName(),
                WampUris.RUNTIME_ERROR);
            uri = WampUris.RUNTIME_ERROR;
        }

        return new InvocationException(uri, positionalArgs(failure), null, null);
    }


    /**
     * Sets the invocation error reported for {@code failure}.
     * <p>
     * If {@code failure} is an {@link InvocationException} its fields are overwritten with those of {@code error}
     * and it keeps its identity. Any other failure is left untouched and {@code error} is attached to it on the
     * side.
     */
    public void setInvocationError(Throwable failure, InvocationException error) {

        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(error, "error");

        if (failure instanceof InvocationException invocationException) {
            log.info("Overwriting {} with {}.", invocationException, error);
            invocationException.overwriteWith(error);
            return;
        }

        InvocationException previous = this.attachments.attach(failure, error);
        if (previous != null) {
            log.info("Replaced invocation error {} attached to {} with {}.", previous,
                failure.getClass().getName(), error);
        }
    }


    /**
     * @return the invocation error attached to {@code failure}, empty if none was attached
     */
    public Optional<InvocationException> getAttachedInvocationError(Throwable failure) {

        return this.attachments.find(failure);
    }


    /**
     * Removes the invocation error attached to {@code failure}.
     * <p>
     * Call this once the error has been reported to the caller. Attachments otherwise live as long as their failure,
     * and one whose cause chain reaches its own failure is never collected.
     *
     * @return the removed attachment, empty if none was attached
     */
    public Optional<InvocationException> clearInvocationError(Throwable failure) {

        Objects.requireNonNull(failure, "failure");
        return Optional.ofNullable(this.attachments.detach(failure));
    }


    int attachmentCount() {

        return this.attachments.size();
    }


    private static List<Object> positionalArgs(Throwable failure) {

        String message = failure.getMessage();
        return message == null ? List.of() : List.of(message);
    }


    /**
     * The thread context class loader, which sees application providers in container setups, or this class's own
     * loader when no context loader is set.
     */
    static ClassLoader providerClassLoader() {

        ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : ErrorRegistry.class.getClassLoader();
    }


    private static final class DefaultHolder {

        private static final ErrorRegistry INSTANCE = new ErrorRegistry().loadProviders(providerClassLoader());
    }
}
