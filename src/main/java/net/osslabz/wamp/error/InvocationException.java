package net.osslabz.wamp.error;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.ErrorMessage;


/**
 * A failure that is reported back to the remote caller of a procedure as an ERROR message.
 * <p>
 * Arguments, keyword arguments and details are either absent or non-empty: empty collections passed to the
 * constructors are stored as absent so the wire encoding can leave them out.
 * <p>
 * {@link #getMessage()} is the display form {@code <uri> <arg>, <arg>} and does not include keyword arguments or
 * details. {@link #toString()} is the debug form and includes all of them.
 *
 * @see ErrorRegistry#exceptionToInvocationError(Throwable)
 * @see ErrorRegistry#setInvocationError(Throwable, InvocationException)
 */
public class InvocationException extends WampException {

    private Uri uri;

    private transient List<Object> args;

    private transient Map<String, Object> kwargs;

    private transient Map<String, Object> details;


    public InvocationException(String uri, Object... args) {

        this(Uri.of(uri), args == null ? null : Arrays.asList(args), null, null);
    }


    public InvocationException(Uri uri, List<?> args, Map<String, ?> kwargs, Map<String, ?> details) {

        super();
        this.uri = Objects.requireNonNull(uri, "uri");
        this.args = args == null || args.isEmpty() ? null : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null || kwargs.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        this.details = details == null || details.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }


    public Uri getUri() {

        return uri;
    }


    public Optional<List<Object>> getArgs() {

        return Optional.ofNullable(args);
    }


    public Optional<Map<String, Object>> getKwargs() {

        return Optional.ofNullable(kwargs);
    }


    public Optional<Map<String, Object>> getDetails() {

        return Optional.ofNullable(details);
    }


    /**
     * Builds the ERROR message answering the request identified by {@code requestType} and {@code requestId}.
     */
    public ErrorMessage toErrorMessage(int requestType, long requestId) {

        return new ErrorMessage(requestType, requestId, this.details, this.uri, this.args, this.kwargs);
    }


    void overwriteWith(InvocationException other) {

        this.uri = other.uri;
        this.args = other.args;
        this.kwargs = other.kwargs;
        this.details = other.details;
    }


    @Override
    public String getMessage() {

        if (this.args != null) {
            return "%s %s".formatted(this.uri, Renderings.joinPlain(this.args));
        }
        return this.uri.toString();
    }


    @Override
    public String toString() {

        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('(').append(this.uri);
        if (this.args != null) {
            sb.append(", ").append(Renderings.joinRepr(this.args));
        }
        if (this.kwargs != null) {
            sb.append(", kwargs=").append(this.kwargs);
        }
        if (this.details != null) {
            sb.append(", details=").append(this.details);
        }
        return sb.append(')').toString();
    }
}
