package net.osslabz.wamp.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import net.osslabz.wamp.Uri;


/**
 * {@code [ERROR, REQUEST.Type|int, REQUEST.Request|id, Details|dict, Error|uri, Arguments|list?, ArgumentsKw|dict?]}
 * <p>
 * Absent arguments are kept absent so they can be omitted on the wire. An empty list or map passed in is treated
 * as absent.
 */
public final class ErrorMessage implements WampMessage {

    private final int requestType;

    private final long requestId;

    private final Map<String, Object> details;

    private final Uri error;

    private final List<Object> args;

    private final Map<String, Object> kwargs;


    public ErrorMessage(int requestType, long requestId, Map<String, ?> details, Uri error, List<?> args,
        Map<String, ?> kwargs) {

        this.requestType = requestType;
        this.requestId = requestId;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.error = Objects.requireNonNull(error, "error");
        this.args = args == null || args.isEmpty() ? null : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null || kwargs.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }


    @Override
    public int getMessageType() {

        return WampMessageTypes.ERROR;
    }


    public int getRequestType() {

        return requestType;
    }


    public long getRequestId() {

        return requestId;
    }


    public Map<String, Object> getDetails() {

        return details;
    }


    public Uri getError() {

        return error;
    }


    public Optional<List<Object>> getArgs() {

        return Optional.ofNullable(args);
    }


    public Optional<Map<String, Object>> getKwargs() {

        return Optional.ofNullable(kwargs);
    }


    @Override
    public boolean equals(Object o) {

        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ErrorMessage that = (ErrorMessage) o;
        return requestType == that.requestType && requestId == that.requestId && Objects.equals(details, that.details)
            && Objects.equals(error, that.error) && Objects.equals(args, that.args) && Objects.equals(kwargs, that.kwargs);
    }


    @Override
    public int hashCode() {

        return Objects.hash(requestType, requestId, details, error, args, kwargs);
    }


    @Override
    public String toString() {

        return "ErrorMessage[requestType=%d, requestId=%d, details=%s, error=%s, args=%s, kwargs=%s]"
            .formatted(requestType, requestId, details, error, args, kwargs);
    }
}
