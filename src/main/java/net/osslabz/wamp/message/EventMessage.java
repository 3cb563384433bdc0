package net.osslabz.wamp.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;


/**
 * {@code [EVENT, SUBSCRIBED.Subscription|id, PUBLISHED.Publication|id, Details|dict, PUBLISH.Arguments|list?,
 * PUBLISH.ArgumentKw|dict?]}
 */
public final class EventMessage implements WampMessage {

    private final long subscriptionId;

    private final long publicationId;

    private final Map<String, Object> details;

    private final List<Object> args;

    private final Map<String, Object> kwargs;


    public EventMessage(long subscriptionId, long publicationId, Map<String, ?> details, List<?> args,
        Map<String, ?> kwargs) {

        this.subscriptionId = subscriptionId;
        this.publicationId = publicationId;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.args = args == null ? null : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }


    @Override
    public int getMessageType() {

        return WampMessageTypes.EVENT;
    }


    public long getSubscriptionId() {

        return subscriptionId;
    }


    public long getPublicationId() {

        return publicationId;
    }


    public Map<String, Object> getDetails() {

        return details;
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
        EventMessage that = (EventMessage) o;
        return subscriptionId == that.subscriptionId && publicationId == that.publicationId
            && Objects.equals(details, that.details) && Objects.equals(args, that.args)
            && Objects.equals(kwargs, that.kwargs);
    }


    @Override
    public int hashCode() {

        return Objects.hash(subscriptionId, publicationId, details, args, kwargs);
    }


    @Override
    public String toString() {

        return "EventMessage[subscriptionId=%d, publicationId=%d, details=%s, args=%s, kwargs=%s]"
            .formatted(subscriptionId, publicationId, details, args, kwargs);
    }
}
