package net.osslabz.wamp.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.osslabz.wamp.Uri;


/**
 * {@code [ABORT, Details|dict, Reason|uri]}
 */
public final class AbortMessage implements WampMessage {

    private final Map<String, Object> details;

    private final Uri reason;


    public AbortMessage(Map<String, ?> details, Uri reason) {

        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.reason = Objects.requireNonNull(reason, "reason");
    }


    @Override
    public int getMessageType() {

        return WampMessageTypes.ABORT;
    }


    public Map<String, Object> getDetails() {

        return details;
    }


    public Uri getReason() {

        return reason;
    }


    @Override
    public boolean equals(Object o) {

        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AbortMessage that = (AbortMessage) o;
        return Objects.equals(details, that.details) && Objects.equals(reason, that.reason);
    }


    @Override
    public int hashCode() {

        return Objects.hash(details, reason);
    }


    @Override
    public String toString() {

        return "AbortMessage[details=%s, reason=%s]".formatted(details, reason);
    }
}
