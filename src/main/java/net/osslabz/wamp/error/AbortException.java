package net.osslabz.wamp.error;

import java.util.Map;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.AbortMessage;


/**
 * The peer aborted the session join.
 */
public class AbortException extends WampException {

    private final Uri reason;

    private final transient Map<String, Object> details;


    public AbortException(AbortMessage message) {

        super("%s (details = %s)".formatted(message.getReason(), message.getDetails()));
        this.reason = message.getReason();
        this.details = message.getDetails();
    }


    public Uri getReason() {

        return reason;
    }


    public Map<String, Object> getDetails() {

        return details;
    }
}
