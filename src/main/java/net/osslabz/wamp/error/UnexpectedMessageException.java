package net.osslabz.wamp.error;

import java.util.Objects;
import net.osslabz.wamp.message.WampMessage;


/**
 * Raised when a message of one specific type was required but another one arrived.
 */
public class UnexpectedMessageException extends InvalidMessageException {

    private final transient WampMessage received;

    private final Class<? extends WampMessage> expected;


    public UnexpectedMessageException(WampMessage received, Class<? extends WampMessage> expected) {

        super("received message %s but expected message of type %s".formatted(received,
            Objects.requireNonNull(expected, "expected").getSimpleName()));
        this.received = received;
        this.expected = expected;
    }


    public WampMessage getReceived() {

        return received;
    }


    public Class<? extends WampMessage> getExpected() {

        return expected;
    }
}
