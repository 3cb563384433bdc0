package net.osslabz.wamp.message;

/**
 * A decoded WAMP message. Implementations are immutable.
 */
public interface WampMessage {

    /**
     * @return the message type code, one of {@link WampMessageTypes}
     */
    int getMessageType();
}
