package net.osslabz.wamp.error;

/**
 * A message that could not be parsed or violates the protocol.
 */
public class InvalidMessageException extends WampException {

    public InvalidMessageException(String message) {

        super(message);
    }


    public InvalidMessageException(String message, Throwable cause) {

        super(message, cause);
    }
}
