package net.osslabz.wamp.error;

/**
 * Transport level failure, such as a lost connection. Usually ends the current session.
 */
public class TransportException extends WampException {

    public TransportException(String message) {

        super(message);
    }


    public TransportException(String message, Throwable cause) {

        super(message, cause);
    }
}
