package net.osslabz.wamp.error;

/**
 * Raised when an operation is attempted on a client that has already been closed.
 */
public class ClientClosedException extends WampException {

    public ClientClosedException() {

        super("client is closed");
    }


    public ClientClosedException(String message) {

        super(message);
    }
}
