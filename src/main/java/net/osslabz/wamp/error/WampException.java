package net.osslabz.wamp.error;

/**
 * Base class of every failure raised by the WAMP client.
 * <p>
 * Catch this to handle all client failures uniformly; the subclasses tell them apart.
 */
public class WampException extends RuntimeException {

    public WampException(String message) {

        super(message);

    }


    public WampException(Throwable e) {

        super(e);
    }


    public WampException(String message, Throwable cause) {

        super(message, cause);
    }


    protected WampException() {

        super();
    }
}
