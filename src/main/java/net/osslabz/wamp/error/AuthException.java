package net.osslabz.wamp.error;

public class AuthException extends WampException {

    public AuthException(String message) {

        super(message);
    }


    public AuthException(String message, Throwable cause) {

        super(message, cause);
    }
}
