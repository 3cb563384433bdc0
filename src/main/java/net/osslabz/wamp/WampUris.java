package net.osslabz.wamp;

public class WampUris {

    public static final Uri RUNTIME_ERROR = Uri.of("wamp.error.runtime_error");

    public static final Uri INVALID_ARGUMENT = Uri.of("wamp.error.invalid_argument");

    public static final Uri CANCELED = Uri.of("wamp.error.canceled");

    public static final Uri NO_SUCH_PROCEDURE = Uri.of("wamp.error.no_such_procedure");

    public static final Uri NOT_AUTHORIZED = Uri.of("wamp.error.not_authorized");

    public static final Uri CLOSE_NORMAL = Uri.of("wamp.close.normal");


    private WampUris() {

    }
}
