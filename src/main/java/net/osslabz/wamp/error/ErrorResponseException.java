package net.osslabz.wamp.error;

import java.util.List;
import java.util.Map;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.ErrorMessage;


/**
 * A remote error whose URI has no registered {@link ErrorFactory}. Wraps the error message unchanged.
 * <p>
 * The message reads {@code <uri> <args> (<key>=<value>, ...)}; the argument and keyword sections are left out when
 * they are empty.
 */
public class ErrorResponseException extends WampException {

    private final transient ErrorMessage errorMessage;


    public ErrorResponseException(ErrorMessage errorMessage) {

        super(render(errorMessage));
        this.errorMessage = errorMessage;
    }


    public ErrorMessage getErrorMessage() {

        return errorMessage;
    }


    public Uri getUri() {

        return errorMessage.getError();
    }


    @Override
    public String toString() {

        return "%s(%s)".formatted(getClass().getSimpleName(), errorMessage);
    }


    private static String render(ErrorMessage message) {

        StringBuilder sb = new StringBuilder(message.getError().toString());

        List<Object> args = message.getArgs().orElse(List.of());
        if (!args.isEmpty()) {
            sb.append(' ').append(Renderings.joinRepr(args));
        }

        Map<String, Object> kwargs = message.getKwargs().orElse(Map.of());
        if (!kwargs.isEmpty()) {
            sb.append(" (").append(Renderings.joinKeywords(kwargs)).append(')');
        }

        return sb.toString();
    }
}
