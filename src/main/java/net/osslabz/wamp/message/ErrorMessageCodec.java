package net.osslabz.wamp.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.List;
import java.util.Map;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.error.InvalidMessageException;
import net.osslabz.wamp.error.WampException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * JSON serialization of ERROR messages.
 * <p>
 * Trailing {@code Arguments} and {@code ArgumentsKw} are omitted when absent. An empty {@code Arguments} list is only
 * written when {@code ArgumentsKw} follows it.
 */
public class ErrorMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(ErrorMessageCodec.class);

    private static final int TYPE = 0;

    private static final int REQUEST_TYPE = 1;

    private static final int REQUEST_ID = 2;

    private static final int DETAILS = 3;

    private static final int ERROR = 4;

    private static final int ARGS = 5;

    private static final int KWARGS = 6;

    private static final long MAX_ID = 1L << 53;

    private static final TypeReference<Map<String, Object>> DICT = new TypeReference<>() {
    };

    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;


    public ErrorMessageCodec() {

        this(new ObjectMapper());
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }


    public ErrorMessageCodec(ObjectMapper objectMapper) {

        this.objectMapper = objectMapper;
    }


    public String encode(ErrorMessage message) {

        ArrayNode frame = this.objectMapper.createArrayNode();
        frame.add(WampMessageTypes.ERROR);
        frame.add(message.getRequestType());
        frame.add(message.getRequestId());
        frame.add(toNode(message.getDetails()));
        frame.add(message.getError().toString());

        if (message.getArgs().isPresent() || message.getKwargs().isPresent()) {
            frame.add(toNode(message.getArgs().orElse(List.of())));
        }
        if (message.getKwargs().isPresent()) {
            frame.add(toNode(message.getKwargs().get()));
        }

        try {
            return this.objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new WampException("Failed to encode %s".formatted(message), e);
        }
    }


    private JsonNode toNode(Object value) {

        return this.objectMapper.valueToTree(value);
    }


    /**
     * @throws InvalidMessageException if {@code raw} is not a well-formed ERROR message
     */
    public ErrorMessage decode(String raw) {

        JsonNode frame;
        try {
            frame = this.objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Received malformed JSON: %s".formatted(e.getOriginalMessage()), e);
        }

        if (frame == null || !frame.isArray() || frame.size() < ERROR + 1 || frame.size() > KWARGS + 1) {
            throw new InvalidMessageException("Received invalid ERROR message: %s".formatted(raw));
        }
        if (!frame.get(TYPE).isInt() || frame.get(TYPE).asInt() != WampMessageTypes.ERROR) {
            throw new InvalidMessageException("Expected message type %d but got %s".formatted(WampMessageTypes.ERROR,
                frame.get(TYPE)));
        }

        JsonNode requestType = frame.get(REQUEST_TYPE);
        JsonNode requestId = frame.get(REQUEST_ID);
        JsonNode details = frame.get(DETAILS);
        JsonNode error = frame.get(ERROR);
        if (!requestType.isInt() || !requestId.isIntegralNumber() || !details.isObject() || !error.isTextual()) {
            throw new InvalidMessageException("Received invalid ERROR message: %s".formatted(raw));
        }

        if (!requestId.canConvertToLong() || requestId.asLong() < 0 || requestId.asLong() > MAX_ID) {
            throw new InvalidMessageException("ERROR request id out of range: %s".formatted(requestId));
        }

        JsonNode args = frame.get(ARGS);
        if (args != null && !args.isArray()) {
            throw new InvalidMessageException("ERROR arguments must be a list: %s".formatted(raw));
        }
        JsonNode kwargs = frame.get(KWARGS);
        if (kwargs != null && !kwargs.isObject()) {
            throw new InvalidMessageException("ERROR keyword arguments must be a dict: %s".formatted(raw));
        }

        Uri uri;
        try {
            uri = Uri.of(error.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageException("ERROR carries an invalid uri: %s".formatted(error.asText()), e);
        }

        log.trace("Decoded ERROR for request {} with uri '{}'.", requestId.asLong(), uri);

        return new ErrorMessage(
            requestType.asInt(),
            requestId.asLong(),
            this.objectMapper.convertValue(details, DICT),
            uri,
            args == null ? null : this.objectMapper.convertValue(args, LIST),
            kwargs == null ? null : this.objectMapper.convertValue(kwargs, DICT));
    }
}
