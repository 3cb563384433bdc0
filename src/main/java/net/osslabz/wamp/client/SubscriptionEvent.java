package net.osslabz.wamp.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.EventMessage;


/**
 * A publication delivered to a subscription handler.
 * <p>
 * Carries the already decoded payload and lets the handler unsubscribe from the topic it was delivered for.
 *
 * @param <C> client type
 */
public class SubscriptionEvent<C extends WampClient> {

    private final C client;

    private final Uri subscribedTopic;

    private final long publicationId;

    private final List<Object> args;

    private final Map<String, Object> kwargs;

    private final Map<String, Object> details;


    public SubscriptionEvent(C client, EventMessage message, Uri topic) {

        this.client = Objects.requireNonNull(client, "client");
        this.subscribedTopic = Objects.requireNonNull(topic, "topic");
        this.publicationId = message.getPublicationId();
        this.args = message.getArgs().orElse(List.of());
        this.kwargs = message.getKwargs().orElse(Map.of());
        this.details = message.getDetails();
    }


    public C getClient() {

        return client;
    }


    public long getPublicationId() {

        return publicationId;
    }


    public Uri getSubscribedTopic() {

        return subscribedTopic;
    }


    public List<Object> getArgs() {

        return args;
    }


    public Map<String, Object> getKwargs() {

        return kwargs;
    }


    public Map<String, Object> getDetails() {

        return details;
    }


    public CompletableFuture<Void> unsubscribe() {

        return this.client.unsubscribe(this.subscribedTopic);
    }
}
