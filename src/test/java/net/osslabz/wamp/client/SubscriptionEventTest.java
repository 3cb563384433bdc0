package net.osslabz.wamp.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import net.osslabz.wamp.Uri;
import net.osslabz.wamp.message.EventMessage;
import org.junit.jupiter.api.Test;


class SubscriptionEventTest {

    private final Uri topic = Uri.of("com.example.topic");


    @Test
    void exposesPublication() {

        WampClient client = mock(WampClient.class);
        EventMessage message = new EventMessage(1L, 99L, Map.of("publisher", 5), List.of("hello"), Map.of("n", 1));

        SubscriptionEvent<WampClient> event = new SubscriptionEvent<>(client, message, topic);

        assertThat(event.getClient()).isSameAs(client);
        assertThat(event.getPublicationId()).isEqualTo(99L);
        assertThat(event.getSubscribedTopic()).isEqualTo(topic);
        assertThat(event.getArgs()).containsExactly("hello");
        assertThat(event.getKwargs()).containsEntry("n", 1);
        assertThat(event.getDetails()).containsEntry("publisher", 5);
    }


    @Test
    void absentPayloadBecomesEmpty() {

        EventMessage message = new EventMessage(1L, 99L, Map.of(), null, null);

        SubscriptionEvent<WampClient> event = new SubscriptionEvent<>(mock(WampClient.class), message, topic);

        assertThat(event.getArgs()).isEmpty();
        assertThat(event.getKwargs()).isEmpty();
    }


    @Test
    void unsubscribeDelegatesToClient() {

        WampClient client = mock(WampClient.class);
        CompletableFuture<Void> ack = new CompletableFuture<>();
        when(client.unsubscribe(topic)).thenReturn(ack);

        SubscriptionEvent<WampClient> event = new SubscriptionEvent<>(client,
            new EventMessage(1L, 2L, Map.of(), null, null), topic);

        assertThat(event.unsubscribe()).isSameAs(ack);
        verify(client).unsubscribe(topic);
    }
}
