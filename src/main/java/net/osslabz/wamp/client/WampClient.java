package net.osslabz.wamp.client;

import java.util.concurrent.CompletableFuture;
import net.osslabz.wamp.Uri;


/**
 * The parts of a WAMP client that objects handed to application code call back into.
 */
public interface WampClient {

    /**
     * Removes the subscription for {@code topic}.
     *
     * @return completes once the router acknowledged the removal
     */
    CompletableFuture<Void> unsubscribe(Uri topic);
}
