package net.osslabz.wamp;

import java.util.NoSuchElementException;


/**
 * Thrown by {@link UriMap#resolve(Uri)} when no registration applies to a URI.
 */
public class UriNotFoundException extends NoSuchElementException {

    private final Uri uri;


    public UriNotFoundException(Uri uri) {

        super("no entry registered for uri '%s'".formatted(uri));
        this.uri = uri;
    }


    public Uri getUri() {

        return uri;
    }
}
