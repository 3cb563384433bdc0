package net.osslabz.wamp.error;

import net.osslabz.wamp.WampUris;


/**
 * Mappings for the error URIs defined by the WAMP basic profile.
 */
public class WampErrorMappings implements ErrorMappingProvider {

    @Override
    public void registerMappings(ErrorRegistry registry) {

        registry.registerExceptionUri(IllegalArgumentException.class, WampUris.INVALID_ARGUMENT);
    }
}
