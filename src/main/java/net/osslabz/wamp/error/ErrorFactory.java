package net.osslabz.wamp.error;

import net.osslabz.wamp.message.ErrorMessage;


/**
 * Creates the exception representing a received ERROR message.
 */
@FunctionalInterface
public interface ErrorFactory {

    RuntimeException create(ErrorMessage message);
}
