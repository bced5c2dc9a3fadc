package org.autofetch.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

/**
 * Translates OS signals into {@link ControlEvent}s: TERM and INT request a graceful
 * shutdown, HUP requests a configuration reload. Handlers only post to the channel.
 */
public final class SignalEvents {
    private static final Logger logger = LoggerFactory.getLogger(SignalEvents.class);

    private SignalEvents() {}

    public static void install(ControlEvents events) {
        handle("TERM", events, ControlEvent.SHUTDOWN_REQUESTED);
        handle("INT", events, ControlEvent.SHUTDOWN_REQUESTED);
        handle("HUP", events, ControlEvent.RELOAD_REQUESTED);
    }

    private static void handle(String name, ControlEvents events, ControlEvent event) {
        try {
            Signal.handle(new Signal(name), signal -> events.post(event));
            logger.debug("SIG{} mapped to {}", name, event);
        } catch (IllegalArgumentException e) {
            logger.warn("Signal SIG{} not available on this platform: {}", name, e.getMessage());
        }
    }
}
