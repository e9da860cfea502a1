package org.endlesssource.mediarotator.spi;

import org.endlesssource.mediarotator.HostSupport;
import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.RotatorOptions;

/**
 * SPI implemented by host-specific modules.
 */
public interface HostBindingProvider {

    /**
     * Stable host id, e.g. mpris.
     */
    String hostId();

    /**
     * True when this provider can target the current environment at all.
     */
    boolean supportsCurrentEnvironment();

    /**
     * Probe runtime availability (native deps, running host process, init preconditions).
     */
    HostSupport probeSupport();

    /**
     * Create the binding to the host's media and overlay slots.
     */
    HostBinding create(RotatorOptions options);
}
