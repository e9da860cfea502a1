package org.endlesssource.mediarotator;

import java.util.Objects;

/**
 * Host availability information for a binding provider.
 */
public record HostSupport(String host, boolean compiled, boolean available, String reason) {
    public HostSupport(String host, boolean compiled, boolean available, String reason) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.compiled = compiled;
        this.available = available;
        this.reason = reason == null ? "" : reason;
    }

    public static HostSupport available(String host) {
        return new HostSupport(host, true, true, "");
    }

    public static HostSupport unavailable(String host, String reason) {
        return new HostSupport(host, true, false, reason);
    }

    public static HostSupport notCompiled(String host, String reason) {
        return new HostSupport(host, false, false, reason);
    }
}
