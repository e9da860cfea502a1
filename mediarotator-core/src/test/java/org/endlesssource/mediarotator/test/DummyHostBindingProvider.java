package org.endlesssource.mediarotator.test;

import org.endlesssource.mediarotator.HostSupport;
import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.spi.HostBindingProvider;

import java.util.concurrent.atomic.AtomicReference;

public final class DummyHostBindingProvider implements HostBindingProvider {
    private static final AtomicReference<RotatorOptions> LAST_OPTIONS = new AtomicReference<>();

    @Override
    public String hostId() {
        return "test-dummy";
    }

    @Override
    public boolean supportsCurrentEnvironment() {
        return true;
    }

    @Override
    public HostSupport probeSupport() {
        return HostSupport.available(hostId());
    }

    @Override
    public HostBinding create(RotatorOptions options) {
        LAST_OPTIONS.set(options);
        return new DummyHostBinding();
    }

    public static RotatorOptions consumeLastOptions() {
        return LAST_OPTIONS.getAndSet(null);
    }
}
