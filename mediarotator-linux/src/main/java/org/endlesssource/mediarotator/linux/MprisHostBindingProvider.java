package org.endlesssource.mediarotator.linux;

import org.endlesssource.mediarotator.HostSupport;
import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.spi.HostBindingProvider;
import org.freedesktop.dbus.exceptions.DBusException;

public final class MprisHostBindingProvider implements HostBindingProvider {
    @Override
    public String hostId() {
        return "mpris";
    }

    @Override
    public boolean supportsCurrentEnvironment() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("nix") || os.contains("nux");
    }

    @Override
    public HostSupport probeSupport() {
        if (!supportsCurrentEnvironment()) {
            return HostSupport.unavailable(hostId(), "Current OS is not Linux");
        }
        try {
            Class.forName("org.freedesktop.dbus.connections.impl.DBusConnectionBuilder");
            return HostSupport.available(hostId());
        } catch (ClassNotFoundException e) {
            return HostSupport.unavailable(hostId(), "Missing D-Bus runtime classes");
        }
    }

    @Override
    public HostBinding create(RotatorOptions options) {
        try {
            return new MprisHostBinding(options);
        } catch (DBusException e) {
            throw new RuntimeException("Failed to connect to the session bus: " + e.getMessage(), e);
        }
    }
}
