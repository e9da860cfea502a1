package org.endlesssource.mediarotator;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.library.LibraryStore;
import org.endlesssource.mediarotator.spi.HostBindingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class RotatorFactory {
    private static final Logger logger = LoggerFactory.getLogger(RotatorFactory.class);

    private RotatorFactory() {}

    /**
     * Create a host binding using the first runtime-available provider
     * @param options Configuration options
     * @return HostBinding for the current environment
     * @throws UnsupportedOperationException if no provider is available
     * @throws IllegalStateException if a provider is available but initialization fails
     */
    public static HostBinding createBinding(RotatorOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<HostBindingProvider> candidates = loadProviders().stream()
                .filter(HostBindingProvider::supportsCurrentEnvironment)
                .sorted(Comparator.comparing(HostBindingProvider::hostId))
                .toList();

        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No host binding module found for the current environment");
        }

        List<String> reasons = new ArrayList<>();
        for (HostBindingProvider provider : candidates) {
            logger.debug("Probing host provider {}", provider.hostId());
            HostSupport support = provider.probeSupport();
            if (support.available()) {
                logger.info("Using host binding {}", provider.hostId());
                try {
                    return provider.create(options);
                } catch (RuntimeException e) {
                    throw new IllegalStateException("Failed to initialize host binding "
                            + provider.hostId() + ": " + e.getMessage(), e);
                }
            }
            reasons.add(provider.hostId() + ": " + support.reason());
        }

        throw new UnsupportedOperationException("No host binding is runtime-available: "
                + String.join("; ", reasons));
    }

    /**
     * Create a runtime that drives the given library against the current host
     * @param options Configuration options
     * @param library Library filled by the ingestion side
     * @return A runtime that is not yet started
     */
    public static RotatorRuntime createRuntime(RotatorOptions options, LibraryStore library) {
        Objects.requireNonNull(library, "library must not be null");
        return new RotatorRuntime(createBinding(options), library, options);
    }

    /**
     * Check if any host binding is usable right now
     * @return true if a provider is runtime-available
     */
    public static boolean isHostSupported() {
        return getCurrentHostSupport().available();
    }

    /**
     * Get host bindings compiled into the current classpath (providers present).
     */
    public static List<String> getCompiledHosts() {
        return loadProviders().stream()
                .map(HostBindingProvider::hostId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get host bindings that are runtime-available right now.
     */
    public static List<String> getRuntimeAvailableHosts() {
        return loadProviders().stream()
                .map(HostBindingProvider::probeSupport)
                .filter(HostSupport::available)
                .map(HostSupport::host)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get support status for the current environment.
     */
    public static HostSupport getCurrentHostSupport() {
        List<HostBindingProvider> candidates = loadProviders().stream()
                .filter(HostBindingProvider::supportsCurrentEnvironment)
                .toList();
        if (candidates.isEmpty()) {
            return HostSupport.notCompiled("none", "No host binding module on classpath for this environment");
        }
        List<HostSupport> probes = candidates.stream()
                .map(HostBindingProvider::probeSupport)
                .toList();
        Optional<HostSupport> available = probes.stream()
                .filter(HostSupport::available)
                .findFirst();
        if (available.isPresent()) {
            return available.get();
        }
        String reasons = probes.stream()
                .map(HostSupport::reason)
                .filter(reason -> reason != null && !reason.isBlank())
                .collect(Collectors.joining("; "));
        return HostSupport.unavailable(candidates.get(0).hostId(),
                reasons.isBlank() ? "Provider probe failed" : reasons);
    }

    private static List<HostBindingProvider> loadProviders() {
        ServiceLoader<HostBindingProvider> loader = ServiceLoader.load(HostBindingProvider.class);
        List<HostBindingProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered host providers: {}",
                    providers.stream().map(HostBindingProvider::hostId).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
