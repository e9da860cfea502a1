package org.endlesssource.mediarotator;

import org.endlesssource.mediarotator.api.HostBinding;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.library.LibraryStore;
import org.endlesssource.mediarotator.test.DummyHostBinding;
import org.endlesssource.mediarotator.test.DummyHostBindingProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RotatorFactoryDummyProviderTest {

    @Test
    void createBinding_nullOptions_throws() {
        assertThrows(NullPointerException.class, () -> RotatorFactory.createBinding(null));
    }

    @Test
    void createBinding_usesDummyProvider_andPassesOptions() {
        RotatorOptions options = RotatorOptions.defaults()
                .withInitialMode(PlaybackMode.LOOP)
                .withHostTarget("vlc")
                .withTickInterval(Duration.ofMillis(250));

        try (HostBinding binding = RotatorFactory.createBinding(options)) {
            assertNotNull(binding);
            assertInstanceOf(DummyHostBinding.class, binding);
            assertTrue(binding.signals().isOutputVisible());
        }

        RotatorOptions captured = DummyHostBindingProvider.consumeLastOptions();
        assertNotNull(captured);
        assertEquals(PlaybackMode.LOOP, captured.getInitialMode());
        assertEquals("vlc", captured.getHostTarget().orElseThrow());
        assertEquals(Duration.ofMillis(250), captured.getTickInterval());
    }

    @Test
    void currentHostSupport_reportsAvailableWhenDummyProviderPresent() {
        HostSupport support = RotatorFactory.getCurrentHostSupport();
        assertTrue(support.available());
        assertTrue(support.compiled());
        assertEquals("test-dummy", support.host());
        assertTrue(RotatorFactory.isHostSupported());
    }

    @Test
    void compiledAndRuntimeHosts_includeDummyProvider() {
        assertTrue(RotatorFactory.getCompiledHosts().contains("test-dummy"));
        assertTrue(RotatorFactory.getRuntimeAvailableHosts().contains("test-dummy"));
    }

    @Test
    void createRuntime_closeStopsAndClosesBinding() {
        RotatorRuntime runtime = RotatorFactory.createRuntime(RotatorOptions.defaults(), new LibraryStore());
        DummyHostBinding binding = (DummyHostBinding) runtime.getBinding();
        assertEquals(PlaybackMode.CONTINUOUS, runtime.getMode());

        runtime.close();

        assertTrue(binding.isClosed());
        assertThrows(IllegalStateException.class, runtime::start);
        DummyHostBindingProvider.consumeLastOptions();
    }
}
