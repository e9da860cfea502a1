package org.endlesssource.mediarotator.linux;

import org.freedesktop.dbus.types.Variant;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads the few metadata entries the adapter needs out of an MPRIS metadata dictionary.
 */
final class MprisMetadataUtils {
    static final String LENGTH_KEY = "mpris:length";
    static final String TRACK_ID_KEY = "mpris:trackid";
    static final String URL_KEY = "xesam:url";

    private MprisMetadataUtils() {
    }

    static Optional<Map<String, Object>> toMetadataMap(Object metadata) {
        Object value = metadata instanceof Variant<?> variant ? variant.getValue() : metadata;
        if (!(value instanceof Map<?, ?> rawMetadata) || rawMetadata.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(normalizeMap(rawMetadata));
    }

    /**
     * @return Track length in milliseconds, 0 if absent
     */
    static long lengthMs(Map<String, Object> metadata) {
        return toLong(metadata.get(LENGTH_KEY)).map(micros -> micros / 1000L).orElse(0L);
    }

    static boolean hasTrack(Map<String, Object> metadata) {
        return metadata.containsKey(URL_KEY) || metadata.containsKey(TRACK_ID_KEY);
    }

    /**
     * @return Local path of a {@code file://} track url, or empty for remote and missing urls
     */
    static Optional<String> localPath(Map<String, Object> metadata) {
        Object url = metadata.get(URL_KEY);
        if (!(url instanceof String urlString) || !urlString.startsWith("file:")) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(URI.create(urlString)).toString());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static Optional<Long> toLong(Object value) {
        Object unwrapped = unwrap(value);
        if (unwrapped instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (unwrapped instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> rawMap) {
        Map<String, Object> normalized = new HashMap<>();
        rawMap.forEach((key, rawValue) -> {
            if (key instanceof String keyStr) {
                normalized.put(keyStr, unwrap(rawValue));
            }
        });
        return normalized;
    }

    static Object unwrap(Object value) {
        if (value instanceof Variant<?> variant) {
            return unwrap(variant.getValue());
        }
        if (value instanceof Map<?, ?> nestedMap) {
            return normalizeMap(nestedMap);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> unwrapped = collection.stream()
                    .map(MprisMetadataUtils::unwrap)
                    .collect(Collectors.toList());
            return unwrapped;
        }
        return value;
    }
}
