package org.endlesssource.mediarotator.examples;

import org.endlesssource.mediarotator.HostSupport;
import org.endlesssource.mediarotator.RotatorFactory;
import org.endlesssource.mediarotator.RotatorRuntime;
import org.endlesssource.mediarotator.api.LibraryItem;
import org.endlesssource.mediarotator.api.MutableHostSignals;
import org.endlesssource.mediarotator.api.PlaybackMode;
import org.endlesssource.mediarotator.api.RotatorOptions;
import org.endlesssource.mediarotator.library.LibraryStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Scanner;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rotates the videos of a directory through the current host.
 * Usage: {@code RotatorCliExample [mediaDir] [playerName]}
 */
public final class RotatorCliExample {

    public static void main(String[] args) {
        HostSupport support = RotatorFactory.getCurrentHostSupport();
        if (!support.available()) {
            System.out.println("Unsupported host: " + support.host());
            System.out.println("Reason: " + support.reason());
            return;
        }

        RotatorOptions options = RotatorOptions.defaults()
                .withPlayHistoryFile(Path.of(System.getProperty("user.home"), ".mediarotator", "played.json"));
        if (args.length > 1) {
            options = options.withHostTarget(args[1]);
        }

        LibraryStore library = LibraryStore.forOptions(options);
        if (args.length > 0) {
            scan(library, Path.of(args[0]));
        }

        try (RotatorRuntime runtime = RotatorFactory.createRuntime(options, library);
             Scanner scanner = new Scanner(System.in)) {
            System.out.println("Media Rotator CLI");
            printHelp();
            runtime.start();

            while (true) {
                System.out.print("rotator> ");
                if (!scanner.hasNextLine()) {
                    break;
                }

                String line = scanner.nextLine().trim();
                if (line.isEmpty()) {
                    continue;
                }

                String[] parts = line.split("\\s+", 2);
                String cmd = parts[0].toLowerCase(Locale.ROOT);
                String arg = parts.length > 1 ? parts[1].trim() : "";

                switch (cmd) {
                    case "help" -> printHelp();
                    case "quit", "exit" -> {
                        return;
                    }
                    case "mode" -> changeMode(runtime, arg);
                    case "show" -> setVisible(runtime, true);
                    case "hide" -> setVisible(runtime, false);
                    case "scan" -> scan(library, Path.of(arg.isEmpty() ? "." : arg));
                    case "list" -> printLibrary(library);
                    case "remove" -> removeItem(library, arg);
                    case "status" -> System.out.println(runtime.describe());
                    default -> System.out.println("Unknown command: " + cmd + " (type 'help')");
                }
            }
        } catch (Exception e) {
            System.err.println("Rotator CLI failed: " + e.getMessage());
        }
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  help                          Show this help");
        System.out.println("  mode <continuous|single|loop> Change playback mode");
        System.out.println("  show|hide                     Toggle output visibility");
        System.out.println("  scan <dir>                    Add the videos of a directory");
        System.out.println("  list                          List library items");
        System.out.println("  remove <id>                   Remove an item");
        System.out.println("  status                        Show rotator state");
        System.out.println("  exit                          Quit");
    }

    private static void changeMode(RotatorRuntime runtime, String arg) {
        Optional<PlaybackMode> mode = PlaybackMode.fromId(arg);
        if (mode.isEmpty()) {
            System.out.println("Usage: mode <" + Arrays.stream(PlaybackMode.values())
                    .map(PlaybackMode::id)
                    .collect(Collectors.joining("|")) + ">");
            return;
        }
        runtime.setMode(mode.get());
        System.out.println("mode: " + mode.get().id());
    }

    private static void setVisible(RotatorRuntime runtime, boolean visible) {
        if (runtime.getBinding().signals() instanceof MutableHostSignals signals) {
            signals.setOutputVisible(visible);
            System.out.println("visible: " + visible);
        } else {
            System.out.println("Visibility is controlled by the host.");
        }
    }

    private static void scan(LibraryStore library, Path directory) {
        if (!Files.isDirectory(directory)) {
            System.out.println("Not a directory: " + directory);
            return;
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> paths = files.filter(Files::isRegularFile).sorted().toList();
            int added = 0;
            for (Path path : paths) {
                LibraryItem item = toItem(path.toAbsolutePath());
                if (library.getValidator().isValid(item.localPath())) {
                    library.put(item);
                    added++;
                }
            }
            System.out.println("Added " + added + " item(s) from " + directory);
        } catch (IOException e) {
            System.out.println("Failed to scan " + directory + ": " + e.getMessage());
        }
    }

    /**
     * "Artist - Title.ext" names give full metadata; anything else is used as a degraded title.
     */
    private static LibraryItem toItem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String[] parts = stem.split(" - ", 2);
        if (parts.length == 2) {
            return new LibraryItem(stem, path, parts[1].trim(), parts[0].trim(), false);
        }
        return new LibraryItem(stem, path, stem, "", true);
    }

    private static void printLibrary(LibraryStore library) {
        if (library.isEmpty()) {
            System.out.println("Library is empty.");
            return;
        }
        String current = library.currentItemId().orElse(null);
        library.snapshot().values().forEach(item -> {
            String marker = item.id().equals(current) ? "*" : " ";
            System.out.printf("%s %s (%s)%n", marker, item.id(), item.localPath());
        });
    }

    private static void removeItem(LibraryStore library, String id) {
        if (id.isEmpty()) {
            System.out.println("Usage: remove <id>");
            return;
        }
        if (!library.contains(id)) {
            System.out.println("Unknown item: " + id);
            return;
        }
        boolean removed = library.remove(id);
        System.out.println(removed ? "removed: " + id : "deferred until " + id + " stops playing");
    }
}
