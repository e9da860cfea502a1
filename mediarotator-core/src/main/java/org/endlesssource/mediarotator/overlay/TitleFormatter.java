package org.endlesssource.mediarotator.overlay;

/**
 * Renders a {@link TitleCard} as overlay text: {@code "Title - Artist"}.
 */
public final class TitleFormatter {
    /** Appended when the metadata came from the fallback parser. */
    public static final String DEGRADED_MARKER = " ⚠";

    private TitleFormatter() {
    }

    public static String format(TitleCard card) {
        if (card == null) {
            return "";
        }
        String title = card.title().trim();
        String artist = card.artist().trim();
        String text;
        if (!title.isEmpty() && !artist.isEmpty()) {
            text = title + " - " + artist;
        } else if (!title.isEmpty()) {
            text = title;
        } else {
            text = artist;
        }
        if (!text.isEmpty() && card.degraded()) {
            text += DEGRADED_MARKER;
        }
        return text;
    }
}
