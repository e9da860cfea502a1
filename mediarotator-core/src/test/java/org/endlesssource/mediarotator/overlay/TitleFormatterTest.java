package org.endlesssource.mediarotator.overlay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TitleFormatterTest {

    @Test
    void formatsTitleAndArtist() {
        assertEquals("Song - Artist", TitleFormatter.format(new TitleCard("Song", "Artist", false)));
        assertEquals("Song", TitleFormatter.format(new TitleCard(" Song ", "", false)));
        assertEquals("Artist", TitleFormatter.format(new TitleCard(null, "Artist", false)));
        assertEquals("", TitleFormatter.format(new TitleCard("", " ", false)));
        assertEquals("", TitleFormatter.format(null));
    }

    @Test
    void degradedMetadata_getsMarker() {
        assertEquals("Song - Artist ⚠", TitleFormatter.format(new TitleCard("Song", "Artist", true)));
        assertEquals("", TitleFormatter.format(new TitleCard("", "", true)));
    }
}
