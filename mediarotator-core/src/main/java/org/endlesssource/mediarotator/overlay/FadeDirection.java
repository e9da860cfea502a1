package org.endlesssource.mediarotator.overlay;

public enum FadeDirection {
    IN,
    OUT
}
