package org.endlesssource.mediarotator.linux;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

@DBusInterfaceName("org.mpris.MediaPlayer2.Player")
interface MprisPlayer extends DBusInterface {
    void Stop();
    void Play();
    void OpenUri(String uri);

    String getPlaybackStatus();
    long getPosition();
    boolean getCanControl();
}
