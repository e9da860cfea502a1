package org.endlesssource.mediarotator.linux;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

@DBusInterfaceName("org.mpris.MediaPlayer2")
interface MprisMediaPlayer2 extends DBusInterface {
    String getIdentity();
    String[] getSupportedUriSchemes();
}
