package de.jwiegmann.ultraupload.control.limits;

/**
 * Liefert die von der Laufzeitplattform erzwungenen Upload-Grenzen.
 */
public interface PlatformLimitsProvider {

    RawLimits platformLimits();
}
