package de.jwiegmann.ultraupload.control.limits;

/**
 * Welche Quelle einen effektiven Grenzwert bestimmt.
 */
public enum LimitSource {
    PLATFORM,
    APPLICATION,
    EQUAL      // beide Quellen liefern denselben Wert
}
