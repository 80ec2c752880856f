package de.jwiegmann.ultraupload.client;

/**
 * Darstellungsart einer Statusmeldung.
 */
public enum StatusKind {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
