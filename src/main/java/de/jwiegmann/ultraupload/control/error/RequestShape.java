package de.jwiegmann.ultraupload.control.error;

import lombok.Value;

/**
 * Die für die Antwortform relevanten Merkmale des aufrufenden Requests.
 */
@Value
public class RequestShape {

    public static final String API_PREFIX = "/api/";

    boolean expectsJson;
    String path;

    public static RequestShape json(String path) {
        return new RequestShape(true, path);
    }

    public static RequestShape html(String path) {
        return new RequestShape(false, path);
    }

    public boolean wantsJson() {
        return expectsJson || (path != null && path.startsWith(API_PREFIX));
    }
}
