package de.jwiegmann.ultraupload.client.realtime;

import de.jwiegmann.ultraupload.control.scan.UploadEvent;

import java.io.IOException;
import java.util.function.Consumer;

public interface RealTimeChannel extends AutoCloseable {

    /**
     * @throws IOException wenn der Kanal nicht erreichbar ist
     */
    void subscribe(String channel, Consumer<UploadEvent> listener) throws IOException;

    @Override
    void close();
}
