package de.jwiegmann.ultraupload.client.realtime;

import de.jwiegmann.ultraupload.client.StatusKind;
import de.jwiegmann.ultraupload.client.UploadStatusListener;
import de.jwiegmann.ultraupload.control.scan.UploadEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Abonniert den Kanal "upload" und leitet benannte Ereignisse an den Orchestrator weiter.
 * Ist der Kanal nicht erreichbar, wird nur protokolliert; der Upload läuft über HTTP weiter.
 */
@Slf4j(topic = "ultra.upload")
public class RealTimeEventListener {

    private final RealTimeChannel channel;
    private final ScanEventSink sink;
    private final UploadStatusListener statusListener;

    public RealTimeEventListener(RealTimeChannel channel, ScanEventSink sink, UploadStatusListener statusListener) {
        this.channel = channel;
        this.sink = sink;
        this.statusListener = statusListener;
    }

    /**
     * @return false, wenn das Abonnement fehlgeschlagen ist
     */
    public boolean subscribe() {
        try {
            channel.subscribe(UploadEvent.CHANNEL, this::dispatch);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Real-time channel '{}' unavailable, continuing without scan events: {}",
                    UploadEvent.CHANNEL, e.getMessage());
            return false;
        }
    }

    public void dispatch(UploadEvent event) {
        String state = event.getState() == null ? "" : event.getState();
        String message = event.getMessage();
        String fileName = event.getFileName();

        switch (state) {
            case UploadEvent.VIRUS_SCAN:
                statusListener.onStatus(message, StatusKind.INFO);
                break;
            case UploadEvent.ALL_CLEAN:
                statusListener.onStatus(message, StatusKind.SUCCESS);
                sink.onScanClean(fileName, message);
                break;
            case UploadEvent.SOME_INFECTED:
                statusListener.onStatus(message, StatusKind.WARNING);
                sink.onScanInfected(fileName, message);
                break;
            case UploadEvent.END_VIRUS_SCAN:
                statusListener.onStatus(message, StatusKind.WARNING);
                sink.onScanError(fileName, message);
                break;
            case UploadEvent.UPLOAD_FAILED:
                statusListener.onStatus(message, StatusKind.ERROR);
                sink.onUploadFailed(fileName, message);
                break;
            default:
                statusListener.onStatus(message, StatusKind.INFO);
        }
    }
}
