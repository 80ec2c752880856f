package de.jwiegmann.ultraupload.control.scan;

public interface UploadEventPublisher {

    void publish(UploadEvent event);
}
