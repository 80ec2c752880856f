package de.jwiegmann.ultraupload.client.realtime;

import de.jwiegmann.ultraupload.client.StatusKind;
import de.jwiegmann.ultraupload.client.UploadStatusListener;
import de.jwiegmann.ultraupload.control.scan.UploadEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RealTimeEventListenerTest {

    @Mock
    private RealTimeChannel channel;

    @Mock
    private ScanEventSink sink;

    @Mock
    private UploadStatusListener statusListener;

    @Test
    void subscribes_to_upload_channel() throws IOException {
        RealTimeEventListener listener = new RealTimeEventListener(channel, sink, statusListener);

        assertThat(listener.subscribe()).isTrue();
        verify(channel).subscribe(eq("upload"), any());
    }

    @Test
    void unreachable_channel_is_reported_not_thrown() throws IOException {
        doThrow(new IOException("connection refused")).when(channel).subscribe(eq("upload"), any());
        RealTimeEventListener listener = new RealTimeEventListener(channel, sink, statusListener);

        assertThat(listener.subscribe()).isFalse();
        verifyNoInteractions(sink);
    }

    @Test
    void clean_event_goes_to_sink_as_success() {
        RealTimeEventListener listener = new RealTimeEventListener(channel, sink, statusListener);

        listener.dispatch(UploadEvent.of(UploadEvent.ALL_CLEAN, "All clean", "a.png"));

        verify(sink).onScanClean("a.png", "All clean");
        verify(statusListener).onStatus("All clean", StatusKind.SUCCESS);
    }

    @Test
    void infected_end_and_failed_events_map_to_sink_methods() {
        RealTimeEventListener listener = new RealTimeEventListener(channel, sink, statusListener);

        listener.dispatch(UploadEvent.of(UploadEvent.SOME_INFECTED, "Virus", "a.png"));
        listener.dispatch(UploadEvent.of(UploadEvent.END_VIRUS_SCAN, "Scan skipped", null));
        listener.dispatch(UploadEvent.of(UploadEvent.UPLOAD_FAILED, "Failed", "b.png"));

        verify(sink).onScanInfected("a.png", "Virus");
        verify(sink).onScanError(null, "Scan skipped");
        verify(sink).onUploadFailed("b.png", "Failed");
        verify(statusListener).onStatus("Failed", StatusKind.ERROR);
    }

    @Test
    void progress_and_unknown_states_are_informational_only() {
        RealTimeEventListener listener = new RealTimeEventListener(channel, sink, statusListener);

        listener.dispatch(UploadEvent.of(UploadEvent.VIRUS_SCAN, "Scanning", "a.png"));
        listener.dispatch(UploadEvent.of("somethingNew", "Other", "a.png"));

        verify(statusListener).onStatus("Scanning", StatusKind.INFO);
        verify(statusListener).onStatus("Other", StatusKind.INFO);
        verifyNoInteractions(sink);
    }
}
