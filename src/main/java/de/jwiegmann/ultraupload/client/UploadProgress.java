package de.jwiegmann.ultraupload.client;

import lombok.Value;

@Value
public class UploadProgress {
    int total;
    int finalized;
    int failed;
    int invalid;
    int cancelled;

    public int getCompleted() {
        return finalized + failed + invalid + cancelled;
    }

    public int getPercent() {
        return total == 0 ? 100 : (int) Math.round(getCompleted() * 100.0 / total);
    }

    public boolean isDone() {
        return getCompleted() == total;
    }
}
