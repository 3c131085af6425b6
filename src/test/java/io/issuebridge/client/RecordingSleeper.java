package io.issuebridge.client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingSleeper implements Sleeper {
    private final List<Long> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(long millis) {
        delays.add(millis);
    }

    List<Long> delays() {
        return List.copyOf(delays);
    }
}
