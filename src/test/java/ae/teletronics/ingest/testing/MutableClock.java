package ae.teletronics.ingest.testing;

import ae.teletronics.ingest.ports.ClockProvider;

import java.time.Duration;
import java.time.Instant;

public class MutableClock implements ClockProvider {

    private Instant now;

    public MutableClock(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public synchronized void advance(Duration d) {
        now = now.plus(d);
    }
}
