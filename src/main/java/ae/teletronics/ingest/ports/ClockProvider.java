package ae.teletronics.ingest.ports;

import java.time.Instant;

/**
 * Source of "now" for session expiry, job backoff and leases, and record timestamps.
 */
public interface ClockProvider {

    Instant now();
}
