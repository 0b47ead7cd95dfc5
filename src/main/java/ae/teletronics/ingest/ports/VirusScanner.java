package ae.teletronics.ingest.ports;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Pluggable antivirus check.
 */
public interface VirusScanner {

    ScanReport scan(StreamSource source) throws IOException;

    enum Verdict { CLEAN, INFECTED, ERROR }

    final class ScanReport {
        private final Verdict verdict;
        private final String engine;           // e.g., "NoOp", "ClamAV"
        private final List<String> signatures; // threats found, empty unless INFECTED
        private final String details;

        public static ScanReport clean(String engine) {
            return new ScanReport(Verdict.CLEAN, engine, List.of(), null);
        }
        public static ScanReport infected(String engine, List<String> signatures) {
            return new ScanReport(Verdict.INFECTED, engine, signatures, String.join(", ", signatures));
        }
        public static ScanReport error(String engine, String details) {
            return new ScanReport(Verdict.ERROR, engine, List.of(), details);
        }

        public ScanReport(Verdict verdict, String engine, List<String> signatures, String details) {
            this.verdict = Objects.requireNonNull(verdict, "verdict");
            this.engine = engine;
            this.signatures = signatures == null ? List.of() : List.copyOf(signatures);
            this.details = details;
        }

        public Verdict getVerdict() { return verdict; }
        public String getEngine() { return engine; }
        public List<String> getSignatures() { return signatures; }
        public String getDetails() { return details; }
    }
}
