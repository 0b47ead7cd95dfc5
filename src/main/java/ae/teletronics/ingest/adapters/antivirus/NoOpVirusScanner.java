package ae.teletronics.ingest.adapters.antivirus;

import ae.teletronics.ingest.ports.StreamSource;
import ae.teletronics.ingest.ports.VirusScanner;

/**
 * Used while scanning is disabled. Always CLEAN and never reads the content.
 */
public class NoOpVirusScanner implements VirusScanner {

    private static final String ENGINE = "NoOp";

    @Override
    public ScanReport scan(StreamSource source) {
        return ScanReport.clean(ENGINE);
    }
}
