package ae.teletronics.ingest.adapters.antivirus;

import ae.teletronics.ingest.ports.StreamSource;
import ae.teletronics.ingest.ports.VirusScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streams content to a clamd daemon with the {@code zINSTREAM} command.
 *
 * Connection or protocol problems are reported as an ERROR verdict; what to do with that
 * (reject or accept unscanned) is the caller's decision.
 */
public class ClamAvVirusScanner implements VirusScanner {

    private static final Logger log = LoggerFactory.getLogger(ClamAvVirusScanner.class);

    private static final String ENGINE = "ClamAV";
    private static final byte[] INSTREAM = "zINSTREAM\0".getBytes(StandardCharsets.US_ASCII);
    static final int CHUNK_SIZE = 8192;

    private final String host;
    private final int port;
    private final int timeoutMillis;

    public ClamAvVirusScanner(String host, int port, int timeoutMillis) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public ScanReport scan(StreamSource source) throws IOException {
        String reply;
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);

            DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            out.write(INSTREAM);
            try (InputStream in = source.openStream()) {
                byte[] buf = new byte[CHUNK_SIZE];
                int r;
                while ((r = in.read(buf)) != -1) {
                    out.writeInt(r);
                    out.write(buf, 0, r);
                }
            }
            out.writeInt(0);
            out.flush();

            reply = readReply(socket.getInputStream());
        } catch (IOException e) {
            log.warn("clamd at {}:{} unavailable: {}", host, port, e.getMessage());
            return ScanReport.error(ENGINE, e.getMessage());
        }
        return parseReply(reply);
    }

    /**
     * clamd answers {@code stream: OK}, {@code stream: <signature> FOUND} or {@code <reason> ERROR}.
     */
    static ScanReport parseReply(String reply) {
        String r = reply == null ? "" : reply.trim();
        if (r.endsWith("FOUND")) {
            List<String> signatures = new ArrayList<>();
            for (String line : r.split("\n")) {
                String l = line.trim();
                if (!l.endsWith("FOUND")) continue;
                int colon = l.indexOf(':');
                String sig = l.substring(colon + 1, l.length() - "FOUND".length()).trim();
                if (!sig.isEmpty()) signatures.add(sig);
            }
            log.warn("Virus detected: {}", signatures);
            return ScanReport.infected(ENGINE, signatures);
        }
        if (r.endsWith("OK")) {
            return ScanReport.clean(ENGINE);
        }
        return ScanReport.error(ENGINE, r.isEmpty() ? "empty reply from clamd" : r);
    }

    private static String readReply(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1 && b != 0) {
            buf.write(b);
        }
        return buf.toString(StandardCharsets.US_ASCII);
    }
}
