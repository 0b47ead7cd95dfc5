package ae.teletronics.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FileIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileIngestApplication.class, args);
    }
}
