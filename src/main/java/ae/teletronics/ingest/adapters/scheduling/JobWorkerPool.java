package ae.teletronics.ingest.adapters.scheduling;

import ae.teletronics.ingest.application.jobs.JobDispatcher;
import ae.teletronics.ingest.domain.QueueName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of polling workers per queue. Each worker drains its queue and sleeps for
 * {@code pollInterval} whenever nothing is runnable.
 */
public class JobWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobWorkerPool.class);

    private final JobDispatcher dispatcher;
    private final Map<QueueName, Integer> concurrency;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;

    private volatile boolean running;
    private ExecutorService executor;

    public JobWorkerPool(JobDispatcher dispatcher,
                         Map<QueueName, Integer> concurrency,
                         Duration pollInterval,
                         Duration shutdownTimeout) {
        this.dispatcher = dispatcher;
        this.concurrency = Map.copyOf(concurrency);
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        int total = concurrency.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            log.info("Job workers disabled");
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(total, r -> {
            Thread t = new Thread(r, "ingest-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        List<String> started = new ArrayList<>();
        concurrency.forEach((queue, threads) -> {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> workLoop(queue));
            }
            started.add(queue + "=" + threads);
        });
        log.info("Job workers started: {}", String.join(", ", started));
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job workers did not stop within {}, interrupting", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Job workers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void workLoop(QueueName queue) {
        while (running) {
            boolean worked;
            try {
                worked = dispatcher.runNext(queue);
            } catch (Exception e) {
                // queue backend unavailable; back off like an empty poll
                log.error("Worker on {} failed to claim a job: {}", queue, e.getMessage(), e);
                worked = false;
            }
            if (!worked && !idle()) {
                return;
            }
        }
    }

    private boolean idle() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
