package tech.simplekanban.platform.apikey;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort, asynchronous last-used bookkeeping for API keys.
 *
 * <p>Updates run on a small bounded pool. A full queue or a failing update is logged
 * and dropped; the authenticated request never waits for or fails because of it.
 */
@ApplicationScoped
public class ApiKeyUsageRecorder {

    private static final Logger LOG = Logger.getLogger(ApiKeyUsageRecorder.class);

    @Inject
    ApiKeyRepository apiKeyRepository;

    @Inject
    Clock clock;

    @ConfigProperty(name = "simplekanban.auth.api-key.usage-threads", defaultValue = "2")
    int threads;

    @ConfigProperty(name = "simplekanban.auth.api-key.usage-queue-size", defaultValue = "1000")
    int queueSize;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueSize),
            r -> {
                Thread t = new Thread(r, "api-key-usage-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Queue a last-used update for the key. Returns immediately.
     */
    public void recordUse(String apiKeyId) {
        Instant usedAt = clock.instant();
        try {
            executor.execute(() -> {
                try {
                    apiKeyRepository.recordUsage(apiKeyId, usedAt);
                } catch (RuntimeException e) {
                    LOG.warnf("Failed to record usage of API key %s: %s", apiKeyId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debugf("Usage queue full, dropping last-used update for API key %s", apiKeyId);
        }
    }
}
