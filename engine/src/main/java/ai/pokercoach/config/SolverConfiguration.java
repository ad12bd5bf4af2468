package ai.pokercoach.config;

import ai.pokercoach.solver.ConfigurationException;
import ai.pokercoach.solver.cache.FileSolutionStore;
import ai.pokercoach.solver.cache.InMemorySolutionStore;
import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.cache.SolutionStore;
import ai.pokercoach.solver.texas.ExternalProcessRunner;
import ai.pokercoach.solver.texas.ProcessRunner;
import ai.pokercoach.solver.texas.RetryingProcessRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the solver pipeline: worker slots, solution store, cache and process runner.
 */
@Configuration
public class SolverConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SolverConfiguration.class);

    /**
     * Fixed pool whose size bounds concurrent solver processes; excess solves wait in FIFO order.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService solverWorkers(SolverProperties properties) {
        int size = properties.getWorkerPoolSize();
        if (size <= 0) {
            throw new ConfigurationException("solver.worker-pool-size", "must be positive: " + size);
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "solver-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(size, threads);
    }

    @Bean
    public SolutionStore solutionStore(CacheProperties properties, ObjectMapper objectMapper) {
        String kind = properties.getStore() == null ? "" : properties.getStore().trim().toLowerCase();
        return switch (kind) {
            case "memory" -> {
                log.info("Using in-memory solution store");
                yield new InMemorySolutionStore();
            }
            case "file" -> {
                Path directory = Path.of(properties.getDirectory()).toAbsolutePath().normalize();
                log.info("Using solution store at {}", directory);
                yield new FileSolutionStore(directory, objectMapper);
            }
            default -> throw new ConfigurationException("cache.store",
                    "expected 'file' or 'memory' but was '" + properties.getStore() + "'");
        };
    }

    @Bean
    public SolutionCache solutionCache(SolutionStore store, ObjectMapper objectMapper, ExecutorService solverWorkers,
            SolverProperties properties) {
        return new SolutionCache(store, objectMapper, solverWorkers, properties.getCallerTimeout());
    }

    @Bean
    public ProcessRunner processRunner(SolverProperties properties) {
        return new RetryingProcessRunner(new ExternalProcessRunner(properties.getTransientExitCodes()),
                properties.getRetryBackoff());
    }
}
