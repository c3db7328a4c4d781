package papyri.d5.converter.batch;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes TM numbers on a fixed pool of worker threads.
 */
public class BatchRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);

    private final DocumentProcessor processor;
    private final int threads;

    public BatchRunner(DocumentProcessor processor, int threads) {
        this.processor = Objects.requireNonNull(processor, "processor");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    /**
     * @return one outcome per distinct TM number, sorted by TM number
     */
    public List<ProcessingOutcome> run(List<Integer> tmNumbers) {
        List<Integer> distinct = tmNumbers.stream().distinct().collect(Collectors.toList());
        LOGGER.info("Processing {} TM numbers with {} worker(s)", distinct.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<ProcessingOutcome>> futures = distinct.stream()
                    .map(tm -> CompletableFuture.supplyAsync(() -> processAndReport(tm), executor))
                    .collect(Collectors.toList());
            List<ProcessingOutcome> outcomes = futures.stream()
                    .map(BatchRunner::await)
                    .sorted(Comparator.comparingInt(ProcessingOutcome::tm))
                    .collect(Collectors.toUnmodifiableList());
            logSummary(outcomes);
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private ProcessingOutcome processAndReport(int tm) {
        ProcessingOutcome outcome = processor.process(tm);
        if (outcome.isSkipped()) {
            LOGGER.warn(outcome.message());
        }
        return outcome;
    }

    private static ProcessingOutcome await(CompletableFuture<ProcessingOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private static void logSummary(List<ProcessingOutcome> outcomes) {
        long written = outcomes.stream().filter(outcome -> outcome.status() == ProcessingOutcome.Status.WRITTEN).count();
        long skipped = outcomes.stream().filter(ProcessingOutcome::isSkipped).count();
        LOGGER.info("Processed {} TM numbers: {} written, {} skipped", outcomes.size(), written, skipped);
    }
}
