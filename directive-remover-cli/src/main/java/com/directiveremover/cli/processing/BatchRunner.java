package com.directiveremover.cli.processing;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the {@link FileProcessor} over a list of files, sequentially or on a fixed pool.
 *
 * The listener sees each result as soon as its file is done and is never called
 * concurrently. The returned list is always in input order.
 */
public class BatchRunner {

    private static final int THREAD_POOL_SIZE = Runtime.getRuntime().availableProcessors();

    private final FileProcessor processor;
    private final boolean parallel;
    private final Consumer<ProcessingResult> listener;
    private final Object listenerLock = new Object();

    public BatchRunner(FileProcessor processor, boolean parallel, Consumer<ProcessingResult> listener) {
        this.processor = processor;
        this.parallel = parallel;
        this.listener = listener;
    }

    public List<ProcessingResult> run(List<Path> files) {
        return parallel && files.size() > 1 ? runParallel(files) : runSequential(files);
    }

    private List<ProcessingResult> runSequential(List<Path> files) {
        List<ProcessingResult> results = new ArrayList<>(files.size());
        for (Path file : files) {
            ProcessingResult result = processor.process(file);
            results.add(result);
            listener.accept(result);
        }
        return results;
    }

    private List<ProcessingResult> runParallel(List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(THREAD_POOL_SIZE, files.size()));
        try {
            List<Future<ProcessingResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    ProcessingResult result = processor.process(file);
                    synchronized (listenerLock) {
                        listener.accept(result);
                    }
                    return result;
                }));
            }

            List<ProcessingResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), files.get(i)));
            }
            return results;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ProcessingResult await(Future<ProcessingResult> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + file, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ProcessingResult.failed(file, List.of("Unexpected error: " + cause.getMessage()), List.of());
        }
    }
}
