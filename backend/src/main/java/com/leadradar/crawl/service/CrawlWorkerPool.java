package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.browser.BrowserSessionFactory;
import com.leadradar.crawl.browser.FetchSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fixed set of single-thread workers, each owning one {@link FetchSession}. A crawl borrows an idle worker,
 * runs entirely on that worker's thread, then returns it. Sessions are closed on their own thread at shutdown.
 */
@Component
public class CrawlWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorkerPool.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final List<Worker> workers = new ArrayList<>();
    private final BlockingQueue<Worker> idle;

    public CrawlWorkerPool(CrawlerProperties properties, BrowserSessionFactory sessionFactory) {
        int count = properties.getWorkerCount();
        this.idle = new ArrayBlockingQueue<>(count);
        for (int i = 1; i <= count; i++) {
            String name = "crawl-worker-" + i;
            Worker worker = new Worker(
                Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, name)),
                new FetchSession(sessionFactory, name)
            );
            workers.add(worker);
            idle.add(worker);
        }
    }

    public int size() {
        return workers.size();
    }

    /**
     * Runs the task on the next idle worker, blocking until one is free and the task completes.
     *
     * @throws CancellationException when the calling thread is interrupted while waiting
     */
    public <T> T execute(Function<FetchSession, T> task) {
        Worker worker;
        try {
            worker = idle.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a crawl worker");
        }
        Future<T> future = null;
        try {
            future = worker.executor().submit(() -> task.apply(worker.session()));
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for crawl to finish");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Crawl task failed", cause);
        } finally {
            idle.offer(worker);
        }
    }

    @PreDestroy
    public void shutdown() {
        for (Worker worker : workers) {
            try {
                worker.executor().submit(worker.session()::close).get(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                worker.session().close();
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Worker {} session teardown did not complete: {}", worker.session().name(), e.getMessage());
                worker.session().close();
            } finally {
                worker.executor().shutdownNow();
            }
        }
    }

    private record Worker(ExecutorService executor, FetchSession session) {
    }
}
