package com.leadradar.crawl.browser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A worker's own browser handle. The browser is launched on first use and kept until the worker shuts down.
 * Never shared between workers.
 */
public class FetchSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchSession.class);

    private final BrowserSessionFactory factory;
    private final String name;
    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile BrowserSession browser;
    private volatile Thread ownerThread;
    private volatile String unavailableReason;

    public FetchSession(BrowserSessionFactory factory, String name) {
        this.factory = factory;
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean isScriptingAvailable() {
        return unavailableReason == null && !closed.get();
    }

    public boolean isStarted() {
        return browser != null;
    }

    /**
     * Opens a new page in this session's browser, launching it on first call.
     *
     * @throws ScriptedFetchUnavailableException when the browser cannot be launched or the session is closed
     */
    public BrowserPage openPage() {
        return browser().newPage();
    }

    private BrowserSession browser() {
        BrowserSession current = browser;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (closed.get()) {
                throw new ScriptedFetchUnavailableException("Fetch session " + name + " is closed");
            }
            if (unavailableReason != null) {
                throw new ScriptedFetchUnavailableException(unavailableReason);
            }
            if (browser == null) {
                try {
                    browser = factory.open();
                    ownerThread = Thread.currentThread();
                    log.debug("Fetch session {} started browser on {}", name, ownerThread.getName());
                } catch (ScriptedFetchUnavailableException e) {
                    unavailableReason = e.getMessage() == null ? "Scripted fetch unavailable" : e.getMessage();
                    log.warn("Scripted fetch unavailable for session {}: {}", name, e.getMessage());
                    throw e;
                }
            }
            return browser;
        }
    }

    /**
     * Idempotent. A teardown failure raised because the caller is not the thread that launched the browser
     * is expected and only logged.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        BrowserSession current;
        synchronized (lock) {
            current = browser;
            browser = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.close();
            log.debug("Fetch session {} closed", name);
        } catch (RuntimeException e) {
            if (ownerThread != null && ownerThread != Thread.currentThread()) {
                log.debug("Fetch session {} closed from foreign thread {}: {}", name, Thread.currentThread().getName(), e.getMessage());
            } else {
                log.warn("Fetch session {} teardown failed: {}", name, e.getMessage());
            }
        }
    }
}
