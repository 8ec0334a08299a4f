package com.leadradar.crawl.browser;

import com.leadradar.crawl.model.ReviewSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-host scroll sequences that trigger lazy-loaded review cards.
 */
public enum ScrollProfile {
    LOAD_MORE {
        @Override
        void scroll(BrowserPage page, Pause pause) throws InterruptedException {
            for (int i = 0; i < 5; i++) {
                page.evaluate(SCROLL_BOTTOM);
                pause.millis(2000);
                if (clickLoadMore(page)) {
                    pause.millis(2000);
                }
            }
        }
    },
    REPEATED_BOTTOM {
        @Override
        void scroll(BrowserPage page, Pause pause) throws InterruptedException {
            for (int i = 0; i < 4; i++) {
                page.evaluate(SCROLL_BOTTOM);
                pause.millis(2000);
            }
        }
    },
    PROPORTIONAL {
        @Override
        void scroll(BrowserPage page, Pause pause) throws InterruptedException {
            for (int i = 0; i <= 4; i++) {
                page.evaluate("window.scrollTo(0, document.body.scrollHeight * " + i + " / 4)");
                pause.millis(1500);
            }
        }
    };

    static final String SCROLL_BOTTOM = "window.scrollTo(0, document.body.scrollHeight)";
    static final String SCROLL_TOP = "window.scrollTo(0, 0)";
    static final String LOAD_MORE_SELECTOR =
        "button:has-text(\"Load more\"), button:has-text(\"Show more\"), a:has-text(\"Load more\")";

    private static final Logger log = LoggerFactory.getLogger(ScrollProfile.class);

    abstract void scroll(BrowserPage page, Pause pause) throws InterruptedException;

    // A button that vanished or never became clickable only ends the extra loading.
    static boolean clickLoadMore(BrowserPage page) {
        try {
            return page.clickIfPresent(LOAD_MORE_SELECTOR);
        } catch (RuntimeException e) {
            log.debug("Load more click failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Host-specific sequence followed by the closing bottom, top, bottom cycle.
     */
    public void apply(BrowserPage page, Pause pause) throws InterruptedException {
        scroll(page, pause);
        page.evaluate(SCROLL_BOTTOM);
        pause.millis(3000);
        page.evaluate(SCROLL_TOP);
        pause.millis(1000);
        page.evaluate(SCROLL_BOTTOM);
        pause.millis(2000);
    }

    public static ScrollProfile forSite(ReviewSite site) {
        return switch (site) {
            case GETAPP -> LOAD_MORE;
            case G2, TRUSTRADIUS -> REPEATED_BOTTOM;
            default -> PROPORTIONAL;
        };
    }

    @FunctionalInterface
    public interface Pause {
        void millis(long millis) throws InterruptedException;
    }
}
