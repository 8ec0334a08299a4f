package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.browser.FetchSession;
import com.leadradar.crawl.model.CancellationToken;
import com.leadradar.crawl.model.CrawlResult;
import com.leadradar.crawl.model.CrawlRunRequest;
import com.leadradar.crawl.model.LeadCrawlSummary;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.model.SaveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeadDiscoveryServiceTest {
    @Mock
    private CrawlWorkerPool workerPool;
    @Mock
    private ReviewCrawlService crawlService;
    @Mock
    private LeadStoreService storeService;
    @Mock
    private FetchSession session;

    private LeadDiscoveryService service;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxCrawlUrls(2);
        properties.setDefaultMaxPages(4);
        service = new LeadDiscoveryService(workerPool, crawlService, storeService, properties);
    }

    @SuppressWarnings("unchecked")
    private void runTasksInline() {
        when(workerPool.execute(any())).thenAnswer(invocation ->
            ((Function<FetchSession, Object>) invocation.getArgument(0)).apply(session)
        );
    }

    private static LeadReview lead() {
        return new LeadReview(
            "Acme", "Jane Doe", "Slow", "Everything about it is slow and confusing to set up.",
            2.0, List.of(PainTag.COMPLEXITY), "https://example.com/reviews", Instant.now(), 50.0
        );
    }

    @Test
    void blankUrlsAreRejectedBeforeAnyWork() {
        assertThatThrownBy(() -> service.run(new CrawlRunRequest(Arrays.asList("  ", ""), 1, true, false)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("At least one URL is required");
        assertThatThrownBy(() -> service.run(new CrawlRunRequest(null, 1, true, false)))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(workerPool, storeService);
    }

    @Test
    void tooManyUrlsAreRejected() {
        List<String> urls = List.of("https://a.example", "https://b.example", "https://c.example");

        assertThatThrownBy(() -> service.run(new CrawlRunRequest(urls, 1, false, false)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max 2");
    }

    @Test
    void crawlsTrimmedUrlsWithDefaultPageCapAndSaves() {
        runTasksInline();
        List<LeadReview> leads = List.of(lead());
        when(crawlService.crawl(anyList(), anyInt(), anyBoolean(), eq(session), any(CancellationToken.class)))
            .thenReturn(new CrawlResult(leads, new ArrayList<>(), 2));
        when(storeService.save(leads)).thenReturn(new SaveResult(1, 0, 0));

        LeadCrawlSummary summary = service.run(new CrawlRunRequest(List.of(" https://example.com/reviews "), 0, true, true));

        verify(crawlService).crawl(
            eq(List.of("https://example.com/reviews")),
            eq(4),
            eq(true),
            eq(session),
            any(CancellationToken.class)
        );
        assertThat(summary.leads()).hasSize(1);
        assertThat(summary.pagesFetched()).isEqualTo(2);
        assertThat(summary.saved()).isEqualTo(1);
    }

    @Test
    void unsavedRunLeavesStoreUntouched() {
        runTasksInline();
        when(crawlService.crawl(anyList(), anyInt(), anyBoolean(), eq(session), any(CancellationToken.class)))
            .thenReturn(new CrawlResult(List.of(lead()), List.of(), 1));

        LeadCrawlSummary summary = service.run(new CrawlRunRequest(List.of("https://example.com/reviews"), 1, false, false));

        assertThat(summary.saved()).isZero();
        assertThat(summary.duplicates()).isZero();
        verifyNoInteractions(storeService);
    }
}
