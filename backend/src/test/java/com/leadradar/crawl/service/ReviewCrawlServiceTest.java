package com.leadradar.crawl.service;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.browser.FetchSession;
import com.leadradar.crawl.fetch.FetchOrchestrator;
import com.leadradar.crawl.model.CancellationToken;
import com.leadradar.crawl.model.CrawlResult;
import com.leadradar.crawl.model.FetchErrorKind;
import com.leadradar.crawl.model.FetchMethod;
import com.leadradar.crawl.model.FetchOutcome;
import com.leadradar.crawl.model.LeadReview;
import com.leadradar.crawl.model.PainTag;
import com.leadradar.crawl.parse.ReviewPageParser;
import com.leadradar.crawl.util.ReasonCodeClassifier;
import com.leadradar.crawl.util.SitePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewCrawlServiceTest {
    private static final String G2 = "https://www.g2.com/products/acme/reviews";

    @Mock
    private FetchOrchestrator fetchOrchestrator;
    @Mock
    private ReviewPageParser parser;
    @Mock
    private FetchSession session;

    private ReviewCrawlService service;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPageDelayMs(0);
        service = new ReviewCrawlService(fetchOrchestrator, parser, new SitePolicy(properties), properties);
    }

    private static FetchOutcome page(String url) {
        return FetchOutcome.ok(url, "<html>" + url + "</html>", FetchMethod.HTTP, 200);
    }

    private static LeadReview lead(String text, String url) {
        return new LeadReview("Acme", "Jane", "", text, 2.0, List.of(PainTag.BUGS), url, Instant.now(), 50);
    }

    @Test
    void emptySecondPageStopsPagination() {
        String page2 = G2 + "?page=2";
        when(fetchOrchestrator.fetch(eq(G2), anyBoolean(), eq(session))).thenReturn(page(G2));
        when(fetchOrchestrator.fetch(eq(page2), anyBoolean(), eq(session))).thenReturn(page(page2));
        when(parser.parse(anyString(), eq(G2))).thenReturn(List.of(lead("crashes all day", G2)));
        when(parser.parse(anyString(), eq(page2))).thenReturn(List.of());

        CrawlResult result = service.crawl(List.of(G2), 3, false, session, CancellationToken.none());

        assertThat(result.leads()).hasSize(1);
        assertThat(result.errors()).isEmpty();
        assertThat(result.pagesFetched()).isEqualTo(2);
        verify(fetchOrchestrator, never()).fetch(eq(G2 + "?page=3"), anyBoolean(), eq(session));
    }

    @Test
    void denylistedUrlIsAnErrorWithoutFetching() {
        CrawlResult result = service.crawl(
            List.of("https://www.capterra.com/p/1/acme/reviews"), 3, false, session, CancellationToken.none()
        );

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).reasonCode()).isEqualTo(ReasonCodeClassifier.DENYLISTED);
        assertThat(result.errors().get(0).message()).contains("www.capterra.com");
        verifyNoInteractions(fetchOrchestrator, parser);
    }

    @Test
    void authGatedUrlIsSkippedSilently() {
        CrawlResult result = service.crawl(
            List.of("https://www.linkedin.com/company/acme"), 3, false, session, CancellationToken.none()
        );

        assertThat(result.errors()).isEmpty();
        assertThat(result.leads()).isEmpty();
        verifyNoInteractions(fetchOrchestrator);
    }

    @Test
    void firstPageFailureIsRecordedAndNextUrlStillRuns() {
        String other = "https://reviews.example.com/other";
        when(fetchOrchestrator.fetch(eq(G2), anyBoolean(), eq(session)))
            .thenReturn(FetchOutcome.failed(G2, FetchMethod.HTTP, FetchErrorKind.BLOCKED, 403, "403 Forbidden"));
        when(fetchOrchestrator.fetch(eq(other), anyBoolean(), eq(session))).thenReturn(page(other));
        when(parser.parse(anyString(), eq(other))).thenReturn(List.of(lead("too expensive", other)));

        CrawlResult result = service.crawl(List.of(G2, other), 3, false, session, CancellationToken.none());

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).url()).isEqualTo(G2);
        assertThat(result.errors().get(0).reasonCode()).isEqualTo(ReasonCodeClassifier.BLOCKED);
        assertThat(result.leads()).hasSize(1);
        verify(fetchOrchestrator, times(1)).fetch(eq(G2), anyBoolean(), eq(session));
    }

    @Test
    void laterPageFailureKeepsEarlierLeadsWithoutError() {
        String page2 = G2 + "?page=2";
        when(fetchOrchestrator.fetch(eq(G2), anyBoolean(), eq(session))).thenReturn(page(G2));
        when(fetchOrchestrator.fetch(eq(page2), anyBoolean(), eq(session)))
            .thenReturn(FetchOutcome.failed(page2, FetchMethod.HTTP, FetchErrorKind.TIMEOUT, 0, "timeout"));
        when(parser.parse(anyString(), eq(G2))).thenReturn(List.of(lead("slow and buggy", G2)));

        CrawlResult result = service.crawl(List.of(G2), 3, false, session, CancellationToken.none());

        assertThat(result.leads()).hasSize(1);
        assertThat(result.errors()).isEmpty();
        verify(fetchOrchestrator, never()).fetch(eq(G2 + "?page=3"), anyBoolean(), eq(session));
    }

    @Test
    void parseFailureOnFirstPageIsRecorded() {
        String url = "https://reviews.example.com/acme";
        when(fetchOrchestrator.fetch(eq(url), anyBoolean(), eq(session))).thenReturn(page(url));
        when(parser.parse(anyString(), eq(url))).thenThrow(new IllegalStateException("bad markup"));

        CrawlResult result = service.crawl(List.of(url), 3, false, session, CancellationToken.none());

        assertThat(result.errors()).singleElement()
            .satisfies(error -> assertThat(error.reasonCode()).isEqualTo(ReasonCodeClassifier.PARSING_FAILED));
    }

    @Test
    void cancelledTokenStopsBeforeNextUrl() {
        CancellationToken token = new CancellationToken();
        String first = "https://reviews.example.com/first";
        when(fetchOrchestrator.fetch(eq(first), anyBoolean(), eq(session))).thenAnswer(invocation -> {
            token.cancel();
            return page(first);
        });
        when(parser.parse(anyString(), eq(first))).thenReturn(List.of());

        CrawlResult result = service.crawl(
            List.of(first, "https://reviews.example.com/second"), 3, false, session, token
        );

        assertThat(result.pagesFetched()).isEqualTo(1);
        verify(fetchOrchestrator, never()).fetch(eq("https://reviews.example.com/second"), anyBoolean(), eq(session));
    }

    @Test
    void unexpectedFetchFailureKeepsLeadsFromOtherUrls() {
        String first = "https://reviews.example.com/first";
        String last = "https://reviews.example.com/last";
        when(fetchOrchestrator.fetch(eq(first), anyBoolean(), eq(session))).thenReturn(page(first));
        when(fetchOrchestrator.fetch(eq(G2), anyBoolean(), eq(session)))
            .thenThrow(new IllegalStateException("Target page, context or browser has been closed"));
        when(fetchOrchestrator.fetch(eq(last), anyBoolean(), eq(session))).thenReturn(page(last));
        when(parser.parse(anyString(), eq(first))).thenReturn(List.of(lead("it keeps crashing", first)));
        when(parser.parse(anyString(), eq(last))).thenReturn(List.of(lead("support never answers", last)));

        CrawlResult result = service.crawl(List.of(first, G2, last), 3, false, session, CancellationToken.none());

        assertThat(result.leads()).extracting(LeadReview::sourceUrl).containsExactly(first, last);
        assertThat(result.pagesFetched()).isEqualTo(2);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.url()).isEqualTo(G2);
            assertThat(error.reasonCode()).isEqualTo(ReasonCodeClassifier.UNKNOWN);
            assertThat(error.message()).contains("browser has been closed");
        });
    }
}
