package com.leadradar.crawl.indicator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.http.ReviewHttpClient;
import com.leadradar.crawl.model.HttpFetchResult;
import com.leadradar.crawl.model.IndicatorMatch;
import com.leadradar.crawl.model.TargetIndicator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TargetIndicatorServiceTest {
    private static final TargetIndicator AVIONTE = new TargetIndicator(
        "Avionté",
        "*.myavionte.com",
        List.of("avionte", "myavionte"),
        List.of("avionte.com", "myavionte.com")
    );

    @Mock
    private ReviewHttpClient httpClient;

    private static HttpFetchResult status(String url, int code, String body) {
        return new HttpFetchResult(url, URI.create(url), code, body, "text/html", Instant.now(), Duration.ZERO, null, null);
    }

    @Test
    void keywordEvidenceIncludesSurroundingText() {
        String text = "We switched our whole back office over to Avionte last spring and it has been rough.";

        IndicatorMatch match = TargetIndicatorService.checkKeywords(text, AVIONTE);

        assertThat(match.found()).isTrue();
        assertThat(match.evidence()).contains("Avionte last spring").startsWith("We switched");
        assertThat(TargetIndicatorService.checkKeywords("nothing relevant", AVIONTE).found()).isFalse();
    }

    @Test
    void linkEvidencePrefersAnchors() {
        String html = "<html><body><a href=\"https://acme.myavionte.com/login\">Staff Portal Login</a></body></html>";

        IndicatorMatch match = TargetIndicatorService.checkLinks(html, AVIONTE);

        assertThat(match.evidence()).isEqualTo("Link found: https://acme.myavionte.com/login (Staff Portal Login)");
    }

    @Test
    void linkCheckFallsBackToPageSource() {
        String html = "<html><script src=\"https://cdn.avionte.com/widget.js\"></script></html>";

        IndicatorMatch match = TargetIndicatorService.checkLinks(html, AVIONTE);

        assertThat(match.found()).isTrue();
        assertThat(match.evidence()).isEqualTo("Reference found in page source: avionte.com");
    }

    @Test
    void subdomainCandidatesComeFromCompanyDomain() {
        assertThat(TargetIndicatorService.subdomainCandidates("https://www.Acme-Staffing.com/about", AVIONTE))
            .containsExactly(
                "https://Acme-Staffing.myavionte.com",
                "https://acme-staffing.myavionte.com",
                "https://acmestaffing.myavionte.com"
            );
        TargetIndicator noPattern = new TargetIndicator("None", null, List.of(), List.of());
        assertThat(TargetIndicatorService.subdomainCandidates("acme.com", noPattern)).isEmpty();
    }

    private TargetIndicatorService serviceAnswering(String liveSubdomain) {
        String homepage = "<html><body><p>We moved our recruiters to Mindscope last year.</p>"
            + "<a href=\"https://bullhorn.com/x\">Jobs</a></body></html>";
        when(httpClient.get(anyString(), anyInt())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.equals("https://acme.com")) {
                return status(url, 200, homepage);
            }
            return status(url, url.equals(liveSubdomain) ? 200 : 404, "");
        });
        return new TargetIndicatorService(httpClient, new ObjectMapper(), new CrawlerProperties());
    }

    @Test
    void websiteCheckReportsFirstMethodThatFindsEachIndicator() {
        TargetIndicatorService service = serviceAnswering(null);

        List<IndicatorMatch> matches = service.checkWebsite("acme.com", true);

        assertThat(matches)
            .extracting(IndicatorMatch::indicator, IndicatorMatch::check, IndicatorMatch::found)
            .containsExactly(
                tuple("Avionté", null, false),
                tuple("Mindscope", TargetIndicatorService.CHECK_KEYWORDS, true),
                tuple("Bullhorn", TargetIndicatorService.CHECK_LINKS, true)
            );
        assertThat(matches.get(1).evidence()).contains("Mindscope last year");
    }

    @Test
    void liveSubdomainWinsAndKeywordsAreOptIn() {
        TargetIndicatorService service = serviceAnswering("https://acme.bullhorn.com");

        List<IndicatorMatch> matches = service.checkWebsite("https://acme.com", false);

        assertThat(matches)
            .extracting(IndicatorMatch::indicator, IndicatorMatch::check, IndicatorMatch::evidence)
            .containsExactly(
                tuple("Avionté", null, null),
                tuple("Mindscope", null, null),
                tuple("Bullhorn", TargetIndicatorService.CHECK_SUBDOMAIN, "https://acme.bullhorn.com")
            );
    }

    @Test
    void indicatorsLoadFromFileWithSnakeCaseKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("indicators.json");
        Files.writeString(file, """
            [{"name": "Crelate", "subdomain_pattern": "*.crelate.com",
              "keywords": ["crelate"], "link_patterns": ["crelate.com"]}]
            """);

        List<TargetIndicator> loaded = TargetIndicatorService.loadIndicators(new ObjectMapper(), file.toString());

        assertThat(loaded).singleElement().satisfies(indicator -> {
            assertThat(indicator.name()).isEqualTo("Crelate");
            assertThat(indicator.subdomainBase()).isEqualTo("crelate.com");
            assertThat(indicator.linkPatterns()).containsExactly("crelate.com");
        });
    }

    @Test
    void brokenOrMissingFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{not json");

        assertThat(TargetIndicatorService.loadIndicators(new ObjectMapper(), broken.toString()))
            .isEqualTo(TargetIndicatorService.DEFAULT_INDICATORS);
        assertThat(TargetIndicatorService.loadIndicators(new ObjectMapper(), dir.resolve("missing.json").toString()))
            .isEqualTo(TargetIndicatorService.DEFAULT_INDICATORS);
        assertThat(TargetIndicatorService.loadIndicators(new ObjectMapper(), null))
            .extracting(TargetIndicator::name)
            .containsExactly("Avionté", "Mindscope", "Bullhorn");
    }
}
