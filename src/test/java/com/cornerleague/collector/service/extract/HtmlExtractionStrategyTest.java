package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.exception.ExtractionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HtmlExtractionStrategyTest {

    private final HtmlExtractionStrategy strategy = new HtmlExtractionStrategy();

    private static RawDocument html(String body) {
        Source source = Source.builder().id(1L).name("ESPN").domain("espn.com").build();
        return new RawDocument(source, "https://espn.com/nba/story/1", "https://espn.com/nba/story/1",
                body, DocumentType.HTML, null, Instant.parse("2025-03-01T12:00:00Z"), 1L, "cid");
    }

    @Test
    void extract_prefersArticleBody_andReadsMetadataBeforeBoilerplateRemoval() {
        String page = """
                <html><head>
                  <title>Celtics top Heat in overtime - ESPN</title>
                  <meta property="article:published_time" content="2025-03-01T02:30:00Z">
                  <link rel="canonical" href="https://www.espn.com/nba/story/1?utm_source=x">
                </head><body>
                  <header><span class="byline">By Tim Bontemps</span></header>
                  <nav>Scores Schedule Standings</nav>
                  <article>
                    <p>Jayson Tatum scored 38 points as Boston beat Miami in overtime on Friday night.</p>
                    <div class="share">Share this on social media please</div>
                    <p>Jaylen Brown added 24 points and Derrick White hit the go-ahead three late.</p>
                  </article>
                  <footer>Copyright ESPN Internet Ventures</footer>
                </body></html>
                """;

        ExtractedContent out = strategy.extract(html(page));

        assertThat(out.title()).isEqualTo("Celtics top Heat in overtime");
        assertThat(out.byline()).isEqualTo("Tim Bontemps");
        assertThat(out.publishedAt()).isEqualTo(Instant.parse("2025-03-01T02:30:00Z"));
        assertThat(out.canonicalUrlHint()).isEqualTo("https://www.espn.com/nba/story/1?utm_source=x");
        assertThat(out.method()).isEqualTo("article");
        assertThat(out.confidence()).isEqualTo(0.9);
        assertThat(out.text())
                .contains("Jayson Tatum scored 38 points")
                .contains("Derrick White hit the go-ahead three")
                .doesNotContain("Share this")
                .doesNotContain("Scores Schedule");
    }

    @Test
    void extract_fallsBackToDensestBlock() {
        String page = """
                <html><head><title>Trade deadline recap</title></head><body>
                  <div id="x">
                    <p>The Lakers moved two second round picks for a backup center on Thursday.</p>
                    <p>The Knicks stood pat despite weeks of rumors about a third star player.</p>
                    <p>Denver added wing depth in a three team deal that also involved Utah.</p>
                  </div>
                </body></html>
                """;

        ExtractedContent out = strategy.extract(html(page));

        assertThat(out.method()).isEqualTo("density");
        assertThat(out.confidence()).isEqualTo(0.5);
        assertThat(out.text()).contains("Lakers").contains("Denver");
    }

    @Test
    void extract_emptyBody_throws() {
        assertThatThrownBy(() -> strategy.extract(html("  ")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Empty HTML body");
    }

    @Test
    void parseDate_acceptsOffsetInstantAndPlainDate() {
        assertThat(HtmlExtractionStrategy.parseDate("2025-03-01T02:30:00+01:00"))
                .isEqualTo(Instant.parse("2025-03-01T01:30:00Z"));
        assertThat(HtmlExtractionStrategy.parseDate("2025-03-01"))
                .isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(HtmlExtractionStrategy.parseDate("yesterday")).isNull();
    }
}
