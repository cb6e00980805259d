package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.exception.ExtractionException;
import com.cornerleague.collector.util.UrlCanonicalizer;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.time.Instant;
import java.util.Objects;

/**
 * Documents served as RSS/Atom: the entry linking to the fetched URL (or the first entry) is the article.
 */
@Component
public class FeedEntryExtractionStrategy implements ExtractionStrategy {

    @Override
    public DocumentType type() {
        return DocumentType.FEED;
    }

    @Override
    public ExtractedContent extract(RawDocument document) {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(Objects.requireNonNullElse(document.body(), "")));
        } catch (Exception e) {
            throw new ExtractionException("Unparseable feed document url=" + document.finalUrl(), e);
        }
        if (feed.getEntries().isEmpty()) {
            throw new ExtractionException("Feed document has no entries url=" + document.finalUrl());
        }

        SyndEntry entry = pickEntry(feed, document.finalUrl());

        StringBuilder body = new StringBuilder();
        for (SyndContent c : entry.getContents()) {
            appendText(body, c.getValue());
        }
        if (body.isEmpty() && entry.getDescription() != null) {
            appendText(body, entry.getDescription().getValue());
        }

        Instant published = entry.getPublishedDate() != null
                ? entry.getPublishedDate().toInstant()
                : (entry.getUpdatedDate() != null ? entry.getUpdatedDate().toInstant() : null);

        String author = entry.getAuthor() == null || entry.getAuthor().isBlank() ? null : entry.getAuthor().trim();
        String title = entry.getTitle() == null ? null : entry.getTitle().trim();

        return new ExtractedContent(title, body.isEmpty() ? null : body.toString(), author, published,
                entry.getLink(), 0.6, "feed-entry");
    }

    private SyndEntry pickEntry(SyndFeed feed, String url) {
        String target = UrlCanonicalizer.canonicalize(url);
        if (target != null) {
            for (SyndEntry e : feed.getEntries()) {
                if (target.equals(UrlCanonicalizer.canonicalize(e.getLink()))) return e;
            }
        }
        return feed.getEntries().get(0);
    }

    private static void appendText(StringBuilder sb, String html) {
        if (html == null || html.isBlank()) return;
        String text = Jsoup.parse(html).text().trim();
        if (text.isEmpty()) return;
        if (!sb.isEmpty()) sb.append("\n");
        sb.append(text);
    }
}
