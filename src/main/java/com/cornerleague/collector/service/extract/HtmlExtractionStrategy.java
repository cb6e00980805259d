package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

@Slf4j
@Component
public class HtmlExtractionStrategy implements ExtractionStrategy {

    private static final Pattern MULTI_WS = Pattern.compile("\\s+");
    private static final Pattern TITLE_SUFFIX = Pattern.compile("\\s+[-|\u2013\u2014]\\s+.*$");

    private static final List<String> REMOVE_SELECTORS = List.of(
            "script", "style", "noscript", "svg", "canvas",
            "header", "footer", "nav", "aside",
            "form", "button", "input",
            "[role=banner]", "[role=navigation]", "[role=contentinfo]"
    );

    private static final List<String> BAD_CLASS_ID_HINTS = List.of(
            "cookie", "consent", "subscribe", "newsletter",
            "promo", "advert", "ads", "banner", "paywall",
            "share", "social", "comment", "related", "recommend"
    );

    private static final List<String> BYLINE_SELECTORS = List.of(
            "meta[name=author]", "meta[property=article:author]",
            ".byline", ".author", ".writer", "[rel=author]", ".post-author"
    );

    private static final List<String> DATE_SELECTORS = List.of(
            "meta[property=article:published_time]", "meta[name=publishdate]",
            "meta[name=date]", "meta[itemprop=datePublished]", "time[datetime]"
    );

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            Instant::parse,
            s -> LocalDate.parse(s.substring(0, Math.min(10, s.length()))).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    @Override
    public DocumentType type() {
        return DocumentType.HTML;
    }

    @Override
    public ExtractedContent extract(RawDocument document) {
        String html = document.body();
        if (html == null || html.isBlank()) {
            throw new ExtractionException("Empty HTML body url=" + document.finalUrl());
        }

        Document doc = Jsoup.parse(html, document.finalUrl());

        // metadata must be read before boilerplate removal strips <header> bylines and <time> tags
        String title = extractTitle(doc);
        String byline = extractByline(doc);
        Instant publishedAt = extractPublishedAt(doc);
        String canonical = extractCanonical(doc);

        for (String sel : REMOVE_SELECTORS) {
            doc.select(sel).remove();
        }
        removeByHints(doc);

        String text = bestTextFromElements(doc.select("article"));
        double confidence = 0.9;
        String method = "article";

        if (text == null) {
            text = bestTextFromElements(doc.select("main, [role=main], #content, #main, .content, .main, .article, .post, .entry-content"));
            confidence = 0.75;
            method = "main";
        }
        if (text == null) {
            text = densestBlock(doc);
            confidence = 0.5;
            method = "density";
        }
        if (text == null) {
            throw new ExtractionException("No body text found url=" + document.finalUrl());
        }

        return new ExtractedContent(title, text, byline, publishedAt, canonical, confidence, method);
    }

    private String extractTitle(Document doc) {
        Element og = doc.selectFirst("meta[property=og:title]");
        if (og != null && !og.attr("content").isBlank()) {
            return clean(og.attr("content"));
        }
        String t = doc.title();
        if (t != null && !t.isBlank()) {
            return clean(TITLE_SUFFIX.matcher(t).replaceFirst(""));
        }
        Element h1 = doc.selectFirst("h1");
        return h1 == null ? null : clean(h1.text());
    }

    private String extractByline(Document doc) {
        for (String sel : BYLINE_SELECTORS) {
            Element el = doc.selectFirst(sel);
            if (el == null) continue;
            String value = el.tagName().equals("meta") ? el.attr("content") : el.text();
            value = clean(value);
            if (value == null) continue;
            value = value.replaceFirst("(?i)^by\\s+", "");
            if (value.length() > 0 && value.length() <= 200) return value;
        }
        return null;
    }

    private Instant extractPublishedAt(Document doc) {
        for (String sel : DATE_SELECTORS) {
            Element el = doc.selectFirst(sel);
            if (el == null) continue;
            String raw = el.hasAttr("content") ? el.attr("content") : el.attr("datetime");
            Instant parsed = parseDate(raw);
            if (parsed != null) return parsed;
        }
        return null;
    }

    private String extractCanonical(Document doc) {
        Element link = doc.selectFirst("link[rel=canonical][href]");
        if (link == null) return null;
        String href = link.absUrl("href");
        return href.isBlank() ? null : href;
    }

    static Instant parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(s);
            } catch (DateTimeParseException e) {
                log.trace("Date format mismatch value='{}'", s);
            }
        }
        return null;
    }

    private void removeByHints(Document doc) {
        for (Element el : doc.getAllElements()) {
            if (el == doc.body() || el.tagName().equals("html") || el.tagName().equals("article")) continue;
            String hay = (el.className() + " " + el.id()).toLowerCase(Locale.ROOT);
            for (String hint : BAD_CLASS_ID_HINTS) {
                if (containsToken(hay, hint)) {
                    el.remove();
                    break;
                }
            }
        }
    }

    private static boolean containsToken(String hay, String hint) {
        for (String token : hay.split("[\\s_-]+")) {
            if (token.equals(hint)) return true;
        }
        return false;
    }

    private String bestTextFromElements(Elements els) {
        if (els == null || els.isEmpty()) return null;

        String best = null;
        int bestLen = 0;

        for (Element el : els) {
            String txt = paragraphText(el);
            if (txt == null) {
                txt = clean(el.text());
            }
            if (txt != null && txt.length() > bestLen) {
                bestLen = txt.length();
                best = txt;
            }
        }
        return best;
    }

    private String densestBlock(Document doc) {
        Element body = doc.body();
        if (body == null) return null;

        Element best = null;
        int bestScore = 0;

        for (Element el : body.select("div, section")) {
            Elements ps = el.select("p");
            if (ps.size() < 3) continue;

            int score = 0;
            for (Element p : ps) {
                score += p.text().length();
            }
            if (score > bestScore) {
                bestScore = score;
                best = el;
            }
        }

        if (best == null) {
            return clean(body.text());
        }
        return paragraphText(best);
    }

    private String paragraphText(Element el) {
        StringBuilder sb = new StringBuilder();
        for (Element p : el.select("p")) {
            String t = p.text().trim();
            if (t.length() < 30) continue;
            if (!sb.isEmpty()) sb.append("\n");
            sb.append(MULTI_WS.matcher(t).replaceAll(" "));
        }
        return sb.isEmpty() ? null : sb.toString();
    }

    private static String clean(String s) {
        if (s == null) return null;
        String x = MULTI_WS.matcher(s).replaceAll(" ").trim();
        return x.isEmpty() ? null : x;
    }
}
