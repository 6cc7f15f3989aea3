package com.geekhub.collector.service.feed;

import com.geekhub.collector.dto.FeedEntry;
import com.geekhub.collector.exception.FeedParseException;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Decodes RSS 0.9x/1.0/2.0 and Atom documents into {@link FeedEntry} values.
 */
@Component
public class FeedDocumentParser {

    private static final int SNIPPET_MAX_LENGTH = 500;

    /**
     * Decodes a raw feed body. The charset comes from the byte order mark or the XML
     * declaration, falling back to the {@code Content-Type} charset and then UTF-8.
     *
     * @param contentType the response {@code Content-Type}, or {@code null} if unknown
     * @throws FeedParseException if the body is not a syndication document
     */
    public List<FeedEntry> parse(byte[] body, String contentType) {
        if (body == null || preambleLength(body) == body.length) {
            throw new FeedParseException("Empty feed document");
        }
        int start = preambleLength(body);
        SyndFeed feed;
        try (InputStream in = new ByteArrayInputStream(body, start, body.length - start);
             XmlReader reader = contentType != null ? new XmlReader(in, contentType, true) : new XmlReader(in, true)) {
            feed = new SyndFeedInput().build(reader);
        } catch (FeedException | IllegalArgumentException | IOException e) {
            throw new FeedParseException("Failed to parse feed: " + e.getMessage(), e);
        }

        List<FeedEntry> entries = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            entries.add(toEntry(entry));
        }
        return entries;
    }

    private FeedEntry toEntry(SyndEntry entry) {
        String content = content(entry);
        String contentText = content != null ? snippet(content) : null;

        List<String> categories = entry.getCategories() == null ? List.of() : entry.getCategories().stream()
                .map(SyndCategory::getName)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();

        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return new FeedEntry(
                trimToNull(entry.getTitle()),
                trimToNull(entry.getLink()),
                trimToNull(entry.getUri()),
                trimToNull(entry.getAuthor()),
                published != null ? LocalDateTime.ofInstant(published.toInstant(), ZoneOffset.UTC) : null,
                content,
                contentText,
                categories
        );
    }

    /**
     * {@code content:encoded} / Atom content first, then the description.
     */
    private String content(SyndEntry entry) {
        if (entry.getContents() != null) {
            for (SyndContent candidate : entry.getContents()) {
                if (candidate != null && candidate.getValue() != null && !candidate.getValue().isBlank()) {
                    return candidate.getValue();
                }
            }
        }
        SyndContent description = entry.getDescription();
        if (description != null && description.getValue() != null && !description.getValue().isBlank()) {
            return description.getValue();
        }
        return null;
    }

    private String snippet(String html) {
        String text = Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
        if (text.isEmpty()) {
            return null;
        }
        return text.length() > SNIPPET_MAX_LENGTH ? text.substring(0, SNIPPET_MAX_LENGTH) : text;
    }

    // Rome rejects whitespace before the XML declaration. A UTF-8 BOM is kept unless
    // whitespace follows it, since XmlReader reads the charset from it.
    private static int preambleLength(byte[] body) {
        boolean bom = body.length >= 3
                && (body[0] & 0xFF) == 0xEF && (body[1] & 0xFF) == 0xBB && (body[2] & 0xFF) == 0xBF;
        int offset = bom ? 3 : 0;
        int i = offset;
        while (i < body.length && isXmlWhitespace(body[i])) {
            i++;
        }
        return bom && i == offset && i < body.length ? 0 : i;
    }

    private static boolean isXmlWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
