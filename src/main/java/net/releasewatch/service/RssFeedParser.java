package net.releasewatch.service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.dto.FeedItemRecord;
import net.releasewatch.util.DateParsingUtils;
import net.releasewatch.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;

/**
 * Parses RSS 2.0 and Atom documents into feed item records using jsoup's XML parser.
 * Items repeating a guid or link already seen in the same document are dropped.
 */
@Slf4j
public class RssFeedParser {

    private final ZoneId zone;

    public RssFeedParser(ZoneId zone) {
        this.zone = zone;
    }

    public List<FeedItemRecord> parse(String feedId, String xml) {
        List<FeedItemRecord> records = new ArrayList<>();
        if (xml == null || xml.isBlank()) {
            return records;
        }
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        Elements items = document.select("item");
        boolean atom = items.isEmpty();
        if (atom) {
            items = document.select("entry");
        }

        Set<String> seenKeys = new LinkedHashSet<>();
        for (Element item : items) {
            FeedItemRecord record = atom ? parseAtomEntry(feedId, item) : parseRssItem(feedId, item);
            String key = dedupKey(record);
            if (key != null && !seenKeys.add(key)) {
                log.debug("Dropping duplicate item '{}' in feed {}", key, feedId);
                continue;
            }
            records.add(record);
        }
        return records;
    }

    private FeedItemRecord parseRssItem(String feedId, Element item) {
        List<String> categories = new ArrayList<>();
        for (Element category : item.select("category")) {
            addIfText(categories, category.text());
        }
        String published = firstText(item, "pubDate", "dc|date", "date");
        return new FeedItemRecord(
            feedId,
            TextUtils.collapseWhitespace(childText(item, "title")),
            blankToNull(childText(item, "link")),
            TextUtils.stripMarkup(childText(item, "description")),
            DateParsingUtils.parseFeedTimestamp(published, zone),
            blankToNull(childText(item, "guid")),
            categories);
    }

    private FeedItemRecord parseAtomEntry(String feedId, Element entry) {
        String link = null;
        for (Element candidate : entry.select("link")) {
            String rel = candidate.attr("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                link = blankToNull(candidate.attr("href"));
                break;
            }
        }
        List<String> categories = new ArrayList<>();
        for (Element category : entry.select("category")) {
            addIfText(categories, category.hasAttr("term") ? category.attr("term") : category.text());
        }
        String summary = firstText(entry, "summary", "content");
        String published = firstText(entry, "published", "updated");
        Instant publishedAt = DateParsingUtils.parseFeedTimestamp(published, zone);
        return new FeedItemRecord(
            feedId,
            TextUtils.collapseWhitespace(childText(entry, "title")),
            link,
            TextUtils.stripMarkup(summary),
            publishedAt,
            blankToNull(childText(entry, "id")),
            categories);
    }

    private static String dedupKey(FeedItemRecord record) {
        if (TextUtils.hasText(record.guid())) {
            return "guid:" + record.guid();
        }
        if (TextUtils.hasText(record.link())) {
            return "link:" + record.link();
        }
        return null;
    }

    private static String firstText(Element parent, String... tags) {
        for (String tag : tags) {
            String value = childText(parent, tag);
            if (TextUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static String childText(Element parent, String tag) {
        Element child = parent.selectFirst(tag);
        return child != null ? child.text() : null;
    }

    private static void addIfText(List<String> values, String value) {
        if (TextUtils.hasText(value)) {
            values.add(value.strip());
        }
    }

    private static String blankToNull(String value) {
        return TextUtils.hasText(value) ? value.strip() : null;
    }
}
