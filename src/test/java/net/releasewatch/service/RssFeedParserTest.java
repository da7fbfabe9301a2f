package net.releasewatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import net.releasewatch.dto.FeedItemRecord;
import org.junit.jupiter.api.Test;

class RssFeedParserTest {

    private final RssFeedParser parser = new RssFeedParser(ZoneId.of("Asia/Tokyo"));

    @Test
    void should_ParseRssItemsAndDropRepeats_When_GuidSeenTwice() {
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>New manga</title>
                <item>
                  <title>ダンジョン飯 第14巻</title>
                  <link>https://bookwalker.example/dungeon-14</link>
                  <guid>bw-14</guid>
                  <pubDate>Tue, 07 Jan 2025 10:00:00 +0900</pubDate>
                  <category>Fantasy</category>
                  <category>Seinen</category>
                  <description><![CDATA[<p>New <b>volume</b></p>]]></description>
                </item>
                <item>
                  <title>ダンジョン飯 第14巻 (repost)</title>
                  <link>https://bookwalker.example/dungeon-14?ref=repost</link>
                  <guid>bw-14</guid>
                </item>
                <item>
                  <title>Kagurabachi Vol. 2</title>
                  <link>https://bookwalker.example/kagurabachi-2</link>
                </item>
              </channel>
            </rss>
            """;

        List<FeedItemRecord> items = parser.parse("bookwalker", xml);

        assertThat(items).hasSize(2);
        FeedItemRecord first = items.get(0);
        assertThat(first.sourceId()).isEqualTo("bookwalker");
        assertThat(first.title()).isEqualTo("ダンジョン飯 第14巻");
        assertThat(first.link()).isEqualTo("https://bookwalker.example/dungeon-14");
        assertThat(first.guid()).isEqualTo("bw-14");
        assertThat(first.publishedAt()).isEqualTo(Instant.parse("2025-01-07T01:00:00Z"));
        assertThat(first.categories()).containsExactly("Fantasy", "Seinen");
        assertThat(first.description()).isEqualTo("New volume");
        assertThat(items.get(1).guid()).isNull();
        assertThat(items.get(1).publishedAt()).isNull();
        assertThat(items.get(1).itemKey()).isEqualTo("https://bookwalker.example/kagurabachi-2");
    }

    @Test
    void should_ParseAtomEntries_When_DocumentHasNoItems() {
        String xml = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Shonen news</title>
              <entry>
                <id>tag:news.example,2025:1</id>
                <title>Chainsaw Man 第19巻</title>
                <link rel="alternate" href="https://news.example/csm-19"/>
                <link rel="enclosure" href="https://news.example/csm-19.jpg"/>
                <category term="Action"/>
                <published>2025-01-03T00:00:00+09:00</published>
                <summary>Out now</summary>
              </entry>
              <entry>
                <id>tag:news.example,2025:2</id>
                <title>Sakamoto Days 第18巻</title>
                <link href="https://news.example/sd-18"/>
                <updated>2025-01-04</updated>
              </entry>
            </feed>
            """;

        List<FeedItemRecord> items = parser.parse("shonen-news", xml);

        assertThat(items).extracting(FeedItemRecord::link)
            .containsExactly("https://news.example/csm-19", "https://news.example/sd-18");
        assertThat(items.get(0).guid()).isEqualTo("tag:news.example,2025:1");
        assertThat(items.get(0).categories()).containsExactly("Action");
        assertThat(items.get(0).publishedAt()).isEqualTo(Instant.parse("2025-01-02T15:00:00Z"));
        assertThat(items.get(0).description()).isEqualTo("Out now");
        assertThat(items.get(1).publishedAt()).isEqualTo(Instant.parse("2025-01-03T15:00:00Z"));
    }

    @Test
    void should_ReturnNoItems_When_BodyBlank() {
        assertThat(parser.parse("bookwalker", "  ")).isEmpty();
        assertThat(parser.parse("bookwalker", null)).isEmpty();
    }
}
