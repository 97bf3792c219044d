package com.statejobs.harvester.crawl.discovery;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.model.ListPage;
import com.statejobs.harvester.crawl.model.RawListItem;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ListPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(ListPageExtractor.class);

    private final HarvesterProperties properties;

    public ListPageExtractor(HarvesterProperties properties) {
        this.properties = properties;
    }

    public ListPage extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return new ListPage(List.of(), null);
        }
        HarvesterProperties.ListSelectors selectors = properties.getListSelectors();
        Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);

        List<RawListItem> items = new ArrayList<>();
        for (Element item : document.select(selectors.getItem())) {
            Element link = selectors.getLink() == null || selectors.getLink().isBlank()
                ? item
                : item.selectFirst(selectors.getLink());
            String sourceUrl = link == null ? null : blankToNull(link.attr("abs:href"));
            List<String> idCandidates = new ArrayList<>();
            for (String attribute : selectors.getIdAttributes()) {
                addIfPresent(idCandidates, item.attr(attribute));
                if (link != null && link != item) {
                    addIfPresent(idCandidates, link.attr(attribute));
                }
            }
            if (sourceUrl == null && idCandidates.isEmpty()) {
                log.debug("Selector miss: list item without link or id base={}", baseUrl);
                continue;
            }
            items.add(new RawListItem(
                sourceUrl,
                idCandidates,
                dateValue(item, selectors.getPublishedAt()),
                dateValue(item, selectors.getUpdatedAt())
            ));
        }

        String nextPageUrl = null;
        if (selectors.getNextPage() != null && !selectors.getNextPage().isBlank()) {
            Element next = document.selectFirst(selectors.getNextPage());
            nextPageUrl = next == null ? null : blankToNull(next.attr("abs:href"));
        }
        return new ListPage(items, nextPageUrl);
    }

    private String dateValue(Element item, String selector) {
        if (selector == null || selector.isBlank()) {
            return null;
        }
        Element element = item.selectFirst(selector);
        if (element == null) {
            log.debug("Selector miss selector={}", selector);
            return null;
        }
        String datetime = blankToNull(element.attr("datetime"));
        return datetime != null ? datetime : blankToNull(element.text());
    }

    private void addIfPresent(List<String> values, String value) {
        if (value != null && !value.isBlank() && !values.contains(value.trim())) {
            values.add(value.trim());
        }
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
