package com.statejobs.harvester.crawl.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.model.DetailFields;
import com.statejobs.harvester.crawl.util.DateNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pulls detail fields out of a listing page with the configured CSS selectors.
 * Fields the selectors miss are taken from an embedded schema.org JobPosting
 * block when the page carries one.
 */
@Component
public class DetailPageExtractor {
    private static final Logger log = LoggerFactory.getLogger(DetailPageExtractor.class);
    private static final String BLOCK_ELEMENTS = "p, li, tr, dd, dt, h1, h2, h3, h4, h5, h6";

    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;

    public DetailPageExtractor(HarvesterProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public DetailFields extract(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            return null;
        }
        HarvesterProperties.DetailSelectors selectors = properties.getDetailSelectors();
        Document document = Jsoup.parse(html, sourceUrl == null ? "" : sourceUrl);
        JsonNode posting = firstJobPosting(document);

        String title = firstNonBlank(firstText(document, selectors.getTitle()), text(posting, "title"));
        String jobTitle = firstText(document, selectors.getJobTitle());
        String employer = firstNonBlank(
            firstText(document, selectors.getEmployer()),
            posting == null ? null : text(posting.path("hiringOrganization"), "name")
        );
        String locations = firstNonBlank(
            splitLocations(firstText(document, selectors.getLocations())),
            posting == null ? null : extractLocation(posting.get("jobLocation"))
        );
        String employmentType = firstNonBlank(
            firstText(document, selectors.getEmploymentType()),
            posting == null ? null : extractEmploymentType(posting.get("employmentType"))
        );
        String extent = firstText(document, selectors.getExtent());
        Instant publishedAt = firstInstant(dateValue(document, selectors.getPublishedAt()), text(posting, "datePosted"));
        Instant updatedAt = DateNormalizer.toInstant(dateValue(document, selectors.getUpdatedAt()));
        Instant applyDeadline = firstInstant(dateValue(document, selectors.getApplyDeadline()), text(posting, "validThrough"));
        String salaryText = firstText(document, selectors.getSalaryText());

        List<String> lines = new ArrayList<>();
        addLine(lines, salaryText);
        lines.addAll(blockLines(document, selectors.getJobCodeBlocks()));
        List<String> descriptionLines = blockLines(document, selectors.getDescription());
        if (descriptionLines.isEmpty() && posting != null) {
            String description = text(posting, "description");
            if (description != null) {
                descriptionLines = blockLines(Jsoup.parseBodyFragment(description), "body");
            }
        }
        lines.addAll(descriptionLines);

        return new DetailFields(
            title,
            jobTitle,
            employer,
            locations,
            employmentType,
            extent,
            publishedAt,
            updatedAt,
            applyDeadline,
            salaryText,
            String.join("\n", new LinkedHashSet<>(lines)),
            document.body() == null ? document.text() : document.body().text()
        );
    }

    private String firstText(Document document, String selector) {
        if (selector == null || selector.isBlank()) {
            return null;
        }
        Element element = document.selectFirst(selector);
        if (element == null) {
            log.debug("Selector miss selector={}", selector);
            return null;
        }
        String text = element.text();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private String dateValue(Document document, String selector) {
        if (selector == null || selector.isBlank()) {
            return null;
        }
        Element element = document.selectFirst(selector);
        if (element == null) {
            log.debug("Selector miss selector={}", selector);
            return null;
        }
        String datetime = element.attr("datetime");
        if (datetime != null && !datetime.isBlank()) {
            return datetime.trim();
        }
        String text = element.text();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /**
     * One line per block-level descendant of the selected elements, or the whole
     * element text when it has no block children.
     */
    private List<String> blockLines(Element root, String selector) {
        List<String> lines = new ArrayList<>();
        if (selector == null || selector.isBlank()) {
            return lines;
        }
        Elements containers = root.select(selector);
        if (containers.isEmpty()) {
            log.debug("Selector miss selector={}", selector);
            return lines;
        }
        for (Element container : containers) {
            boolean foundBlock = false;
            for (Element block : container.select(BLOCK_ELEMENTS)) {
                if (block == container || hasBlockChild(block)) {
                    continue;
                }
                foundBlock = true;
                addLine(lines, block.text());
            }
            if (!foundBlock) {
                addLine(lines, container.text());
            }
        }
        return lines;
    }

    private boolean hasBlockChild(Element block) {
        for (Element child : block.select(BLOCK_ELEMENTS)) {
            if (child != block) {
                return true;
            }
        }
        return false;
    }

    private void addLine(List<String> lines, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(value.trim());
        }
    }

    private String splitLocations(String raw) {
        if (raw == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : raw.replace('/', ',').split(",")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts.isEmpty() ? null : String.join(" | ", parts);
    }

    private Instant firstInstant(String... candidates) {
        for (String candidate : candidates) {
            Instant parsed = DateNormalizer.toInstant(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private JsonNode firstJobPosting(Document document) {
        List<JsonNode> nodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectJobPostingNodes(objectMapper.readTree(payload), nodes);
            } catch (JsonProcessingException e) {
                log.debug("Malformed JSON-LD block skipped: {}", e.getOriginalMessage());
            }
            if (!nodes.isEmpty()) {
                return nodes.get(0);
            }
        }
        return null;
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private String extractLocation(JsonNode jobLocation) {
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        LinkedHashSet<String> locations = new LinkedHashSet<>();
        collectLocalities(jobLocation, locations);
        return locations.isEmpty() ? null : String.join(" | ", locations);
    }

    private void collectLocalities(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectLocalities(item, out);
            }
            return;
        }
        if (node.isTextual()) {
            String value = node.asText().trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
            return;
        }
        JsonNode address = node.has("address") ? node.get("address") : node;
        String locality = firstNonBlank(text(address, "addressLocality"), text(node, "name"));
        if (locality != null) {
            out.add(locality);
        }
    }

    private String extractEmploymentType(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
            return values.isEmpty() ? null : values.stream().distinct().collect(Collectors.joining(", "));
        }
        return node.isTextual() ? node.asText() : null;
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
