package com.statejobs.harvester.crawl.robots;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.http.PoliteHttpClient;
import com.statejobs.harvester.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final HarvesterProperties properties;
    private final PoliteHttpClient httpClient;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(HarvesterProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public boolean isAllowed(String url) {
        if (!properties.getRobots().isEnabled()) {
            return true;
        }
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        RobotsRules rules = rulesFor(uri);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        boolean allowed = rules.isAllowed(path);
        if (!allowed) {
            log.info("robots disallowed url={}", url);
        }
        return allowed;
    }

    public Duration crawlDelay(String url) {
        if (!properties.getRobots().isEnabled()) {
            return null;
        }
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return rulesFor(uri).getCrawlDelay();
    }

    private RobotsRules rulesFor(URI uri) {
        String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT);
        return cache.computeIfAbsent(origin, this::loadRules);
    }

    private RobotsRules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1");
        if (fetch.statusCode() == 404 || fetch.statusCode() == 410) {
            log.debug("No robots.txt origin={} status={}", origin, fetch.statusCode());
            return RobotsRules.allowAll();
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getRobots().isFailOpen();
            log.warn(
                "robots fetch failed origin={} status={} errorCode={} errorMessage={} decision={}",
                origin,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage(),
                failOpen ? "allow_all" : "disallow_all"
            );
            return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body(), properties.getUserAgent());
        log.debug("Loaded robots origin={} crawlDelay={}", origin, rules.getCrawlDelay());
        return rules;
    }

    private URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = new URI(url);
            return uri.getScheme() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
