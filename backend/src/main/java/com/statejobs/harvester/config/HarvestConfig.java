package com.statejobs.harvester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.statejobs.harvester.crawl.identity.IdentityRules;
import com.statejobs.harvester.crawl.orgmatch.OrgMatchRules;
import com.statejobs.harvester.crawl.salary.ParsingRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HarvesterProperties properties) {
        return Executors.newFixedThreadPool(properties.getHttpThreads());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public IdentityRules identityRules(HarvesterProperties properties) {
        return IdentityRules.from(properties.getIdentity());
    }

    @Bean
    public OrgMatchRules orgMatchRules(HarvesterProperties properties) {
        return OrgMatchRules.from(properties.getOrgs(), properties.getMatching().getFuzzyThreshold());
    }

    @Bean
    public ParsingRules parsingRules(HarvesterProperties properties) {
        return ParsingRules.from(properties.getParsing());
    }
}
