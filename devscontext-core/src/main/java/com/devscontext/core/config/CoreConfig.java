package com.devscontext.core.config;

import com.devscontext.core.cache.SynthesisDedupCache;
import com.devscontext.core.synthesis.LlmSynthesisEngine;
import com.devscontext.core.synthesis.PassthroughSynthesisEngine;
import com.devscontext.core.synthesis.SynthesisEngine;
import com.devscontext.llm.config.SynthesisProperties;
import com.devscontext.llm.service.LlmService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties({DevsContextProperties.class, SynthesisProperties.class})
@Slf4j
public class CoreConfig {

    public static final String FETCH_EXECUTOR = "fetchExecutor";
    public static final String SYNTHESIS_EXECUTOR = "synthesisExecutor";

    private static final int SYNTHESIS_THREADS = 4;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = FETCH_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(DevsContextProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getThreads());
    }

    @Bean(name = SYNTHESIS_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService synthesisExecutor() {
        return Executors.newFixedThreadPool(SYNTHESIS_THREADS);
    }

    @Bean
    public SynthesisEngine synthesisEngine(SynthesisProperties synthesisProperties, LlmService llmService) {
        if (synthesisProperties.isPassthrough()) {
            log.info("[CONFIG] Synthesis plugin selected | plugin=passthrough");
            return new PassthroughSynthesisEngine();
        }
        log.info("[CONFIG] Synthesis plugin selected | plugin=llm | provider={} | model={}",
            llmService.getProvider(), llmService.effectiveModel());
        return new LlmSynthesisEngine(llmService, synthesisProperties);
    }

    @Bean
    public SynthesisDedupCache synthesisDedupCache(DevsContextProperties properties, Clock clock,
                                                   @Qualifier(SYNTHESIS_EXECUTOR) ExecutorService synthesisExecutor) {
        DevsContextProperties.Cache cache = properties.getCache();
        // Disabled cache still deduplicates in-flight builds, it just keeps nothing afterwards
        Duration ttl = cache.isEnabled() ? cache.getTtl() : Duration.ZERO;
        return new SynthesisDedupCache(ttl, cache.getMaxSize(), clock, synthesisExecutor);
    }
}
