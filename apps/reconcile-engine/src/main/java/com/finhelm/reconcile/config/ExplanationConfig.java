package com.finhelm.reconcile.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finhelm.reconcile.ai.OpenAiResponsesClient;
import com.finhelm.reconcile.explanation.AiExplanationGenerator;
import com.finhelm.reconcile.explanation.ExplanationGenerator;
import com.finhelm.reconcile.explanation.TemplateExplanationGenerator;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExplanationConfig {

    private static final Logger log = LoggerFactory.getLogger(ExplanationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Dedicated pool for blocking language-model calls; a full queue makes the caller fall back
     * to the template.
     */
    @Bean(name = "explanationExecutor")
    public ThreadPoolTaskExecutor explanationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("explain-");
        executor.setDaemon(true);
        return executor;
    }

    @Bean
    @Primary
    public ExplanationGenerator explanationGenerator(
            OpenAiResponsesClient client,
            TemplateExplanationGenerator template,
            ObjectMapper objectMapper,
            ReconcileProperties properties,
            @Qualifier("explanationExecutor") Executor explanationExecutor) {
        if (!client.hasCredentials()) {
            log.info("Explanations: no AI credentials configured, using template generator");
            return template;
        }
        log.info("Explanations: language model enabled with timeoutMs={}", properties.ai().timeoutMs());
        return new AiExplanationGenerator(
                client, template, objectMapper, explanationExecutor, properties.ai().timeoutMs());
    }
}
