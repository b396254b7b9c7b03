package com.yourname.contentvalidation.config;

import com.yourname.contentvalidation.provider.GeminiProviderClient;
import com.yourname.contentvalidation.provider.OpenAiProviderClient;
import com.yourname.contentvalidation.provider.ProviderAdapter;
import com.yourname.contentvalidation.provider.ResponseParser;
import com.yourname.contentvalidation.service.FallbackController;
import com.yourname.contentvalidation.service.PromptBuilder;
import com.yourname.contentvalidation.service.TwoRoundOrchestrator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two-provider engine. Provider A is OpenAI and provider B is Gemini.
 */
@Configuration
public class ValidationConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public TwoRoundOrchestrator twoRoundOrchestrator(
        OpenAiProviderClient openAi,
        GeminiProviderClient gemini,
        ResponseParser parser,
        FallbackController fallback,
        PromptBuilder promptBuilder,
        ExecutorService providerExecutor
    ) {
        return new TwoRoundOrchestrator(
            new ProviderAdapter(openAi, parser, providerExecutor),
            new ProviderAdapter(gemini, parser, providerExecutor),
            fallback,
            promptBuilder,
            providerExecutor
        );
    }
}
