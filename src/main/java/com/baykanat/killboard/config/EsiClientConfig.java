package com.baykanat.killboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;

/** ESI erişimi için HttpClient ve fan-out işlerinin koştuğu paylaşılan havuz. */
@Configuration
public class EsiClientConfig {

    @Bean
    public HttpClient esiHttpClient(AppProperties appProperties) {
        return HttpClient.newBuilder()
                .connectTimeout(appProperties.getEsi().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Hesap/killmail başına bir görev; thread sayısı sabit, hesap sayısıyla büyümez. */
    @Bean
    public ThreadPoolTaskExecutor fanOutExecutor(AppProperties appProperties) {
        int threads = appProperties.getProcessor().getFanOutThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("esi-fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
