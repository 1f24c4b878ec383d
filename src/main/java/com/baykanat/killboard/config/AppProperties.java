package com.baykanat.killboard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/** app.* için tip güvenli configuration (ESI kimlik bilgileri ve endpoint'ler, scheduler aralıkları, kuyruk). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private EsiProperties esi = new EsiProperties();
    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();
    @Valid
    private QueueProperties queue = new QueueProperties();
    @Valid
    private ProcessorProperties processor = new ProcessorProperties();

    @Getter
    @Setter
    public static class EsiProperties {
        @NotBlank
        private String applicationId;
        @NotBlank
        private String applicationSecret;
        @NotBlank
        private String redirectUri;
        private String scope = "publicData esi-killmails.read_killmails.v1 esi-killmails.read_corporation_killmails.v1";
        private String authorizeUrl = "https://login.eveonline.com/v2/oauth/authorize";
        private String tokenUrl = "https://login.eveonline.com/v2/oauth/token";
        private String jwksUrl = "https://login.eveonline.com/oauth/jwks";
        private String baseUrl = "https://esi.evetech.net/latest";
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** Refresh job'unda expiry'si bu pencere içinde kalan hesaplar yenilenir. */
        private Duration refreshWindow = Duration.ofMinutes(10);
        /** true: pencereye bakmadan tüm hesaplar yenilenir. */
        private boolean refreshAll = false;
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private boolean enabled = true;
        @NotNull
        private Duration refreshInterval = Duration.ofMinutes(5);
        @NotNull
        private Duration fetchInterval = Duration.ofMinutes(10);
        @NotNull
        private Duration resolveInterval = Duration.ofMinutes(60);
    }

    @Getter
    @Setter
    public static class QueueProperties {
        @Min(1)
        private int capacity = 100;
    }

    @Getter
    @Setter
    public static class ProcessorProperties {
        private boolean enabled = true;
        /** Fan-out (hesap/killmail başına fetch) için paylaşılan havuz boyutu. */
        @Min(1)
        private int fanOutThreads = 8;
        /** Kapanışta elindeki job'un bitmesi için beklenecek süre. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
}
