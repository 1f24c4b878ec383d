package com.baykanat.killboard.domain.service;

import com.baykanat.killboard.config.AppProperties;
import com.baykanat.killboard.domain.exception.QueueFullException;
import com.baykanat.killboard.domain.job.Job;
import com.baykanat.killboard.domain.job.JobQueue;
import com.baykanat.killboard.domain.mapper.KillmailMapper;
import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.GameEntity;
import com.baykanat.killboard.domain.model.KillmailReference;
import com.baykanat.killboard.domain.model.KillmailStatus;
import com.baykanat.killboard.infrastructure.esi.EsiApiClient;
import com.baykanat.killboard.infrastructure.esi.EsiTokenService;
import com.baykanat.killboard.infrastructure.esi.KillmailListing;
import com.baykanat.killboard.infrastructure.persistence.AccountJdbcRepository;
import com.baykanat.killboard.infrastructure.persistence.EntityJdbcRepository;
import com.baykanat.killboard.infrastructure.persistence.KillmailJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JobQueue'nun tek tüketicisi. Job'ları sırayla (FIFO) alır ve türüne göre işler.
 *
 * <p>Bir job'daki hata loglanır ve sonraki job'a geçilir; döngü yalnızca {@link Job.Stop} ile biter.
 * Fan-out job'ları (FetchKillmails, ResolveKillmails) hesap/killmail başına bir görevi paylaşılan havuzda
 * başlatır, hepsinin bitmesini bekler; bir görevin hatası diğerlerini iptal etmez. Türetilen Save* job'ları
 * fan-out bittikten sonra üretim sırasıyla burada işlenir, kuyruğa geri yazılmaz (tek tüketici kendi
 * kuyruğunda bloklanmasın diye).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobProcessor {

    private final JobQueue jobQueue;
    private final EsiTokenService tokenService;
    private final EsiApiClient esiApiClient;
    private final EntityExtractor entityExtractor;
    private final KillmailMapper killmailMapper;
    private final AccountJdbcRepository accountRepository;
    private final KillmailJdbcRepository killmailRepository;
    private final EntityJdbcRepository entityRepository;
    @Qualifier("fanOutExecutor")
    private final Executor fanOutExecutor;
    private final AppProperties appProperties;

    private volatile Thread worker;

    /** Uygulama hazır olunca tüketici thread'ini başlatır. */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!appProperties.getProcessor().isEnabled()) {
            log.info("Job processor is disabled");
            return;
        }
        Thread thread = new Thread(this::runUntilStopped, "job-processor");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
    }

    /** Kapanışta Stop gönderir; elindeki job bitince döngü sonlanır. Kuyruk doluysa thread kesilir. */
    @Order(2)
    @EventListener(ContextClosedEvent.class)
    public void stop() {
        Thread thread = worker;
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            jobQueue.trySubmit(Job.STOP);
        } catch (QueueFullException e) {
            log.warn("Could not enqueue Stop, interrupting job processor");
            thread.interrupt();
        }
        try {
            thread.join(appProperties.getProcessor().getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Stop gelene (ya da thread kesilene) kadar kuyruğu tüketir. */
    public void runUntilStopped() {
        log.info("Job processor started");
        while (true) {
            Job job;
            try {
                job = jobQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Job processor interrupted, exiting");
                return;
            }
            if (!process(job)) {
                break;
            }
        }
        log.info("Job processor stopped, {} queued jobs dropped", jobQueue.size());
    }

    /** Tek job'u işler; false yalnızca Stop için. Hata asla dışarı taşmaz. */
    public boolean process(Job job) {
        log.debug("Processing job {}", job);
        try {
            if (job instanceof Job.Stop) {
                log.info("Stopping processor");
                return false;
            } else if (job instanceof Job.Refresh) {
                refreshAccounts();
            } else if (job instanceof Job.FetchKillmails) {
                fetchKillmails();
            } else if (job instanceof Job.ResolveKillmails) {
                resolveKillmails();
            } else {
                save(job);
            }
        } catch (Exception e) {
            log.error("Failed to process job {}: {}", job, e.getMessage(), e);
        }
        return true;
    }

    /** Süresi pencere içinde dolacak hesapları yeniler; her başarılı hesap bir SaveAccount. */
    private void refreshAccounts() {
        AppProperties.EsiProperties esi = appProperties.getEsi();
        List<Account> accounts = esi.isRefreshAll()
                ? accountRepository.findAll()
                : accountRepository.findExpiringBefore(Instant.now().plus(esi.getRefreshWindow()));
        if (accounts.isEmpty()) {
            log.debug("No accounts due for token refresh");
            return;
        }

        List<Account> refreshed = tokenService.refresh(accounts);
        log.info("Token refresh: {} of {} accounts refreshed", refreshed.size(), accounts.size());
        refreshed.forEach(account -> save(new Job.SaveAccount(account)));
    }

    /**
     * Hesap başına eşzamanlı liste çekimi; her killmail bir SaveKillmailReference (status new).
     * last_fetched yalnızca listedeki tüm killmail'ler kaydedildiyse ilerler.
     */
    private void fetchKillmails() {
        List<Account> accounts = accountRepository.findAll();
        log.debug("Fetching killmails for {} accounts", accounts.size());

        List<FetchResult> results = fanOut(accounts,
                account -> () -> new FetchResult(account, esiApiClient.fetchRecentKillmails(account)),
                (account, e) -> log.error("Failed to fetch killmails for character_id={}: {}",
                        account.getCharacterId(), e.getMessage()));

        int saved = 0;
        for (FetchResult result : results) {
            KillmailListing listing = result.listing();
            if (listing.notModified()) {
                continue;
            }
            boolean complete = true;
            for (KillmailReference reference : listing.killmails()) {
                if (save(killmailMapper.toSaveJob(reference))) {
                    saved++;
                } else {
                    complete = false;
                }
            }
            if (complete) {
                markFetched(result.account(), listing);
            } else {
                log.warn("Keeping last_fetched for character_id={}, some killmails were not saved",
                        result.account().getCharacterId());
            }
        }
        log.info("Killmail discovery: {} accounts queried, {} references saved", accounts.size(), saved);
    }

    /** Bekleyen killmail'lerin detayını eşzamanlı çeker; sentinel dışı her varlık bir SaveEntity. */
    private void resolveKillmails() {
        List<KillmailReference> pending = killmailRepository.findPending();
        log.debug("Resolving {} killmails", pending.size());

        List<ResolvedKillmail> results = fanOut(pending,
                reference -> () -> new ResolvedKillmail(reference, entityExtractor.extractPersistable(
                        esiApiClient.fetchKillmail(reference.getKillmailId(), reference.getKillmailHash()))),
                (reference, e) -> log.error("Failed to resolve killmail_id={}: {}",
                        reference.getKillmailId(), e.getMessage()));

        int resolved = 0;
        for (ResolvedKillmail result : results) {
            long killmailId = result.reference().getKillmailId();
            log.trace("Collected {} entities from killmail_id={}", result.entities().size(), killmailId);
            boolean complete = true;
            for (GameEntity entity : result.entities()) {
                complete &= save(new Job.SaveEntity(entity));
            }
            if (complete && markResolved(killmailId)) {
                resolved++;
            }
        }
        log.info("Killmail resolution: {} pending, {} resolved", pending.size(), resolved);
    }

    /**
     * Her öğe için havuzda bir görev başlatır, hepsinin sonuçlanmasını bekler.
     * Hatalı görev loglanır ve sonuçtan çıkar; diğerleri etkilenmez. Sonuç sırası girdi sırasıdır.
     */
    private <T, R> List<R> fanOut(List<T> items,
                                  Function<T, Supplier<R>> task,
                                  BiConsumer<T, Throwable> onFailure) {
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(task.apply(item), fanOutExecutor)
                    .exceptionally(e -> {
                        onFailure.accept(item, unwrap(e));
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();
    }

    /** Save* job'larını Persistence katmanına uygular; hata loglanır, tekrar denenmez. */
    private boolean save(Job job) {
        try {
            if (job instanceof Job.SaveAccount saveAccount) {
                Account account = saveAccount.account();
                log.debug("Saving account character_id={}", account.getCharacterId());
                accountRepository.upsert(account);
            } else if (job instanceof Job.SaveKillmailReference saveKillmail) {
                log.debug("Saving killmail killmail_id={}, killmail_hash={}",
                        saveKillmail.killmailId(), saveKillmail.killmailHash());
                killmailRepository.insertIfAbsent(saveKillmail.killmailId(), saveKillmail.killmailHash(), KillmailStatus.NEW);
            } else if (job instanceof Job.SaveEntity saveEntity) {
                log.trace("Saving entity {}", saveEntity.entity());
                entityRepository.insertIfAbsent(saveEntity.entity());
            } else {
                throw new IllegalStateException("Unhandled job type: " + job);
            }
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to save {}: {}", job, e.getMessage());
            return false;
        }
    }

    private void markFetched(Account account, KillmailListing listing) {
        Instant fetchedAt = listing.lastModified() != null ? listing.lastModified() : Instant.now();
        try {
            accountRepository.updateLastFetched(account.getCharacterId(), fetchedAt);
        } catch (DataAccessException e) {
            log.error("Failed to update last_fetched for character_id={}: {}", account.getCharacterId(), e.getMessage());
        }
    }

    private boolean markResolved(long killmailId) {
        try {
            killmailRepository.updateStatus(killmailId, KillmailStatus.RESOLVED);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to mark killmail_id={} resolved: {}", killmailId, e.getMessage());
            return false;
        }
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private record FetchResult(Account account, KillmailListing listing) {
    }

    private record ResolvedKillmail(KillmailReference reference, List<GameEntity> entities) {
    }
}
