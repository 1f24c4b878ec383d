package com.baykanat.killboard.domain.job;

import com.baykanat.killboard.domain.model.Account;
import com.baykanat.killboard.domain.model.GameEntity;

/**
 * JobProcessor'ın tükettiği iş birimi. Kapalı küme: yeni tür eklemek permits listesine ve
 * JobProcessor.process dispatch'ine dokunmayı gerektirir.
 */
public sealed interface Job permits Job.Refresh, Job.FetchKillmails, Job.ResolveKillmails,
        Job.SaveAccount, Job.SaveKillmailReference, Job.SaveEntity, Job.Stop {

    Refresh REFRESH = new Refresh();
    FetchKillmails FETCH_KILLMAILS = new FetchKillmails();
    ResolveKillmails RESOLVE_KILLMAILS = new ResolveKillmails();
    Stop STOP = new Stop();

    /** Süresi yaklaşan hesapların token'larını yeniler. */
    record Refresh() implements Job {
    }

    /** Tüm hesapların son killmail listesini çeker. */
    record FetchKillmails() implements Job {
    }

    /** Bekleyen (new) killmail'lerin detayını çekip varlıkları çıkarır. */
    record ResolveKillmails() implements Job {
    }

    record SaveAccount(Account account) implements Job {
        @Override
        public String toString() {
            return "SaveAccount[characterId=" + account.getCharacterId() + "]";
        }
    }

    record SaveKillmailReference(long killmailId, String killmailHash) implements Job {
    }

    record SaveEntity(GameEntity entity) implements Job {
    }

    /** Sentinel: tüketici döngüsünü sonlandırır. */
    record Stop() implements Job {
    }
}
