package com.baykanat.killboard.domain.mapper;

import com.baykanat.killboard.domain.job.Job;
import com.baykanat.killboard.domain.model.KillmailReference;
import com.baykanat.killboard.infrastructure.esi.dto.KillmailSummary;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** ESI killmail listesi → domain referansı ve kayıt job'u. MapStruct. */
@Mapper(componentModel = "spring")
public interface KillmailMapper {

    /** Listeden gelen her killmail "new" durumunda başlar. */
    @Mapping(target = "status", constant = "NEW")
    KillmailReference toReference(KillmailSummary summary);

    List<KillmailReference> toReferences(List<KillmailSummary> summaries);

    default Job.SaveKillmailReference toSaveJob(KillmailReference reference) {
        return new Job.SaveKillmailReference(reference.getKillmailId(), reference.getKillmailHash());
    }
}
