package me.golemcore.pulse.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHitDto {
    private String id;
    private double score;
    private Map<String, String> metadata;
    private String backend;

    public static SearchHitDto from(ScoredVectorRecord hit) {
        return SearchHitDto.builder()
                .id(hit.record().getId())
                .score(hit.score())
                .metadata(hit.record().getMetadata())
                .backend(hit.record().getBackendOrigin() != null ? hit.record().getBackendOrigin().name() : null)
                .build();
    }
}
