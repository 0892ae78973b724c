package com.autopilot.api.dto.response;

import com.autopilot.domain.model.Candidate;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Latest candidate list, for display only. {@code fetchedAt} is null before the first fetch. */
@Getter
@Builder
public class CandidateListResponse {

    private final Instant fetchedAt;
    private final long cycleSequence;
    private final int count;
    private final List<Candidate> candidates;
}
