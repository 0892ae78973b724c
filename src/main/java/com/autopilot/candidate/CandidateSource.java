package com.autopilot.candidate;

import com.autopilot.domain.model.Candidate;
import java.util.List;

/**
 * Supplies scored symbols chosen by the external selection model. Called at most once per cycle,
 * through {@link CandidateCache}.
 */
public interface CandidateSource {

    List<Candidate> getQualifiedCandidates();
}
