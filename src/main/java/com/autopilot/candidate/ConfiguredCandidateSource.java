package com.autopilot.candidate;

import com.autopilot.domain.model.Candidate;
import java.util.List;

/** Fixed candidate list from {@code autopilot.candidates.static-list}, for paper runs. */
public class ConfiguredCandidateSource implements CandidateSource {

    private final List<Candidate> candidates;

    public ConfiguredCandidateSource(List<Candidate> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    @Override
    public List<Candidate> getQualifiedCandidates() {
        return candidates;
    }
}
