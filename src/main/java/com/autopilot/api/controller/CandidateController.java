package com.autopilot.api.controller;

import com.autopilot.api.dto.response.CandidateListResponse;
import com.autopilot.candidate.CandidateCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** GET /qualified-stocks: the candidate list fetched by the most recent cycle. Never calls the source. */
@RestController
public class CandidateController {

    private final CandidateCache candidateCache;

    public CandidateController(CandidateCache candidateCache) {
        this.candidateCache = candidateCache;
    }

    @GetMapping("/qualified-stocks")
    public ResponseEntity<CandidateListResponse> getQualifiedStocks() {
        CandidateCache.CandidateList latest = candidateCache.latest();
        return ResponseEntity.ok(CandidateListResponse.builder()
                .fetchedAt(latest.getFetchedAt())
                .cycleSequence(latest.getCycleSequence())
                .count(latest.getCandidates().size())
                .candidates(latest.getCandidates())
                .build());
    }
}
