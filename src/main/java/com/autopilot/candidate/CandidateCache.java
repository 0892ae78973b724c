package com.autopilot.candidate;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.model.Candidate;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lazily fetches the candidate list at most once per cycle and keeps the most recent successful
 * list for the control surface.
 *
 * <p>{@link #forCycle} is called from the scheduling loop only. {@link #latest()} may be called from
 * any thread.
 */
@Component
public class CandidateCache {

    private static final Logger log = LoggerFactory.getLogger(CandidateCache.class);

    private final CandidateSource candidateSource;
    private final AdapterCallGuard adapterCallGuard;
    private final Clock clock;

    private final AtomicReference<CandidateList> latest = new AtomicReference<>(CandidateList.EMPTY);

    private long fetchedForCycle = -1;
    private List<Candidate> cycleCandidates = List.of();
    private RuntimeException cycleFailure;

    public CandidateCache(CandidateSource candidateSource, AdapterCallGuard adapterCallGuard, Clock clock) {
        this.candidateSource = candidateSource;
        this.adapterCallGuard = adapterCallGuard;
        this.clock = clock;
    }

    /**
     * Returns the candidates for {@code cycleSequence}, sorted by score descending. The source is
     * called on the first request of a cycle only; a failure is rethrown for every later request in
     * the same cycle without calling the source again.
     */
    public synchronized List<Candidate> forCycle(long cycleSequence) {
        if (fetchedForCycle != cycleSequence) {
            fetchedForCycle = cycleSequence;
            cycleFailure = null;
            cycleCandidates = List.of();
            try {
                List<Candidate> fetched = adapterCallGuard.call(AdapterName.CANDIDATES, "getQualifiedCandidates",
                        candidateSource::getQualifiedCandidates);
                cycleCandidates = fetched.stream()
                        .sorted(Comparator.comparingInt(Candidate::getScore).reversed())
                        .toList();
                latest.set(new CandidateList(cycleCandidates, clock.instant(), cycleSequence));
                log.debug("Fetched {} candidate(s) for cycle {}", cycleCandidates.size(), cycleSequence);
            } catch (RuntimeException e) {
                cycleFailure = e;
            }
        }
        if (cycleFailure != null) {
            throw cycleFailure;
        }
        return cycleCandidates;
    }

    public CandidateList latest() {
        return latest.get();
    }

    @Value
    public static class CandidateList {

        static final CandidateList EMPTY = new CandidateList(List.of(), null, 0);

        List<Candidate> candidates;
        Instant fetchedAt;
        long cycleSequence;
    }
}
