package com.autopilot.unit.candidate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autopilot.adapter.AdapterCallGuard;
import com.autopilot.candidate.CandidateCache;
import com.autopilot.candidate.CandidateSource;
import com.autopilot.domain.enums.AdapterName;
import com.autopilot.domain.model.Candidate;
import com.autopilot.exception.AdapterException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandidateCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-11T15:00:00Z");

    @Mock
    private CandidateSource candidateSource;

    @Mock
    private AdapterCallGuard adapterCallGuard;

    private CandidateCache cache;

    @BeforeEach
    void setUp() {
        cache = new CandidateCache(candidateSource, adapterCallGuard, Clock.fixed(NOW, ZoneOffset.UTC));
        when(adapterCallGuard.call(eq(AdapterName.CANDIDATES), eq("getQualifiedCandidates"), any()))
                .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(2).get());
    }

    private static Candidate candidate(String symbol, int score) {
        return Candidate.builder().symbol(symbol).score(score).confidence(8).build();
    }

    @Test
    @DisplayName("Fetches once per cycle and sorts by score")
    void fetchesOncePerCycle() {
        when(candidateSource.getQualifiedCandidates())
                .thenReturn(List.of(candidate("AMD", 70), candidate("NVDA", 95), candidate("AAPL", 80)));

        List<Candidate> first = cache.forCycle(3);
        List<Candidate> again = cache.forCycle(3);

        assertThat(first).extracting(Candidate::getSymbol).containsExactly("NVDA", "AAPL", "AMD");
        assertThat(again).isSameAs(first);
        verify(candidateSource, times(1)).getQualifiedCandidates();
        assertThat(cache.latest().getCycleSequence()).isEqualTo(3);
        assertThat(cache.latest().getFetchedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("A failure is rethrown for the whole cycle and the last good list is kept")
    void failureSticksForCycle() {
        when(candidateSource.getQualifiedCandidates())
                .thenReturn(List.of(candidate("AAPL", 80)))
                .thenThrow(AdapterException.transientFailure(AdapterName.CANDIDATES, "screener timeout"));
        cache.forCycle(1);

        assertThatThrownBy(() -> cache.forCycle(2)).hasMessage("screener timeout");
        assertThatThrownBy(() -> cache.forCycle(2)).hasMessage("screener timeout");

        verify(candidateSource, times(2)).getQualifiedCandidates();
        assertThat(cache.latest().getCycleSequence()).isEqualTo(1);
        assertThat(cache.latest().getCandidates()).extracting(Candidate::getSymbol).containsExactly("AAPL");
    }
}
