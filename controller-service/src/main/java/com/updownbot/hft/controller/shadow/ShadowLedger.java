package com.updownbot.hft.controller.shadow;

import com.updownbot.hft.controller.decision.Decision;
import com.updownbot.hft.controller.io.DecisionLog;
import com.updownbot.hft.outcome.MarketOutcome;
import com.updownbot.hft.outcome.OutcomeResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks escalated proposals as paper positions and scores them against the settled market outcome.
 * The pending set lives in memory, is owned by the decision loop, and is rebuilt from the shadow log on
 * start so proposals made before a restart still get resolved. In-memory state changes only after the
 * matching event has been written to the shadow log.
 */
@Slf4j
public class ShadowLedger {

    private final ShadowLog shadowLog;
    private final DecisionLog decisionLog;
    private final OutcomeResolver outcomeResolver;
    private final Clock clock;
    private final int maxResolutionAttempts;

    private final Map<String, ShadowProposal> pending = new LinkedHashMap<>();
    private final Map<String, ShadowProposal> latest = new LinkedHashMap<>();
    private long idCounter;

    public ShadowLedger(
            ShadowLog shadowLog,
            DecisionLog decisionLog,
            OutcomeResolver outcomeResolver,
            Clock clock,
            int maxResolutionAttempts
    ) {
        this.shadowLog = Objects.requireNonNull(shadowLog, "shadowLog");
        this.decisionLog = Objects.requireNonNull(decisionLog, "decisionLog");
        this.outcomeResolver = Objects.requireNonNull(outcomeResolver, "outcomeResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxResolutionAttempts = Math.max(1, maxResolutionAttempts);
    }

    /**
     * Reloads proposals whose last logged state is still pending.
     *
     * @return number of proposals recovered
     */
    public int recover() {
        pending.clear();
        latest.clear();
        latest.putAll(shadowLog.latestById());
        idCounter = Math.max(idCounter, latest.size());
        for (ShadowProposal p : latest.values()) {
            if (p.status() == ShadowStatus.PENDING) {
                pending.put(p.id(), p);
            }
        }
        if (!pending.isEmpty()) {
            log.info("shadow ledger recovered {} pending proposal(s)", pending.size());
        }
        return pending.size();
    }

    /**
     * Opens a paper position for a {@code PROPOSE_*} decision and returns its id.
     */
    public String recordProposal(Decision decision) {
        if (!decision.decision().isPropose()) {
            throw new IllegalArgumentException("only PROPOSE decisions are tracked, got " + decision.decision());
        }
        Instant now = clock.instant();
        String id = "shadow-%d-%d".formatted(now.toEpochMilli(), ++idCounter);
        ShadowProposal proposal = ShadowProposal.open(id, decision, now);
        shadowLog.append(proposal);
        pending.put(id, proposal);
        latest.put(id, proposal);
        log.info("shadow opened {}: {} {} @ {} (p={} netEdge={})", id, proposal.symbol(), proposal.side(),
                proposal.entryPrice(), proposal.probability(), proposal.netEdge());
        return id;
    }

    /**
     * Looks up the outcome of every pending proposal whose window has closed. Unsettled lookups are
     * deferred to the next call until the attempt budget runs out. A proposal whose event cannot be
     * written stays pending unchanged and is retried on the next call.
     *
     * @return the events produced by this call (RESOLVED or DEFERRED)
     */
    public List<ShadowProposal> resolveDue(Instant now) {
        List<ShadowProposal> due = pending.values().stream().filter(p -> p.isDue(now)).toList();
        List<ShadowProposal> events = new ArrayList<>(due.size());
        for (ShadowProposal p : due) {
            MarketOutcome outcome = lookup(p.slug());
            boolean closing = outcome.isSettled() || p.resolutionAttempts() + 1 >= maxResolutionAttempts;
            ShadowProposal next = closing ? p.resolved(outcome, now) : p.deferred(outcome);
            try {
                shadowLog.append(next);
            } catch (UncheckedIOException e) {
                log.warn("shadow {} kept pending, event not written: {}", p.id(), e.getMessage());
                continue;
            }
            latest.put(p.id(), next);
            if (closing) {
                pending.remove(p.id());
                if (next.won() == null) {
                    log.warn("shadow {} closed without a settled outcome after {} attempts (last={})",
                            p.id(), next.resolutionAttempts(), outcome);
                } else {
                    log.info("shadow resolved {}: {} {} -> {} won={} pnl={}", p.id(), p.symbol(), p.side(),
                            outcome, next.won(), next.realizedPnl());
                }
            } else {
                pending.put(p.id(), next);
                log.debug("shadow {} deferred ({}), attempt {}", p.id(), outcome, next.resolutionAttempts());
            }
            events.add(next);
        }
        return events;
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<ShadowProposal> pending() {
        return List.copyOf(pending.values());
    }

    /**
     * Statistics over every proposal seen since {@link #recover()}, plus the decision log's filter counts.
     */
    public ShadowStats stats() {
        long pendingCount = 0;
        long unresolvable = 0;
        long wins = 0;
        long losses = 0;
        double sumEdge = 0;
        double sumNetEdge = 0;
        double sumProbability = 0;
        double sumPnl = 0;
        for (ShadowProposal p : latest.values()) {
            if (p.status() == ShadowStatus.PENDING) {
                pendingCount++;
                continue;
            }
            if (p.won() == null) {
                unresolvable++;
                continue;
            }
            if (p.won()) {
                wins++;
            } else {
                losses++;
            }
            sumEdge += nz(p.edge());
            sumNetEdge += nz(p.netEdge());
            sumProbability += nz(p.probability());
            sumPnl += nz(p.realizedPnl());
        }
        long settled = wins + losses;
        DecisionLog.FlagCounts flags = decisionLog.flagCounts();
        return new ShadowStats(
                latest.size(),
                pendingCount,
                settled,
                unresolvable,
                wins,
                losses,
                settled == 0 ? 0.0 : (double) wins / settled,
                settled == 0 ? 0.0 : sumEdge / settled,
                settled == 0 ? 0.0 : sumNetEdge / settled,
                settled == 0 ? 0.0 : sumProbability / settled,
                sumPnl,
                settled == 0 ? 0.0 : sumPnl / settled,
                flags.volFloorHit(),
                flags.zClamped()
        );
    }

    private MarketOutcome lookup(String slug) {
        try {
            MarketOutcome outcome = outcomeResolver.resolve(slug);
            return outcome == null ? MarketOutcome.UNRESOLVED : outcome;
        } catch (RuntimeException e) {
            log.warn("outcome lookup for {} failed: {}", slug, e.getMessage());
            return MarketOutcome.FETCH_ERROR;
        }
    }

    private static double nz(Double v) {
        return v == null ? 0.0 : v;
    }
}
