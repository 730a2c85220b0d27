package com.starkiller.core.consequence;

import com.starkiller.core.day.DayRuleProvider;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.events.ReentrancyViolationException;
import com.starkiller.core.events.StarkillerEvent;
import com.starkiller.core.metrics.StarkillerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only ledger of consequence tokens.
 * <p>
 * Each token is delivered at most once, on the first {@link #processDay} at or after
 * its trigger day. Tokens are kept after delivery as an audit trail. Once a day has
 * started processing, every due token is delivered before the call returns; a
 * failing handler is logged and does not stop the others. A handler that calls
 * back into {@link #processDay} does not stop the pass either, but the violation
 * is rethrown once the pass is complete.
 */
@Service
public class ConsequenceTokenLedger {

    private static final Logger log = LoggerFactory.getLogger(ConsequenceTokenLedger.class);

    public static final String TOKEN_TRIGGERED = "consequence.triggered";

    private final DayRuleProvider dayRuleProvider;
    private final EventBus eventBus;
    private final StarkillerMetrics metrics;

    private final List<ConsequenceToken> tokens = new ArrayList<>();
    private final List<ConsequenceHandler> handlers = new CopyOnWriteArrayList<>();
    private int tokenSequence = 0;
    private boolean processing;

    public ConsequenceTokenLedger(DayRuleProvider dayRuleProvider,
                                  EventBus eventBus,
                                  @Autowired(required = false) StarkillerMetrics metrics) {
        this.dayRuleProvider = dayRuleProvider;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public void registerHandler(ConsequenceHandler handler) {
        handlers.add(handler);
    }

    /**
     * Schedules a consequence {@code delayDays} after the current day.
     */
    public ConsequenceToken addToken(String decisionId, int delayDays, ConsequencePayload payload) {
        Objects.requireNonNull(decisionId, "decisionId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (delayDays < 0) {
            throw new IllegalArgumentException("delayDays must not be negative, was " + delayDays);
        }
        int today = dayRuleProvider.currentDay();
        ConsequenceToken token = new ConsequenceToken(
                String.format("CT-%04d", ++tokenSequence), decisionId, today, today + delayDays, payload, false, -1);
        tokens.add(token);
        log.info("Added consequence token {} for {}: triggers on day {}", token.id(), decisionId, token.triggerDay());
        return token;
    }

    /**
     * Delivers every untriggered token whose trigger day has been reached.
     *
     * @return the tokens delivered by this call
     * @throws ReentrancyViolationException if a handler called back into this method;
     *                                      the pass has completed when it is thrown
     */
    public List<ConsequenceToken> processDay(int currentDay) {
        if (processing) {
            throw new ReentrancyViolationException("processDay(" + currentDay + ") called while a day is being processed");
        }
        processing = true;
        try {
            List<Integer> due = new ArrayList<>();
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).isDue(currentDay)) {
                    due.add(i);
                }
            }

            List<ConsequenceToken> delivered = new ArrayList<>();
            List<ReentrancyViolationException> violations = new ArrayList<>();
            for (int index : due) {
                ConsequenceToken token = tokens.get(index).markTriggered(currentDay);
                tokens.set(index, token);
                deliver(token, currentDay, violations);
                delivered.add(token);
            }
            if (!delivered.isEmpty()) {
                log.info("Day {}: {} consequence token(s) triggered", currentDay, delivered.size());
            }
            if (!violations.isEmpty()) {
                ReentrancyViolationException first = violations.get(0);
                violations.stream().skip(1).forEach(first::addSuppressed);
                throw first;
            }
            return delivered;
        } finally {
            processing = false;
        }
    }

    public List<ConsequenceToken> activeTokens() {
        return tokens.stream().filter(t -> !t.triggered()).toList();
    }

    public List<ConsequenceToken> allTokens() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    /**
     * Whether an untriggered token's source decision contains {@code fragment}.
     */
    public boolean hasActiveToken(String fragment) {
        return tokens.stream().anyMatch(t -> !t.triggered() && t.sourceDecisionId().contains(fragment));
    }

    /**
     * Untriggered tokens due within the next {@code days} days.
     */
    public int upcomingTokenCount(int currentDay, int days) {
        return (int) tokens.stream().filter(t -> !t.triggered() && t.triggerDay() <= currentDay + days).count();
    }

    public int triggeredOn(int day) {
        return (int) tokens.stream().filter(t -> t.triggered() && t.triggeredOnDay() == day).count();
    }

    public void reset() {
        tokens.clear();
        tokenSequence = 0;
    }

    public void restore(List<ConsequenceToken> restored) {
        reset();
        tokens.addAll(restored);
        tokenSequence = restored.size();
    }

    private void deliver(ConsequenceToken token, int day, List<ReentrancyViolationException> violations) {
        log.info("Triggering consequence token {} from {}", token.id(), token.sourceDecisionId());
        if (token.payload().scenarioToTrigger() != null) {
            log.info("Consequence {} requests scenario {}", token.id(), token.payload().scenarioToTrigger());
        }
        for (ConsequenceHandler handler : handlers) {
            try {
                handler.onConsequence(token, day);
            } catch (ReentrancyViolationException e) {
                log.error("Consequence handler re-entered the ledger on token {}: {}", token.id(), e.getMessage());
                violations.add(e);
            } catch (Exception e) {
                log.warn("Consequence handler failed on token {}: {}", token.id(), e.getMessage(), e);
            }
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("source", token.sourceDecisionId());
        payload.put("triggerDay", token.triggerDay());
        if (token.payload().newsHeadline() != null) {
            payload.put("headline", token.payload().newsHeadline());
        }
        eventBus.publish(StarkillerEvent.of(TOKEN_TRIGGERED, day, token.id(), payload));
        if (metrics != null) {
            metrics.recordTokenTriggered(token.sourceDecisionId());
        }
    }
}
