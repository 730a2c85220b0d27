package com.starkiller.core.consequence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Publishes a news item for every triggered consequence that carries a headline.
 */
@Component
public class NewsFeed implements ConsequenceHandler {

    private static final Logger log = LoggerFactory.getLogger(NewsFeed.class);

    private static final String SEVERE_SUFFIX = "\n\nCommand emphasizes the importance of strict adherence to protocols.";

    private final List<NewsEntry> entries = new ArrayList<>();

    @Override
    public void onConsequence(ConsequenceToken token, int day) {
        ConsequencePayload payload = token.payload();
        if (payload.newsHeadline() == null || payload.newsHeadline().isBlank()) {
            return;
        }
        NewsEntry entry = new NewsEntry(day, payload.newsHeadline(), content(token),
                payload.suspicionIncrease() > 5, token.sourceDecisionId());
        entries.add(entry);
        log.info("News published on day {}: {}", day, entry.headline());
    }

    public List<NewsEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<NewsEntry> entriesOn(int day) {
        return entries.stream().filter(e -> e.day() == day).toList();
    }

    public void clear() {
        entries.clear();
    }

    static String content(ConsequenceToken token) {
        String content = switch (token.sourceDecisionId()) {
            case "SMUGGLER_APPROVED" -> "Imperial Security reports increased contraband trafficking through outer "
                    + "system checkpoints. New screening protocols are being implemented.";
            case "REBEL_SYMPATHIZER_HELPED" -> "Intelligence sources confirm rebel supply lines remain active "
                    + "despite recent security measures. Investigation ongoing.";
            case "BRIBE_ACCEPTED" -> "Internal Affairs announces random audits of checkpoint personnel following "
                    + "reports of irregular procedures.";
            case "MEDICAL_SUPPLIES_APPROVED" -> "Medical Command reports shortages of critical supplies in outer "
                    + "territories. Supply chain review initiated.";
            default -> "Security Command reviews recent checkpoint activities. Days since incident: "
                    + token.dayCreated();
        };
        return token.payload().isSevere() ? content + SEVERE_SUFFIX : content;
    }
}
