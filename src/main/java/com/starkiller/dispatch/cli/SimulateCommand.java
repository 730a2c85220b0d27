package com.starkiller.dispatch.cli;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.encounter.GameRandom;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.logging.MdcContext;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.persistence.SessionSnapshotStore;
import com.starkiller.core.persistence.SnapshotStoreException;
import com.starkiller.core.session.DayStart;
import com.starkiller.core.session.DecisionOutcome;
import com.starkiller.core.session.GameSession;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: starkiller simulate
 * <p>
 * Plays a number of checkpoint days with a scripted officer, printing each
 * encounter, decision, consequence and branch change, then the narrative report.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Simulate checkpoint shifts")
@Component
public class SimulateCommand implements Runnable {

    @Option(names = {"--days", "-d"}, description = "Days to play (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int days;

    @Option(names = {"--encounters", "-e"}, description = "Encounters per day (default: starkiller.session.encounters-per-day)")
    private Integer encounters;

    @Option(names = {"--seed", "-s"}, description = "Random seed; same seed, same game")
    private Long seed;

    @Option(names = {"--strategy"},
            description = "Officer behavior: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "PERFECT")
    private DecisionStrategy strategy;

    @Option(names = {"--save"}, description = "Write the final session snapshot to this file")
    private Path save;

    private final GameSession session;
    private final SessionSnapshotStore snapshotStore;
    private final EventBus eventBus;
    private final StarkillerProperties properties;

    public SimulateCommand(GameSession session, SessionSnapshotStore snapshotStore,
                           EventBus eventBus, StarkillerProperties properties) {
        this.session = session;
        this.snapshotStore = snapshotStore;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        long gameSeed = seed != null ? seed : System.nanoTime();
        int perDay = encounters != null ? encounters : properties.getSession().getEncountersPerDay();
        GameRandom officer = new GameRandom(gameSeed ^ 0x5DEECE66DL);

        try {
            session.newGame(gameSeed);
            ConsoleOutput.info("Session " + session.sessionId() + " (seed " + gameSeed + ", strategy " + strategy + ")");

            EventBus.Subscription subscription = eventBus.subscribeAll(ConsoleOutput::event);
            try {
                ConsoleOutput.day(session.currentDay());
                for (int d = 1; d <= days && !session.isGameOver(); d++) {
                    for (int i = 0; i < perDay && !session.isGameOver(); i++) {
                        Encounter encounter = session.nextEncounter();
                        ConsoleOutput.encounter(encounter);
                        DecisionOutcome outcome = session.decide(encounter, strategy.choose(encounter, officer));
                        ConsoleOutput.decision(outcome);
                    }
                    if (d < days && !session.isGameOver()) {
                        DayStart start = session.advanceDay();
                        ConsoleOutput.day(start.day());
                        start.newRules().forEach(ConsoleOutput::rule);
                        start.news().forEach(ConsoleOutput::news);
                    }
                }
            } finally {
                subscription.unsubscribe();
            }

            ConsoleOutput.report(session.generateReport());

            if (save != null) {
                try {
                    snapshotStore.save(session.snapshot(), save);
                    ConsoleOutput.success("Snapshot written to " + save);
                } catch (SnapshotStoreException e) {
                    ConsoleOutput.error("Could not save snapshot: " + e.getMessage());
                }
            }
        } finally {
            MdcContext.clear();
        }
    }
}
