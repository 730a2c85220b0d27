package com.starkiller.dispatch.cli;

import com.starkiller.core.logging.MdcContext;
import com.starkiller.core.persistence.SessionSnapshotStore;
import com.starkiller.core.persistence.SnapshotStoreException;
import com.starkiller.core.session.GameSession;
import com.starkiller.core.session.SessionSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: starkiller report &lt;snapshot&gt;
 * <p>
 * Restores a saved session and prints its narrative report and projected ending.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Report on a saved session")
@Component
public class ReportCommand implements Runnable {

    @Parameters(index = "0", description = "Snapshot file written by simulate --save")
    private Path snapshotFile;

    private final GameSession session;
    private final SessionSnapshotStore snapshotStore;

    public ReportCommand(GameSession session, SessionSnapshotStore snapshotStore) {
        this.session = session;
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        SessionSnapshot snapshot;
        try {
            snapshot = snapshotStore.load(snapshotFile);
        } catch (SnapshotStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        try {
            session.restore(snapshot);
            ConsoleOutput.info("Session " + snapshot.sessionId() + " at day " + snapshot.day());
            if (session.isGameOver()) {
                ConsoleOutput.error("Game over: strike limit reached");
            }
            ConsoleOutput.report(session.generateReport());
        } finally {
            MdcContext.clear();
        }
    }
}
