package com.starkiller.dispatch.cli;

import com.starkiller.core.consequence.NewsEntry;
import com.starkiller.core.events.StarkillerEvent;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.session.DecisionOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Starkiller CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) STARKILLER BASE COMMAND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHECKPOINT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void day(int day) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [DAY " + day + "]|@"));
    }

    public static void rule(DayRule rule) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [BRIEFING]|@ " + rule.type() + ": " + rule.description()));
    }

    public static void encounter(Encounter e) {
        String marker = e.storyShip() ? "@|fg(magenta) [STORY]|@ " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + e.encounterId() + "]|@ " + marker + e.shipName()
                        + " (" + e.category().categoryName() + ", " + e.faction() + ") from " + e.origin()
                        + ", code " + e.accessCode()
                        + (e.offersBribe() ? ", @|fg(yellow) bribe " + e.bribeAmount() + "|@" : "")));
    }

    public static void decision(DecisionOutcome outcome) {
        String verdict = outcome.correct() ? "@|fg(green) CORRECT|@" : "@|fg(red) WRONG|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + verdict + " " + outcome.decision() + " (strikes " + outcome.strikes() + ")"
                        + (outcome.scheduled().isEmpty() ? ""
                        : ", " + outcome.scheduled().size() + " consequence"
                        + (outcome.scheduled().size() != 1 ? "s" : "") + " pending")));
    }

    public static void news(NewsEntry entry) {
        String color = entry.requiresAction() ? "fg(red),bold" : "fg(white)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [NEWS]|@ " + entry.headline()));
    }

    public static void event(StarkillerEvent event) {
        String prefix = switch (event.eventType()) {
            case "branch.changed" -> "@|bold,fg(magenta) [BRANCH]|@";
            case "story_tag.unlocked" -> "@|fg(magenta) [STORY TAG]|@";
            case "consequence.triggered" -> "@|fg(yellow) [CONSEQUENCE]|@";
            case "session.game_over" -> "@|fg(red),bold [GAME OVER]|@";
            default -> null;
        };
        if (prefix != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + prefix + " " + event.subjectId() + " " + event.payload()));
        }
    }

    public static void report(String report) {
        System.out.println("──────────────────────────────────");
        for (String line : report.split("\n")) {
            System.out.println("  " + line);
        }
    }
}
