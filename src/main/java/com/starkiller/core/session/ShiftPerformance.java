package com.starkiller.core.session;

/**
 * Scorekeeping for the officer's calls: right and wrong decisions, strikes and credits.
 */
public class ShiftPerformance {

    private final int maxStrikes;

    private int correctDecisions;
    private int wrongDecisions;
    private int dayCorrect;
    private int dayWrong;
    private int strikes;
    private int credits;

    public ShiftPerformance(int maxStrikes) {
        this.maxStrikes = maxStrikes;
    }

    /**
     * Counts a decision. A wrong decision is a strike.
     */
    public void record(boolean correct) {
        if (correct) {
            correctDecisions++;
            dayCorrect++;
        } else {
            wrongDecisions++;
            dayWrong++;
            strikes++;
        }
    }

    public void adjustCredits(int delta) {
        credits += delta;
    }

    public boolean isGameOver() {
        return strikes >= maxStrikes;
    }

    /** Percentage of correct decisions, 0 when nothing has been decided. */
    public double accuracy() {
        int total = correctDecisions + wrongDecisions;
        return total == 0 ? 0.0 : correctDecisions * 100.0 / total;
    }

    public void startNewDay() {
        dayCorrect = 0;
        dayWrong = 0;
    }

    public String summary() {
        return String.format("Decisions: %d correct, %d wrong (%.1f%%), strikes %d/%d, credits %d",
                correctDecisions, wrongDecisions, accuracy(), strikes, maxStrikes, credits);
    }

    public int correctDecisions() {
        return correctDecisions;
    }

    public int wrongDecisions() {
        return wrongDecisions;
    }

    public int dayCorrect() {
        return dayCorrect;
    }

    public int dayWrong() {
        return dayWrong;
    }

    public int strikes() {
        return strikes;
    }

    public int maxStrikes() {
        return maxStrikes;
    }

    public int credits() {
        return credits;
    }

    public void reset() {
        correctDecisions = 0;
        wrongDecisions = 0;
        strikes = 0;
        credits = 0;
        startNewDay();
    }

    public void restore(int correctDecisions, int wrongDecisions, int strikes, int credits) {
        reset();
        this.correctDecisions = correctDecisions;
        this.wrongDecisions = wrongDecisions;
        this.strikes = strikes;
        this.credits = credits;
    }
}
