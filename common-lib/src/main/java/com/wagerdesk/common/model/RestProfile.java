package com.wagerdesk.common.model;

/**
 * Rest and schedule density of one side ahead of a game date.
 *
 * @param restDays     full days since the previous game; {@code null} when the warehouse has no prior game
 * @param backToBack   true when the side also played the previous day
 * @param gamesLast7   games played in the trailing 7 days
 * @param gamesLast14  games played in the trailing 14 days
 */
public record RestProfile(Integer restDays, boolean backToBack, int gamesLast7, int gamesLast14) {

    /**
     * Fatigue points: two per game above three in the last week, one per game above seven
     * in the last fortnight.
     */
    public int fatigueScore() {
        int score = 0;
        if (gamesLast7 >= 4) score += (gamesLast7 - 3) * 2;
        if (gamesLast14 >= 8) score += gamesLast14 - 7;
        return score;
    }
}
