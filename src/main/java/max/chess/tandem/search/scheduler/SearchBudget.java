package max.chess.tandem.search.scheduler;

import max.chess.tandem.search.TimeControl;

/**
 * Limits for one scheduling turn.
 *
 * @param budgetMs    wall-clock budget, {@link TimeControl#UNBOUNDED} for none
 * @param maxDepth    deepest alpha-beta iteration
 * @param maxRollouts refiner rollout cap, negative for none, 0 to skip the refiner
 */
public record SearchBudget(long budgetMs, int maxDepth, int maxRollouts) {

    public static SearchBudget forDepth(int depth, int rollouts) {
        return new SearchBudget(TimeControl.UNBOUNDED, depth, rollouts);
    }

    public static SearchBudget forMovetime(long budgetMs, int maxDepth) {
        return new SearchBudget(budgetMs, maxDepth, -1);
    }

    public boolean isBounded() {
        return budgetMs != TimeControl.UNBOUNDED;
    }
}
