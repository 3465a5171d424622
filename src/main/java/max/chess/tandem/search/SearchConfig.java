package max.chess.tandem.search;

/**
 * Search tunables. Built with {@link Builder}; {@link #fromSystemProperties()} reads
 * {@code -Dtandem.*} overrides on top of the defaults.
 */
public final class SearchConfig {

    public final boolean debug;

    // TT
    public final boolean useTT;
    public final int ttSizeMb;

    // Iterative deepening
    public final int maxDepth;
    public final int aspirationCp;
    public final int aspirationCap;

    // Quiescence
    public final int qsCheckPlies;        // plies of quiescence that also try checking moves
    public final boolean useDeltaPruning;
    public final int deltaMargin;

    // Null move pruning
    public final boolean useNullMove;
    public final int nullMinDepth;
    public final int nullReduction;
    public final int nullMinMaterial;     // both sides' non-pawn material must exceed this

    // Frontier futility (depth == 1)
    public final boolean useFutility;
    public final int futilityMargin;

    // Move count pruning
    public final boolean useMoveCountPruning;
    public final int mcpMinDepth;
    public final int mcpStartAt;

    // Late Move Reduction
    public final boolean useLMR;
    public final int lmrMinDepth;
    public final int lmrMinMove;
    public final int lmrBase;

    // Root refiner
    public final boolean useRefiner;
    public final double refinerExploration;
    public final int rolloutPlies;
    public final int rolloutMinPlies;     // a rollout may stop on a quiet position after this many plies
    public final int rolloutBatch;
    public final double rolloutValueScale;
    public final double rolloutCaptureBias;
    public final double priorTemperature;
    public final double hintBonus;

    // Scheduler
    public final long refinerReserveMs;
    public final long safetyMarginMs;
    public final double minGrowth;
    public final double maxGrowth;
    public final long defaultBudgetMs;

    private SearchConfig(Builder b) {
        debug = b.debug;
        useTT = b.useTT; ttSizeMb = b.ttSizeMb;
        maxDepth = b.maxDepth; aspirationCp = b.aspirationCp; aspirationCap = b.aspirationCap;
        qsCheckPlies = b.qsCheckPlies; useDeltaPruning = b.useDeltaPruning; deltaMargin = b.deltaMargin;
        useNullMove = b.useNullMove; nullMinDepth = b.nullMinDepth; nullReduction = b.nullReduction;
        nullMinMaterial = b.nullMinMaterial;
        useFutility = b.useFutility; futilityMargin = b.futilityMargin;
        useMoveCountPruning = b.useMoveCountPruning; mcpMinDepth = b.mcpMinDepth; mcpStartAt = b.mcpStartAt;
        useLMR = b.useLMR; lmrMinDepth = b.lmrMinDepth; lmrMinMove = b.lmrMinMove; lmrBase = b.lmrBase;
        useRefiner = b.useRefiner; refinerExploration = b.refinerExploration; rolloutPlies = b.rolloutPlies;
        rolloutMinPlies = b.rolloutMinPlies; rolloutBatch = b.rolloutBatch; rolloutValueScale = b.rolloutValueScale;
        rolloutCaptureBias = b.rolloutCaptureBias; priorTemperature = b.priorTemperature; hintBonus = b.hintBonus;
        refinerReserveMs = b.refinerReserveMs; safetyMarginMs = b.safetyMarginMs;
        minGrowth = b.minGrowth; maxGrowth = b.maxGrowth; defaultBudgetMs = b.defaultBudgetMs;
    }

    public Builder toBuilder() {
        return new Builder()
                .debug(debug).useTT(useTT).ttSizeMb(ttSizeMb)
                .maxDepth(maxDepth).aspirationCp(aspirationCp).aspirationCap(aspirationCap)
                .qsCheckPlies(qsCheckPlies).useDeltaPruning(useDeltaPruning).deltaMargin(deltaMargin)
                .useNullMove(useNullMove).nullMinDepth(nullMinDepth).nullReduction(nullReduction)
                .nullMinMaterial(nullMinMaterial)
                .useFutility(useFutility).futilityMargin(futilityMargin)
                .useMoveCountPruning(useMoveCountPruning).mcpMinDepth(mcpMinDepth).mcpStartAt(mcpStartAt)
                .useLMR(useLMR).lmrMinDepth(lmrMinDepth).lmrMinMove(lmrMinMove).lmrBase(lmrBase)
                .useRefiner(useRefiner).refinerExploration(refinerExploration).rolloutPlies(rolloutPlies)
                .rolloutMinPlies(rolloutMinPlies).rolloutBatch(rolloutBatch).rolloutValueScale(rolloutValueScale)
                .rolloutCaptureBias(rolloutCaptureBias).priorTemperature(priorTemperature).hintBonus(hintBonus)
                .refinerReserveMs(refinerReserveMs).safetyMarginMs(safetyMarginMs)
                .minGrowth(minGrowth).maxGrowth(maxGrowth).defaultBudgetMs(defaultBudgetMs);
    }

    public static SearchConfig defaults() {
        return new Builder().build();
    }

    /** Every score-altering pruning off: alpha-beta then returns plain negamax values. */
    public static SearchConfig exact() {
        return new Builder()
                .useNullMove(false)
                .useFutility(false)
                .useMoveCountPruning(false)
                .useLMR(false)
                .useDeltaPruning(false)
                .build();
    }

    public static SearchConfig fromSystemProperties() {
        Builder b = new Builder();
        b.debug(Boolean.parseBoolean(System.getProperty("tandem.debug", "false")));
        b.ttSizeMb(Integer.getInteger("tandem.hash", b.ttSizeMb));
        b.maxDepth(Integer.getInteger("tandem.maxDepth", b.maxDepth));
        b.aspirationCp(Integer.getInteger("tandem.aspiration", b.aspirationCp));
        b.useRefiner(Boolean.parseBoolean(System.getProperty("tandem.refiner", String.valueOf(b.useRefiner))));
        b.rolloutPlies(Integer.getInteger("tandem.rolloutPlies", b.rolloutPlies));
        b.safetyMarginMs(Long.getLong("tandem.safetyMargin", b.safetyMarginMs));
        b.refinerReserveMs(Long.getLong("tandem.reserve", b.refinerReserveMs));
        b.defaultBudgetMs(Long.getLong("tandem.defaultBudget", b.defaultBudgetMs));
        return b.build();
    }

    public static class Builder {
        private boolean debug = false;

        private boolean useTT = true;
        private int ttSizeMb = 64;

        private int maxDepth = 64;
        private int aspirationCp = 24;
        private int aspirationCap = 2048;

        private int qsCheckPlies = 1;
        private boolean useDeltaPruning = true;
        private int deltaMargin = 150;

        private boolean useNullMove = true;
        private int nullMinDepth = 3;
        private int nullReduction = 2;
        private int nullMinMaterial = 1000;

        private boolean useFutility = true;
        private int futilityMargin = 200;

        private boolean useMoveCountPruning = true;
        private int mcpMinDepth = 3;
        private int mcpStartAt = 6;

        private boolean useLMR = true;
        private int lmrMinDepth = 3;
        private int lmrMinMove = 3;
        private int lmrBase = 1;

        private boolean useRefiner = true;
        private double refinerExploration = 1.4;
        private int rolloutPlies = 8;
        private int rolloutMinPlies = 2;
        private int rolloutBatch = 32;
        private double rolloutValueScale = 400.0;
        private double rolloutCaptureBias = 0.7;
        private double priorTemperature = 200.0;
        private double hintBonus = 0.25;

        private long refinerReserveMs = 50;
        private long safetyMarginMs = 20;
        private double minGrowth = 1.5;
        private double maxGrowth = 8.0;
        private long defaultBudgetMs = 2000;

        public Builder debug(boolean v){debug=v;return this;}

        public Builder useTT(boolean v){useTT=v;return this;}
        public Builder ttSizeMb(int v){ttSizeMb=v;return this;}

        public Builder maxDepth(int v){maxDepth=Math.max(1, Math.min(v, SearchConstants.MAX_PLY / 2));return this;}
        public Builder aspirationCp(int v){aspirationCp=v;return this;}
        public Builder aspirationCap(int v){aspirationCap=v;return this;}

        public Builder qsCheckPlies(int v){qsCheckPlies=v;return this;}
        public Builder useDeltaPruning(boolean v){useDeltaPruning=v;return this;}
        public Builder deltaMargin(int v){deltaMargin=v;return this;}

        public Builder useNullMove(boolean v){useNullMove=v;return this;}
        public Builder nullMinDepth(int v){nullMinDepth=v;return this;}
        public Builder nullReduction(int v){nullReduction=v;return this;}
        public Builder nullMinMaterial(int v){nullMinMaterial=v;return this;}

        public Builder useFutility(boolean v){useFutility=v;return this;}
        public Builder futilityMargin(int v){futilityMargin=v;return this;}

        public Builder useMoveCountPruning(boolean v){useMoveCountPruning=v;return this;}
        public Builder mcpMinDepth(int v){mcpMinDepth=v;return this;}
        public Builder mcpStartAt(int v){mcpStartAt=v;return this;}

        public Builder useLMR(boolean v){useLMR=v;return this;}
        public Builder lmrMinDepth(int v){lmrMinDepth=v;return this;}
        public Builder lmrMinMove(int v){lmrMinMove=v;return this;}
        public Builder lmrBase(int v){lmrBase=v;return this;}

        public Builder useRefiner(boolean v){useRefiner=v;return this;}
        public Builder refinerExploration(double v){refinerExploration=v;return this;}
        public Builder rolloutPlies(int v){rolloutPlies=v;return this;}
        public Builder rolloutMinPlies(int v){rolloutMinPlies=v;return this;}
        public Builder rolloutBatch(int v){rolloutBatch=Math.max(1, v);return this;}
        public Builder rolloutValueScale(double v){rolloutValueScale=v;return this;}
        public Builder rolloutCaptureBias(double v){rolloutCaptureBias=v;return this;}
        public Builder priorTemperature(double v){priorTemperature=v;return this;}
        public Builder hintBonus(double v){hintBonus=v;return this;}

        public Builder refinerReserveMs(long v){refinerReserveMs=v;return this;}
        public Builder safetyMarginMs(long v){safetyMarginMs=v;return this;}
        public Builder minGrowth(double v){minGrowth=v;return this;}
        public Builder maxGrowth(double v){maxGrowth=v;return this;}
        public Builder defaultBudgetMs(long v){defaultBudgetMs=v;return this;}

        public SearchConfig build(){return new SearchConfig(this);}
    }
}
