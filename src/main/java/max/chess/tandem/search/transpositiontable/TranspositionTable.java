package max.chess.tandem.search.transpositiontable;

import java.util.Arrays;

import static max.chess.tandem.search.SearchConstants.MAX_PLY;
import static max.chess.tandem.search.evaluator.GameValues.CHECKMATE_VALUE;

/**
 * Bucketed, generation-aware memo of searched positions. Mate scores are stored relative to the
 * node (ply-independent) and re-anchored to the probing ply on the way out.
 */
public final class TranspositionTable {
    private static final int WAYS = 4;

    // LOWER: search failed high (score >= beta). UPPER: search failed low (score <= alpha).
    public static final byte TT_EXACT = 0, TT_LOWER = 1, TT_UPPER = 2;

    private final long[] keys;   // 64-bit zobrist
    private final long[] info;   // [63..32]=move, [31..16]=score16, [15..8]=depth8, [7..2]=gen6, [1..0]=flag2

    private final int bucketsMask;
    private final int buckets;
    private int generation;      // 0..63

    public static final class Stats {
        public long probes;
        public long hits;
        public long hitsSufficient;
        public long stores;
        public long cutoffsFromTT;

        public void clear() {
            probes = hits = hitsSufficient = stores = cutoffsFromTT = 0;
        }

        /** Counters as an {@code info string} diagnostic line. */
        public String toInfoStringForUCI() {
            return String.format("info string tt probes=%d hits=%d sufficient=%d stores=%d cutoffs=%d",
                    probes, hits, hitsSufficient, stores, cutoffsFromTT);
        }
    }
    private final Stats stats = new Stats();

    /** Lightweight lookup result, one reusable instance per search context. */
    public static final class Hit {
        public boolean found; // depth-sufficient entry present
        public int move;
        public int score;
        public int depth;
        public byte flag;

        public void reset() {
            found = false; move = score = depth = 0; flag = 0;
        }
    }

    public TranspositionTable(int megaBytes) {
        long bytes = (long) Math.max(1, megaBytes) << 20;
        long entries = Math.max(WAYS, (bytes / 16L));
        long bucketsWanted = Math.max(1, entries / WAYS);
        int b = 1; while ((long) b < bucketsWanted && b < (1 << 26)) b <<= 1;
        this.buckets = b;
        this.bucketsMask = b - 1;
        final int slots = buckets * WAYS;
        this.keys = new long[slots];
        this.info = new long[slots];
        this.generation = 0;
    }

    public void clear() {
        Arrays.fill(keys, 0L);
        Arrays.fill(info, 0L);
        generation = 0;
        stats.clear();
    }

    /** Called once per top-level search; older generations become replaceable. */
    public void newSearch() { generation = (generation + 1) & 63; }

    public Stats stats() { return stats; }

    public void countCutoff() { stats.cutoffsFromTT++; }

    /**
     * Fills {@code out} with the deepest matching entry (move is always reported when the key matches).
     * Returns true when its depth is at least {@code reqDepth}.
     */
    public boolean probe(long key, int reqDepth, int ply, Hit out) {
        stats.probes++;
        final int base = bucket(key);

        int bestIdx = -1;
        int bestDepth = -1;
        int bestGenDist = Integer.MAX_VALUE; // smaller is better

        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            if (keys[idx] != key) continue;
            long w = info[idx];
            int depth = (int) ((w >>> 8) & 0xFF);
            int ageDist = (generation - gen(w)) & 63; // 0 is youngest
            if (depth > bestDepth || (depth == bestDepth && ageDist < bestGenDist)) {
                bestDepth = depth; bestGenDist = ageDist; bestIdx = idx;
            }
        }

        if (bestIdx < 0) { out.reset(); return false; }

        long w = info[bestIdx];
        out.move = (int) (w >>> 32);
        out.depth = (int) ((w >>> 8) & 0xFF);
        out.flag = (byte) (w & 0x3);
        out.score = fromTT((short) ((w >>> 16) & 0xFFFF), ply);
        stats.hits++;

        out.found = out.depth >= reqDepth;
        if (out.found) stats.hitsSufficient++;
        return out.found;
    }

    /**
     * Writes when the key is absent, when {@code depth} is at least the stored depth, or when the
     * stored entry belongs to an older search. Otherwise the deeper current entry is kept.
     */
    public void store(long key, int move, int depth, int score, byte flag, int ply) {
        short packedScore = (short) toTT(score, ply);
        int meta = ((generation & 63) << 2) | (flag & 3);
        long w = ((long) move << 32)
                | ((((long) packedScore) & 0xFFFFL) << 16)
                | (((long) (Math.max(0, depth) & 0xFF)) << 8)
                | (meta & 0xFFL);

        final int base = bucket(key);

        int victim = -1;
        int worstScore = Integer.MIN_VALUE;

        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            long k = keys[idx];
            if (k == key) {
                int oldDepth = (int) ((info[idx] >>> 8) & 0xFF);
                boolean stale = gen(info[idx]) != generation;
                if (depth < oldDepth && !stale) {
                    return; // keep deeper
                }
                victim = idx;
                break;
            }
            if (k == 0L) {
                if (victim < 0 || keys[victim] != 0L) victim = idx;
                worstScore = Integer.MAX_VALUE;
                continue;
            }
            int sc = replacementScore(info[idx]);
            if (sc > worstScore) {
                worstScore = sc;
                victim = idx;
            }
        }

        stats.stores++;
        keys[victim] = key;
        info[victim] = w;
    }

    /** Best move recorded for {@code key}, 0 when none. */
    public int peekMove(long key) {
        final int base = bucket(key);
        int bestIdx = -1, bestDepth = -1;
        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            if (keys[idx] != key) continue;
            int d = (int) ((info[idx] >>> 8) & 0xFF);
            if (d > bestDepth) { bestDepth = d; bestIdx = idx; }
        }
        return bestIdx < 0 ? 0 : (int) (info[bestIdx] >>> 32);
    }

    // older generation first, then shallower
    private int replacementScore(long word) {
        int ageDist = (generation - gen(word)) & 63;
        int depth = (int) ((word >>> 8) & 0xFF);
        return (ageDist << 8) | (0xFF - depth);
    }

    private static int gen(long word) {
        return (((int) word) >>> 2) & 63;
    }

    static int toTT(int score, int ply) {
        if (score >=  CHECKMATE_VALUE - MAX_PLY) return score + ply;
        if (score <= -CHECKMATE_VALUE + MAX_PLY) return score - ply;
        if (score >  32767) score =  32767;
        if (score < -32768) score = -32768;
        return score;
    }

    static int fromTT(short packed, int ply) {
        int s = packed;
        if (s >=  CHECKMATE_VALUE - MAX_PLY) return s - ply;
        if (s <= -CHECKMATE_VALUE + MAX_PLY) return s + ply;
        return s;
    }

    private int bucket(long key) {
        int h = Long.hashCode(key);
        h ^= (h >>> 16);
        h *= 0x9E3779B1;                   // golden ratio mix
        h ^= (h >>> 15);
        return (h & bucketsMask) * WAYS;
    }
}
