package io.github.drompincen.clarity.runtime.fsrs;

import io.github.drompincen.clarity.protocol.api.LearningPhase;
import io.github.drompincen.clarity.protocol.api.LearningState;
import io.github.drompincen.clarity.protocol.api.RecallRating;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * FSRS-5 scheduler with short-term (same-day) learning steps and no interval fuzz.
 * Stateless apart from its configuration, so one instance can serve every session.
 */
public class FsrsScheduler {

    static final double[] DEFAULT_WEIGHTS = {
            0.4072, 1.1829, 3.1262, 15.4722, 7.2102, 0.5316, 1.0651, 0.0234, 1.616, 0.1544,
            1.0824, 1.9813, 0.0953, 0.2975, 2.2042, 0.2407, 2.9466, 0.5034, 0.6567
    };

    private static final double DECAY = -0.5;
    private static final double FACTOR = 19.0 / 81.0;
    private static final double MIN_STABILITY = 0.1;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final FsrsSchedulerConfig config;
    private final double[] w;
    private final Clock clock;

    public FsrsScheduler() {
        this(FsrsSchedulerConfig.defaults());
    }

    public FsrsScheduler(FsrsSchedulerConfig config) {
        this(config, Clock.systemUTC());
    }

    public FsrsScheduler(FsrsSchedulerConfig config, Clock clock) {
        this.config = config;
        this.w = DEFAULT_WEIGHTS.clone();
        this.clock = clock;
    }

    public FsrsSchedulerConfig getConfig() {
        return config;
    }

    public LearningState createInitialState() {
        return createInitialState(clock.instant());
    }

    public LearningState createInitialState(Instant now) {
        return LearningState.initial(now != null ? now : clock.instant());
    }

    public LearningState schedule(LearningState state, RecallRating rating) {
        return schedule(state, rating, clock.instant());
    }

    public LearningState schedule(LearningState state, RecallRating rating, Instant reviewTime) {
        Instant now = reviewTime != null ? reviewTime : clock.instant();
        Card card = Card.from(state);
        Card next = switch (card.phase()) {
            case NEW -> fromNew(card, rating.grade(), now);
            case LEARNING, RELEARNING -> fromLearning(card, rating.grade(), now);
            case REVIEW -> fromReview(card, rating.grade(), now);
        };
        return next.toLearningState();
    }

    public boolean isDue(LearningState state) {
        return isDue(state, clock.instant());
    }

    /** Inclusive: a state whose due time equals {@code asOf} is due. */
    public boolean isDue(LearningState state, Instant asOf) {
        Instant at = asOf != null ? asOf : clock.instant();
        return !at.isBefore(state.due());
    }

    public double getRetrievability(LearningState state) {
        return getRetrievability(state, clock.instant());
    }

    public double getRetrievability(LearningState state, Instant asOf) {
        if (state.state() == LearningPhase.NEW || state.lastReview() == null || state.stability() <= 0) {
            return 0;
        }
        Instant at = asOf != null ? asOf : clock.instant();
        double elapsedDays = Math.max(0, (at.toEpochMilli() - state.lastReview().toEpochMilli()) / MILLIS_PER_DAY);
        return clamp(forgettingCurve(elapsedDays, state.stability()), 0, 1);
    }

    // --- phase transitions ---

    private Card fromNew(Card card, int grade, Instant now) {
        double difficulty = clamp(initDifficulty(grade), 1, 10);
        double stability = initStability(grade);
        return switch (grade) {
            case 1 -> card.reviewed(now, difficulty, stability, now.plus(Duration.ofMinutes(1)), LearningPhase.LEARNING, false);
            case 2 -> card.reviewed(now, difficulty, stability, now.plus(Duration.ofMinutes(5)), LearningPhase.LEARNING, false);
            case 3 -> card.reviewed(now, difficulty, stability, now.plus(Duration.ofMinutes(10)), LearningPhase.LEARNING, false);
            default -> card.reviewed(now, difficulty, stability, plusDays(now, nextInterval(stability)), LearningPhase.REVIEW, false);
        };
    }

    private Card fromLearning(Card card, int grade, Instant now) {
        double difficulty = nextDifficulty(card.difficulty(), grade);
        double stability = shortTermStability(card.stability(), grade);
        return switch (grade) {
            case 1 -> card.reviewed(now, difficulty, stability, now.plus(Duration.ofMinutes(5)), card.phase(), false);
            case 2 -> card.reviewed(now, difficulty, stability, now.plus(Duration.ofMinutes(10)), card.phase(), false);
            case 3 -> card.reviewed(now, difficulty, stability, plusDays(now, nextInterval(stability)), LearningPhase.REVIEW, false);
            default -> {
                int goodInterval = nextInterval(shortTermStability(card.stability(), 3));
                int easyInterval = capped(Math.max(nextInterval(stability), goodInterval + 1));
                yield card.reviewed(now, difficulty, stability, plusDays(now, easyInterval), LearningPhase.REVIEW, false);
            }
        };
    }

    private Card fromReview(Card card, int grade, Instant now) {
        double elapsedDays = card.lastReview() == null ? 0
                : Math.max(0, Math.floor((now.toEpochMilli() - card.lastReview().toEpochMilli()) / MILLIS_PER_DAY));
        double s = Math.max(card.stability(), MIN_STABILITY);
        double d = card.difficulty() > 0 ? card.difficulty() : clamp(initDifficulty(3), 1, 10);
        double r = forgettingCurve(elapsedDays, s);

        if (grade == 1) {
            double forgotStability = Math.min(forgetStability(d, s, r), s / Math.exp(w[17] * w[18]));
            return card.reviewed(now, nextDifficulty(d, 1), Math.max(forgotStability, MIN_STABILITY),
                    now.plus(Duration.ofMinutes(5)), LearningPhase.RELEARNING, true);
        }

        double hardStability = recallStability(d, s, r, 2);
        double goodStability = recallStability(d, s, r, 3);
        double easyStability = recallStability(d, s, r, 4);

        int hardInterval = nextInterval(hardStability);
        int goodInterval = nextInterval(goodStability);
        hardInterval = Math.min(hardInterval, goodInterval);
        goodInterval = capped(Math.max(goodInterval, hardInterval + 1));
        int easyInterval = capped(Math.max(nextInterval(easyStability), goodInterval + 1));

        return switch (grade) {
            case 2 -> card.reviewed(now, nextDifficulty(d, 2), hardStability, plusDays(now, hardInterval), LearningPhase.REVIEW, false);
            case 3 -> card.reviewed(now, nextDifficulty(d, 3), goodStability, plusDays(now, goodInterval), LearningPhase.REVIEW, false);
            default -> card.reviewed(now, nextDifficulty(d, 4), easyStability, plusDays(now, easyInterval), LearningPhase.REVIEW, false);
        };
    }

    // --- memory model ---

    private double forgettingCurve(double elapsedDays, double stability) {
        return Math.pow(1 + FACTOR * elapsedDays / stability, DECAY);
    }

    /** Whole days until retrievability drops to the requested retention, capped by the maximum interval. */
    int nextInterval(double stability) {
        double interval = stability / FACTOR * (Math.pow(config.requestRetention(), 1 / DECAY) - 1);
        long rounded = Math.round(interval);
        return (int) Math.min(Math.max(rounded, 1), config.maximumInterval());
    }

    private int capped(int days) {
        return Math.min(days, config.maximumInterval());
    }

    private double initStability(int grade) {
        return Math.max(w[grade - 1], MIN_STABILITY);
    }

    private double initDifficulty(int grade) {
        return w[4] - Math.exp(w[5] * (grade - 1)) + 1;
    }

    private double nextDifficulty(double d, int grade) {
        double delta = -w[6] * (grade - 3);
        double damped = d + delta * (10 - d) / 9;
        double reverted = w[7] * initDifficulty(4) + (1 - w[7]) * damped;
        return clamp(reverted, 1, 10);
    }

    private double recallStability(double d, double s, double r, int grade) {
        double hardPenalty = grade == 2 ? w[15] : 1;
        double easyBonus = grade == 4 ? w[16] : 1;
        double growth = Math.exp(w[8]) * (11 - d) * Math.pow(s, -w[9])
                * (Math.exp((1 - r) * w[10]) - 1) * hardPenalty * easyBonus;
        return Math.max(s * (1 + growth), MIN_STABILITY);
    }

    private double forgetStability(double d, double s, double r) {
        return w[11] * Math.pow(d, -w[12]) * (Math.pow(s + 1, w[13]) - 1) * Math.exp((1 - r) * w[14]);
    }

    private double shortTermStability(double s, int grade) {
        double base = s > 0 ? s : initStability(3);
        return Math.max(base * Math.exp(w[17] * (grade - 3 + w[18])), MIN_STABILITY);
    }

    private static Instant plusDays(Instant now, int days) {
        return now.plus(Duration.ofDays(days));
    }

    private static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    /** Scheduler-side view of a learning state. */
    private record Card(double difficulty, double stability, Instant due, Instant lastReview,
                        int reps, int lapses, LearningPhase phase) {

        static Card from(LearningState state) {
            LearningPhase phase = state.state() != null ? state.state() : LearningPhase.NEW;
            return new Card(state.difficulty(), state.stability(), state.due(), state.lastReview(),
                    state.reps(), state.lapses(), phase);
        }

        Card reviewed(Instant now, double difficulty, double stability, Instant due,
                      LearningPhase phase, boolean lapse) {
            return new Card(difficulty, stability, due, now, reps + 1, lapse ? lapses + 1 : lapses, phase);
        }

        LearningState toLearningState() {
            return new LearningState(difficulty, stability, due, lastReview, reps, lapses, phase);
        }
    }
}
