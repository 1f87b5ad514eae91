/*
 * utala: kaos 9
 * Copyright (C) 2026  utala developers
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package utala.ai.simulation;

import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import utala.ai.AiProfileUtil;
import utala.ai.AiProps;
import utala.game.GameEngine;
import utala.game.GameState;
import utala.game.HiddenInformationSampler;
import utala.game.Phase;
import utala.game.Player;

/**
 * Scores a candidate action by playing the game out at random many times from the position
 * it leads to.
 *
 * Each trial gets its own engine on a deep copy of the state, seeded from
 * (game seed, turn, dogfight index, trial, sample). The seed does not depend on the
 * candidate, so every candidate in a decision faces the same sequence of random worlds.
 * With information sets on, each trial first replaces what the deciding player cannot see
 * (the opponent's face-down powers and draw order) with a plausible sample.
 *
 * A trial that throws counts as a draw. If more than half the trials fail the candidate
 * gets a flat 0.5.
 *
 * Thread safety: one instance per agent; trials share nothing.
 */
public class RolloutEvaluator {
    private static final HashFunction SEED_HASH = Hashing.murmur3_128();

    // Configuration
    private final int trials;
    private final boolean useInformationSets;
    private final int samplesPerTrial;

    // Statistics
    private long totalTrials;
    private long failedTrials;

    public RolloutEvaluator(int trials, boolean useInformationSets, int samplesPerTrial) {
        Preconditions.checkArgument(trials > 0, "trials must be positive: %s", trials);
        Preconditions.checkArgument(samplesPerTrial > 0, "samples per trial must be positive: %s", samplesPerTrial);
        this.trials = trials;
        this.useInformationSets = useInformationSets;
        this.samplesPerTrial = samplesPerTrial;
    }

    public static RolloutEvaluator fromProfile(String profile) {
        return new RolloutEvaluator(
                AiProfileUtil.getIntProperty(profile, AiProps.ROLLOUT_TRIALS),
                AiProfileUtil.getBoolProperty(profile, AiProps.USE_INFORMATION_SETS),
                AiProfileUtil.getIntProperty(profile, AiProps.INFO_SET_SAMPLES_PER_TRIAL));
    }

    /**
     * Win rate for {@code player} after playing {@code actionIndex}: (wins + draws / 2) / playouts.
     *
     * @param state  the decision snapshot; never modified
     */
    public double evaluate(GameState state, int actionIndex, Player player) {
        int samples = useInformationSets ? samplesPerTrial : 1;
        int total = trials * samples;
        int wins = 0;
        int draws = 0;
        int failures = 0;

        for (int trial = 0; trial < trials; trial++) {
            for (int sample = 0; sample < samples; sample++) {
                long seed = trialSeed(state, trial, sample);
                try {
                    Player winner = runTrial(state, actionIndex, player, seed);
                    if (winner == player) {
                        wins++;
                    } else if (winner == null) {
                        draws++;
                    }
                } catch (RuntimeException e) {
                    // Non-fatal: score the trial as neutral.
                    System.err.println("Rollout trial " + trial + "/" + sample + " for action "
                            + actionIndex + " failed: " + e.getMessage());
                    failures++;
                    draws++;
                }
            }
        }

        totalTrials += total;
        failedTrials += failures;

        if (failures > total * 0.5) {
            return 0.5;
        }
        return (wins + draws * 0.5) / total;
    }

    /**
     * One playout: optional sampling, a fresh engine, the candidate move, then random play
     * to the end.
     *
     * @return the winner, or null on a draw
     */
    protected Player runTrial(GameState state, int actionIndex, Player player, long seed) {
        Random rng = new Random(seed);
        GameState start = useInformationSets ? HiddenInformationSampler.sample(state, player, rng) : state;
        GameEngine engine = GameEngine.forSimulation(start, seed);

        if (engine.getPhase() == Phase.PLACEMENT) {
            if (!engine.applyAction(actionIndex)) {
                throw new IllegalStateException("Candidate " + actionIndex + " rejected in simulation");
            }
        } else {
            if (engine.getDogfightActor() == null && !engine.isDogfightComplete()) {
                engine.beginDogfight();
            }
            Player actor = engine.getDogfightActor();
            if (!engine.applyDogfightTurnAction(actor, actionIndex)) {
                throw new IllegalStateException("Candidate " + actionIndex + " rejected in simulation");
            }
        }
        return RandomPlayout.playToEnd(engine, rng);
    }

    static long trialSeed(GameState state, int trial, int sample) {
        return trialSeed(state.getRngSeed(), state.getTurnNumber(), state.getCurrentDogfightIndex(), trial, sample);
    }

    public static long trialSeed(long gameSeed, int turnNumber, int dogfightIndex, int trial, int sample) {
        return SEED_HASH.newHasher()
                .putLong(gameSeed)
                .putInt(turnNumber)
                .putInt(dogfightIndex)
                .putInt(trial)
                .putInt(sample)
                .hash()
                .asLong();
    }

    public int getTrials() {
        return trials;
    }

    public boolean isUsingInformationSets() {
        return useInformationSets;
    }

    public int getSamplesPerTrial() {
        return samplesPerTrial;
    }

    public long getTotalTrials() {
        return totalTrials;
    }

    public long getFailedTrials() {
        return failedTrials;
    }
}
