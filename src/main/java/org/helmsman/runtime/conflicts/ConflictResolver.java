package org.helmsman.runtime.conflicts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.helmsman.runtime.errors.UnmergeableConflictException;
import org.helmsman.runtime.model.SystemState;
import org.helmsman.runtime.model.Value;
import org.helmsman.runtime.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commits rule writes for one tick and settles writes that collide on a path.
 * <p>
 * The resolver keeps a ledger per path: the value it held before the tick (the baseline), the
 * write currently standing, the clamp range standing on it with the value that range was applied
 * to, and every rule that wrote it. A write to a path no other rule wrote
 * this tick is committed directly, as are successive writes of the same rule. Anything else is a
 * conflict, settled by the strategy {@link ConflictPolicy#select} picks, and always yields a
 * {@link ConflictRecord}.
 * <p>
 * All writes of a tick go through one resolver, so each path ends the tick with exactly one value.
 * A new resolver is created per tick.
 */
public class ConflictResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConflictResolver.class);

    private final long tick;
    private final ConflictPolicy policy;
    private final Map<String, PathLedger> ledgers = new HashMap<>();
    private final List<ConflictRecord> records = new ArrayList<>();
    private int sequence;

    /**
     * @param tick The tick this resolver serves.
     * @param policy The conflict policy.
     */
    public ConflictResolver(long tick, ConflictPolicy policy) {
        this.tick = tick;
        this.policy = policy;
    }

    /**
     * Commits a write, resolving it against earlier writes to the same path.
     *
     * @param write The write.
     * @param state The live state.
     * @return what became of the write.
     * @throws org.helmsman.runtime.errors.EngineException if the path cannot be written.
     */
    public WriteOutcome submit(PendingWrite write, SystemState state) {
        PathLedger ledger = ledgers.get(write.path());
        if (ledger == null) {
            ledger = new PathLedger(PathResolver.tryResolve(state, write.path()));
            PathResolver.write(state, write.path(), write.proposed());
            ledger.accept(write, ledger.baseline.orElse(Value.absent()));
            ledgers.put(write.path(), ledger);
            return new WriteOutcome(write.proposed(), true, null);
        }
        if (!ledger.underReview && ledger.writtenOnlyBy(write.ruleId())) {
            Value before = PathResolver.tryResolve(state, write.path()).orElse(Value.absent());
            PathResolver.write(state, write.path(), write.proposed());
            ledger.accept(write, before);
            return new WriteOutcome(write.proposed(), true, null);
        }
        return resolve(ledger, write, state);
    }

    /**
     * @return the conflict records of this tick, in the order they occurred.
     */
    public List<ConflictRecord> records() {
        return List.copyOf(records);
    }

    /**
     * @return true if the path was sent to manual review this tick.
     */
    public boolean isUnderReview(String path) {
        PathLedger ledger = ledgers.get(path);
        return ledger != null && ledger.underReview;
    }

    private WriteOutcome resolve(PathLedger ledger, PendingWrite incoming, SystemState state) {
        PendingWrite keeper = ledger.keeper;
        ledger.contributors.add(incoming);

        ConflictStrategy requested = policy.select(keeper, incoming);
        ConflictStrategy applied = requested;
        String note = null;
        if (ledger.underReview) {
            applied = ConflictStrategy.MANUAL_REVIEW;
            note = "Path is already under manual review";
        } else if (requested == ConflictStrategy.PRIORITY && policy.escalates(keeper.priority(), incoming.priority())) {
            applied = ConflictStrategy.MANUAL_REVIEW;
            note = "Priority gap " + Math.abs(keeper.priority() - incoming.priority())
                    + " is below threshold " + policy.priorityThreshold();
        }

        String winner = null;
        List<String> merged = List.of();
        boolean applies = false;
        boolean resolved = true;
        switch (applied) {
            case PRIORITY -> {
                applies = incoming.priority() > keeper.priority();
                winner = keep(ledger, applies ? incoming : keeper, state);
            }
            case LAST_WRITE_WINS -> {
                applies = true;
                winner = keep(ledger, incoming, state);
            }
            case MERGE -> {
                try {
                    merge(ledger, incoming, state);
                    applies = true;
                    merged = ledger.contributorIds();
                } catch (UnmergeableConflictException e) {
                    applied = ConflictStrategy.PRIORITY;
                    note = e.getMessage() + "; fell back to PRIORITY";
                    applies = incoming.priority() > keeper.priority();
                    winner = keep(ledger, applies ? incoming : keeper, state);
                }
            }
            case MANUAL_REVIEW -> {
                restoreBaseline(ledger, incoming.path(), state);
                ledger.underReview = true;
                resolved = false;
            }
        }

        Value finalValue = PathResolver.tryResolve(state, incoming.path()).orElse(Value.absent());
        List<String> actions = new ArrayList<>(ledger.contributors.size());
        for (PendingWrite contributor : ledger.contributors) {
            actions.add(contributor.ruleId() + ": " + contributor.action());
        }
        ConflictRecord record = new ConflictRecord(
                "conflict-" + tick + "-" + sequence++,
                tick,
                incoming.path(),
                ledger.contributorIds(),
                actions,
                applied,
                new ConflictRecord.ResolutionResult(finalValue, winner, merged, requested, note),
                resolved);
        records.add(record);
        LOG.debug("Conflict on '{}' between {} resolved by {}: {}", incoming.path(), record.conflictingRules(),
                applied, finalValue.render());
        return new WriteOutcome(finalValue, applies, record);
    }

    private String keep(PathLedger ledger, PendingWrite winner, SystemState state) {
        if (winner != ledger.keeper) {
            Value before = PathResolver.tryResolve(state, winner.path()).orElse(Value.absent());
            PathResolver.write(state, winner.path(), winner.proposed());
            ledger.keeper = winner;
            ledger.range = winner.range();
            ledger.rangeBase = winner.range() == null ? null : before;
        }
        return winner.ruleId();
    }

    /**
     * CLAMP ranges intersect and apply to the value the standing range was applied to, so writes
     * committed before the first CLAMP of the tick are kept. A scalar meeting a range is clamped
     * into it. Two scalars combine through the merge function.
     */
    private void merge(PathLedger ledger, PendingWrite incoming, SystemState state) {
        ClampRange keptRange = ledger.range;
        ClampRange incomingRange = incoming.range();
        Value kept = PathResolver.tryResolve(state, incoming.path()).orElse(Value.absent());
        double result;
        ClampRange resultRange;
        Value resultBase;
        if (keptRange != null && incomingRange != null) {
            resultRange = keptRange.intersect(incomingRange);
            if (resultRange == null) {
                throw new UnmergeableConflictException("Ranges " + keptRange + " and " + incomingRange
                        + " on '" + incoming.path() + "' do not overlap");
            }
            resultBase = ledger.rangeBase;
            result = resultRange.clamp(number(resultBase, incoming));
        } else if (keptRange != null) {
            resultRange = keptRange;
            resultBase = incoming.proposed();
            result = keptRange.clamp(number(resultBase, incoming));
        } else if (incomingRange != null) {
            resultRange = incomingRange;
            resultBase = kept;
            result = incomingRange.clamp(number(kept, incoming));
        } else {
            resultRange = null;
            resultBase = null;
            result = policy.mergeFunction().apply(number(kept, incoming), number(incoming.proposed(), incoming));
        }
        PathResolver.write(state, incoming.path(), Value.number(result));
        if (incoming.priority() > ledger.keeper.priority()) {
            ledger.keeper = incoming;
        }
        ledger.range = resultRange;
        ledger.rangeBase = resultBase;
    }

    private static double number(Value value, PendingWrite incoming) {
        if (value instanceof Value.NumberValue number) {
            return number.value();
        }
        throw new UnmergeableConflictException("Cannot merge " + value.typeName() + " '" + value.render()
                + "' on '" + incoming.path() + "'");
    }

    private static void restoreBaseline(PathLedger ledger, String path, SystemState state) {
        if (ledger.baseline.isPresent()) {
            PathResolver.write(state, path, ledger.baseline.get());
        } else {
            PathResolver.remove(state, path);
        }
    }

    private static final class PathLedger {
        private final Optional<Value> baseline;
        private final List<PendingWrite> contributors = new ArrayList<>();
        private PendingWrite keeper;
        private ClampRange range;
        private Value rangeBase;
        private boolean underReview;

        private PathLedger(Optional<Value> baseline) {
            this.baseline = baseline;
        }

        private void accept(PendingWrite write, Value before) {
            contributors.add(write);
            keeper = write;
            range = write.range();
            rangeBase = range == null ? null : before;
        }

        private boolean writtenOnlyBy(String ruleId) {
            return contributors.stream().allMatch(c -> c.ruleId().equals(ruleId));
        }

        private List<String> contributorIds() {
            List<String> ids = new ArrayList<>();
            for (PendingWrite contributor : contributors) {
                if (!ids.contains(contributor.ruleId())) {
                    ids.add(contributor.ruleId());
                }
            }
            return ids;
        }
    }
}
