package com.planview.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.planview.core.model.Phase;
import com.planview.core.model.Plan;
import com.planview.core.model.ReservedPhase;
import com.planview.core.model.Timestamps;
import com.planview.core.progress.ProgressAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Loads and saves plan documents.
 * <p>
 * Every save stamps {@code meta.updated_at}, sorts the phases and reruns the
 * {@link ProgressAggregator}, so the file on disk is always self-consistent.
 */
@Service
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    /** Legacy documents predate these buckets; they are added on load. */
    private static final List<ReservedPhase> ENSURED_ON_LOAD = List.of(ReservedPhase.BUGS, ReservedPhase.DEFERRED);

    /**
     * Numbered phases ascending, then other custom phases in their current
     * order, then {@code bugs}, {@code ideas}, {@code deferred}.
     */
    public static final Comparator<Phase> PHASE_ORDER = Comparator
            .comparingInt(PlanStore::rank)
            .thenComparing(PlanStore::numericKey);

    private final ProgressAggregator progressAggregator;
    private final Clock clock;

    public PlanStore(ProgressAggregator progressAggregator, Clock clock) {
        this.progressAggregator = progressAggregator;
        this.clock = clock;
    }

    public Plan load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PlanNotFoundException(path);
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        Plan plan;
        try {
            plan = PlanJson.read(json);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Invalid plan file " + path + ": " + e.getOriginalMessage(), e);
        }
        if (plan == null) {
            throw new PlanParseException("Invalid plan file " + path + ": empty document", null);
        }
        ensureReservedPhases(plan);
        log.debug("Loaded {} with {} phases", path, plan.getPhases().size());
        return plan;
    }

    /**
     * Adds the {@code bugs} and {@code deferred} phases when absent.
     *
     * @return {@code true} if the plan was changed
     */
    public boolean ensureReservedPhases(Plan plan) {
        boolean changed = false;
        for (ReservedPhase reserved : ENSURED_ON_LOAD) {
            if (plan.findPhase(reserved.id()).isEmpty()) {
                plan.addPhase(reserved.newPhase());
                changed = true;
            }
        }
        return changed;
    }

    public void save(Path path, Plan plan) {
        plan.getMeta().setUpdatedAt(now());
        plan.sortPhases(PHASE_ORDER);
        progressAggregator.recalculate(plan);
        write(path, toJson(plan));
        log.debug("Saved {}", path);
    }

    /** The document exactly as {@link #save} would write it, trailing newline included. */
    public String toJson(Plan plan) {
        return PlanJson.write(plan) + "\n";
    }

    /**
     * Load, apply {@code change}, save. The plan is saved even when the
     * function returns normally with no visible change.
     */
    public <T> T update(Path path, Function<Plan, T> change) {
        Plan plan = load(path);
        T result = change.apply(plan);
        save(path, plan);
        return result;
    }

    public String now() {
        return Timestamps.now(clock);
    }

    void write(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    private static int rank(Phase phase) {
        if (phase.isNumbered()) {
            return 0;
        }
        return ReservedPhase.fromId(phase.getId())
                .map(reserved -> 2 + reserved.ordinal())
                .orElse(1);
    }

    private static BigInteger numericKey(Phase phase) {
        return phase.isNumbered() ? new BigInteger(phase.getId()) : BigInteger.ZERO;
    }
}
