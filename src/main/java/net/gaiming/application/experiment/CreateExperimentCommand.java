package net.gaiming.application.experiment;

import jakarta.annotation.Nullable;
import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;
import net.gaiming.domain.model.ExperimentVariant;

import java.time.Instant;
import java.util.List;

/**
 * Registers a draft experiment. Returns its id.
 *
 * @param targetContexts contexts the experiment applies to; empty means every context
 */
public record CreateExperimentCommand(String name,
                                      @Nullable String description,
                                      List<String> targetContexts,
                                      List<ExperimentVariant> variants,
                                      Instant startDate,
                                      @Nullable Instant endDate,
                                      CommandMetadata metadata) implements Command<Long> {

    public CreateExperimentCommand {
        targetContexts = targetContexts == null ? List.of() : List.copyOf(targetContexts);
        variants = variants == null ? List.of() : List.copyOf(variants);
    }
}
