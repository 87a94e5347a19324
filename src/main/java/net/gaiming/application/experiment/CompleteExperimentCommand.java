package net.gaiming.application.experiment;

import jakarta.annotation.Nullable;
import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;

/**
 * @param winningVariant name of the winning variant, {@code null} when inconclusive
 */
public record CompleteExperimentCommand(String experimentName,
                                        @Nullable String winningVariant,
                                        CommandMetadata metadata) implements Command<Boolean> {
}
