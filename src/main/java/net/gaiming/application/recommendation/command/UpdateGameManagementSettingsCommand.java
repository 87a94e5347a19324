package net.gaiming.application.recommendation.command;

import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;
import net.gaiming.domain.model.GameSettingsOverrides;

import java.util.Objects;

/**
 * Creates or updates the operator overrides of one game. Only non-null override fields are applied.
 */
public record UpdateGameManagementSettingsCommand(long gameId,
                                                  GameSettingsOverrides overrides,
                                                  CommandMetadata metadata) implements Command<Boolean> {

    public UpdateGameManagementSettingsCommand {
        Objects.requireNonNull(overrides, "overrides");
    }
}
