package net.gaiming.application.experiment;

import net.gaiming.application.cqrs.Command;
import net.gaiming.application.cqrs.CommandMetadata;

public record StartExperimentCommand(String experimentName, CommandMetadata metadata) implements Command<Boolean> {
}
