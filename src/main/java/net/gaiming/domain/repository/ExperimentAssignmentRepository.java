package net.gaiming.domain.repository;

import net.gaiming.domain.model.ExperimentAssignment;

import java.util.Optional;

public interface ExperimentAssignmentRepository extends EntityRepository<ExperimentAssignment> {

    Optional<ExperimentAssignment> findAssignment(long experimentId, long playerId);
}
