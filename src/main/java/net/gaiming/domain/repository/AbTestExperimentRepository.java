package net.gaiming.domain.repository;

import net.gaiming.domain.model.AbTestExperiment;

import java.util.List;
import java.util.Optional;

public interface AbTestExperimentRepository extends EntityRepository<AbTestExperiment> {

    Optional<AbTestExperiment> findByName(String name);

    List<AbTestExperiment> findRunning();
}
