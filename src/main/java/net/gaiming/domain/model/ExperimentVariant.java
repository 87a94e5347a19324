package net.gaiming.domain.model;

import java.util.Objects;

/**
 * One arm of an A/B experiment: the algorithm it serves and its share of traffic.
 */
public record ExperimentVariant(String name, String algorithm, double trafficWeight) {

    public ExperimentVariant {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(algorithm, "algorithm");
        if (trafficWeight <= 0) {
            throw new IllegalArgumentException("trafficWeight must be positive for variant " + name);
        }
    }
}
