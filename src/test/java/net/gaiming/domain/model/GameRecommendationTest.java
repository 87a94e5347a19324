package net.gaiming.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import net.gaiming.domain.event.GameRecommendationGeneratedEvent;
import net.gaiming.domain.event.RecommendationClickedEvent;
import net.gaiming.domain.event.RecommendationPlayedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GameRecommendationTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    private GameRecommendation recommendation;

    @BeforeEach
    void setUp() {
        recommendation = GameRecommendation.builder()
            .playerId(42)
            .gameId(7)
            .algorithm("Hybrid")
            .score(0.8)
            .position(1)
            .context("lobby")
            .createdAt(CREATED)
            .build();
        recommendation.assignIdentity(100);
        recommendation.clearDomainEvents();
    }

    @Test
    void should_KeepFirstClickTime_When_ClickedTwice() {
        Instant first = CREATED.plus(Duration.ofMinutes(1));

        assertThat(recommendation.markClicked(first, "s-1")).isTrue();
        assertThat(recommendation.markClicked(first.plus(Duration.ofMinutes(5)), "s-2")).isFalse();

        assertThat(recommendation.isClicked()).isTrue();
        assertThat(recommendation.getClickedAt()).isEqualTo(first);
        assertThat(recommendation.getDomainEvents()).singleElement().isInstanceOf(RecommendationClickedEvent.class);
    }

    @Test
    void should_SetPlayedIndependentlyOfClick_When_PlayedFirst() {
        assertThat(recommendation.markPlayed(CREATED.plusSeconds(30), null)).isTrue();

        assertThat(recommendation.isPlayed()).isTrue();
        assertThat(recommendation.isClicked()).isFalse();
        assertThat(recommendation.getDomainEvents()).singleElement().isInstanceOf(RecommendationPlayedEvent.class);
    }

    @Test
    void should_ExposePersistedIdAndFlags_When_ConvertedForReaders() {
        recommendation.markClicked(CREATED.plusSeconds(10), null);

        Recommendation view = recommendation.toRecommendation();

        assertThat(view.getId()).isEqualTo(100L);
        assertThat(view.isClicked()).isTrue();
        assertThat(view.getGeneratedAt()).isEqualTo(CREATED);
        assertThat(view.getCategory()).isEmpty();
    }

    @Test
    void should_CarryServedFieldsAndPreferCommandSession_When_BuiltFromServed() {
        Recommendation served = Recommendation.builder()
            .playerId(42)
            .gameId(9)
            .algorithm("ContentBased")
            .score(0.4)
            .position(2)
            .context("lobby")
            .category("slots")
            .reason("Similar")
            .confidence(0.6)
            .sessionId("from-list")
            .experimentVariant("AlgoTest/A")
            .modelVersion("1.0")
            .featureValue("popularity", 0.4)
            .generatedAt(CREATED)
            .build();

        GameRecommendation row = GameRecommendation.fromServed(served, "from-command", "mobile", CREATED);

        assertThat(row.getSessionId()).isEqualTo("from-command");
        assertThat(row.getExperimentVariant()).isEqualTo("AlgoTest/A");
        assertThat(row.getFeatureSnapshot()).containsEntry("popularity", 0.4);
        assertThat(row.getPosition()).isEqualTo(2);
    }
}
