package net.gaiming.support.specification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpecificationEvaluatorTest {

    private record Game(long id, String type, double score) {
    }

    private static final List<Game> GAMES = List.of(
        new Game(1, "slots", 0.9),
        new Game(2, "table", 0.4),
        new Game(3, "slots", 0.2),
        new Game(4, "live", 0.7),
        new Game(5, "slots", 0.6));

    private static final class SlotsByScore extends BaseSpecification<Game> {
        SlotsByScore(int skip, int take) {
            super(game -> "slots".equals(game.type()));
            addInclude("provider");
            applyOrderByDescending(Game::score);
            applyPaging(skip, take);
        }
    }

    @Test
    void should_FilterOrderThenPage_When_SpecificationHasAllParts() {
        List<Game> page = SpecificationEvaluator.evaluate(GAMES, new SlotsByScore(1, 1));

        assertThat(page).extracting(Game::id).containsExactly(5L);
    }

    @Test
    void should_IgnorePaging_When_Counting() {
        assertThat(SpecificationEvaluator.count(GAMES, new SlotsByScore(0, 1))).isEqualTo(3);
    }

    @Test
    void should_MatchEverything_When_NoCriteria() {
        assertThat(SpecificationEvaluator.evaluate(GAMES, Specification.all())).hasSize(GAMES.size());
    }

    @Test
    void should_CombineCriteria_When_UsingAndOrNot() {
        Specification<Game> slots = Specification.where(game -> "slots".equals(game.type()));
        Specification<Game> highScore = Specification.where(game -> game.score() >= 0.6);

        assertThat(SpecificationEvaluator.evaluate(GAMES, slots.and(highScore)))
            .extracting(Game::id).containsExactly(1L, 5L);
        assertThat(SpecificationEvaluator.evaluate(GAMES, slots.or(highScore)))
            .extracting(Game::id).containsExactly(1L, 3L, 4L, 5L);
        assertThat(SpecificationEvaluator.evaluate(GAMES, slots.not()))
            .extracting(Game::id).containsExactly(2L, 4L);
    }

    @Test
    void should_SelectSameGames_When_AndOrGroupingOrOperandOrderChanges() {
        String[] types = {"slots", "table", "live", "crash"};
        List<Game> catalogue = new ArrayList<>();
        for (int i = 1; i <= 64; i++) {
            catalogue.add(new Game(i, types[i % types.length], (i * 37 % 100) / 100.0));
        }
        Specification<Game> a = Specification.where(game -> !"table".equals(game.type()));
        Specification<Game> b = Specification.where(game -> game.score() >= 0.3);
        Specification<Game> c = Specification.where(game -> game.id() % 3 != 0);

        List<Game> leftGrouped = SpecificationEvaluator.evaluate(catalogue, a.and(b).and(c));
        List<Game> rightGrouped = SpecificationEvaluator.evaluate(catalogue, a.and(b.and(c)));
        List<Game> commuted = SpecificationEvaluator.evaluate(catalogue, c.and(a).and(b));

        assertThat(leftGrouped).isNotEmpty().hasSizeLessThan(catalogue.size());
        assertThat(rightGrouped).containsExactlyElementsOf(leftGrouped);
        assertThat(commuted).containsExactlyElementsOf(leftGrouped);
        assertThat(SpecificationEvaluator.evaluate(catalogue, a.or(b).or(c)))
            .containsExactlyElementsOf(SpecificationEvaluator.evaluate(catalogue, a.or(b.or(c))));
    }

    @Test
    void should_KeepLeftShapeAndMergeIncludes_When_Composed() {
        SlotsByScore left = new SlotsByScore(0, 2);
        Specification<Game> composed = left.and(Specification.where(game -> game.id() != 1));

        assertThat(composed.includes()).containsExactly("provider");
        assertThat(composed.isPagingEnabled()).isTrue();
        assertThat(SpecificationEvaluator.evaluate(GAMES, composed)).extracting(Game::id).containsExactly(5L, 3L);
        assertThat(left.isSatisfiedBy(GAMES.get(0))).isTrue();
    }

    @Test
    void should_ResolveIncludes_When_LoaderProvided() {
        List<String> loaded = new ArrayList<>();

        SpecificationEvaluator.evaluate(GAMES, new SlotsByScore(0, 10), (game, include) -> {
            loaded.add(include + ":" + game.id());
            return game;
        });

        assertThat(loaded).containsExactlyInAnyOrder("provider:1", "provider:3", "provider:5");
    }

    @Test
    void should_RejectSecondOrdering_When_AppliedTwice() {
        assertThatThrownBy(() -> new BaseSpecification<Game>() {
            {
                applyOrderBy(Game::id);
                applyOrderByDescending(Game::score);
            }
        }).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void should_RejectInvalidPaging_When_TakeIsNotPositive() {
        assertThatThrownBy(() -> new Specification.Paging(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Specification.Paging(-1, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
