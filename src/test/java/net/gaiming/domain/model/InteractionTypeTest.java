package net.gaiming.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class InteractionTypeTest {

    @ParameterizedTest
    @CsvSource({
        "click,CLICK",
        "Play,PLAY",
        " VIEW ,VIEW",
        "dismiss,DISMISS",
        "like,LIKE",
        "DisLike,DISLIKE"
    })
    void should_ParseIgnoringCase_When_TypeKnown(String raw, InteractionType expected) {
        assertThat(InteractionType.parse(raw)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "hover", "clicked"})
    void should_ReturnEmpty_When_TypeUnknownOrBlank(String raw) {
        assertThat(InteractionType.parse(raw)).isEmpty();
    }
}
