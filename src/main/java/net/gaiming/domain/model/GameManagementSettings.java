package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Getter;
import net.gaiming.domain.event.GameManagementSettingsUpdatedEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Operator overrides for one game, layered over the catalogue values.
 */
@Getter
public class GameManagementSettings extends BaseEntity {

    private final long gameId;
    @Nullable private Boolean activeOverride;
    @Nullable private Boolean hideInLobbyOverride;
    @Nullable private Integer gameOrderOverride;
    @Nullable private BigDecimal minBetAmountOverride;
    @Nullable private BigDecimal maxBetAmountOverride;
    @Nullable private Boolean mobileOverride;
    @Nullable private Boolean desktopOverride;
    @Nullable private Boolean ukCompliantOverride;
    @Nullable private BigDecimal jackpotContributionOverride;
    @Nullable private String gameDescriptionOverride;
    @Nullable private String imageUrlOverride;
    @Nullable private String thumbnailUrlOverride;
    private List<String> tagsOverride = List.of();
    @Nullable private String notes;
    private boolean featured;
    private int featurePriority;
    private Map<String, Object> customMetadata = Map.of();
    @Nullable private String updatedBy;

    public GameManagementSettings(long gameId, Instant createdAt) {
        super(createdAt);
        this.gameId = gameId;
    }

    /**
     * Applies every non-null override and raises {@link GameManagementSettingsUpdatedEvent}
     * naming the fields that were supplied.
     *
     * @return names of the supplied fields
     */
    public Set<String> applyOverrides(GameSettingsOverrides overrides, Instant at, @Nullable String actor) {
        Objects.requireNonNull(overrides, "overrides");
        Set<String> changed = new LinkedHashSet<>();
        apply("activeOverride", overrides.getActiveOverride(), v -> activeOverride = v, changed);
        apply("hideInLobbyOverride", overrides.getHideInLobbyOverride(), v -> hideInLobbyOverride = v, changed);
        apply("gameOrderOverride", overrides.getGameOrderOverride(), v -> gameOrderOverride = v, changed);
        apply("minBetAmountOverride", overrides.getMinBetAmountOverride(), v -> minBetAmountOverride = v, changed);
        apply("maxBetAmountOverride", overrides.getMaxBetAmountOverride(), v -> maxBetAmountOverride = v, changed);
        apply("mobileOverride", overrides.getMobileOverride(), v -> mobileOverride = v, changed);
        apply("desktopOverride", overrides.getDesktopOverride(), v -> desktopOverride = v, changed);
        apply("ukCompliantOverride", overrides.getUkCompliantOverride(), v -> ukCompliantOverride = v, changed);
        apply("jackpotContributionOverride", overrides.getJackpotContributionOverride(),
            v -> jackpotContributionOverride = v, changed);
        apply("gameDescriptionOverride", overrides.getGameDescriptionOverride(), v -> gameDescriptionOverride = v, changed);
        apply("imageUrlOverride", overrides.getImageUrlOverride(), v -> imageUrlOverride = v, changed);
        apply("thumbnailUrlOverride", overrides.getThumbnailUrlOverride(), v -> thumbnailUrlOverride = v, changed);
        apply("tagsOverride", overrides.getTagsOverride(), v -> tagsOverride = List.copyOf(v), changed);
        apply("notes", overrides.getNotes(), v -> notes = v, changed);
        apply("featured", overrides.getFeatured(), v -> featured = v, changed);
        apply("featurePriority", overrides.getFeaturePriority(), v -> featurePriority = v, changed);
        apply("customMetadata", overrides.getCustomMetadata(),
            v -> customMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(v)), changed);

        this.updatedBy = actor;
        touch(at);
        raise(new GameManagementSettingsUpdatedEvent(at, gameId, changed, actor));
        return changed;
    }

    /**
     * Whether the operator has switched the game off.
     */
    public boolean isDeactivated() {
        return Boolean.FALSE.equals(activeOverride);
    }

    public boolean isHiddenInLobby() {
        return Boolean.TRUE.equals(hideInLobbyOverride);
    }

    /**
     * Rehydrates stored override columns without raising events.
     */
    public void restoreState(GameSettingsOverrides stored, @Nullable String storedUpdatedBy) {
        this.activeOverride = stored.getActiveOverride();
        this.hideInLobbyOverride = stored.getHideInLobbyOverride();
        this.gameOrderOverride = stored.getGameOrderOverride();
        this.minBetAmountOverride = stored.getMinBetAmountOverride();
        this.maxBetAmountOverride = stored.getMaxBetAmountOverride();
        this.mobileOverride = stored.getMobileOverride();
        this.desktopOverride = stored.getDesktopOverride();
        this.ukCompliantOverride = stored.getUkCompliantOverride();
        this.jackpotContributionOverride = stored.getJackpotContributionOverride();
        this.gameDescriptionOverride = stored.getGameDescriptionOverride();
        this.imageUrlOverride = stored.getImageUrlOverride();
        this.thumbnailUrlOverride = stored.getThumbnailUrlOverride();
        this.tagsOverride = stored.getTagsOverride() == null ? List.of() : List.copyOf(stored.getTagsOverride());
        this.notes = stored.getNotes();
        this.featured = Boolean.TRUE.equals(stored.getFeatured());
        this.featurePriority = stored.getFeaturePriority() == null ? 0 : stored.getFeaturePriority();
        this.customMetadata = stored.getCustomMetadata() == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stored.getCustomMetadata()));
        this.updatedBy = storedUpdatedBy;
    }

    private static <V> void apply(String field, @Nullable V value, Consumer<V> setter, Set<String> changed) {
        if (value != null) {
            setter.accept(value);
            changed.add(field);
        }
    }
}
