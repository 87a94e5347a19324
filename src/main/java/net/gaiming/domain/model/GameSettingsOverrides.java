package net.gaiming.domain.model;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Partial update for {@link GameManagementSettings}. A {@code null} field means "leave unchanged".
 */
@Value
@Builder
public class GameSettingsOverrides {
    @Nullable Boolean activeOverride;
    @Nullable Boolean hideInLobbyOverride;
    @Nullable Integer gameOrderOverride;
    @Nullable BigDecimal minBetAmountOverride;
    @Nullable BigDecimal maxBetAmountOverride;
    @Nullable Boolean mobileOverride;
    @Nullable Boolean desktopOverride;
    @Nullable Boolean ukCompliantOverride;
    @Nullable BigDecimal jackpotContributionOverride;
    @Nullable String gameDescriptionOverride;
    @Nullable String imageUrlOverride;
    @Nullable String thumbnailUrlOverride;
    @Nullable List<String> tagsOverride;
    @Nullable String notes;
    @Nullable Boolean featured;
    @Nullable Integer featurePriority;
    @Nullable Map<String, Object> customMetadata;
}
