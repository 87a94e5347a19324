package net.gaiming.adapters.persistence;

import net.gaiming.domain.model.GameManagementSettings;
import net.gaiming.domain.model.GameSettingsOverrides;
import net.gaiming.domain.repository.GameManagementSettingsRepository;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.dao.DataAccessException;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static net.gaiming.adapters.persistence.ResultSetSupport.getBooleanOrNull;
import static net.gaiming.adapters.persistence.ResultSetSupport.getInstant;
import static net.gaiming.adapters.persistence.ResultSetSupport.getIntOrNull;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableBoolean;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableDecimal;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableInt;
import static net.gaiming.adapters.persistence.ResultSetSupport.setNullableString;
import static net.gaiming.adapters.persistence.ResultSetSupport.toTimestamp;

class JdbcGameManagementSettingsRepository extends AbstractJdbcEntityRepository<GameManagementSettings>
    implements GameManagementSettingsRepository {

    private static final String COLUMNS = """
        is_active_override, hide_in_lobby_override, game_order_override, min_bet_amount_override,
        max_bet_amount_override, is_mobile_override, is_desktop_override, uk_compliant_override,
        jackpot_contribution_override, game_description_override, image_url_override, thumbnail_url_override,
        tags_override, notes, is_featured, feature_priority, custom_metadata, updated_by""";

    private static final String INSERT_SQL = "INSERT INTO game_management_settings (game_id, " + COLUMNS
        + ", version, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_SQL = """
        UPDATE game_management_settings
        SET is_active_override = ?, hide_in_lobby_override = ?, game_order_override = ?,
            min_bet_amount_override = ?, max_bet_amount_override = ?, is_mobile_override = ?,
            is_desktop_override = ?, uk_compliant_override = ?, jackpot_contribution_override = ?,
            game_description_override = ?, image_url_override = ?, thumbnail_url_override = ?,
            tags_override = ?, notes = ?, is_featured = ?, feature_priority = ?, custom_metadata = ?,
            updated_by = ?, updated_at = ?, version = version + 1
        WHERE id = ? AND version = ?
        """;

    private final RowMapper<GameManagementSettings> mapper;
    private final NamedParameterJdbcTemplate namedTemplate;

    JdbcGameManagementSettingsRepository(JdbcRepositoryContext context) {
        super(context);
        this.namedTemplate = new NamedParameterJdbcTemplate(context.jdbcTemplate());
        JsonColumns json = context.json();
        this.mapper = (rs, rowNum) -> {
            GameManagementSettings settings =
                new GameManagementSettings(rs.getLong("game_id"), getInstant(rs, "created_at"));
            GameSettingsOverrides stored = GameSettingsOverrides.builder()
                .activeOverride(getBooleanOrNull(rs, "is_active_override"))
                .hideInLobbyOverride(getBooleanOrNull(rs, "hide_in_lobby_override"))
                .gameOrderOverride(getIntOrNull(rs, "game_order_override"))
                .minBetAmountOverride(rs.getBigDecimal("min_bet_amount_override"))
                .maxBetAmountOverride(rs.getBigDecimal("max_bet_amount_override"))
                .mobileOverride(getBooleanOrNull(rs, "is_mobile_override"))
                .desktopOverride(getBooleanOrNull(rs, "is_desktop_override"))
                .ukCompliantOverride(getBooleanOrNull(rs, "uk_compliant_override"))
                .jackpotContributionOverride(rs.getBigDecimal("jackpot_contribution_override"))
                .gameDescriptionOverride(rs.getString("game_description_override"))
                .imageUrlOverride(rs.getString("image_url_override"))
                .thumbnailUrlOverride(rs.getString("thumbnail_url_override"))
                .tagsOverride(json.readStringList(rs.getString("tags_override")))
                .notes(rs.getString("notes"))
                .featured(rs.getBoolean("is_featured"))
                .featurePriority(rs.getInt("feature_priority"))
                .customMetadata(json.readObjectMap(rs.getString("custom_metadata")))
                .build();
            settings.restoreState(stored, rs.getString("updated_by"));
            settings.restore(rs.getLong("id"), rs.getLong("version"),
                getInstant(rs, "created_at"), getInstant(rs, "updated_at"));
            return settings;
        };
    }

    @Override
    protected String tableName() {
        return "game_management_settings";
    }

    @Override
    protected RowMapper<GameManagementSettings> rowMapper() {
        return mapper;
    }

    @Override
    public Optional<GameManagementSettings> findByGameId(long gameId) {
        return query("settings for game " + gameId,
            "SELECT * FROM game_management_settings WHERE game_id = ?", gameId).stream().findFirst();
    }

    @Override
    public Map<Long, GameManagementSettings> findByGameIds(Collection<Long> gameIds) {
        if (gameIds == null || gameIds.isEmpty()) {
            return Map.of();
        }
        List<GameManagementSettings> rows;
        try {
            rows = namedTemplate.query(
                "SELECT * FROM game_management_settings WHERE game_id IN (:gameIds)",
                new MapSqlParameterSource("gameIds", gameIds),
                mapper);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load settings for " + gameIds.size() + " games", ex);
        }
        Map<Long, GameManagementSettings> byGame = new LinkedHashMap<>();
        for (GameManagementSettings settings : rows) {
            byGame.put(settings.getGameId(), settings);
        }
        return byGame;
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected void bindInsert(PreparedStatement ps, GameManagementSettings entity) throws SQLException {
        Instant createdAt = entity.getCreatedAt() != null ? entity.getCreatedAt() : now();
        ps.setLong(1, entity.getGameId());
        int next = bindOverrides(ps, 2, entity);
        ps.setLong(next, entity.getVersion());
        ps.setTimestamp(next + 1, toTimestamp(createdAt));
        ps.setTimestamp(next + 2, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : createdAt));
    }

    @Override
    protected String updateSql() {
        return UPDATE_SQL;
    }

    @Override
    protected int bindUpdate(PreparedStatement ps, GameManagementSettings entity) throws SQLException {
        int next = bindOverrides(ps, 1, entity);
        ps.setTimestamp(next, toTimestamp(entity.getUpdatedAt() != null ? entity.getUpdatedAt() : now()));
        return next + 1;
    }

    private int bindOverrides(PreparedStatement ps, int start, GameManagementSettings entity) throws SQLException {
        JsonColumns json = context.json();
        int i = start;
        setNullableBoolean(ps, i++, entity.getActiveOverride());
        setNullableBoolean(ps, i++, entity.getHideInLobbyOverride());
        setNullableInt(ps, i++, entity.getGameOrderOverride());
        setNullableDecimal(ps, i++, entity.getMinBetAmountOverride());
        setNullableDecimal(ps, i++, entity.getMaxBetAmountOverride());
        setNullableBoolean(ps, i++, entity.getMobileOverride());
        setNullableBoolean(ps, i++, entity.getDesktopOverride());
        setNullableBoolean(ps, i++, entity.getUkCompliantOverride());
        setNullableDecimal(ps, i++, entity.getJackpotContributionOverride());
        setNullableString(ps, i++, entity.getGameDescriptionOverride());
        setNullableString(ps, i++, entity.getImageUrlOverride());
        setNullableString(ps, i++, entity.getThumbnailUrlOverride());
        setNullableString(ps, i++, json.write(entity.getTagsOverride()));
        setNullableString(ps, i++, entity.getNotes());
        ps.setBoolean(i++, entity.isFeatured());
        ps.setInt(i++, entity.getFeaturePriority());
        setNullableString(ps, i++, json.write(entity.getCustomMetadata()));
        setNullableString(ps, i++, entity.getUpdatedBy());
        return i;
    }
}
