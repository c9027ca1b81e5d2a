package com.delta.creatoringest.ingest.persistence;

import com.delta.creatoringest.config.IngestProperties;
import com.delta.creatoringest.ingest.model.EntitySnapshot;
import com.delta.creatoringest.ingest.model.ItemRecord;
import com.delta.creatoringest.ingest.model.ItemStats;
import com.delta.creatoringest.ingest.model.ListingItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class ItemRecordJdbcRepository implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(ItemRecordJdbcRepository.class);

    private static final String UPDATE_SQL = """
        UPDATE channel_videos
        SET channel_handle = :channelHandle,
            channel_title = :channelTitle,
            channel_description = :channelDescription,
            subscriber_count = :subscriberCount,
            video_count = :videoCount,
            view_count = :viewCount,
            uploads_playlist_id = :uploadsPlaylistId,
            country = :country,
            channel_published_at = :channelPublishedAt,
            topic_categories = :topicCategories,
            made_for_kids = :madeForKids,
            privacy_status = :privacyStatus,
            title = :title,
            description = :description,
            video_published_at = :videoPublishedAt,
            video_url = :videoUrl,
            channel_title_video = :channelTitleVideo,
            tags = :tags,
            likes = :likes,
            comments = :comments,
            views = :views,
            duration = :duration,
            video_definition = :videoDefinition,
            category_id = :categoryId,
            video_license = :videoLicense,
            video_made_for_kids = :videoMadeForKids,
            scraped_at = :scrapedAt
        WHERE channel_id = :channelId
          AND video_id = :videoId
        """;

    private static final String INSERT_COLUMNS = """
        INSERT INTO channel_videos (
            channel_id, channel_handle, channel_title, channel_description, subscriber_count, video_count,
            view_count, uploads_playlist_id, country, channel_published_at, topic_categories, made_for_kids,
            privacy_status, video_id, title, description, video_published_at, video_url, channel_title_video,
            tags, likes, comments, views, duration, video_definition, category_id, video_license,
            video_made_for_kids, first_seen_at, scraped_at
        )
        VALUES (
            :channelId, :channelHandle, :channelTitle, :channelDescription, :subscriberCount, :videoCount,
            :viewCount, :uploadsPlaylistId, :country, :channelPublishedAt, :topicCategories, :madeForKids,
            :privacyStatus, :videoId, :title, :description, :videoPublishedAt, :videoUrl, :channelTitleVideo,
            :tags, :likes, :comments, :views, :duration, :videoDefinition, :categoryId, :videoLicense,
            :videoMadeForKids, :scrapedAt, :scrapedAt
        )
        """;

    private static final String UPSERT_SQL = INSERT_COLUMNS + """
        ON CONFLICT (channel_id, video_id)
        DO UPDATE SET
            channel_handle = EXCLUDED.channel_handle,
            channel_title = EXCLUDED.channel_title,
            channel_description = EXCLUDED.channel_description,
            subscriber_count = EXCLUDED.subscriber_count,
            video_count = EXCLUDED.video_count,
            view_count = EXCLUDED.view_count,
            uploads_playlist_id = EXCLUDED.uploads_playlist_id,
            country = EXCLUDED.country,
            channel_published_at = EXCLUDED.channel_published_at,
            topic_categories = EXCLUDED.topic_categories,
            made_for_kids = EXCLUDED.made_for_kids,
            privacy_status = EXCLUDED.privacy_status,
            title = EXCLUDED.title,
            description = EXCLUDED.description,
            video_published_at = EXCLUDED.video_published_at,
            video_url = EXCLUDED.video_url,
            channel_title_video = EXCLUDED.channel_title_video,
            tags = EXCLUDED.tags,
            likes = EXCLUDED.likes,
            comments = EXCLUDED.comments,
            views = EXCLUDED.views,
            duration = EXCLUDED.duration,
            video_definition = EXCLUDED.video_definition,
            category_id = EXCLUDED.category_id,
            video_license = EXCLUDED.video_license,
            video_made_for_kids = EXCLUDED.video_made_for_kids,
            scraped_at = EXCLUDED.scraped_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final IngestProperties properties;
    private final boolean postgres;

    public ItemRecordJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        IngestProperties properties
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public void upsert(List<ItemRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> paramsList = buildParams(records, Instant.now());
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!postgres) {
                    for (MapSqlParameterSource params : paramsList) {
                        upsertLegacy(params);
                    }
                    return;
                }
                int batchSize = properties.getPersistence().getBatchSize();
                for (int i = 0; i < paramsList.size(); i += batchSize) {
                    int end = Math.min(paramsList.size(), i + batchSize);
                    jdbc.batchUpdate(UPSERT_SQL, paramsList.subList(i, end).toArray(new MapSqlParameterSource[0]));
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Failed to upsert " + records.size() + " item records", e);
        }
    }

    @Override
    public boolean hasCommittedRecords(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            return false;
        }
        return countForChannel(entityId) > 0;
    }

    public long countRecords() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM channel_videos", Long.class);
        return count == null ? 0L : count;
    }

    public long countForChannel(String channelId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM channel_videos WHERE channel_id = :channelId",
            new MapSqlParameterSource("channelId", channelId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Optional<ItemRecord> findRecord(String channelId, String videoId) {
        List<ItemRecord> rows = jdbc.query(
            """
                SELECT *
                FROM channel_videos
                WHERE channel_id = :channelId
                  AND video_id = :videoId
                """,
            new MapSqlParameterSource()
                .addValue("channelId", channelId)
                .addValue("videoId", videoId),
            itemRecordRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private void upsertLegacy(MapSqlParameterSource params) {
        int updated = jdbc.update(UPDATE_SQL, params);
        if (updated == 0) {
            jdbc.update(INSERT_COLUMNS, params);
        }
    }

    private List<MapSqlParameterSource> buildParams(List<ItemRecord> records, Instant scrapedAt) {
        List<MapSqlParameterSource> out = new ArrayList<>(records.size());
        for (ItemRecord record : records) {
            EntitySnapshot entity = record.entity();
            ListingItem item = record.item();
            ItemStats stats = record.stats() == null ? ItemStats.EMPTY : record.stats();
            out.add(new MapSqlParameterSource()
                .addValue("channelId", entity.entityId())
                .addValue("channelHandle", entity.customHandle())
                .addValue("channelTitle", entity.title())
                .addValue("channelDescription", entity.description())
                .addValue("subscriberCount", entity.subscriberCount())
                .addValue("videoCount", entity.videoCount())
                .addValue("viewCount", entity.viewCount())
                .addValue("uploadsPlaylistId", entity.listingId())
                .addValue("country", entity.country())
                .addValue("channelPublishedAt", toTimestamp(entity.publishedAt()))
                .addValue("topicCategories", entity.topicCategories())
                .addValue("madeForKids", entity.madeForKids())
                .addValue("privacyStatus", entity.privacyStatus())
                .addValue("videoId", item.itemId())
                .addValue("title", item.title())
                .addValue("description", item.description())
                .addValue("videoPublishedAt", toTimestamp(item.publishedAt()))
                .addValue("videoUrl", item.url())
                .addValue("channelTitleVideo", item.channelTitle())
                .addValue("tags", stats.tags())
                .addValue("likes", stats.likes())
                .addValue("comments", stats.comments())
                .addValue("views", stats.views())
                .addValue("duration", stats.duration())
                .addValue("videoDefinition", stats.definition())
                .addValue("categoryId", stats.categoryId())
                .addValue("videoLicense", stats.license())
                .addValue("videoMadeForKids", stats.madeForKids())
                .addValue("scrapedAt", toTimestamp(scrapedAt)));
        }
        return out;
    }

    private RowMapper<ItemRecord> itemRecordRowMapper() {
        return (rs, rowNum) -> new ItemRecord(
            new EntitySnapshot(
                rs.getString("channel_id"),
                rs.getString("channel_handle"),
                rs.getString("channel_title"),
                rs.getString("channel_description"),
                rs.getLong("subscriber_count"),
                rs.getLong("video_count"),
                rs.getLong("view_count"),
                rs.getString("uploads_playlist_id"),
                rs.getString("country"),
                toInstant(rs.getTimestamp("channel_published_at")),
                rs.getString("topic_categories"),
                rs.getBoolean("made_for_kids"),
                rs.getString("privacy_status")
            ),
            new ListingItem(
                rs.getString("video_id"),
                rs.getString("title"),
                rs.getString("description"),
                toInstant(rs.getTimestamp("video_published_at")),
                rs.getString("video_url"),
                rs.getString("channel_title_video")
            ),
            new ItemStats(
                rs.getLong("likes"),
                rs.getLong("comments"),
                rs.getLong("views"),
                rs.getString("tags"),
                rs.getString("duration"),
                rs.getString("video_definition"),
                rs.getString("category_id"),
                rs.getString("video_license"),
                rs.getBoolean("video_made_for_kids")
            )
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to update-then-insert upserts", e);
            return false;
        }
    }
}
