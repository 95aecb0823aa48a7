package com.gt.practice.content.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.practice.content.ContentItemDao;
import com.gt.practice.exception.MappingException;
import com.gt.practice.model.ContentItem;
import com.gt.practice.model.TaskVariant;
import com.gt.practice.model.payload.TaskPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

public class ContentItemDaoPG implements ContentItemDao {

    private static final Logger log = LoggerFactory.getLogger(ContentItemDaoPG.class);

    private static final String LOAD_POOL_SQL =
            "SELECT id, topic_id, learning_path_id, variant, payload, hint " +
            "FROM content_item " +
            "WHERE topic_id = :topicId AND (:allPaths OR learning_path_id IN (:learningPathIds)) " +
            "ORDER BY id";

    private static final String LOAD_ITEMS_SQL =
            "SELECT id, topic_id, learning_path_id, variant, payload, hint " +
            "FROM content_item " +
            "WHERE id IN (:itemIds)";

    // IN () is not valid SQL, so an unused path filter still needs one placeholder value
    private static final String NO_PATH_PLACEHOLDER = "";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public ContentItemDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ContentItem> loadPool(String topicId, Collection<String> learningPathIds) {
        boolean allPaths = learningPathIds == null || learningPathIds.isEmpty();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("topicId", topicId)
                .addValue("allPaths", allPaths)
                .addValue("learningPathIds", allPaths ? List.of(NO_PATH_PLACEHOLDER) : learningPathIds);

        return template.query(LOAD_POOL_SQL, params, this::getContentItemFromResultSet);
    }

    @Override
    public List<ContentItem> loadItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_ITEMS_SQL, new MapSqlParameterSource("itemIds", itemIds), this::getContentItemFromResultSet);
    }

    private ContentItem getContentItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        String variantCode = rs.getString("variant");

        TaskVariant variant = TaskVariant.fromCode(variantCode);
        if (variant == null) {
            String errMsg = "Content item " + id + " has unknown variant " + variantCode;
            log.error(errMsg);
            throw new MappingException(errMsg);
        }

        TaskPayload payload;
        try {
            payload = objectMapper.readValue(rs.getString("payload"), TaskPayload.class);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to read payload of content item " + id;
            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }

        try {
            return new ContentItem(id, rs.getString("topic_id"), rs.getString("learning_path_id"), variant, payload, rs.getString("hint"));
        } catch (IllegalArgumentException ex) {
            String errMsg = "Content item " + id + " is inconsistent";
            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }
}
