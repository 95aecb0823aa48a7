package com.gt.practice.content;

import com.gt.practice.conf.CachingConfig;
import com.gt.practice.exception.StorageException;
import com.gt.practice.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ContentService {

    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    private final ContentItemDao contentItemDao;

    public ContentService(ContentItemDao contentItemDao) {
        this.contentItemDao = contentItemDao;
    }

    @Cacheable(value = CachingConfig.CONTENT_POOLS, key = "#topicId + ':' + #learningPathIds")
    public List<ContentItem> loadPool(String topicId, List<String> learningPathIds) {
        try {
            return contentItemDao.loadPool(topicId, learningPathIds);
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load content pool for topic " + topicId;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }

    public Map<String, ContentItem> loadItems(Collection<String> itemIds) {
        List<ContentItem> items;
        try {
            items = contentItemDao.loadItems(new HashSet<>(itemIds));
        } catch (DataAccessException ex) {
            String errMsg = "Unable to load " + itemIds.size() + " content items";
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        return items.stream().collect(Collectors.toMap(ContentItem::id, Function.identity(), (first, second) -> first));
    }
}
