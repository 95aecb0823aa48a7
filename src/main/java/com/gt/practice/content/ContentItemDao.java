package com.gt.practice.content;

import com.gt.practice.model.ContentItem;

import java.util.Collection;
import java.util.List;

public interface ContentItemDao {

    // All items of a topic, limited to the given learning paths when any are given
    List<ContentItem> loadPool(String topicId, Collection<String> learningPathIds);

    List<ContentItem> loadItems(Collection<String> itemIds);
}
