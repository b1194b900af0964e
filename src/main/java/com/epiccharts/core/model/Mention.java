package com.epiccharts.core.model;

import java.io.Serializable;

/**
 * A feed post that mentions the bot, passed the trigger filters, and replies to a parent post.
 *
 * @param id       id of the mention itself (the reply target)
 * @param authorId id of the account that wrote the mention
 * @param text     raw mention text
 * @param parentId id of the post being replied to; expected to carry the chart image (nullable)
 */
public record Mention(
    String id,
    String authorId,
    String text,
    String parentId
) implements Serializable {

    public boolean hasParent() {
        return parentId != null && !parentId.isBlank();
    }
}
