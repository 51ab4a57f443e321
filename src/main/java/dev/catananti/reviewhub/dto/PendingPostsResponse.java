package dev.catananti.reviewhub.dto;

import java.util.List;

public record PendingPostsResponse(List<Long> postIds, int count) {

    public static PendingPostsResponse of(List<Long> postIds) {
        return new PendingPostsResponse(List.copyOf(postIds), postIds.size());
    }
}
