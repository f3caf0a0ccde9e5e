package com.causescore.api.dto;

import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;

import java.time.Instant;

public record SocialPostResponse(String postId, Platform platform, String content, String url,
                                 Instant postTimestamp, Instant fetchedAt) {

    public static SocialPostResponse from(StoredPost post) {
        return new SocialPostResponse(post.getPostId(), post.getPlatform(), post.getContent(), post.getUrl(),
                post.getPostTimestamp(), post.getFetchedAt());
    }
}
