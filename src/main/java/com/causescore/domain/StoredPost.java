package com.causescore.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One ingested post. The platform-native id is unique per owning account; timestamps may collide across accounts.
 */
@Document(collection = "stored_posts")
@CompoundIndex(name = "post_account_unique", def = "{'postId': 1, 'accountId': 1}", unique = true)
@CompoundIndex(name = "account_platform_ts", def = "{'accountId': 1, 'platform': 1, 'postTimestamp': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StoredPost {

    @Id
    @EqualsAndHashCode.Include
    private String id;

    private String postId;
    /** TrackedAccount.id of the owner. */
    private String accountId;
    private Platform platform;
    private String content;
    private String url;
    private Instant postTimestamp;
    private Instant fetchedAt;
    private Map<String, Object> metadata = new HashMap<>();
}
