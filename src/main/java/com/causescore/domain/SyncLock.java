package com.causescore.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cluster-wide lock row. The key is the document id, so insert-if-absent relies on the _id uniqueness.
 */
@Document(collection = "sync_locks")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class SyncLock {

    @Id
    private String key;
    private String holder;
    private Instant acquiredAt;
    @Indexed
    private Instant expiresAt;
}
