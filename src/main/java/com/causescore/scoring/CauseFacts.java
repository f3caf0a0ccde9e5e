package com.causescore.scoring;

import java.util.List;

/**
 * The cause a project is scored against, as supplied by the evaluation request.
 */
public record CauseFacts(String id, String title, String description, List<Category> categories) {

    public CauseFacts {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public record Category(String name, String description, String mainCategoryTitle, String mainCategoryDescription) {
    }
}
