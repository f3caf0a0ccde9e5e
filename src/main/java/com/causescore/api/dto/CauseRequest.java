package com.causescore.api.dto;

import com.causescore.scoring.CauseFacts;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * The cause being evaluated. Category fields keep the catalog's snake_case names.
 */
public record CauseRequest(
        @NotNull(message = "INVALID_CAUSE")
        @Positive(message = "INVALID_CAUSE")
        Long id,

        @NotBlank(message = "INVALID_CAUSE")
        String title,

        String description,

        List<@Valid CategoryRequest> categories
) {

    public CauseFacts toCauseFacts() {
        List<CauseFacts.Category> mapped = categories == null ? List.of() : categories.stream()
                .map(c -> new CauseFacts.Category(c.categoryName(), c.categoryDescription(),
                        c.mainCategoryTitle(), c.mainCategoryDescription()))
                .toList();
        return new CauseFacts(String.valueOf(id), title, description, mapped);
    }

    public record CategoryRequest(
            @NotBlank(message = "INVALID_CATEGORY")
            @JsonProperty("category_name")
            String categoryName,

            @JsonProperty("category_description")
            String categoryDescription,

            @JsonProperty("maincategory_title")
            String mainCategoryTitle,

            @JsonProperty("maincategory_description")
            String mainCategoryDescription
    ) {
    }
}
