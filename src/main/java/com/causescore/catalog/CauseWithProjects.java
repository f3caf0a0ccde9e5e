package com.causescore.catalog;

import java.util.List;

/**
 * One page entry of the catalog's cause listing.
 */
public record CauseWithProjects(String id, String title, String description, List<ProjectFacts> projects) {

    public CauseWithProjects {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }
}
