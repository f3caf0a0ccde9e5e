package com.causescore.catalog;

import java.util.List;

/**
 * Project catalog. Implementations throw {@link CatalogException} when a call fails as a whole.
 */
public interface CatalogClient {

    /** One page of causes with their projects; an empty list means no more pages. */
    List<CauseWithProjects> getCausesWithProjects(int limit, int offset);

    /** Projects found for the ids; unknown ids are left out. */
    List<ProjectFacts> getProjectsByIds(List<String> projectIds);

    /** Pushes scores in one bulk mutation; returns the number of rows the catalog acknowledged. */
    int reportScores(List<ScoreUpdate> updates);
}
