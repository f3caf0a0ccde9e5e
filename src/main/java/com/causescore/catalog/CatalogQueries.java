package com.causescore.catalog;

/**
 * GraphQL documents sent to the impact-graph endpoint.
 */
final class CatalogQueries {

    private static final String PROJECT_FIELDS = """
            id
            title
            slug
            description
            qualityScore
            latestUpdateCreationDate
            status { name }
            projectPower { powerRank }
            socialMedia { type link }
            projectUpdate { title content createdAt }
            """;

    static final String CAUSES_WITH_PROJECTS = """
            query GetCausesWithProjects($limit: Float, $offset: Float) {
              causes(limit: $limit, offset: $offset) {
                id
                title
                description
                projects {
            %s    }
              }
            }
            """.formatted(PROJECT_FIELDS);

    static final String PROJECT_BY_ID = """
            query GetProjectById($id: Float!) {
              projectById(id: $id) {
            %s  }
            }
            """.formatted(PROJECT_FIELDS);

    static final String BULK_UPDATE_EVALUATIONS = """
            mutation BulkUpdateCauseProjectEvaluation($updates: [UpdateCauseProjectEvaluationInput!]!) {
              bulkUpdateCauseProjectEvaluation(updates: $updates) {
                id
                causeId
                projectId
                causeScore
              }
            }
            """;

    private CatalogQueries() {
    }
}
