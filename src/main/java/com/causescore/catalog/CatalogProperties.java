package com.causescore.catalog;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Project catalog (Giveth impact-graph) endpoint.
 */
@ConfigurationProperties(prefix = "causescore.catalog")
@NoArgsConstructor
@Getter
@Setter
public class CatalogProperties {

    private String graphqlUrl = "https://impact-graph.serve.giveth.io/graphql";

    /** Safety ceiling for one GraphQL call. Default 120 s. */
    private int timeoutSeconds = 120;
}
