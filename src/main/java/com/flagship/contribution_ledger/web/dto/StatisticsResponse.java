package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.contribution_ledger.ledger.ContributionStatistics;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
public class StatisticsResponse {

    @JsonProperty("total_contributions")
    int totalContributions;

    @JsonProperty("total_quantity")
    long totalQuantity;

    @JsonProperty("contributors")
    List<Contributor> contributors;

    @JsonProperty("categories")
    List<Category> categories;

    @Value
    public static class Contributor {
        @JsonProperty("actor_id")
        long actorId;
        @JsonProperty("contributions")
        int contributions;
        @JsonProperty("total_quantity")
        long totalQuantity;
        @JsonProperty("categories")
        Set<String> categories;
    }

    @Value
    public static class Category {
        @JsonProperty("category")
        String category;
        @JsonProperty("contributions")
        int contributions;
        @JsonProperty("total_quantity")
        long totalQuantity;
        @JsonProperty("contributor_count")
        int contributorCount;
    }

    public static StatisticsResponse from(ContributionStatistics statistics) {
        return new StatisticsResponse(
            statistics.getTotalContributions(),
            statistics.getTotalQuantity(),
            statistics.getContributors().stream()
                .map(c -> new Contributor(c.getActorId(), c.getContributions(), c.getTotalQuantity(), c.getCategories()))
                .toList(),
            statistics.getCategories().stream()
                .map(c -> new Category(c.getCategory(), c.getContributions(), c.getTotalQuantity(), c.getContributorCount()))
                .toList());
    }
}
