package com.flagship.contribution_ledger.ledger;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-contributor and per-category totals over a guild's current contribution rows.
 * Both lists are sorted by total quantity, largest first.
 */
@Value
public class ContributionStatistics {
    int totalContributions;
    long totalQuantity;
    List<ContributorStats> contributors;
    List<CategoryStats> categories;

    @Value
    public static class ContributorStats {
        long actorId;
        int contributions;
        long totalQuantity;
        Set<String> categories;
    }

    @Value
    public static class CategoryStats {
        String category;
        int contributions;
        long totalQuantity;
        int contributorCount;
    }

    public static ContributionStatistics of(List<ContributionEvent> contributions) {
        Map<Long, List<ContributionEvent>> byActor = new HashMap<>();
        Map<String, List<ContributionEvent>> byCategory = new HashMap<>();
        long total = 0;
        for (ContributionEvent contribution : contributions) {
            byActor.computeIfAbsent(contribution.getActorId(), k -> new ArrayList<>()).add(contribution);
            byCategory.computeIfAbsent(contribution.getCategory(), k -> new ArrayList<>()).add(contribution);
            total += contribution.getQuantity();
        }

        List<ContributorStats> contributors = new ArrayList<>();
        byActor.forEach((actorId, rows) -> {
            Set<String> categories = new TreeSet<>();
            rows.forEach(r -> categories.add(r.getCategory()));
            contributors.add(new ContributorStats(actorId, rows.size(), sum(rows), categories));
        });
        contributors.sort(Comparator.comparingLong(ContributorStats::getTotalQuantity).reversed()
            .thenComparingLong(ContributorStats::getActorId));

        List<CategoryStats> categories = new ArrayList<>();
        byCategory.forEach((category, rows) -> categories.add(new CategoryStats(
            category,
            rows.size(),
            sum(rows),
            (int) rows.stream().mapToLong(ContributionEvent::getActorId).distinct().count())));
        categories.sort(Comparator.comparingLong(CategoryStats::getTotalQuantity).reversed()
            .thenComparing(CategoryStats::getCategory));

        return new ContributionStatistics(contributions.size(), total, contributors, categories);
    }

    private static long sum(List<ContributionEvent> rows) {
        return rows.stream().mapToLong(ContributionEvent::getQuantity).sum();
    }
}
