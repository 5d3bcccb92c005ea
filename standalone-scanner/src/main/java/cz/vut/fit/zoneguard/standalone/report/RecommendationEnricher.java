package cz.vut.fit.zoneguard.standalone.report;

import cz.vut.fit.zoneguard.models.results.BatchResult;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Rewrites the recommendation texts shown in a report, for example to tailor them to the scanned organization.
 * It runs after classification and cannot change the findings.
 */
@FunctionalInterface
public interface RecommendationEnricher {
    /**
     * @param batch           The finished batch.
     * @param recommendations The recommendation text per rule identifier, for the rules that produced findings.
     * @return The recommendations to show. Rules missing from the returned map keep their original text.
     */
    @NotNull Map<String, String> enrich(@NotNull BatchResult batch, @NotNull Map<String, String> recommendations);
}
