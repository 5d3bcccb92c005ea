package cz.vut.fit.zoneguard.models.results;

/**
 * Summary statistics of a batch.
 */
public record BatchSummary(int criticalCount,
                           int warningCount,
                           int infoCount,
                           int domainsOk,
                           int domainsPartial,
                           int domainsFailed
) {
    public int totalFindings() {
        return criticalCount + warningCount + infoCount;
    }

    public int totalDomains() {
        return domainsOk + domainsPartial + domainsFailed;
    }
}
