package cz.vut.fit.zoneguard;

/**
 * The configuration keys, descriptions and default values for the scanner.
 */
@SuppressWarnings("ALL")
public class ScannerConfig {
    /* --- Scan orchestration --- */
    public static final String THREADS_CONFIG = "scanner.threads";
    public static final String THREADS_DOC = "The number of domains scanned in parallel.";
    public static final String THREADS_DEFAULT = "4";

    public static final String TIMEOUT_PER_DOMAIN_MS_CONFIG = "scanner.timeout.per.domain";
    public static final String TIMEOUT_PER_DOMAIN_MS_DOC = "The maximum time a single collector call (DNS or WHOIS) may take for one domain (milliseconds).";
    public static final String TIMEOUT_PER_DOMAIN_MS_DEFAULT = "15000";

    /* --- Rules --- */
    public static final String EXPIRY_WARNING_DAYS_CONFIG = "rules.expiry.warning.days";
    public static final String EXPIRY_WARNING_DAYS_DOC = "A domain expiring within this number of days yields a WARNING finding.";
    public static final String EXPIRY_WARNING_DAYS_DEFAULT = "90";

    public static final String EXPIRY_CRITICAL_DAYS_CONFIG = "rules.expiry.critical.days";
    public static final String EXPIRY_CRITICAL_DAYS_DOC = "A domain expiring within this number of days yields a CRITICAL finding.";
    public static final String EXPIRY_CRITICAL_DAYS_DEFAULT = "30";

    /* --- DNS collector --- */
    public static final String DNS_MAIN_RESOLVER_IPS_CONFIG = "dns.main.resolver.ips";
    public static final String DNS_MAIN_RESOLVER_IPS_DOC = "IP addresses of the DNS resolvers (comma-separated).";
    public static final String DNS_MAIN_RESOLVER_IPS_DEFAULT = "1.1.1.1,8.8.8.8,9.9.9.9";

    public static final String DNS_MAIN_RESOLVER_ROUND_ROBIN_CONFIG = "dns.main.resolver.round.robin";
    public static final String DNS_MAIN_RESOLVER_ROUND_ROBIN_DOC = "If true, queries will be distributed across the configured DNS resolvers. Otherwise, the first server will be used until it is not available.";
    public static final String DNS_MAIN_RESOLVER_ROUND_ROBIN_DEFAULT = "true";

    public static final String DNS_MAIN_RESOLVER_RANDOMIZE_CONFIG = "dns.main.resolver.randomize";
    public static final String DNS_MAIN_RESOLVER_RANDOMIZE_DOC = "If true, the order of the DNS resolver IPs will be randomized when the collector is created.";
    public static final String DNS_MAIN_RESOLVER_RANDOMIZE_DEFAULT = "false";

    public static final String DNS_MAIN_RESOLVER_TIMEOUT_PER_NS_MS_CONFIG = "dns.main.resolver.timeout.per.ns";
    public static final String DNS_MAIN_RESOLVER_TIMEOUT_PER_NS_MS_DOC = "The timeout for DNS queries made against one of the configured resolvers (milliseconds).";
    public static final String DNS_MAIN_RESOLVER_TIMEOUT_PER_NS_MS_DEFAULT = "3000";

    public static final String DNS_MAIN_RESOLVER_RETRIES_CONFIG = "dns.main.resolver.retries";
    public static final String DNS_MAIN_RESOLVER_RETRIES_DOC = "The number of attempts to query a single DNS server until the next one is used.";
    public static final String DNS_MAIN_RESOLVER_RETRIES_DEFAULT = "1";

    public static final String DNS_DKIM_SELECTORS_CONFIG = "dns.dkim.selectors";
    public static final String DNS_DKIM_SELECTORS_DOC = "The DKIM selectors probed at <selector>._domainkey.<domain> (comma-separated).";
    public static final String DNS_DKIM_SELECTORS_DEFAULT = "default,selector1,selector2,google,k1,mail,dkim";

    public static final String DNS_AXFR_ENABLED_CONFIG = "dns.axfr.enabled";
    public static final String DNS_AXFR_ENABLED_DOC = "If true, each name server of the domain is asked for a zone transfer (AXFR) to detect open transfers.";
    public static final String DNS_AXFR_ENABLED_DEFAULT = "true";

    public static final String DNS_AXFR_TIMEOUT_MS_CONFIG = "dns.axfr.timeout";
    public static final String DNS_AXFR_TIMEOUT_MS_DOC = "The timeout for a single zone transfer attempt (milliseconds).";
    public static final String DNS_AXFR_TIMEOUT_MS_DEFAULT = "3000";

    /* --- WHOIS collector --- */
    public static final String WHOIS_ROOT_SERVER_CONFIG = "whois.root.server";
    public static final String WHOIS_ROOT_SERVER_DOC = "The WHOIS server queried for the registry WHOIS server of a TLD.";
    public static final String WHOIS_ROOT_SERVER_DEFAULT = "whois.iana.org";

    public static final String WHOIS_FOLLOW_REFERRALS_CONFIG = "whois.follow.referrals";
    public static final String WHOIS_FOLLOW_REFERRALS_DOC = "If true, a registrar WHOIS server referral in the registry response is followed once.";
    public static final String WHOIS_FOLLOW_REFERRALS_DEFAULT = "true";
}
