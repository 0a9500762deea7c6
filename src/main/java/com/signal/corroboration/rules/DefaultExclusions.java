package com.signal.corroboration.rules;

import java.util.Set;

/**
 * Names that are never target entities: consultancies and system integrators,
 * technology vendors, job boards and generic placeholders.
 */
public final class DefaultExclusions {

    public static final Set<String> ENTRIES = Set.of(
            // System integrators and consulting
            "accenture", "deloitte", "pwc", "pricewaterhousecoopers", "kpmg", "ey",
            "ernst & young", "ernst young", "capgemini", "infosys", "wipro", "tcs",
            "tata consultancy", "cognizant", "ibm", "hcl", "tech mahindra", "lti",
            "mindtree", "ntt data", "atos", "dxc technology", "bearing point",
            "bearingpoint", "bain", "mckinsey", "boston consulting", "bcg",
            "roland berger", "oliver wyman", "seidor", "zalaris", "rizing",
            "agilityworks", "resulting", "epi-use", "brightree", "nagarro",
            "world wide technology",
            // Technology vendors
            "sap", "sap se", "amazon", "aws", "amazon web services", "microsoft",
            "google", "google cloud", "oracle", "salesforce", "servicenow",
            "workday", "adobe", "vmware", "cisco", "dell", "hp", "hewlett packard",
            "intel", "nvidia", "meta", "facebook", "apple", "twitter",
            // Generic placeholders and job boards
            "unknown", "n/a", "confidential", "(conference speaker)", "various",
            "linkedin", "indeed", "bayt", "gulftalent", "glassdoor", "monster"
    );

    private DefaultExclusions() {
        // Utility class
    }
}
