package com.lifecycle.engine.projection.companyproduct;

/**
 * Event names of the company_product aggregate.
 */
public final class CompanyProductEvents {

    public static final String AGGREGATE_TYPE = "company_product";

    public static final String PROCESS_SET = "CompanyProductProcessSet";
    public static final String STAGE_SET = "CompanyProductStageSet";
    public static final String PROCESS_COMPLETED = "CompanyProductProcessCompleted";
    public static final String HEALTH_UPDATED = "CompanyProductHealthUpdated";
    public static final String RISK_LEVEL_SET = "CompanyProductRiskLevelSet";
    public static final String OWNER_SET = "CompanyProductOwnerSet";
    public static final String SLA_WARNING = "CompanyProductSLAWarning";
    public static final String SLA_BREACHED = "CompanyProductSLABreached";

    public static final String EXIT_PROGRESSED = "progressed";
    public static final String EXIT_REGRESSED = "regressed";
    public static final String EXIT_COMPLETED = "completed";

    private CompanyProductEvents() {
    }
}
