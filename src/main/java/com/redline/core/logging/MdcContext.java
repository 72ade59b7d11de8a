package com.redline.core.logging;

import org.slf4j.MDC;

/**
 * Manages the campaign/attack MDC keys used by the log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCampaign(String campaignId) {
        if (campaignId != null) {
            MDC.put("campaignId", campaignId);
        }
    }

    public static void setAttack(String campaignId, String attackId, String templateId) {
        setCampaign(campaignId);
        MDC.put("attackId", attackId);
        MDC.put("templateId", templateId);
    }

    /** Drops only the attack-level keys, keeping the campaign in context. */
    public static void clearAttack() {
        MDC.remove("attackId");
        MDC.remove("templateId");
    }

    public static void clear() {
        MDC.remove("campaignId");
        clearAttack();
    }
}
