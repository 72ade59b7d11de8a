package com.redline.core.persistence;

import com.redline.core.model.Attack;
import com.redline.core.model.Campaign;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for campaigns and their attacks. A save is treated as durable once it
 * returns; failures surface as {@link PersistenceException} and are not retried.
 */
public interface CampaignRepository {

    Campaign saveCampaign(Campaign campaign);

    Optional<Campaign> findCampaign(String campaignId);

    List<Campaign> findAllCampaigns();

    Attack saveAttack(Attack attack);

    /** Attacks of a campaign in the order they were first saved. */
    List<Attack> findAttacks(String campaignId);
}
