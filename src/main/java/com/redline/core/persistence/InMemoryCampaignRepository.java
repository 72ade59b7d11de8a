package com.redline.core.persistence;

import com.redline.core.model.Attack;
import com.redline.core.model.Campaign;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local repository. Contents are lost on restart.
 */
@Repository
public class InMemoryCampaignRepository implements CampaignRepository {

    private final ConcurrentHashMap<String, Campaign> campaigns = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<String, Attack>> attacks = new ConcurrentHashMap<>();

    @Override
    public Campaign saveCampaign(Campaign campaign) {
        campaigns.put(campaign.id(), campaign);
        return campaign;
    }

    @Override
    public Optional<Campaign> findCampaign(String campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public List<Campaign> findAllCampaigns() {
        return campaigns.values().stream()
                .sorted(Comparator.comparing(Campaign::createdAt).reversed())
                .toList();
    }

    @Override
    public Attack saveAttack(Attack attack) {
        if (attack.campaignId() == null) {
            throw new PersistenceException("Attack " + attack.id() + " has no campaign");
        }
        Map<String, Attack> byId = attacks.computeIfAbsent(attack.campaignId(), k -> new LinkedHashMap<>());
        synchronized (byId) {
            byId.put(attack.id(), attack);
        }
        return attack;
    }

    @Override
    public List<Attack> findAttacks(String campaignId) {
        Map<String, Attack> byId = attacks.get(campaignId);
        if (byId == null) {
            return List.of();
        }
        synchronized (byId) {
            return List.copyOf(byId.values());
        }
    }
}
