package com.growthlens.kpi.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "kpi_rollups")
public class RollupEntity {
    @EmbeddedId
    private RollupEntityId id;

    @Column(name = "quality_users", nullable = false)
    private long qualityUsers;

    @Column(name = "all_users", nullable = false)
    private long allUsers;

    @Column(name = "good_users", nullable = false)
    private long goodUsers;

    @Column(name = "verified_users", nullable = false)
    private long verifiedUsers;

    @Column(name = "retained_users", nullable = false)
    private long retainedUsers;

    @Column(name = "paying_users", nullable = false)
    private long payingUsers;

    @Column(name = "female_users", nullable = false)
    private long femaleUsers;

    @Column(name = "young_users", nullable = false)
    private long youngUsers;

    @Column(name = "high_tier_users", nullable = false)
    private long highTierUsers;

    // minor units
    @Column(name = "total_revenue", nullable = false)
    private long totalRevenue;

    @Column(name = "total_cost", nullable = false)
    private long totalCost;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    // Default constructor for JPA
    public RollupEntity() {}

    // Getters and setters
    public RollupEntityId getId() { return id; }
    public void setId(RollupEntityId id) { this.id = id; }

    public long getQualityUsers() { return qualityUsers; }
    public void setQualityUsers(long qualityUsers) { this.qualityUsers = qualityUsers; }

    public long getAllUsers() { return allUsers; }
    public void setAllUsers(long allUsers) { this.allUsers = allUsers; }

    public long getGoodUsers() { return goodUsers; }
    public void setGoodUsers(long goodUsers) { this.goodUsers = goodUsers; }

    public long getVerifiedUsers() { return verifiedUsers; }
    public void setVerifiedUsers(long verifiedUsers) { this.verifiedUsers = verifiedUsers; }

    public long getRetainedUsers() { return retainedUsers; }
    public void setRetainedUsers(long retainedUsers) { this.retainedUsers = retainedUsers; }

    public long getPayingUsers() { return payingUsers; }
    public void setPayingUsers(long payingUsers) { this.payingUsers = payingUsers; }

    public long getFemaleUsers() { return femaleUsers; }
    public void setFemaleUsers(long femaleUsers) { this.femaleUsers = femaleUsers; }

    public long getYoungUsers() { return youngUsers; }
    public void setYoungUsers(long youngUsers) { this.youngUsers = youngUsers; }

    public long getHighTierUsers() { return highTierUsers; }
    public void setHighTierUsers(long highTierUsers) { this.highTierUsers = highTierUsers; }

    public long getTotalRevenue() { return totalRevenue; }
    public void setTotalRevenue(long totalRevenue) { this.totalRevenue = totalRevenue; }

    public long getTotalCost() { return totalCost; }
    public void setTotalCost(long totalCost) { this.totalCost = totalCost; }

    public Instant getComputedAt() { return computedAt; }
    public void setComputedAt(Instant computedAt) { this.computedAt = computedAt; }
}
