package com.growthlens.kpi.repository;

import com.growthlens.kpi.entity.RollupEntity;
import com.growthlens.kpi.entity.RollupEntityId;
import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class JpaRollupStore implements RollupStore {

    private final JpaRollupRepository jpaRollupRepository;
    private final Clock clock;

    @Autowired
    public JpaRollupStore(JpaRollupRepository jpaRollupRepository) {
        this(jpaRollupRepository, Clock.systemUTC());
    }

    JpaRollupStore(JpaRollupRepository jpaRollupRepository, Clock clock) {
        this.jpaRollupRepository = jpaRollupRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RollupRow> getRollup(LocalDate date, Granularity granularity, String granularityKey) {
        return jpaRollupRepository.findById(new RollupEntityId(date, granularity, granularityKey))
                .map(this::toModel);
    }

    @Override
    @Transactional
    public RollupRow putRollup(RollupRow row) {
        return toModel(jpaRollupRepository.save(toEntity(row)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<RollupRow> findRollups(LocalDate date, Granularity granularity) {
        return jpaRollupRepository.findByDateAndGranularity(date, granularity).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    @Transactional
    public void replaceRollups(LocalDate date, List<RollupRow> rows) {
        for (RollupRow row : rows) {
            if (!date.equals(row.date())) {
                throw new IllegalArgumentException("row dated " + row.date() + " cannot replace rollups of " + date);
            }
        }
        jpaRollupRepository.deleteByDate(date);
        jpaRollupRepository.saveAll(rows.stream().map(this::toEntity).toList());
    }

    private RollupEntity toEntity(RollupRow row) {
        RollupEntity entity = new RollupEntity();
        entity.setId(new RollupEntityId(row.date(), row.granularity(), row.granularityKey()));
        entity.setQualityUsers(row.qualityUsers());
        entity.setAllUsers(row.allUsers());
        entity.setGoodUsers(row.goodUsers());
        entity.setVerifiedUsers(row.verifiedUsers());
        entity.setRetainedUsers(row.retainedUsers());
        entity.setPayingUsers(row.payingUsers());
        entity.setFemaleUsers(row.femaleUsers());
        entity.setYoungUsers(row.youngUsers());
        entity.setHighTierUsers(row.highTierUsers());
        entity.setTotalRevenue(row.totalRevenue());
        entity.setTotalCost(row.totalCost());
        entity.setComputedAt(clock.instant());
        return entity;
    }

    private RollupRow toModel(RollupEntity entity) {
        RollupEntityId id = entity.getId();
        return new RollupRow(
                id.getDate(),
                id.getGranularity(),
                id.getGranularityKey(),
                entity.getQualityUsers(),
                entity.getAllUsers(),
                entity.getGoodUsers(),
                entity.getVerifiedUsers(),
                entity.getRetainedUsers(),
                entity.getPayingUsers(),
                entity.getFemaleUsers(),
                entity.getYoungUsers(),
                entity.getHighTierUsers(),
                entity.getTotalRevenue(),
                entity.getTotalCost()
        );
    }
}
