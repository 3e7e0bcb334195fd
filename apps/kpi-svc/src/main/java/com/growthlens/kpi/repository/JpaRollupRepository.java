package com.growthlens.kpi.repository;

import com.growthlens.kpi.entity.RollupEntity;
import com.growthlens.kpi.entity.RollupEntityId;
import com.growthlens.kpi.model.Granularity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRollupRepository extends JpaRepository<RollupEntity, RollupEntityId> {

    @Query("SELECT r FROM RollupEntity r WHERE r.id.date = :date AND r.id.granularity = :granularity ORDER BY r.id.granularityKey")
    List<RollupEntity> findByDateAndGranularity(@Param("date") LocalDate date,
                                                @Param("granularity") Granularity granularity);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RollupEntity r WHERE r.id.date = :date")
    int deleteByDate(@Param("date") LocalDate date);
}
