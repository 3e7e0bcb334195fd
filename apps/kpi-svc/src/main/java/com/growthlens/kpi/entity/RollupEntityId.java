package com.growthlens.kpi.entity;

import com.growthlens.kpi.model.Granularity;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

@Embeddable
public class RollupEntityId implements Serializable {

    @Column(name = "dt", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(name = "granularity", nullable = false, length = 16)
    private Granularity granularity;

    @Column(name = "granularity_key", nullable = false)
    private String granularityKey;

    public RollupEntityId() {}

    public RollupEntityId(LocalDate date, Granularity granularity, String granularityKey) {
        this.date = date;
        this.granularity = granularity;
        this.granularityKey = granularityKey;
    }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public Granularity getGranularity() { return granularity; }
    public void setGranularity(Granularity granularity) { this.granularity = granularity; }

    public String getGranularityKey() { return granularityKey; }
    public void setGranularityKey(String granularityKey) { this.granularityKey = granularityKey; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RollupEntityId other)) {
            return false;
        }
        return Objects.equals(date, other.date)
                && granularity == other.granularity
                && Objects.equals(granularityKey, other.granularityKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, granularity, granularityKey);
    }
}
