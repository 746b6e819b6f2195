package com.lihtcmate.backend.modules.rentroll.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.property.domain.Property;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Point-in-time capture of a property, one per compliance upload. At most one per property is active.
 * The HUD columns are filled after the upload commits.
 */
@Entity
@Table(name = "rent_roll_snapshot")
public class RentRollSnapshot extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "property_id", nullable = false)
    private Property property;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Column(name = "upload_date", nullable = false)
    private LocalDate uploadDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "hud_income_limits", columnDefinition = "jsonb")
    private Map<String, Object> hudIncomeLimits;

    @Column(name = "hud_data_year")
    private Integer hudDataYear;

    @Column(name = "hud_regime", length = 20)
    private String hudRegime;

    @Column(name = "hud_fetched_at")
    private OffsetDateTime hudFetchedAt;

    protected RentRollSnapshot() {
    }

    public RentRollSnapshot(Property property, String filename, LocalDate uploadDate) {
        this.property = property;
        this.filename = filename;
        this.uploadDate = uploadDate;
        this.active = true;
    }

    public boolean hasHudData() {
        return hudIncomeLimits != null && !hudIncomeLimits.isEmpty();
    }

    public void recordHudData(Map<String, Object> limits, int dataYear, String regime, OffsetDateTime fetchedAt) {
        this.hudIncomeLimits = limits;
        this.hudDataYear = dataYear;
        this.hudRegime = regime;
        this.hudFetchedAt = fetchedAt;
    }

    public UUID getId() {
        return id;
    }

    public Property getProperty() {
        return property;
    }

    public String getFilename() {
        return filename;
    }

    public LocalDate getUploadDate() {
        return uploadDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Map<String, Object> getHudIncomeLimits() {
        return hudIncomeLimits;
    }

    public Integer getHudDataYear() {
        return hudDataYear;
    }

    public String getHudRegime() {
        return hudRegime;
    }

    public OffsetDateTime getHudFetchedAt() {
        return hudFetchedAt;
    }
}
