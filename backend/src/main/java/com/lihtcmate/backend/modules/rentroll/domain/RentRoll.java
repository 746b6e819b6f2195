package com.lihtcmate.backend.modules.rentroll.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.property.domain.Property;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "rent_roll")
public class RentRoll extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "property_id", nullable = false)
    private Property property;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "snapshot_id", nullable = false, unique = true)
    private RentRollSnapshot snapshot;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Column(name = "upload_date", nullable = false)
    private LocalDate uploadDate;

    protected RentRoll() {
    }

    public RentRoll(RentRollSnapshot snapshot) {
        this.property = snapshot.getProperty();
        this.snapshot = snapshot;
        this.filename = snapshot.getFilename();
        this.uploadDate = snapshot.getUploadDate();
    }

    public UUID getId() {
        return id;
    }

    public Property getProperty() {
        return property;
    }

    public RentRollSnapshot getSnapshot() {
        return snapshot;
    }

    public String getFilename() {
        return filename;
    }

    public LocalDate getUploadDate() {
        return uploadDate;
    }
}
