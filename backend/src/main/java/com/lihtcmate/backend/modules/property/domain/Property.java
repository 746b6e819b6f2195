package com.lihtcmate.backend.modules.property.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "property")
public class Property extends AbstractTimestampedEntity {

    public static final String DEFAULT_COMPLIANCE_OPTION = "20% at 50% AMI, 55% at 80% AMI";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "county", nullable = false, length = 100)
    private String county;

    @Column(name = "state", nullable = false, length = 50)
    private String state;

    @Column(name = "compliance_option", length = 200)
    private String complianceOption;

    @Column(name = "placed_in_service_date")
    private LocalDate placedInServiceDate;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCounty() {
        return county;
    }

    public void setCounty(String county) {
        this.county = county;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getComplianceOption() {
        return complianceOption;
    }

    public void setComplianceOption(String complianceOption) {
        this.complianceOption = complianceOption;
    }

    /**
     * The configured set-aside, or the program default when none was entered.
     */
    public String effectiveComplianceOption() {
        return (complianceOption == null || complianceOption.isBlank()) ? DEFAULT_COMPLIANCE_OPTION : complianceOption;
    }

    public LocalDate getPlacedInServiceDate() {
        return placedInServiceDate;
    }

    public void setPlacedInServiceDate(LocalDate placedInServiceDate) {
        this.placedInServiceDate = placedInServiceDate;
    }
}
