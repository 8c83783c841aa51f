package com.photohunt.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Geolocated photo challenge. Owned by challenge management; read-only here.
 */
@Getter
@Setter
@Entity
@Table(name = "photohunts")
public class PhotoHunt {

    @Id
    @Column(name = "photohunt_id", nullable = false, updatable = false)
    private UUID photoHuntId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "latitude", nullable = false, precision = 20, scale = 15)
    private BigDecimal latitude;

    @Column(name = "longitude", nullable = false, precision = 20, scale = 15)
    private BigDecimal longitude;

    @Column(name = "reference_image", length = 500)
    private String referenceImage;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
