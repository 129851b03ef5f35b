package com.pumpd.backend.models;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A restaurant lead. Owned by the lead management side of the CRM;
 * the sequence engine only reads it to fill message variables.
 */
@Entity
@Table(name = "restaurants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Restaurant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organisation_id", nullable = false)
    private Long organisationId;

    @Column(nullable = false)
    private String name;

    private String email;
    private String phone;
    private String address;
    private String website;
    private String city;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "cuisine")
    @Builder.Default
    private List<String> cuisine = new ArrayList<>();

    @Column(name = "organisation_name")
    private String organisationName;

    @Column(name = "opening_hours_text", columnDefinition = "TEXT")
    private String openingHoursText;

    // Lead contact
    @Column(name = "contact_name")
    private String contactName;

    @Column(name = "contact_email")
    private String contactEmail;

    @Column(name = "contact_phone")
    private String contactPhone;

    @Column(name = "contact_role")
    private String contactRole;

    // Sales pipeline
    @Column(name = "lead_stage", length = 50)
    private String leadStage;

    @Column(name = "lead_warmth", length = 50)
    private String leadWarmth;

    @Column(name = "lead_status", length = 50)
    private String leadStatus;

    @Column(name = "icp_rating")
    private Integer icpRating;

    @Column(name = "last_contacted")
    private OffsetDateTime lastContacted;

    // Demo store and ordering site
    @Column(name = "demo_store_url")
    private String demoStoreUrl;

    @Column(name = "demo_store_built")
    private Boolean demoStoreBuilt;

    @Column(name = "subdomain", length = 100)
    private String subdomain;

    @Column(name = "website_type", length = 50)
    private String websiteType;

    // Platform links
    @Column(name = "ubereats_url")
    private String ubereatsUrl;

    @Column(name = "doordash_url")
    private String doordashUrl;

    @Column(name = "instagram_url")
    private String instagramUrl;

    @Column(name = "facebook_url")
    private String facebookUrl;

    // Qualification data gathered on discovery calls
    @Column(name = "number_of_venues")
    private Integer numberOfVenues;

    @Column(name = "point_of_sale")
    private String pointOfSale;

    @Column(name = "online_ordering_platform")
    private String onlineOrderingPlatform;

    @Column(name = "online_ordering_handles_delivery")
    private Boolean onlineOrderingHandlesDelivery;

    @Column(name = "self_delivery")
    private Boolean selfDelivery;

    @Column(name = "weekly_uber_sales_volume", precision = 12, scale = 2)
    private BigDecimal weeklyUberSalesVolume;

    @Column(name = "uber_aov", precision = 10, scale = 2)
    private BigDecimal uberAov;

    @Column(name = "uber_markup", precision = 6, scale = 2)
    private BigDecimal uberMarkup;

    @Column(name = "uber_profitability", precision = 6, scale = 2)
    private BigDecimal uberProfitability;

    @Column(name = "uber_profitability_description", columnDefinition = "TEXT")
    private String uberProfitabilityDescription;

    @Column(name = "current_marketing_description", columnDefinition = "TEXT")
    private String currentMarketingDescription;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "painpoints")
    @Builder.Default
    private List<String> painpoints = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "core_selling_points")
    @Builder.Default
    private List<String> coreSellingPoints = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "features_to_highlight")
    @Builder.Default
    private List<String> featuresToHighlight = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "possible_objections")
    @Builder.Default
    private List<String> possibleObjections = new ArrayList<>();

    @Column(name = "meeting_link")
    private String meetingLink;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
