package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.dto.sequence.VariableDtos;
import com.pumpd.backend.models.Restaurant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class VariableResolutionServiceTest {

    // 16 January 2025, 13:00 in Auckland
    private static final Instant NOW = Instant.parse("2025-01-16T00:00:00Z");

    private VariableResolutionService service;
    private Restaurant restaurant;

    @BeforeEach
    void setUp() {
        service = new VariableResolutionService(Clock.fixed(NOW, ZoneOffset.UTC), new SequenceProperties());

        restaurant = Restaurant.builder()
                .id(42L)
                .organisationId(1L)
                .name("Bella Pizza")
                .city("Auckland")
                .contactName("John  Smith")
                .subdomain("bella-pizza")
                .cuisine(List.of("Italian", "Pizza"))
                .websiteType("custom_domain")
                .uberAov(new BigDecimal("32.5"))
                .uberMarkup(new BigDecimal("25"))
                .weeklyUberSalesVolume(new BigDecimal("1250"))
                .build();
    }

    @Test
    void resolve_ReplacesKnownVariables() {
        // When
        String result = service.resolve("Hi {first_name}, {restaurant_name} in {city} serves {cuisine}", restaurant);

        // Then
        assertThat(result).isEqualTo("Hi John, Bella Pizza in Auckland serves Italian, Pizza");
    }

    @Test
    void resolve_RepeatedVariable_ReplacedEverywhere() {
        String result = service.resolve("{restaurant_name}! {restaurant_name}?", restaurant);

        assertThat(result).isEqualTo("Bella Pizza! Bella Pizza?");
    }

    @Test
    void resolve_UnknownVariable_LeftAsWritten() {
        String result = service.resolve("Hello {restaurant_name}, {not_a_variable}", restaurant);

        assertThat(result).isEqualTo("Hello Bella Pizza, {not_a_variable}");
    }

    @Test
    void resolve_NullOrEmptyInput_ReturnedUnchanged() {
        assertThat(service.resolve(null, restaurant)).isNull();
        assertThat(service.resolve("", restaurant)).isEmpty();
        assertThat(service.resolve("Hi {restaurant_name}", null)).isEqualTo("Hi {restaurant_name}");
    }

    @Test
    void resolve_MissingValue_RendersEmpty() {
        // Given
        restaurant.setEmail(null);

        // When
        String result = service.resolve("Email: [{restaurant_email}]", restaurant);

        // Then
        assertThat(result).isEqualTo("Email: []");
    }

    @Test
    void resolve_ValueWithReplacementCharacters_InsertedLiterally() {
        restaurant.setName("Joe's $5 \\ Pizza");

        String result = service.resolve("Welcome {restaurant_name}", restaurant);

        assertThat(result).isEqualTo("Welcome Joe's $5 \\ Pizza");
    }

    @Test
    void resolve_MappingThrows_VariableLeftAsWritten() {
        // Given
        Restaurant broken = mock(Restaurant.class);
        when(broken.getName()).thenReturn("Broken Bistro");
        when(broken.getSubdomain()).thenThrow(new IllegalStateException("lazy load failed"));

        // When
        String result = service.resolve("{restaurant_name}: {ordering_url}", broken);

        // Then
        assertThat(result).isEqualTo("Broken Bistro: {ordering_url}");
    }

    @Test
    void resolve_PumpdUrls() {
        String result = service.resolve("{ordering_url} {admin_url}", restaurant);

        assertThat(result).isEqualTo("https://bella-pizza.pumpd.co.nz https://admin.pumpd.co.nz");
    }

    @Test
    void resolve_QualificationFormatting() {
        String result = service.resolve(
                "{uber_aov}|{uber_markup}|{weekly_uber_sales_volume}|{self_delivery}|{website_type}", restaurant);

        assertThat(result).isEqualTo("$32.50|25.0%|1,250 orders|Unknown|Custom Domain");
    }

    @Test
    void resolve_DatesUseConfiguredZone() {
        String result = service.resolve("{today}|{current_date}|{current_year}", restaurant);

        assertThat(result).isEqualTo("16/01/2025|Thursday, 16 January 2025|2025");
    }

    @Test
    void relativeDay_DescribesDistanceFromToday() {
        assertThat(service.relativeDay(null)).isEqualTo("Never");
        assertThat(service.relativeDay(OffsetDateTime.parse("2025-01-16T08:00:00+13:00"))).isEqualTo("today");
        assertThat(service.relativeDay(OffsetDateTime.parse("2025-01-15T09:00:00+13:00"))).isEqualTo("yesterday");
        assertThat(service.relativeDay(OffsetDateTime.parse("2025-01-13T09:00:00+13:00"))).isEqualTo("on Monday");
        assertThat(service.relativeDay(OffsetDateTime.parse("2025-01-07T09:00:00+13:00"))).isEqualTo("last Tuesday");
        assertThat(service.relativeDay(OffsetDateTime.parse("2024-12-30T09:00:00+13:00"))).isEqualTo("3 weeks ago");
        assertThat(service.relativeDay(OffsetDateTime.parse("2024-11-01T09:00:00+13:00"))).isEqualTo("last year");
    }

    @Test
    void extract_ReturnsDistinctNamesInOrder() {
        assertThat(service.extract("{b} {a} {b} {c} {not valid}"))
                .containsExactly("b", "a", "c");
    }

    @Test
    void validate_SplitsKnownAndUnknown() {
        // When
        VariableDtos.ValidationResult result = service.validate("Hi {first_name}, see {ordering_url} {mystery}");

        // Then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getKnownVariables()).containsExactly("first_name", "ordering_url");
        assertThat(result.getUnknownVariables()).containsExactly("mystery");
        assertThat(result.getTotalVariables()).isEqualTo(3);
    }

    @Test
    void availableVariables_EveryCatalogueEntryResolves() {
        List<VariableDtos.VariableCategory> categories = service.availableVariables();

        assertThat(categories).hasSize(9);
        categories.stream()
                .flatMap(c -> c.getVariables().stream())
                .forEach(v -> assertThat(service.isKnown(v.getName())).as(v.getName()).isTrue());
    }
}
