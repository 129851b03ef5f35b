package com.pumpd.backend.config;

import com.pumpd.backend.enums.PausePolicy;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

@Configuration
@ConfigurationProperties(prefix = "app.sequences")
@Data
@Slf4j
public class SequenceProperties {

    /** Domain the restaurant's ordering site lives under, as {subdomain}.{orderingDomain}. */
    private String orderingDomain = "pumpd.co.nz";

    private String adminUrl = "https://admin.pumpd.co.nz";

    /** Locale and zone used for date and number variables. */
    private String locale = "en-NZ";
    private String zone = "Pacific/Auckland";

    private PausePolicy pausePolicy = PausePolicy.FROZEN;

    private Bulk bulk = new Bulk();

    @Data
    public static class Bulk {
        private int maxRestaurants = 100;
        private Duration baseTimeout = Duration.ofSeconds(30);
        private Duration perRestaurantTimeout = Duration.ofSeconds(2);

        public Duration budgetFor(int restaurantCount) {
            return baseTimeout.plus(perRestaurantTimeout.multipliedBy(restaurantCount));
        }
    }

    @PostConstruct
    public void init() {
        log.info("Sequence engine: pause policy {}, bulk limit {} restaurants, bulk budget {} + {} per restaurant",
                pausePolicy, bulk.getMaxRestaurants(), bulk.getBaseTimeout(), bulk.getPerRestaurantTimeout());
    }

    public Locale resolveLocale() {
        return Locale.forLanguageTag(locale);
    }

    public ZoneId resolveZone() {
        return ZoneId.of(zone);
    }
}
