package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.dto.sequence.VariableDtos.ValidationResult;
import com.pumpd.backend.dto.sequence.VariableDtos.VariableCategory;
import com.pumpd.backend.dto.sequence.VariableDtos.VariableInfo;
import com.pumpd.backend.exceptions.VariableRenderException;
import com.pumpd.backend.models.Restaurant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {variable_name} placeholders in message text from a restaurant.
 * Resolution never throws: unknown variables and variables whose value cannot be
 * computed are left in the output as written.
 */
@Service
@Slf4j
public class VariableResolutionService {

    static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)\\}");

    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final Map<String, String> WEBSITE_TYPES = Map.of(
            "custom_domain", "Custom Domain",
            "platform_subdomain", "Platform Subdomain",
            "no_website", "No Website"
    );

    private final Clock clock;
    private final SequenceProperties properties;
    private final Map<String, Function<Restaurant, String>> mappings;

    public VariableResolutionService(Clock clock, SequenceProperties properties) {
        this.clock = clock;
        this.properties = properties;
        this.mappings = buildMappings();
    }

    /**
     * Distinct variable names referenced in the text, in order of first appearance.
     */
    public Set<String> extract(String text) {
        Set<String> variables = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return variables;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(text);
        while (matcher.find()) {
            variables.add(matcher.group(1));
        }
        return variables;
    }

    public String resolve(String text, Restaurant restaurant) {
        if (text == null || text.isEmpty() || restaurant == null) {
            return text;
        }

        Map<String, String> resolved = new HashMap<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(text);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String token = matcher.group(0);
            String name = matcher.group(1);
            String value = resolved.computeIfAbsent(name, n -> valueOrLiteral(n, token, restaurant));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);

        return result.toString();
    }

    public boolean isKnown(String variableName) {
        return mappings.containsKey(variableName);
    }

    public ValidationResult validate(String text) {
        Set<String> variables = extract(text);
        List<String> known = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String variable : variables) {
            if (isKnown(variable)) {
                known.add(variable);
            } else {
                unknown.add(variable);
            }
        }

        return ValidationResult.builder()
                .valid(unknown.isEmpty())
                .knownVariables(known)
                .unknownVariables(unknown)
                .totalVariables(variables.size())
                .build();
    }

    private String valueOrLiteral(String name, String token, Restaurant restaurant) {
        Function<Restaurant, String> mapping = mappings.get(name);
        if (mapping == null) {
            return token;
        }
        try {
            return compute(name, mapping, restaurant);
        } catch (VariableRenderException e) {
            log.warn("Leaving {} unrendered for restaurant {}: {}", token, restaurant.getId(), e.getMessage());
            return token;
        }
    }

    private String compute(String name, Function<Restaurant, String> mapping, Restaurant restaurant) {
        try {
            String value = mapping.apply(restaurant);
            return value != null ? value : "";
        } catch (RuntimeException e) {
            throw new VariableRenderException(name, e);
        }
    }

    private Map<String, Function<Restaurant, String>> buildMappings() {
        Map<String, Function<Restaurant, String>> map = new LinkedHashMap<>();

        // Restaurant
        map.put("restaurant_name", Restaurant::getName);
        map.put("restaurant_email", Restaurant::getEmail);
        map.put("restaurant_phone", Restaurant::getPhone);
        map.put("restaurant_address", Restaurant::getAddress);
        map.put("restaurant_website", Restaurant::getWebsite);
        map.put("city", Restaurant::getCity);
        map.put("cuisine", r -> joinList(r.getCuisine()));

        // Contact
        map.put("contact_name", Restaurant::getContactName);
        map.put("first_name", r -> firstName(r.getContactName()));
        map.put("contact_email", Restaurant::getContactEmail);
        map.put("contact_phone", Restaurant::getContactPhone);

        // Business
        map.put("organisation_name", Restaurant::getOrganisationName);
        map.put("opening_hours_text", Restaurant::getOpeningHoursText);

        // Sales
        map.put("lead_stage", r -> r.getLeadStage() != null ? r.getLeadStage().replace('_', ' ') : "");
        map.put("lead_warmth", Restaurant::getLeadWarmth);
        map.put("lead_status", Restaurant::getLeadStatus);
        map.put("icp_rating", r -> asText(r.getIcpRating()));

        // Demo store
        map.put("demo_store_url", Restaurant::getDemoStoreUrl);
        map.put("demo_store_built", r -> Boolean.TRUE.equals(r.getDemoStoreBuilt()) ? "Yes" : "No");

        // Ordering site
        map.put("subdomain", Restaurant::getSubdomain);
        map.put("ordering_url", this::orderingUrl);
        map.put("admin_url", r -> properties.getAdminUrl());

        // Platforms
        map.put("ubereats_url", Restaurant::getUbereatsUrl);
        map.put("doordash_url", Restaurant::getDoordashUrl);
        map.put("instagram_url", Restaurant::getInstagramUrl);
        map.put("facebook_url", Restaurant::getFacebookUrl);

        // Dates
        map.put("today", r -> today().format(SHORT_DATE));
        map.put("current_date", r -> today().format(
                DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", properties.resolveLocale())));
        map.put("current_year", r -> String.valueOf(today().getYear()));
        map.put("last_contacted_day", r -> relativeDay(r.getLastContacted()));

        // Qualification
        map.put("contact_role", Restaurant::getContactRole);
        map.put("number_of_venues", r -> asText(r.getNumberOfVenues()));
        map.put("point_of_sale", Restaurant::getPointOfSale);
        map.put("online_ordering_platform", Restaurant::getOnlineOrderingPlatform);
        map.put("online_ordering_handles_delivery", r -> yesNoUnknown(r.getOnlineOrderingHandlesDelivery()));
        map.put("self_delivery", r -> yesNoUnknown(r.getSelfDelivery()));
        map.put("weekly_uber_sales_volume", r -> formatNumber(r.getWeeklyUberSalesVolume(), "orders"));
        map.put("uber_aov", r -> formatCurrency(r.getUberAov()));
        map.put("uber_markup", r -> formatPercentage(r.getUberMarkup()));
        map.put("uber_profitability", r -> formatPercentage(r.getUberProfitability()));
        map.put("uber_profitability_description", Restaurant::getUberProfitabilityDescription);
        map.put("current_marketing_description", Restaurant::getCurrentMarketingDescription);
        map.put("qualification_details", Restaurant::getDetails);
        map.put("painpoints", r -> joinList(r.getPainpoints()));
        map.put("core_selling_points", r -> joinList(r.getCoreSellingPoints()));
        map.put("features_to_highlight", r -> joinList(r.getFeaturesToHighlight()));
        map.put("possible_objections", r -> joinList(r.getPossibleObjections()));
        map.put("meeting_link", Restaurant::getMeetingLink);
        map.put("website_type", r -> r.getWebsiteType() != null
                ? WEBSITE_TYPES.getOrDefault(r.getWebsiteType(), r.getWebsiteType())
                : "");

        return Collections.unmodifiableMap(map);
    }

    // ================================
    // FORMATTERS
    // ================================

    private String orderingUrl(Restaurant restaurant) {
        if (restaurant.getSubdomain() == null || restaurant.getSubdomain().isBlank()) {
            return "";
        }
        return "https://" + restaurant.getSubdomain().trim() + "." + properties.getOrderingDomain();
    }

    private static String firstName(String contactName) {
        if (contactName == null || contactName.isBlank()) {
            return "";
        }
        return contactName.trim().split("\\s+")[0];
    }

    private static String joinList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return String.join(", ", values);
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : "";
    }

    private static String yesNoUnknown(Boolean value) {
        if (value == null) {
            return "Unknown";
        }
        return value ? "Yes" : "No";
    }

    private String formatNumber(BigDecimal value, String suffix) {
        if (value == null) {
            return "";
        }
        NumberFormat format = NumberFormat.getNumberInstance(properties.resolveLocale());
        format.setMaximumFractionDigits(3);
        String formatted = format.format(value);
        return suffix != null ? formatted + " " + suffix : formatted;
    }

    private static String formatCurrency(BigDecimal value) {
        if (value == null) {
            return "";
        }
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String formatPercentage(BigDecimal value) {
        if (value == null) {
            return "";
        }
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(properties.resolveZone()));
    }

    /**
     * Natural-language distance from the last contact to today, e.g. "yesterday", "last Tuesday", "in March".
     */
    String relativeDay(OffsetDateTime lastContacted) {
        if (lastContacted == null) {
            return "Never";
        }

        ZoneId zone = properties.resolveZone();
        Locale locale = properties.resolveLocale();
        LocalDate today = today();
        LocalDate contacted = lastContacted.atZoneSameInstant(zone).toLocalDate();
        long days = ChronoUnit.DAYS.between(contacted, today);

        if (days == 0) {
            return "today";
        }
        if (days == 1) {
            return "yesterday";
        }
        if (days < 7) {
            return "on " + contacted.getDayOfWeek().getDisplayName(TextStyle.FULL, locale);
        }
        if (days < 14) {
            return "last " + contacted.getDayOfWeek().getDisplayName(TextStyle.FULL, locale);
        }
        if (days < 30) {
            return (days / 7 + 1) + " weeks ago";
        }
        if (contacted.getYear() == today.getYear()) {
            return "in " + contacted.getMonth().getDisplayName(TextStyle.FULL, locale);
        }
        return "last year";
    }

    // ================================
    // CATALOGUE
    // ================================

    /**
     * Every supported variable, grouped for the message editor.
     */
    public List<VariableCategory> availableVariables() {
        return List.of(
                category("Restaurant Information",
                        info("restaurant_name", "Restaurant name", "Bella Pizza"),
                        info("restaurant_email", "Restaurant email", "hello@bellapizza.co.nz"),
                        info("restaurant_phone", "Restaurant phone", "09 123 4567"),
                        info("restaurant_address", "Restaurant address", "123 Main St, Auckland"),
                        info("restaurant_website", "Restaurant website", "www.bellapizza.co.nz"),
                        info("city", "Restaurant city", "Auckland"),
                        info("cuisine", "Cuisine type(s)", "Italian, Pizza")),
                category("Contact Information",
                        info("contact_name", "Lead contact name", "John Smith"),
                        info("first_name", "Lead contact first name", "John"),
                        info("contact_email", "Lead contact email", "john@example.com"),
                        info("contact_phone", "Lead contact phone", "021 123 4567")),
                category("Business Information",
                        info("organisation_name", "Organisation name", "Bella Group Ltd"),
                        info("opening_hours_text", "Opening hours text", "Mon-Fri 11am-9pm")),
                category("Sales Information",
                        info("lead_stage", "Current lead stage", "demo booked"),
                        info("lead_warmth", "Lead warmth level", "warm"),
                        info("lead_status", "Lead status", "active"),
                        info("icp_rating", "ICP fit rating (0-10)", "8")),
                category("Demo Store",
                        info("demo_store_url", "Demo store URL", "https://demo-bella.pumpd.co.nz"),
                        info("demo_store_built", "Demo store built status", "Yes")),
                category("Pumpd URLs",
                        info("subdomain", "Pumpd subdomain", "bella-pizza"),
                        info("ordering_url", "Pumpd ordering URL", "https://bella-pizza.pumpd.co.nz"),
                        info("admin_url", "Pumpd admin portal", "https://admin.pumpd.co.nz")),
                category("Platform URLs",
                        info("ubereats_url", "UberEats URL", "https://www.ubereats.com/store/..."),
                        info("doordash_url", "DoorDash URL", "https://www.doordash.com/store/..."),
                        info("instagram_url", "Instagram profile URL", "https://instagram.com/bellapizza"),
                        info("facebook_url", "Facebook page URL", "https://facebook.com/bellapizza")),
                category("Date Variables",
                        info("today", "Today's date (short format)", "16/01/2025"),
                        info("current_date", "Current date (long format)", "Thursday, 16 January 2025"),
                        info("current_year", "Current year", "2025"),
                        info("last_contacted_day", "Last contact date (natural)", "yesterday")),
                category("Qualification Data",
                        info("contact_role", "Contact person's role", "Owner"),
                        info("number_of_venues", "Number of venues", "3"),
                        info("point_of_sale", "POS system used", "Lightspeed"),
                        info("online_ordering_platform", "Online ordering platform", "ChowNow"),
                        info("online_ordering_handles_delivery", "Online ordering handles delivery", "Yes"),
                        info("self_delivery", "Self-delivery capability", "No"),
                        info("weekly_uber_sales_volume", "Weekly UberEats order volume", "250 orders"),
                        info("uber_aov", "Average order value on UberEats", "$32.50"),
                        info("uber_markup", "UberEats menu markup percentage", "25.0%"),
                        info("uber_profitability", "UberEats profitability percentage", "15.5%"),
                        info("uber_profitability_description", "UberEats profitability notes", "Profitable after commission"),
                        info("current_marketing_description", "Current marketing activities", "Social media, email campaigns"),
                        info("qualification_details", "Additional qualification notes", "Very interested in switching"),
                        info("painpoints", "Customer pain points (comma-separated)", "High commission, Slow support"),
                        info("core_selling_points", "Core selling points (comma-separated)", "Lower fees, Better margins"),
                        info("features_to_highlight", "Features to highlight (comma-separated)", "Custom domain, Analytics"),
                        info("possible_objections", "Possible objections (comma-separated)", "Migration effort, Training time"),
                        info("meeting_link", "Meeting/demo link", "https://meet.google.com/abc-defg-hij"),
                        info("website_type", "Website type", "Custom Domain"))
        );
    }

    private static VariableCategory category(String name, VariableInfo... variables) {
        return VariableCategory.builder()
                .category(name)
                .variables(List.of(variables))
                .build();
    }

    private static VariableInfo info(String name, String description, String example) {
        return VariableInfo.builder()
                .name(name)
                .description(description)
                .example(example)
                .build();
    }
}
