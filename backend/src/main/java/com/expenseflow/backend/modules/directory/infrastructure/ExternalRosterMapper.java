package com.expenseflow.backend.modules.directory.infrastructure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.expenseflow.backend.modules.directory.domain.ExternalEmployeeRecord;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the loosely shaped HR roster payload into {@link ExternalEmployeeRecord}s.
 *
 * <p>The payload is either a bare array or an object wrapping the array under one of several keys.
 * Field names vary between roster exports, so each field is read from a list of aliases.</p>
 */
@Component
public class ExternalRosterMapper {

    private static final Logger log = LoggerFactory.getLogger(ExternalRosterMapper.class);

    static final String DEFAULT_COST_CENTER = "Program Services";
    static final String DEFAULT_POSITION = "Staff";

    private static final List<String> ENVELOPE_KEYS =
            List.of("data", "employees", "Employees", "users", "records", "items", "result");
    private static final List<String> ID_KEYS = List.of("id", "Id");
    private static final List<String> EMAIL_KEYS = List.of("email", "Email", "mail", "userName");
    private static final List<String> NAME_KEYS =
            List.of("name", "Name", "fullName", "full_name", "displayName", "DisplayName");
    private static final List<String> POSITION_KEYS = List.of("position", "Position", "title", "jobTitle");
    private static final List<String> COST_CENTER_KEYS = List.of(
            "costCenters", "cost_centers", "CostCenters", "CostCenter",
            "costCenter", "cost_center", "CostCenterName", "costCenterName",
            "Department", "Departments", "department", "departments",
            "Division", "division", "Location", "Locations", "location");
    private static final List<String> COST_CENTER_VALUE_KEYS = List.of("name", "code", "value", "displayName");

    private static final Pattern COST_CENTER_SEPARATOR = Pattern.compile("[,|;]");
    private static final Pattern MC_PREFIX = Pattern.compile("^[Mm]c(.+)$");
    private static final Pattern MAC_PREFIX = Pattern.compile("^[Mm]ac(.+)$");
    private static final Pattern O_PREFIX = Pattern.compile("^[oO]'(.+)$");

    public List<ExternalEmployeeRecord> map(JsonNode body) {
        List<JsonNode> rows = unwrap(body);

        Map<String, List<JsonNode>> byPerson = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            String key = personKey(row);
            if (key == null) {
                continue;
            }
            byPerson.computeIfAbsent(key, ignored -> new ArrayList<>()).add(row);
        }

        List<ExternalEmployeeRecord> records = new ArrayList<>();
        int rejected = 0;
        for (List<JsonNode> group : byPerson.values()) {
            Set<String> costCenters = new LinkedHashSet<>();
            group.forEach(row -> costCenters.addAll(parseCostCenters(row)));
            ExternalEmployeeRecord record = mapRecord(group.get(0), List.copyOf(costCenters));
            if (record == null) {
                rejected++;
                continue;
            }
            records.add(record);
        }
        if (rejected > 0) {
            log.warn("Skipped {} roster rows without a usable email", rejected);
        }
        return records;
    }

    List<JsonNode> unwrap(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return List.of();
        }
        if (body.isArray()) {
            return toList(body);
        }
        if (body.isObject()) {
            for (String key : ENVELOPE_KEYS) {
                JsonNode candidate = body.get(key);
                if (candidate != null && candidate.isArray()) {
                    return toList(candidate);
                }
            }
        }
        return List.of();
    }

    ExternalEmployeeRecord mapRecord(JsonNode row, List<String> costCenters) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String email = firstText(row, EMAIL_KEYS);
        if (email == null) {
            return null;
        }
        email = email.toLowerCase(Locale.ROOT);
        if (!email.contains("@")) {
            return null;
        }

        String name = firstText(row, NAME_KEYS);
        if (name == null) {
            name = nameFromEmail(email);
        }
        if (name == null || name.isBlank()) {
            return null;
        }

        String position = firstText(row, POSITION_KEYS);
        List<String> resolvedCostCenters = costCenters.isEmpty() ? List.of(DEFAULT_COST_CENTER) : costCenters;
        return new ExternalEmployeeRecord(
                email,
                formatName(name),
                position == null ? DEFAULT_POSITION : position,
                resolvedCostCenters
        );
    }

    List<String> parseCostCenters(JsonNode row) {
        if (row == null || !row.isObject()) {
            return List.of();
        }
        JsonNode raw = null;
        for (String key : COST_CENTER_KEYS) {
            JsonNode candidate = row.get(key);
            if (candidate != null && !candidate.isNull()) {
                raw = candidate;
                break;
            }
        }
        if (raw == null) {
            return List.of();
        }
        if (raw.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : raw) {
                String value = element.isObject() ? firstText(element, COST_CENTER_VALUE_KEYS) : textOf(element);
                if (value != null) {
                    values.add(value);
                }
            }
            return values;
        }
        if (raw.isObject()) {
            String value = firstText(raw, COST_CENTER_VALUE_KEYS);
            return value == null ? List.of() : List.of(value);
        }
        String text = textOf(raw);
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(COST_CENTER_SEPARATOR.split(text))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toList();
    }

    /**
     * Capitalizes Mc, Mac and O' surnames ({@code Mckinney -> McKinney}); other words are kept as given.
     */
    static String formatName(String name) {
        return Arrays.stream(name.trim().split("\\s+"))
                .map(ExternalRosterMapper::formatWord)
                .collect(Collectors.joining(" "));
    }

    /**
     * {@code greg.weisz@example.org -> Greg Weisz}.
     */
    static String nameFromEmail(String email) {
        String local = email.split("@", 2)[0];
        if (local.isEmpty()) {
            return null;
        }
        return Arrays.stream(local.replaceAll("[._-]", " ").trim().split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String formatWord(String word) {
        Matcher mc = MC_PREFIX.matcher(word);
        if (mc.matches()) {
            return "Mc" + capitalize(mc.group(1));
        }
        Matcher mac = MAC_PREFIX.matcher(word);
        if (mac.matches()) {
            return "Mac" + capitalize(mac.group(1));
        }
        Matcher o = O_PREFIX.matcher(word);
        if (o.matches()) {
            return "O'" + capitalize(o.group(1));
        }
        return word;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String personKey(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String id = firstText(row, ID_KEYS);
        if (id != null) {
            return "id:" + id;
        }
        String email = firstText(row, EMAIL_KEYS);
        return email == null ? null : "email:" + email.toLowerCase(Locale.ROOT);
    }

    private static String firstText(JsonNode node, List<String> keys) {
        for (String key : keys) {
            String value = textOf(node.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> rows = new ArrayList<>(array.size());
        array.forEach(rows::add);
        return rows;
    }
}
