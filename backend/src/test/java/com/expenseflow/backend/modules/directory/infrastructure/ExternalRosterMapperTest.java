package com.expenseflow.backend.modules.directory.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.expenseflow.backend.modules.directory.domain.ExternalEmployeeRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExternalRosterMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExternalRosterMapper mapper = new ExternalRosterMapper();

    @Test
    @DisplayName("reads the roster from an Employees envelope and applies defaults")
    void envelopeAndDefaults() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"Employees": [
                  {"userName": " Greg.Weisz@Example.org "},
                  {"Email": "jane@example.org", "Name": "Jane Mckinney", "title": "Case Manager",
                   "cost_center": "North | South;East"}
                ]}
                """);

        List<ExternalEmployeeRecord> records = mapper.map(body);

        assertThat(records).containsExactly(
                new ExternalEmployeeRecord("greg.weisz@example.org", "Greg Weisz", "Staff", List.of("Program Services")),
                new ExternalEmployeeRecord("jane@example.org", "Jane McKinney", "Case Manager", List.of("North", "South", "East"))
        );
    }

    @Test
    @DisplayName("rows without a usable email are skipped")
    void rowsWithoutEmailSkipped() throws Exception {
        JsonNode body = objectMapper.readTree("""
                [{"name": "No Email"}, {"email": "not-an-email"}, {"email": "ok@example.org"}]
                """);

        assertThat(mapper.map(body)).extracting(ExternalEmployeeRecord::email).containsExactly("ok@example.org");
    }

    @Test
    @DisplayName("rows sharing an id are merged and their cost centers unioned")
    void rowsMergedById() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"data": [
                  {"id": 7, "email": "amy@example.org", "name": "Amy O'brien", "costCenters": [{"name": "East"}]},
                  {"id": 7, "email": "amy@example.org", "name": "Amy O'brien", "costCenters": ["West", "East"]}
                ]}
                """);

        assertThat(mapper.map(body)).containsExactly(
                new ExternalEmployeeRecord("amy@example.org", "Amy O'Brien", "Staff", List.of("East", "West")));
    }

    @Test
    @DisplayName("unknown payload shapes yield an empty roster")
    void unknownShape() throws Exception {
        assertThat(mapper.map(objectMapper.readTree("{\"status\": \"ok\"}"))).isEmpty();
        assertThat(mapper.map(null)).isEmpty();
    }

    @Test
    @DisplayName("Mc, Mac and O' prefixes are capitalized")
    void formatName() {
        assertThat(ExternalRosterMapper.formatName("mcdonald macarthur o'neil smith"))
                .isEqualTo("McDonald MacArthur O'Neil smith");
    }
}
