package com.opentoclose.client.service.validation;

import com.opentoclose.client.exception.apiclient.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ListParamsValidator Tests")
class ListParamsValidatorTest {

    private final ListParamsValidator validator = ListParamsValidator.standard();

    @Test
    @DisplayName("Should accept a positive limit unchanged")
    void shouldAcceptPositiveLimit() {
        assertThat(validator.validate(Map.of("limit", 50))).isEqualTo(Map.of("limit", 50));
    }

    @Test
    @DisplayName("Should reject a zero limit")
    void shouldRejectZeroLimit() {
        assertThatThrownBy(() -> validator.validate(Map.of("limit", 0)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be a positive integer, got 0");
    }

    @Test
    @DisplayName("Should coerce numeric strings and reject other strings")
    void shouldCoerceNumericStrings() {
        assertThat(validator.validate(Map.of("limit", "20", "offset", "40")))
                .containsEntry("limit", 20)
                .containsEntry("offset", 40);
        assertThatThrownBy(() -> validator.validate(Map.of("limit", "many")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be an integer, got String: many");
    }

    @Test
    @DisplayName("Should reject a negative offset and accept a large limit")
    void shouldCheckRanges() {
        assertThatThrownBy(() -> validator.validate(Map.of("offset", -1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("offset must be non-negative");
        assertThat(validator.validate(Map.of("limit", 5000))).containsEntry("limit", 5000);
    }

    @Test
    @DisplayName("Should treat null as no parameters and reject non-map input")
    void shouldHandleNullAndNonMap() {
        assertThat(validator.validate(null)).isEmpty();
        assertThatThrownBy(() -> validator.validate("limit=5"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("List parameters must be a map, got String");
    }

    @Test
    @DisplayName("Should pass unknown keys through without touching the input")
    void shouldNotMutateInput() {
        Map<String, Object> params = new HashMap<>();
        params.put("limit", "10");
        params.put("search", "smith");

        Map<String, Object> validated = validator.validate(params);

        assertThat(validated).containsEntry("search", "smith").containsEntry("limit", 10);
        assertThat(params).containsEntry("limit", "10");
    }

    @Test
    @DisplayName("Should require declared filters to be non-blank strings")
    void shouldCheckStringFilters() {
        assertThat(ResourceRules.TAGS_LIST.validate(Map.of("category", "status"))).containsEntry("category", "status");
        assertThatThrownBy(() -> ResourceRules.TAGS_LIST.validate(Map.of("category", " ")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("category filter must be a non-empty string");
        assertThatThrownBy(() -> ResourceRules.TASKS_LIST.validate(Map.of("status", 3)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Integer: 3");
    }

    @Test
    @DisplayName("Should require boolean filters to be real booleans")
    void shouldCheckBooleanFilters() {
        assertThat(ResourceRules.TAGS_LIST.validate(Map.of("is_active", true))).containsEntry("is_active", true);
        assertThatThrownBy(() -> ResourceRules.TAGS_LIST.validate(Map.of("is_active", "yes")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("is_active filter must be a boolean, got String: yes");
    }

    @Test
    @DisplayName("Should check the priority filter of notes and tasks")
    void shouldCheckPriorityFilters() {
        assertThatThrownBy(() -> ResourceRules.NOTES_LIST.validate(Map.of("priority", "")))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("priority filter must be a non-empty string");
        assertThatThrownBy(() -> ResourceRules.TASKS_LIST.validate(Map.of("priority", 2)))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("priority filter must be a non-empty string");
    }
}
