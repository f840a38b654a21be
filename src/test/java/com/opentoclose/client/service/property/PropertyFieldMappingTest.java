package com.opentoclose.client.service.property;

import com.opentoclose.client.exception.apiclient.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PropertyFieldMapping Tests")
class PropertyFieldMappingTest {

    @Test
    @DisplayName("Should hold the built-in field ids")
    void shouldHoldDefaults() {
        PropertyFieldMapping mapping = PropertyFieldMapping.defaults();

        assertThat(mapping.get("title").id()).isEqualTo(922675L);
        assertThat(mapping.get("client_type").key()).isEqualTo("contract_client_type");
        assertThat(mapping.get("status").options()).hasSize(7);
        assertThat(mapping.get("purchase_amount").isChoice()).isFalse();
    }

    @Test
    @DisplayName("Should override entries without touching the defaults")
    void shouldApplyOverrides() {
        PropertyFieldMapping custom = PropertyFieldMapping.defaults().withOverrides(
                Map.of("client_type", FieldDefinition.choice(100L, "contract_client_type", Map.of("Buyer", 1L))));

        assertThat(custom.get("client_type").resolveOption("client_type", "BUYER")).isEqualTo(1L);
        assertThat(PropertyFieldMapping.defaults().get("client_type").id()).isEqualTo(922663L);
        assertThat(PropertyFieldMapping.defaults().withOverrides(Map.of())).isSameAs(PropertyFieldMapping.defaults());
    }

    @Test
    @DisplayName("Should reject overrides of unknown fields")
    void shouldRejectUnknownOverride() {
        assertThatThrownBy(() -> PropertyFieldMapping.defaults().withOverrides(
                Map.of("bedrooms", FieldDefinition.value(1L, "bedrooms"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Unknown property field 'bedrooms'");
    }
}
