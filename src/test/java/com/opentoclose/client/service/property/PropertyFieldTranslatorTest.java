package com.opentoclose.client.service.property;

import com.opentoclose.client.exception.apiclient.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PropertyFieldTranslator Tests")
class PropertyFieldTranslatorTest {

    private static final PropertyFieldMapping MAPPING = PropertyFieldMapping.defaults();

    @Mock
    private TeamMemberResolver teamMemberResolver;

    private PropertyFieldTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new PropertyFieldTranslator(MAPPING, teamMemberResolver);
        lenient().when(teamMemberResolver.resolve(null)).thenReturn(77L);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> fields(Map<String, Object> wire) {
        return (List<Map<String, Object>>) wire.get("fields");
    }

    private static Map<String, Object> field(Map<String, Object> wire, String key) {
        return fields(wire).stream().filter(f -> key.equals(f.get("key"))).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("Bare title")
    class BareTitle {

        @Test
        @DisplayName("Should emit title, Buyer and Active with a resolved team member")
        void shouldTranslateTitle() {
            Map<String, Object> wire = translator.translate("My House");

            assertThat(wire).containsEntry("team_member_id", 77L).containsEntry("time_zone_id", 1L);
            assertThat(fields(wire)).hasSize(3);
            assertThat(field(wire, "contract_title")).containsEntry("id", 922675L).containsEntry("value", "My House");
            assertThat(field(wire, "contract_client_type"))
                    .containsEntry("value", MAPPING.get("client_type").options().get("Buyer"));
            assertThat(field(wire, "contract_status"))
                    .containsEntry("value", MAPPING.get("status").options().get("Active"));
        }

        @Test
        @DisplayName("Should reject a blank title before any lookup")
        void shouldRejectBlankTitle() {
            assertThatThrownBy(() -> translator.translate("  "))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("title is required");
            verify(teamMemberResolver, never()).resolve(any());
        }
    }

    @Nested
    @DisplayName("Human fields")
    class HumanFields {

        @Test
        @DisplayName("Should resolve choices regardless of case")
        void shouldResolveChoicesCaseInsensitively() {
            Map<String, Object> lower = translator.translate(Map.of("title", "X", "client_type", "buyer"));
            Map<String, Object> upper = translator.translate(Map.of("title", "X", "client_type", "BUYER"));

            assertThat(lower).isEqualTo(upper);
            assertThat(field(lower, "contract_client_type")).containsEntry("value", 797212L);
        }

        @Test
        @DisplayName("Should list the valid choices for an unknown status")
        void shouldRejectUnknownStatus() {
            assertThatThrownBy(() -> translator.translate(Map.of("title", "X", "status", "nonexistent-status")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Invalid status 'nonexistent-status'. Valid choices: Pre-MLS, Active, "
                                + "Under Contract, Pending, Closed, Withdrawn, Cancelled");
        }

        @Test
        @DisplayName("Should omit optional fields the caller did not supply")
        void shouldOmitAbsentFields() {
            Map<String, Object> wire = translator.translate(Map.of("title", "Lake Lot"));

            assertThat(fields(wire)).extracting(f -> f.get("key")).containsExactly("contract_title");
        }

        @Test
        @DisplayName("Should coerce the purchase amount and reject negative values")
        void shouldHandlePurchaseAmount() {
            Map<String, Object> wire = translator.translate(Map.of("title", "X", "purchase_amount", "450000"));

            assertThat(field(wire, "contract_purchase_amount")).containsEntry("value", new BigDecimal("450000"));
            assertThatThrownBy(() -> translator.translate(Map.of("title", "X", "purchase_amount", -5)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("purchase_amount must be non-negative, got -5");
            assertThatThrownBy(() -> translator.translate(Map.of("title", "X", "purchase_amount", "lots")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("purchase_amount must be a number");
        }

        @Test
        @DisplayName("Should use an explicit team member and time zone")
        void shouldUseExplicitIds() {
            when(teamMemberResolver.resolve(12)).thenReturn(12L);

            Map<String, Object> wire = translator.translate(Map.of("title", "X", "team_member_id", 12,
                                                                   "time_zone_id", 4));

            assertThat(wire).containsEntry("team_member_id", 12L).containsEntry("time_zone_id", 4L);
        }

        @Test
        @DisplayName("Should propagate a failed team member lookup")
        void shouldFailWithoutTeamMember() {
            when(teamMemberResolver.resolve(null)).thenThrow(new ValidationException("No team member found"));

            assertThatThrownBy(() -> translator.translate("My House"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("No team member found");
        }
    }

    @Nested
    @DisplayName("Wire format")
    class WireFormat {

        @Test
        @DisplayName("Should pass a wire payload through")
        void shouldPassThrough() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("team_member_id", 5);
            payload.put("time_zone_id", 2);
            payload.put("fields", List.of(Map.of("id", 922675, "value", "Direct")));

            assertThat(translator.translate(payload)).isEqualTo(payload);
            verify(teamMemberResolver, never()).resolve(any());
        }

        @Test
        @DisplayName("Should reject malformed field entries")
        void shouldRejectMalformedFields() {
            assertThatThrownBy(() -> translator.translate(Map.of("team_member_id", 5, "fields", "title")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("fields must be a list");
            assertThatThrownBy(() -> translator.translate(Map.of("team_member_id", 5, "fields", List.of(Map.of("value", 1)))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Each entry of fields must be a map with an id");
        }
    }

    @Test
    @DisplayName("Should reject unsupported input types")
    void shouldRejectUnsupportedType() {
        assertThatThrownBy(() -> translator.translate(42))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Property data must be a title string or a map, got Integer");
    }
}
