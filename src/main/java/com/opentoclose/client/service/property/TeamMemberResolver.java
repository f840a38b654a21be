package com.opentoclose.client.service.property;

import com.opentoclose.client.common.apiclient.opentoclose.OpenToCloseApiClient;
import com.opentoclose.client.common.response.ResponseNormalizer;
import com.opentoclose.client.exception.apiclient.OpenToCloseApiException;
import com.opentoclose.client.exception.apiclient.ValidationException;
import com.opentoclose.client.service.validation.ResourceIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Finds the team member a new property is assigned to.
 */
@Slf4j
@RequiredArgsConstructor
public class TeamMemberResolver {

    static final String TEAMS_ENDPOINT = "/teams";
    private static final List<String> MEMBER_ARRAYS = List.of("team_members", "members");

    private final OpenToCloseApiClient apiClient;
    private final ResponseNormalizer normalizer;

    /**
     * Resolves the team member id.
     *
     * <p>An explicit id wins. Otherwise the teams collection is listed and the first member of any
     * team is used.
     *
     * @param explicitId the caller's {@code team_member_id}, may be {@code null}.
     *
     * @return the team member id.
     *
     * @throws ValidationException if the explicit id is invalid, or if no member can be found or the
     *                             lookup fails; the caller must then supply {@code team_member_id}.
     */
    public long resolve(Object explicitId) {
        if (explicitId != null) {
            return ResourceIds.validate(explicitId, "team_member");
        }

        List<Map<String, Object>> teams;
        try {
            teams = normalizer.normalizeList(apiClient.get(TEAMS_ENDPOINT, null));
        } catch (OpenToCloseApiException e) {
            throw new ValidationException("Could not look up a team member for the new property. "
                                          + "Provide team_member_id explicitly.", e);
        }

        for (Map<String, Object> team : teams) {
            for (String arrayName : MEMBER_ARRAYS) {
                if (team.get(arrayName) instanceof List<?> members) {
                    for (Object member : members) {
                        if (member instanceof Map<?, ?> memberMap && memberMap.get("id") != null) {
                            long memberId = ResourceIds.validate(memberMap.get("id"), "team_member");
                            log.debug("Resolved team member {} from team {}", memberId, team.get("id"));
                            return memberId;
                        }
                    }
                }
            }
        }
        throw new ValidationException("No team member found in any team. Provide team_member_id explicitly.");
    }
}
