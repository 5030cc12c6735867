package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Authorization a tool needs before it can run. Carried to the orchestrator
 * as metadata; nothing in this runtime enforces it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthRequirement(
    @JsonProperty("provider_id") String providerId,
    @JsonProperty("provider_type") String providerType,
    @JsonProperty("id") String id,
    @JsonProperty("scopes") List<String> scopes
) {

    public static final String OAUTH2 = "oauth2";

    public AuthRequirement {
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }

    public static AuthRequirement oauth2(String providerId, String... scopes) {
        return new AuthRequirement(providerId, OAUTH2, null, List.of(scopes));
    }

    public static AuthRequirement google(String... scopes) { return oauth2("google", scopes); }
    public static AuthRequirement slack(String... scopes) { return oauth2("slack", scopes); }
    public static AuthRequirement github(String... scopes) { return oauth2("github", scopes); }
    public static AuthRequirement microsoft(String... scopes) { return oauth2("microsoft", scopes); }
    public static AuthRequirement dropbox(String... scopes) { return oauth2("dropbox", scopes); }
    public static AuthRequirement atlassian(String... scopes) { return oauth2("atlassian", scopes); }
}
