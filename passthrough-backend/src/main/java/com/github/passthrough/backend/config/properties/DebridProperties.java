package com.github.passthrough.backend.config.properties;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import javax.validation.constraints.NotNull;
import java.net.URI;

@Data
public class DebridProperties {
    public static final String TOKEN_PLACEHOLDER = "YOUR_REAL_DEBRID_TOKEN_HERE";

    /**
     * The base url of the debrid REST API.
     */
    @NotNull
    private URI url = URI.create("https://api.real-debrid.com/rest/1.0");
    /**
     * The API token which is sent as bearer token.
     */
    private String token;

    /**
     * Verify if an actual API token has been configured.
     *
     * @return Returns true when the token is present and not the placeholder value.
     */
    public boolean isTokenConfigured() {
        return StringUtils.isNotBlank(token) && !TOKEN_PLACEHOLDER.equals(token.trim());
    }
}
