package com.phillippitts.speakerlink.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "speakerlink.taxonomy")
public class TaxonomyProperties {

    /** Version stamped on every profile's metadata; changing tables requires a new version. */
    @NotBlank
    private final String version;

    /** Classpath directory holding one {@code <domain>.json} table per taxonomy domain. */
    @NotBlank
    private final String location;

    @ConstructorBinding
    public TaxonomyProperties(String version, String location) {
        this.version = version == null || version.isBlank() ? "2024.1" : version.strip();
        this.location = location == null || location.isBlank() ? "taxonomy" : location.strip();
    }

    public String getVersion() {
        return version;
    }

    public String getLocation() {
        return location;
    }
}
