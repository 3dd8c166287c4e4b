package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.DataQualityTier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of sources with their declared quality tiers.
 *
 * <p>Sources are processed in list order, which must run from the most trusted tier to the
 * least trusted: later sources merge into, rather than overwrite, profiles built by earlier ones.
 */
public final class SourceCatalog {

    /**
     * A source and its declared tier.
     */
    public record SourceDefinition(String name, DataQualityTier tier) {
        public SourceDefinition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(tier, "tier must not be null");
        }
    }

    private static final List<SourceDefinition> DEFAULTS = List.of(
            new SourceDefinition(SourceNames.LLM_PARSED_DB, DataQualityTier.GOLD),
            new SourceDefinition(SourceNames.LEADING_AUTHORITIES, DataQualityTier.SILVER),
            new SourceDefinition(SourceNames.BIGSPEAK, DataQualityTier.SILVER),
            new SourceDefinition(SourceNames.ALL_AMERICAN_SPEAKERS, DataQualityTier.SILVER),
            new SourceDefinition(SourceNames.A_SPEAKERS, DataQualityTier.BRONZE),
            new SourceDefinition(SourceNames.SPEAKERHUB, DataQualityTier.BRONZE),
            new SourceDefinition(SourceNames.SPEAKER_HANDBOOK, DataQualityTier.BRONZE),
            new SourceDefinition(SourceNames.FREE_SPEAKER_BUREAU, DataQualityTier.BRONZE),
            new SourceDefinition(SourceNames.EVENTRAPTOR, DataQualityTier.BRONZE),
            new SourceDefinition(SourceNames.SESSIONIZE, DataQualityTier.BRONZE));

    private final List<SourceDefinition> sources;
    private final Map<String, DataQualityTier> tiers;

    /**
     * @throws IllegalArgumentException if a source repeats or the list is not ordered from most
     *         to least trusted tier
     */
    public SourceCatalog(List<SourceDefinition> sources) {
        Objects.requireNonNull(sources, "sources must not be null");
        Map<String, DataQualityTier> byName = new HashMap<>();
        SourceDefinition previous = null;
        for (SourceDefinition source : sources) {
            if (byName.put(source.name(), source.tier()) != null) {
                throw new IllegalArgumentException("Source '" + source.name() + "' is listed twice");
            }
            if (previous != null && source.tier().isMoreTrustedThan(previous.tier())) {
                throw new IllegalArgumentException("Source '" + source.name() + "' (" + source.tier()
                        + ") is listed after less trusted source '" + previous.name() + "' (" + previous.tier() + ")");
            }
            previous = source;
        }
        this.sources = List.copyOf(sources);
        this.tiers = Map.copyOf(byName);
    }

    public static SourceCatalog defaults() {
        return new SourceCatalog(DEFAULTS);
    }

    public static List<SourceDefinition> defaultSources() {
        return DEFAULTS;
    }

    /**
     * @return the declared tier, {@link DataQualityTier#UNRATED} for an unknown source
     */
    public DataQualityTier tierOf(String sourceName) {
        return tiers.getOrDefault(sourceName, DataQualityTier.UNRATED);
    }

    public List<SourceDefinition> sources() {
        return sources;
    }

    public List<String> orderedSourceNames() {
        List<String> names = new ArrayList<>(sources.size());
        sources.forEach(s -> names.add(s.name()));
        return names;
    }
}
