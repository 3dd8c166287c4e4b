package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.exception.MalformedRecordException;
import com.phillippitts.speakerlink.util.NameParser;
import com.phillippitts.speakerlink.util.ParsedName;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract base class for source adapters implementing the common name handling.
 *
 * <p>This class implements the Template Method pattern: {@link #adapt(Map)} extracts and parses
 * the name, rejects documents without a usable one, and delegates the source-specific fields to
 * {@link #populate(Map, SourceRecord.Builder)}.
 *
 * <p><b>Name handling:</b>
 * <ul>
 *   <li>Blank names and placeholders such as "N/A" make the document malformed</li>
 *   <li>Post-nominal credentials ("PhD", "CSP") become raw credential terms</li>
 *   <li>Parenthesised pronouns become the record's pronouns</li>
 *   <li>A document without an id is keyed by its normalized name</li>
 * </ul>
 *
 * @since 1.0
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

    private static final Set<String> PLACEHOLDER_NAMES = Set.of("n/a", "na", "none", "null", "unknown", "tbd");

    @Override
    public final SourceRecord adapt(Map<String, Object> document) {
        Objects.requireNonNull(document, "document must not be null");
        String localId = extractLocalId(document);
        ParsedName name = NameParser.parse(extractName(document));
        if (!name.isUsable() || PLACEHOLDER_NAMES.contains(name.fullName().toLowerCase(Locale.ROOT))) {
            throw new MalformedRecordException(sourceName(), localId == null ? "unknown" : localId,
                    "no usable name");
        }

        String id = localId != null ? localId : "name:" + NameParser.comparisonName(name.fullName());
        SourceRecord.Builder builder = SourceRecord.builder(sourceName(), id)
                .name(name.fullName(), name.firstName(), name.lastName(), name.honorific())
                .terms(TaxonomyDomain.CREDENTIAL, name.postNominals())
                .pronouns(name.pronouns());
        populate(document, builder);
        return builder.build();
    }

    /**
     * Returns the raw name of the document, or {@code null} when it has none.
     */
    protected abstract String extractName(Map<String, Object> document);

    /**
     * Returns the source-local id or URL of the document, or {@code null} when it has none.
     */
    protected abstract String extractLocalId(Map<String, Object> document);

    /**
     * Copies the source-specific fields into the builder. The name is already set.
     */
    protected abstract void populate(Map<String, Object> document, SourceRecord.Builder builder);
}
