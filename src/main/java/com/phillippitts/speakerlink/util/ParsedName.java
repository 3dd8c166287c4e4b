package com.phillippitts.speakerlink.util;

import java.util.List;

/**
 * Result of {@link NameParser#parse(String)}.
 *
 * @param fullName     cleaned display name, empty when nothing usable remained
 * @param firstName    first token of the cleaned name
 * @param lastName     last token of the cleaned name
 * @param honorific    stripped leading title, or {@code null}
 * @param postNominals stripped credential suffixes such as "PhD" or "CSP", in input order
 * @param pronouns     parenthesised pronouns such as "she/her", or {@code null}
 */
public record ParsedName(
        String fullName,
        String firstName,
        String lastName,
        String honorific,
        List<String> postNominals,
        String pronouns
) {

    public ParsedName {
        fullName = fullName == null ? "" : fullName;
        postNominals = postNominals == null ? List.of() : List.copyOf(postNominals);
    }

    public boolean isUsable() {
        return !fullName.isBlank() && lastName != null && !lastName.isBlank();
    }
}
