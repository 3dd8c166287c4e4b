package com.phillippitts.speakerlink.domain;

import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Contact field group.
 *
 * @param email       public contact email
 * @param website     personal website
 * @param socialLinks platform name (linkedin, twitter, ...) to URL
 * @param profileUrls source profile pages
 */
public record Contact(
        String email,
        String website,
        SortedMap<String, String> socialLinks,
        SortedSet<String> profileUrls
) {

    public static final Contact EMPTY = new Contact(null, null, null, null);

    public Contact {
        email = DomainValues.trimToNull(email);
        website = DomainValues.trimToNull(website);
        socialLinks = DomainValues.sortedMap(socialLinks);
        profileUrls = DomainValues.sortedSet(profileUrls);
    }

    /**
     * @return website, social links and profile pages as one set of raw URLs
     */
    public SortedSet<String> allUrls() {
        TreeSet<String> urls = new TreeSet<>(profileUrls);
        urls.addAll(socialLinks.values());
        if (website != null) {
            urls.add(website);
        }
        return urls;
    }
}
