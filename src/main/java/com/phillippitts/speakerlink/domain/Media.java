package com.phillippitts.speakerlink.domain;

import java.util.SortedSet;

public record Media(String imageUrl, SortedSet<String> videoUrls, SortedSet<String> books) {

    public static final Media EMPTY = new Media(null, null, null);

    public Media {
        imageUrl = DomainValues.trimToNull(imageUrl);
        videoUrls = DomainValues.sortedSet(videoUrls);
        books = DomainValues.sortedSet(books);
    }
}
