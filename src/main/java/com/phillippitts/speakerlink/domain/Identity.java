package com.phillippitts.speakerlink.domain;

/**
 * Identity field group. Blank values are stored as {@code null}.
 *
 * @param fullName   display name without honorifics or post-nominals
 * @param firstName  first given name
 * @param lastName   family name, the basis of the blocking key
 * @param honorific  stripped title such as "Dr" or "Prof"
 * @param jobTitle   current role
 * @param company    current organization
 */
public record Identity(
        String fullName,
        String firstName,
        String lastName,
        String honorific,
        String jobTitle,
        String company
) {

    public static final Identity EMPTY = new Identity(null, null, null, null, null, null);

    public Identity {
        fullName = DomainValues.trimToNull(fullName);
        firstName = DomainValues.trimToNull(firstName);
        lastName = DomainValues.trimToNull(lastName);
        honorific = DomainValues.trimToNull(honorific);
        jobTitle = DomainValues.trimToNull(jobTitle);
        company = DomainValues.trimToNull(company);
    }
}
