/**
 * Duplicate resolution: blocking index and weighted candidate scoring.
 *
 * <p>Profiles are bucketed by {@link com.phillippitts.speakerlink.service.resolve.BlockingKey}
 * (normalized last name plus country) so an incoming record is only compared with the few
 * profiles sharing its bucket.
 */
package com.phillippitts.speakerlink.service.resolve;
