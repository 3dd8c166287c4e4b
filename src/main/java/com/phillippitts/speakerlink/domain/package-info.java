/**
 * Domain models of the record-linkage engine.
 *
 * <p>All domain models are:
 * <ul>
 *   <li>Immutable Java records; merges and re-scoring produce new instances</li>
 *   <li>Self-validating (validation in compact constructors)</li>
 *   <li>Deterministic: every set and map is sorted, so equal content serializes identically</li>
 * </ul>
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.speakerlink.domain.SourceRecord} - one adapted source document,
 *       consumed once and discarded</li>
 *   <li>{@link com.phillippitts.speakerlink.domain.CanonicalProfile} - the merged profile of one
 *       real person, the unit of output</li>
 *   <li>{@link com.phillippitts.speakerlink.domain.CategoryResult} - taxonomy classification of
 *       one field group</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakerlink.domain;
