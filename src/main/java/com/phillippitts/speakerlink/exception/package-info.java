/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakerlink.exception.SpeakerLinkException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speakerlink.exception.MalformedRecordException} - Thrown when a
 *       source document has no usable name; the pipeline skips the document</li>
 *   <li>{@link com.phillippitts.speakerlink.exception.TaxonomyLoadException} - Thrown when a
 *       taxonomy table is missing or invalid at startup</li>
 *   <li>{@link com.phillippitts.speakerlink.exception.PipelineException} - Thrown when the source
 *       reader or profile sink fails (unreadable input, unwritable store)</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and carry a context
 * field (source name, resource path) for log correlation. Nothing inside a pipeline run is
 * fatal: record-level failures are logged and counted, never propagated.
 *
 * @since 1.0
 */
package com.phillippitts.speakerlink.exception;
