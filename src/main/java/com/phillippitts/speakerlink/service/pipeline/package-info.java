/**
 * Pipeline orchestration and its input/output collaborators.
 *
 * <p>The orchestrator reads each source through a {@link
 * com.phillippitts.speakerlink.service.pipeline.SourceDocumentReader}, keeps the run's profiles
 * in a blocking index and hands the result to a {@link
 * com.phillippitts.speakerlink.service.pipeline.ProfileSink}.
 */
package com.phillippitts.speakerlink.service.pipeline;
