/**
 * Spring configuration: executors, taxonomy loading, resolution wiring and pipeline collaborators.
 *
 * <p>Property binding classes live in {@code config.properties}.
 */
package com.phillippitts.speakerlink.config;
