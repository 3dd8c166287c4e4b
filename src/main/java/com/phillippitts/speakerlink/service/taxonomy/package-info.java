/**
 * Taxonomy tables and the generic staged classifier.
 *
 * <p>Tables are loaded once from classpath JSON by
 * {@link com.phillippitts.speakerlink.service.taxonomy.TaxonomyTableLoader} and never change
 * during a run. A single {@link com.phillippitts.speakerlink.service.taxonomy.DefaultTaxonomyClassifier}
 * implementation serves all six domains; domain differences are expressed as
 * {@link com.phillippitts.speakerlink.service.taxonomy.ClassifierCapability capabilities}.
 */
package com.phillippitts.speakerlink.service.taxonomy;
