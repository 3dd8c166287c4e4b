/**
 * Merge policy that folds matched source records into canonical profiles.
 */
package com.phillippitts.speakerlink.service.merge;
