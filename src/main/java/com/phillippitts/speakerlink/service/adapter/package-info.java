/**
 * Per-source schema adapters.
 *
 * <p>Each of the ten sources has one {@link com.phillippitts.speakerlink.service.adapter.SourceAdapter}
 * mapping its field names onto the common {@link com.phillippitts.speakerlink.domain.SourceRecord}
 * slots. Adapters extend {@link com.phillippitts.speakerlink.service.adapter.AbstractSourceAdapter},
 * which owns name parsing and malformed-document rejection.
 */
package com.phillippitts.speakerlink.service.adapter;
