/**
 * Stateless text helpers: term normalization, name, location, fee and language parsing,
 * URL canonicalisation and profile id generation.
 */
package com.phillippitts.speakerlink.util;
