/**
 * Payload codecs. {@link io.eventlog.codec.JsonEventCodec} is the default, backed by Jackson.
 */
package io.eventlog.codec;
