package io.eventlog.codec;

/**
 * Converts event payloads to and from their stored text form.
 *
 * <p>The round trip must be lossless: {@code decode(encode(e))} equals {@code e}.
 *
 * @param <E> the event type
 * @see JsonEventCodec
 */
public interface EventCodec<E> {

  /**
   * Encodes a payload for storage.
   *
   * @throws CodecException if the payload cannot be encoded
   */
  String encode(E event);

  /**
   * Decodes a stored payload.
   *
   * @throws CodecException if the text is not a valid payload
   */
  E decode(String data);
}
