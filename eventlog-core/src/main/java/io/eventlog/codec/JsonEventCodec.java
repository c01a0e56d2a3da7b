package io.eventlog.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * Jackson-backed {@link EventCodec} storing payloads as JSON.
 *
 * <p>Event hierarchies need Jackson type information to round trip, e.g.
 * {@code @JsonTypeInfo(use = Id.NAME)} with {@code @JsonSubTypes} on the event
 * interface. Enums and plain records work as they are.
 *
 * <pre>{@code
 * EventCodec<OrderEvent> codec = JsonEventCodec.of(OrderEvent.class);
 * EventCodec<OrderEvent> shared = JsonEventCodec.of(springObjectMapper, OrderEvent.class);
 * }</pre>
 *
 * @param <E> the event type
 */
public final class JsonEventCodec<E> implements EventCodec<E> {
  private static final ObjectMapper DEFAULT_MAPPER = defaultMapper();

  private final ObjectMapper mapper;
  private final JavaType type;

  private JsonEventCodec(ObjectMapper mapper, JavaType type) {
    this.mapper = mapper;
    this.type = type;
  }

  /**
   * Creates a codec using a shared mapper with {@link JavaTimeModule} registered
   * and ISO-8601 dates.
   */
  public static <E> JsonEventCodec<E> of(Class<E> eventType) {
    return of(DEFAULT_MAPPER, eventType);
  }

  /**
   * Creates a codec using the given mapper.
   */
  public static <E> JsonEventCodec<E> of(ObjectMapper mapper, Class<E> eventType) {
    Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(eventType, "eventType");
    return new JsonEventCodec<>(mapper, mapper.constructType(eventType));
  }

  /**
   * Returns a mapper configured the way {@link #of(Class)} uses it.
   */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public String encode(E event) {
    try {
      return mapper.writerFor(type).writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to encode " + type.getRawClass().getSimpleName(), e);
    }
  }

  @Override
  public E decode(String data) {
    if (data == null) {
      throw new CodecException("Cannot decode a null payload", null);
    }
    try {
      return mapper.readValue(data, type);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to decode " + type.getRawClass().getSimpleName(), e);
    }
  }
}
