package tiered.cache.infrastructure.cache.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import tiered.cache.core.port.out.SharedValueCodec;
import tiered.cache.error.exception.CacheSerializationException;

/**
 * Jackson 기반 Shared 값 코덱
 *
 * <p>{@link JavaType}으로 제네릭 타입을 보존합니다 (List&lt;Dto&gt; 등).
 */
public class JacksonValueCodec<V> implements SharedValueCodec<V> {

  private final ObjectMapper objectMapper;
  private final JavaType valueType;

  public JacksonValueCodec(ObjectMapper objectMapper, JavaType valueType) {
    this.objectMapper = objectMapper;
    this.valueType = valueType;
  }

  public static <V> JacksonValueCodec<V> of(ObjectMapper objectMapper, Class<V> type) {
    return new JacksonValueCodec<>(objectMapper, objectMapper.constructType(type));
  }

  public static <V> JacksonValueCodec<V> of(ObjectMapper objectMapper, TypeReference<V> type) {
    return new JacksonValueCodec<>(objectMapper, objectMapper.getTypeFactory().constructType(type));
  }

  @Override
  public String encode(V value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("encode " + valueType, e);
    }
  }

  @Override
  public V decode(String payload) {
    try {
      return objectMapper.readValue(payload, valueType);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("decode " + valueType, e);
    }
  }
}
