package org.scriptonbasestar.echocache.redis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.scriptonbasestar.echocache.core.exception.SBCacheStoreException;
import org.scriptonbasestar.echocache.core.store.StaleValue;

import java.io.IOException;
import java.time.Instant;

/**
 * Jackson 기반 값 인코더/디코더.
 *
 * <p>일반 값은 JSON 그대로, stale-while-revalidate 값은
 * {@code {"value":<json>,"createdAt":<epoch millis>}} 형태로 저장합니다.</p>
 *
 * 사용 예시:
 * <pre>
 * JsonValueCodec&lt;User&gt; codec = JsonValueCodec.forClass(User.class);
 * JsonValueCodec&lt;List&lt;User&gt;&gt; listCodec = JsonValueCodec.forType(new TypeReference&lt;List&lt;User&gt;&gt;() {});
 * </pre>
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public final class JsonValueCodec<T> {

	static final String VALUE_FIELD = "value";
	static final String CREATED_AT_FIELD = "createdAt";

	private final ObjectMapper objectMapper;
	private final JavaType valueType;

	private JsonValueCodec(ObjectMapper objectMapper, JavaType valueType) {
		this.objectMapper = objectMapper;
		this.valueType = valueType;
	}

	public static <T> JsonValueCodec<T> forClass(Class<T> type) {
		return forClass(type, new ObjectMapper());
	}

	public static <T> JsonValueCodec<T> forClass(Class<T> type, ObjectMapper objectMapper) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		return new JsonValueCodec<>(objectMapper, objectMapper.constructType(type));
	}

	public static <T> JsonValueCodec<T> forType(TypeReference<T> type) {
		return forType(type, new ObjectMapper());
	}

	public static <T> JsonValueCodec<T> forType(TypeReference<T> type, ObjectMapper objectMapper) {
		if (type == null) {
			throw new IllegalArgumentException("TypeReference must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		return new JsonValueCodec<>(objectMapper, objectMapper.constructType(type));
	}

	public String encode(T value) throws SBCacheStoreException {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (IOException e) {
			throw new SBCacheStoreException("Cannot encode value of type " + valueType, e);
		}
	}

	public T decode(String raw) throws SBCacheStoreException {
		try {
			return objectMapper.readValue(raw, valueType);
		} catch (IOException e) {
			throw new SBCacheStoreException("Cannot decode value as " + valueType, e);
		}
	}

	public String encodeStale(StaleValue<T> staleValue) throws SBCacheStoreException {
		try {
			ObjectNode node = objectMapper.createObjectNode();
			node.set(VALUE_FIELD, objectMapper.valueToTree(staleValue.getValue()));
			node.put(CREATED_AT_FIELD, staleValue.getCreatedAt().toEpochMilli());
			return objectMapper.writeValueAsString(node);
		} catch (IOException | IllegalArgumentException e) {
			throw new SBCacheStoreException("Cannot encode stale value of type " + valueType, e);
		}
	}

	public StaleValue<T> decodeStale(String raw) throws SBCacheStoreException {
		JsonNode node;
		try {
			node = objectMapper.readTree(raw);
		} catch (IOException e) {
			throw new SBCacheStoreException("Cannot decode stale value envelope", e);
		}
		if (node == null || !node.isObject() || !node.has(VALUE_FIELD)
			|| !node.path(CREATED_AT_FIELD).canConvertToLong()) {
			throw new SBCacheStoreException("Malformed stale value envelope: " + raw);
		}
		try {
			T value = objectMapper.readerFor(valueType).readValue(node.get(VALUE_FIELD));
			return StaleValue.of(value, Instant.ofEpochMilli(node.get(CREATED_AT_FIELD).asLong()));
		} catch (IOException e) {
			throw new SBCacheStoreException("Cannot decode stale value as " + valueType, e);
		}
	}
}
