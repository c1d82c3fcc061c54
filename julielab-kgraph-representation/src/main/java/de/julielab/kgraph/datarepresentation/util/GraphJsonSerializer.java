package de.julielab.kgraph.datarepresentation.util;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;
import java.io.InputStream;

/**
 * Shared Jackson mapper for graph exports, options and relation vocabularies.
 */
public class GraphJsonSerializer {
	private GraphJsonSerializer() {
	}

	private static ObjectMapper mapper = JsonMapper.builder()
			.addModule(new Jdk8Module())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();
	static {
		mapper.setSerializationInclusion(Include.NON_NULL);
		mapper.setSerializationInclusion(Include.NON_EMPTY);
	}

	public static synchronized String toJson(Object serializable) {
		try {
			return mapper.writeValueAsString(serializable);
		} catch (JsonProcessingException e) {
			throw new UncheckedJsonProcessingException(e);
		}
	}

	public static synchronized <T> T fromJson(String json, Class<T> cls) throws IOException {
		return mapper.readValue(json, cls);
	}

	public static synchronized <T> T fromJson(InputStream is, Class<T> cls) throws IOException {
		return mapper.readValue(is, cls);
	}

	public static synchronized <T> T fromJson(String json, TypeReference<T> ref) throws IOException {
		return mapper.readValue(json, ref);
	}
}
