package com.contentflow.infrastructure.util;

import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSONB 列编解码：content_data / details 存对象，steps 存数组。空列读出为空集合。
 */
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;

    private final JavaType mapType;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.mapType = objectMapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class);
    }

    public Map<String, Object> readMap(String json) {
        if (StringUtils.isBlank(json)) {
            return new LinkedHashMap<>();
        }
        return read(json, mapType);
    }

    public <T> List<T> readList(String json, Class<T> elementType) {
        if (StringUtils.isBlank(json)) {
            return new ArrayList<>();
        }
        return read(json, objectMapper.getTypeFactory().constructCollectionType(ArrayList.class, elementType));
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "JSONB encode failed for " + value.getClass().getSimpleName(), ex);
        }
    }

    private <T> T read(String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "JSONB decode failed as " + type, ex);
        }
    }
}
