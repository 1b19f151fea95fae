package com.annal.persistence;

import com.annal.store.Document;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts document bodies to and from JSON. Instants are written as
 * {@code {"$date": "<ISO-8601>"}} so they survive a round trip, and integral
 * numbers are read back as {@code Long}.
 */
public class DocumentCodec {
    static final String DATE_KEY = "$date";

    private final Gson gson = new GsonBuilder().serializeNulls().create();

    public String toJson(Document document) {
        return gson.toJson(encode(document.getFields()));
    }

    public Document fromJson(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("document JSON must be an object");
        }
        return toDocument(element.getAsJsonObject());
    }

    String write(JsonElement element) {
        return gson.toJson(element);
    }

    JsonElement encode(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject obj = new JsonObject();
            for (var entry : map.entrySet()) {
                obj.add(String.valueOf(entry.getKey()), encode(entry.getValue()));
            }
            return obj;
        }
        if (value instanceof Collection<?> list) {
            JsonArray arr = new JsonArray();
            for (Object o : list) {
                arr.add(encode(o));
            }
            return arr;
        }
        if (value instanceof Instant instant) {
            JsonObject date = new JsonObject();
            date.addProperty(DATE_KEY, instant.toString());
            return date;
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        return new JsonPrimitive(value.toString());
    }

    Object decode(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonObject()) {
            JsonObject obj = element.getAsJsonObject();
            if (obj.size() == 1 && obj.has(DATE_KEY) && obj.get(DATE_KEY).isJsonPrimitive()) {
                return Instant.parse(obj.get(DATE_KEY).getAsString());
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (var entry : obj.entrySet()) {
                map.put(entry.getKey(), decode(entry.getValue()));
            }
            return map;
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement e : element.getAsJsonArray()) {
                list.add(decode(e));
            }
            return list;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            BigDecimal number = primitive.getAsBigDecimal();
            if (number.stripTrailingZeros().scale() <= 0 && number.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
                return number.longValue();
            }
            return number.doubleValue();
        }
        return primitive.getAsString();
    }

    @SuppressWarnings("unchecked")
    Document toDocument(JsonObject obj) {
        return new Document((Map<String, Object>) decode(obj));
    }
}
