package com.navblocks.network;

import com.google.gson.ExclusionStrategy;
import com.google.gson.FieldAttributes;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapterFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.time.LocalDate;

/**
 * This class has default knowledge of how to parse JSON into Java objects and
 * Java objects into JSON. It's relying heavily on Google Gson for doing this.
 * <p>
 * Null fields are never written. Fields carrying the optional ignore marker
 * annotation are neither read nor written, which lets the same record class
 * serve both the OData and the SOAP surface.
 */
public class DefaultJsonParser implements JsonParser {

    private final GsonBuilder gsonBuilder;
    private volatile Gson gson;


    public DefaultJsonParser() {
        this(null);
    }

    /**
     * @param ignoredMarker Fields annotated with this annotation are excluded
     *                      from (de)serialization. May be null.
     */
    public DefaultJsonParser(final Class<? extends Annotation> ignoredMarker) {
        gsonBuilder = new GsonBuilder();
        if (ignoredMarker != null)
            gsonBuilder.setExclusionStrategies(new ExclusionStrategy() {
                @Override
                public boolean shouldSkipField(FieldAttributes field) {
                    return field.getAnnotation(ignoredMarker) != null;
                }

                @Override
                public boolean shouldSkipClass(Class<?> clazz) {
                    return false;
                }
            });

        registerAdapter(LocalDate.class, new LocalDateAdapter());
    }

    /**
     * Injects a custom JSON to POJO adapter for a certain data type.
     *
     * @param type    The Java type the adapter handles.
     * @param adapter The adapter implementation.
     * @param <T>     The type declaration.
     */
    public synchronized <T> void registerAdapter(final Class<T> type, final JsonAdapter<T> adapter) {
        gsonBuilder.registerTypeAdapter(type, new AdapterBridge<>(adapter));
        gson = null;
    }

    /**
     * Injects a Gson type adapter factory, consulted before the built-in
     * reflective binding.
     *
     * @param factory The factory to add.
     */
    public synchronized void registerAdapterFactory(final TypeAdapterFactory factory) {
        gsonBuilder.registerTypeAdapterFactory(factory);
        gson = null;
    }

    /**
     * Creates a POJO from a JSON string.
     *
     * @param json The raw json to parse.
     * @param type The type of the expected result.
     * @param <T>  The generic type of the result.
     * @return The desired POJO.
     * @throws IllegalArgumentException If the JSON couldn't be parsed as the
     *                                  desired object for any reason.
     */
    @Override
    public <T> T fromJson(String json, Type type) throws IllegalArgumentException {
        try {
            return gson().fromJson(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Couldn't parse JSON: " + json, e);
        }
    }

    /**
     * Creates a JSON string from a POJO.
     *
     * @param object The object to serialize into a JSON string.
     * @return A JSON representation of the given POJO.
     * @throws IllegalArgumentException If the POJO couldn't be expressed as a
     *                                  JSON string for any reason.
     */
    @Override
    public String toJson(Object object) throws IllegalArgumentException {
        try {
            return gson().toJson(object);
        } catch (Exception e) {
            throw new IllegalArgumentException(describe(object), e);
        }
    }

    @Override
    public <T> T fromJsonTree(JsonElement json, Type type) throws IllegalArgumentException {
        try {
            return gson().fromJson(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Couldn't parse JSON: " + json, e);
        }
    }

    @Override
    public JsonElement toJsonTree(Object object) throws IllegalArgumentException {
        try {
            return gson().toJsonTree(object);
        } catch (Exception e) {
            throw new IllegalArgumentException(describe(object), e);
        }
    }

    /**
     * Exposes a {@link JsonAdapter} to Gson as a two-way tree adapter.
     */
    private static final class AdapterBridge<T> implements JsonSerializer<T>, JsonDeserializer<T> {
        private final JsonAdapter<T> adapter;

        private AdapterBridge(final JsonAdapter<T> adapter) {
            this.adapter = adapter;
        }

        @Override
        public T deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
            return adapter.deserialize(json);
        }

        @Override
        public JsonElement serialize(T value, Type typeOfSrc, JsonSerializationContext context) {
            return adapter.serialize(value);
        }
    }

    private Gson gson() {
        Gson current = gson;
        if (current == null) {
            synchronized (this) {
                current = gson;
                if (current == null)
                    gson = current = gsonBuilder.create();
            }
        }
        return current;
    }

    private static String describe(Object object) {
        return String.format("Couldn't serialize object into JSON: %s", object != null ?
                object.getClass().getName() :
                "null");
    }

}
