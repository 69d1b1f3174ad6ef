package com.navblocks.soap;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Collection;

/**
 * Lets collection fields accept a single value. XML has no list marker, so a
 * list with one entry arrives as one element and is mapped to a plain value
 * instead of an array. Registered with the JSON parser used for page
 * entities.
 */
public final class RepeatedElementAdapterFactory implements TypeAdapterFactory {

    @Override
    public <T> TypeAdapter<T> create(final Gson gson, final TypeToken<T> type) {
        if (!Collection.class.isAssignableFrom(type.getRawType()))
            return null;

        final TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
        final TypeAdapter<JsonElement> treeAdapter = gson.getAdapter(JsonElement.class);

        return new TypeAdapter<T>() {
            @Override
            public void write(final JsonWriter out, final T value) throws IOException {
                delegate.write(out, value);
            }

            @Override
            public T read(final JsonReader in) throws IOException {
                JsonElement tree = treeAdapter.read(in);
                if (tree != null && !tree.isJsonNull() && !tree.isJsonArray()) {
                    JsonArray array = new JsonArray();
                    array.add(tree);
                    tree = array;
                }
                return delegate.fromJsonTree(tree);
            }
        };
    }

}
