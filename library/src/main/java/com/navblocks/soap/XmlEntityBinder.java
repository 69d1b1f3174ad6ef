package com.navblocks.soap;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.navblocks.model.SoapIgnore;
import com.navblocks.network.DefaultJsonParser;
import com.navblocks.network.JsonParser;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;

/**
 * Binds NAV page XML to record objects and back. The element tree is mapped
 * onto a JSON tree which the JSON parser then binds by field name, so the
 * same {@code @SerializedName} and adapter configuration applies to both
 * protocols.
 * <p>
 * Only child elements in the entity's own namespace are bound. Leaves become
 * values, elements with children become nested objects and repeated siblings
 * become lists; a collection field also accepts a single element. Empty,
 * blank and nil leaves are skipped so the field keeps its default.
 */
public class XmlEntityBinder {
    private static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String KEY_ELEMENT = "Key";

    private final JsonParser jsonParser;

    /**
     * Creates a binder that leaves out fields marked with {@link SoapIgnore}
     * and reads single elements into collection fields.
     */
    public XmlEntityBinder() {
        this(defaultJsonParser());
    }

    /**
     * @param jsonParser The parser to bind with. It should know
     *                   {@link RepeatedElementAdapterFactory}, or collection
     *                   fields backed by a single element won't bind.
     */
    public XmlEntityBinder(final JsonParser jsonParser) {
        if (jsonParser == null)
            throw new IllegalArgumentException("The JsonParser mustn't be null");

        this.jsonParser = jsonParser;
    }

    /**
     * Binds an entity element to a new instance of the given type.
     *
     * @param element The entity element.
     * @param type    The record type.
     * @param <T>     The record type declaration.
     * @return The bound record.
     * @throws IllegalArgumentException If a value can't be converted to the
     *                                  type of its field.
     */
    public <T> T read(final Element element, final Type type) {
        return jsonParser.fromJsonTree(toJson(element), type);
    }

    /**
     * Writes a record as an element in the given namespace. A {@code Key}
     * member is written first, the other members follow in field order.
     *
     * @param document    The document to create the element in.
     * @param namespace   The page namespace.
     * @param elementName The name of the entity element.
     * @param record      The record to write.
     * @return The entity element, not yet attached to any parent.
     */
    public Element write(final Document document,
                         final String namespace,
                         final String elementName,
                         final Object record) {

        if (record == null)
            throw new IllegalArgumentException("The record mustn't be null");

        JsonElement tree = jsonParser.toJsonTree(record);
        if (!tree.isJsonObject())
            throw new IllegalArgumentException("Only objects can be written as page entities: " +
                    record.getClass().getName());

        Element element = document.createElementNS(namespace, elementName);
        JsonObject object = tree.getAsJsonObject();

        if (object.has(KEY_ELEMENT))
            appendMember(document, namespace, element, KEY_ELEMENT, object.get(KEY_ELEMENT));

        for (Map.Entry<String, JsonElement> member : object.entrySet())
            if (!KEY_ELEMENT.equals(member.getKey()))
                appendMember(document, namespace, element, member.getKey(), member.getValue());

        return element;
    }

    private static JsonParser defaultJsonParser() {
        DefaultJsonParser parser = new DefaultJsonParser(SoapIgnore.class);
        parser.registerAdapterFactory(new RepeatedElementAdapterFactory());
        return parser;
    }

    JsonObject toJson(final Element element) {
        String namespace = Xml.namespaceOf(element);
        JsonObject object = new JsonObject();

        for (Element child : Xml.childElements(element)) {
            if (!Objects.equals(namespace, Xml.namespaceOf(child)))
                continue;

            JsonElement value = toValue(child);
            if (value == null)
                continue;

            String name = child.getLocalName();
            JsonElement existing = object.get(name);
            if (existing == null) {
                object.add(name, value);
            } else if (existing.isJsonArray()) {
                existing.getAsJsonArray().add(value);
            } else {
                JsonArray array = new JsonArray();
                array.add(existing);
                array.add(value);
                object.add(name, array);
            }
        }

        return object;
    }

    private JsonElement toValue(final Element element) {
        if (!Xml.childElements(element).isEmpty())
            return toJson(element);

        if ("true".equals(element.getAttributeNS(XSI_NAMESPACE, "nil")))
            return null;

        String text = element.getTextContent();
        return text == null || text.trim().isEmpty() ?
                null :
                new JsonPrimitive(text);
    }

    private void appendMember(final Document document,
                              final String namespace,
                              final Element parent,
                              final String name,
                              final JsonElement value) {

        if (value == null || value.isJsonNull())
            return;

        if (value.isJsonArray()) {
            for (JsonElement item : value.getAsJsonArray())
                appendMember(document, namespace, parent, name, item);
            return;
        }

        Element child = document.createElementNS(namespace, name);
        if (value.isJsonObject()) {
            for (Map.Entry<String, JsonElement> member : value.getAsJsonObject().entrySet())
                appendMember(document, namespace, child, member.getKey(), member.getValue());
        } else {
            child.setTextContent(value.getAsString());
        }
        parent.appendChild(child);
    }

}
