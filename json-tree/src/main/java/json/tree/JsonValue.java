package json.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A node of a parsed JSON document.
///
/// Instances of `JsonValue` are immutable and thread safe. They hold no reference
/// to the tokens or bytes they were parsed from.
///
/// A `JsonValue` can be produced by {@link JsonTree#parse(String)} or built directly
/// from the record constructors.
///
/// The typed accessors below throw {@link JsonAssertionException} unless they are
/// called on the matching variant.
public sealed interface JsonValue
        permits JsonObject, JsonArray, JsonString, JsonNumber, JsonBoolean, JsonNull {

    /// {@return the JSON type of this value}
    JsonType type();

    /// {@return the compact JSON text of this value}
    /// For indented output use {@link JsonTree#serialize(JsonValue)}.
    @Override
    String toString();

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw JsonAssertionException.typeError(this, "JsonBoolean");
    }

    /// {@return the `double` value represented by a `JsonNumber`}
    default double toDouble() {
        throw JsonAssertionException.typeError(this, "JsonNumber");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw JsonAssertionException.typeError(this, "JsonString");
    }

    /// {@return the elements of a `JsonArray`}
    default List<JsonValue> elements() {
        throw JsonAssertionException.typeError(this, "JsonArray");
    }

    /// {@return the members of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw JsonAssertionException.typeError(this, "JsonObject");
    }

    /// {@return an `Optional` containing this value unless it is a `JsonNull`}
    default Optional<JsonValue> valueOrNull() {
        return type() == JsonType.NULL ? Optional.empty() : Optional.of(this);
    }

    /// {@return the member of a `JsonObject` with the given name}
    ///
    /// @param name the member name
    /// @throws NullPointerException if `name` is `null`
    /// @throws JsonAssertionException if this is not a `JsonObject` or the member does not exist
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        JsonValue member = members().get(name);
        if (member == null) {
            throw new JsonAssertionException("JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return member;
    }

    /// {@return the member of a `JsonObject` with the given name, or an empty `Optional`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if `name` is `null`
    /// @throws JsonAssertionException if this is not a `JsonObject`
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the element of a `JsonArray` at the given index}
    ///
    /// @param index the element index
    /// @throws JsonAssertionException if this is not a `JsonArray` or the index is out of bounds
    default JsonValue element(int index) {
        List<JsonValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new JsonAssertionException(
                    "JsonArray index %d out of bounds for length %d.".formatted(index, elements.size()));
        }
        return elements.get(index);
    }
}
