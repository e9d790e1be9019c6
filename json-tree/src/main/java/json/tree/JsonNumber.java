package json.tree;

/// A JSON number held as a double-precision float.
///
/// @param value the number; must be finite since JSON has no NaN or infinity
public record JsonNumber(double value) implements JsonValue {

    public JsonNumber {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
    }

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public JsonType type() {
        return JsonType.NUMBER;
    }

    @Override
    public String toString() {
        return JsonSerializer.serialize(this, 0);
    }
}
