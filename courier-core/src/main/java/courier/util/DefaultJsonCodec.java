package courier.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free JSON encoder/decoder for metadata maps.
 *
 * <p>Values are written as JSON strings, numbers, booleans, objects and arrays. Non-finite
 * doubles and any other type are written as strings. On parse, integral numbers become
 * {@link Long} (or {@link BigDecimal} if they overflow) and decimals become {@link Double}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    writeValue(sb, values);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    Parser parser = new Parser(trimmed);
    parser.skipWhitespace();
    if (!parser.peek('{')) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Map<String, Object> result = parser.readObject();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Unexpected trailing characters at " + parser.index);
    }
    return result;
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence) {
      writeString(sb, value.toString());
    } else if (value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        writeString(sb, value.toString());
      } else {
        sb.append(value);
      }
    } else if (value instanceof BigDecimal) {
      sb.append(((BigDecimal) value).toPlainString());
    } else if (value instanceof Number) {
      sb.append(value);
    } else if (value instanceof Map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("metadata cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeString(sb, entry.getKey().toString());
        sb.append(':');
        writeValue(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Iterable) {
      sb.append('[');
      boolean first = true;
      for (Object item : (Iterable<?>) value) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item);
      }
      sb.append(']');
    } else if (value instanceof Object[]) {
      writeValue(sb, Arrays.asList((Object[]) value));
    } else if (value instanceof Enum) {
      writeString(sb, ((Enum<?>) value).name());
    } else {
      writeString(sb, value.toString());
    }
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  private static final class Parser {
    private final String input;
    private int index;

    private Parser(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return index >= input.length();
    }

    boolean peek(char expected) {
      return index < input.length() && input.charAt(index) == expected;
    }

    void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        index++;
      }
    }

    void expect(char expected) {
      skipWhitespace();
      if (!peek(expected)) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + index);
      }
      index++;
    }

    Object readValue() {
      skipWhitespace();
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      char c = input.charAt(index);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          return readString();
        case 't':
          return readLiteral("true", Boolean.TRUE);
        case 'f':
          return readLiteral("false", Boolean.FALSE);
        case 'n':
          return readLiteral("null", null);
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at " + index);
      }
    }

    Map<String, Object> readObject() {
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek('}')) {
        index++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (!peek('"')) {
          throw new IllegalArgumentException("Expected string key at " + index);
        }
        String key = readString();
        expect(':');
        result.put(key, readValue());
        skipWhitespace();
        if (peek(',')) {
          index++;
          continue;
        }
        if (peek('}')) {
          index++;
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or '}' at " + index);
      }
    }

    List<Object> readArray() {
      expect('[');
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek(']')) {
        index++;
        return result;
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        if (peek(',')) {
          index++;
          continue;
        }
        if (peek(']')) {
          index++;
          return result;
        }
        throw new IllegalArgumentException("Expected ',' or ']' at " + index);
      }
    }

    Object readLiteral(String literal, Object value) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Invalid literal at " + index);
      }
      index += literal.length();
      return value;
    }

    Object readNumber() {
      int start = index;
      boolean decimal = false;
      if (peek('-')) {
        index++;
      }
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c >= '0' && c <= '9') {
          index++;
        } else if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
          decimal = true;
          index++;
        } else {
          break;
        }
      }
      String text = input.substring(start, index);
      try {
        if (decimal) {
          return Double.parseDouble(text);
        }
        BigInteger value = new BigInteger(text);
        if (value.bitLength() < 64) {
          return value.longValue();
        }
        return new BigDecimal(value);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number '" + text + "' at " + start, ex);
      }
    }

    String readString() {
      index++;
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '"') {
          index++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          index++;
          continue;
        }
        if (index + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(index + 1);
        index += 2;
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (index + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index, index + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
