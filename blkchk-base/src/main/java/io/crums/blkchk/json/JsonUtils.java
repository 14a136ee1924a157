/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.blkchk.Address;

/**
 * Typed getters over {@code json-simple} objects.
 */
public class JsonUtils {

  private JsonUtils() {  }


  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }


  public static int getInt(JSONObject jObj, String name) throws JsonParsingException {
    long value = getLong(jObj, name);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)
      throw new JsonParsingException("'" + name + "' out of int range: " + value);
    return (int) value;
  }


  public static long getLong(JSONObject jObj, String name) throws JsonParsingException {
    return getLong(jObj, name, true);
  }


  /**
   * Returns the named integral value, or {@code null} if absent and not required.
   *
   * @see #toLong(Object, String)
   */
  public static Long getLong(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected numeral '" + name + "' missing");
      return null;
    }
    return toLong(value, "'" + name + "'");
  }


  /**
   * Returns the given parsed value as an integral number. json-simple parses
   * integral numerals as {@code Long}s; fractional and out-of-range numerals
   * (parsed as {@code Double}s) are rejected.
   *
   * @param what    describes the value (for the error message)
   */
  public static long toLong(Object value, String what) throws JsonParsingException {
    if (!(value instanceof Long num))
      throw new JsonParsingException(what + " expects an integral numeral: " + value);
    return num;
  }


  /**
   * Returns the named address value.
   */
  public static Address getAddress(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    String hex = getString(jObj, name, require);
    if (hex == null)
      return null;
    try {
      return Address.of(hex);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("'" + name + "': " + iax.getMessage(), iax);
    }
  }



  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    try {
      return (JSONArray) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value, ccx);
    }
  }

}
