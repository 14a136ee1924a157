/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.json;


import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * The JSON entity input interface.
 *
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {


  /**
   * Returns the given JSON as the typed instance.
   *
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;


  /**
   * Returns the given JSON input as a typed entity.
   *
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   */
  default T toEntity(String json) throws JsonParsingException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(json));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object: " + json, ccx);
    } catch (NumberFormatException nfx) {
      // json-simple's lexer does not range-check integral numerals
      throw new JsonParsingException("numeral out of range: " + json, nfx);
    }
  }


  /**
   * Returns the given JSON input as a typed entity.
   *
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(reader));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object", ccx);
    } catch (NumberFormatException nfx) {
      throw new JsonParsingException("numeral out of range", nfx);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }


  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = new FileReader(file)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }

}
