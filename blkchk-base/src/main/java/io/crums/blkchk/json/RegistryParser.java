/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.json;


import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.blkchk.Address;
import io.crums.blkchk.BlkchkException;
import io.crums.blkchk.Item;
import io.crums.blkchk.VolatileItemRegistry;

/**
 * Snapshot of a {@linkplain VolatileItemRegistry}: its address, existing
 * items with their holders, and the consumed ids. Transfer grants are not
 * part of the snapshot.
 *
 * <pre>
 * {
 *   "address": "0x..",
 *   "items": [ { "id": 1, "rank": 6, "seed": 1, "owner": "0x.." }, .. ],
 *   "consumed": [ 2, 3 ]
 * }
 * </pre>
 */
public class RegistryParser implements JsonEntityParser<VolatileItemRegistry> {

  public final static String ADDRESS = "address";
  public final static String ITEMS = "items";
  public final static String CONSUMED = "consumed";
  public final static String ID = "id";
  public final static String RANK = "rank";
  public final static String SEED = "seed";
  public final static String OWNER = "owner";


  /** Stateless instance. */
  public final static RegistryParser INSTANCE = new RegistryParser();


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(VolatileItemRegistry registry, JSONObject jObj) {
    JSONArray jItems = new JSONArray();
    for (Item item : registry.items()) {
      JSONObject jItem = new JSONObject();
      jItem.put(ID, item.id());
      jItem.put(RANK, item.rank());
      jItem.put(SEED, item.seed());
      jItem.put(OWNER, registry.ownerOf(item.id()).hex());
      jItems.add(jItem);
    }
    JSONArray jConsumed = new JSONArray();
    jConsumed.addAll(registry.consumedIds());

    jObj.put(ADDRESS, registry.address().hex());
    jObj.put(ITEMS, jItems);
    jObj.put(CONSUMED, jConsumed);
    return jObj;
  }


  @Override
  public VolatileItemRegistry toEntity(JSONObject jObj) throws JsonParsingException {
    var registry = new VolatileItemRegistry(JsonUtils.getAddress(jObj, ADDRESS, true));
    try {
      for (Object o : JsonUtils.getJsonArray(jObj, ITEMS, true)) {
        if (!(o instanceof JSONObject jItem))
          throw new JsonParsingException("item entry not an object: " + o);
        var item = new Item(
            JsonUtils.getLong(jItem, ID),
            JsonUtils.getInt(jItem, RANK),
            JsonUtils.getLong(jItem, SEED));
        registry.mint(JsonUtils.getAddress(jItem, OWNER, true), item);
      }
      JSONArray jConsumed = JsonUtils.getJsonArray(jObj, CONSUMED, false);
      if (jConsumed != null) {
        for (Object o : jConsumed)
          registry.markConsumed(JsonUtils.toLong(o, "consumed id"));
      }
    } catch (IllegalArgumentException | BlkchkException x) {
      throw new JsonParsingException(x.getMessage(), x);
    }
    return registry;
  }

}
