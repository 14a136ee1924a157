/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.blkchk.json;


import java.util.LinkedHashMap;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.blkchk.Address;
import io.crums.blkchk.BlkchkConstants;
import io.crums.blkchk.VolatileFungibleLedger;

/**
 * Balance-sheet snapshot of a {@linkplain VolatileFungibleLedger}.
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "symbol": "$BLKCHK",
 *   "decimals": 18,
 *   "total_issued": 31250000000000000,
 *   "balances": [
 *     { "account": "0x..", "amount": 15625000000000000 },
 *     ..
 *   ]
 * }
 * </pre>
 * <p>
 * On read, {@code total_issued} is checked against the sum of the balances;
 * {@code symbol} and {@code decimals}, if present, must match the library's.
 * Allowances are not part of the snapshot.
 * </p>
 */
public class LedgerParser implements JsonEntityParser<VolatileFungibleLedger> {

  public final static String SYMBOL = "symbol";
  public final static String DECIMALS = "decimals";
  public final static String TOTAL_ISSUED = "total_issued";
  public final static String BALANCES = "balances";
  public final static String ACCOUNT = "account";
  public final static String AMOUNT = "amount";


  /** Stateless instance. */
  public final static LedgerParser INSTANCE = new LedgerParser();



  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(VolatileFungibleLedger ledger, JSONObject jObj) {
    var balances = ledger.balances();
    long total = 0;
    JSONArray jBalances = new JSONArray();
    for (var e : balances.entrySet()) {
      JSONObject jEntry = new JSONObject();
      jEntry.put(ACCOUNT, e.getKey().hex());
      jEntry.put(AMOUNT, e.getValue());
      jBalances.add(jEntry);
      total += e.getValue();
    }
    jObj.put(SYMBOL, ledger.symbol());
    jObj.put(DECIMALS, ledger.decimals());
    jObj.put(TOTAL_ISSUED, total);
    jObj.put(BALANCES, jBalances);
    return jObj;
  }


  @Override
  public VolatileFungibleLedger toEntity(JSONObject jObj) throws JsonParsingException {
    String symbol = JsonUtils.getString(jObj, SYMBOL, false);
    if (symbol != null && !symbol.equals(BlkchkConstants.TOKEN_SYMBOL))
      throw new JsonParsingException("foreign symbol: " + symbol);
    Long decimals = JsonUtils.getLong(jObj, DECIMALS, false);
    if (decimals != null && decimals != BlkchkConstants.DECIMALS)
      throw new JsonParsingException("unexpected decimals: " + decimals);

    JSONArray jBalances = JsonUtils.getJsonArray(jObj, BALANCES, true);
    var balances = new LinkedHashMap<Address, Long>();
    long sum = 0;
    for (Object o : jBalances) {
      if (!(o instanceof JSONObject jEntry))
        throw new JsonParsingException("balance entry not an object: " + o);
      Address account = JsonUtils.getAddress(jEntry, ACCOUNT, true);
      long amount = JsonUtils.getLong(jEntry, AMOUNT);
      if (amount < 0)
        throw new JsonParsingException(
            "negative amount %d for account %s".formatted(amount, account));
      if (balances.put(account, amount) != null)
        throw new JsonParsingException("duplicate account: " + account);
      try {
        sum = Math.addExact(sum, amount);
      } catch (ArithmeticException ax) {
        throw new JsonParsingException("balances overflow", ax);
      }
    }

    Long total = JsonUtils.getLong(jObj, TOTAL_ISSUED, false);
    if (total != null && total != sum)
      throw new JsonParsingException(
          "%s (%d) does not match sum of balances (%d)"
          .formatted(TOTAL_ISSUED, total, sum));

    try {
      return new VolatileFungibleLedger(balances);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax);
    }
  }

}
